package com.candor.core.domain;

import com.candor.core.exception.ValidationException;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A caller identity: a 20-byte account address in 0x-prefixed hex form.
 * Addresses are normalised to lower case so equality is case-insensitive.
 */
public record Principal(String address) {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Principal NONE = new Principal("0x0000000000000000000000000000000000000000");

    public Principal {
        if (address == null) {
            throw new ValidationException("Address is required");
        }
        address = address.toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(address).matches()) {
            throw new ValidationException("Malformed address: " + address);
        }
    }

    public static Principal of(String address) {
        return new Principal(address);
    }

    public static Principal fromBigInteger(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 160) {
            throw new ValidationException("Value does not fit an address");
        }
        return new Principal("0x" + String.format("%40s", value.toString(16)).replace(' ', '0'));
    }

    /**
     * True for the all-zero address, which never identifies a real caller.
     */
    public boolean isNone() {
        return NONE.address.equals(address);
    }

    public BigInteger toBigInteger() {
        return new BigInteger(address.substring(2), 16);
    }

    @Override
    public String toString() {
        return address;
    }
}
