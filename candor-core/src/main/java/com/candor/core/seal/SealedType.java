package com.candor.core.seal;

import java.math.BigInteger;

/**
 * Value types a sealed handle can carry, with their bit widths.
 */
public enum SealedType {
    BOOL(1),
    UINT8(8),
    UINT32(32),
    UINT64(64),
    ADDRESS(160);

    private final int bits;

    SealedType(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public boolean fits(BigInteger value) {
        return value != null && value.signum() >= 0 && value.bitLength() <= bits;
    }
}
