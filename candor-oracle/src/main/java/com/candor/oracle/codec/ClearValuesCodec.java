package com.candor.oracle.codec;

import com.candor.core.seal.SealedType;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.NumericType;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Solidity ABI codec for oracle clear values: one 32-byte word per value, in request order.
 */
@Component
public class ClearValuesCodec {

    private static final int WORD_SIZE = 32;

    public byte[] encode(List<SealedType> types, List<BigInteger> values) {
        if (types.size() != values.size()) {
            throw new IllegalArgumentException("Expected " + types.size() + " values, got " + values.size());
        }
        StringBuilder hex = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            hex.append(TypeEncoder.encode(toAbiType(types.get(i), values.get(i))));
        }
        return Numeric.hexStringToByteArray(hex.toString());
    }

    /**
     * @throws IllegalArgumentException if the payload is not exactly one well-formed word per type
     */
    public List<BigInteger> decode(byte[] clearValues, List<SealedType> types) {
        if (clearValues == null || clearValues.length != types.size() * WORD_SIZE) {
            throw new IllegalArgumentException("Clear values must be " + types.size() * WORD_SIZE + " bytes");
        }
        List<TypeReference<?>> references = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            // the ABI decoder truncates oversized words, so range-check each word first
            BigInteger word = new BigInteger(1, Arrays.copyOfRange(clearValues, i * WORD_SIZE, (i + 1) * WORD_SIZE));
            if (!types.get(i).fits(word)) {
                throw new IllegalArgumentException("Word " + i + " does not fit " + types.get(i));
            }
            references.add(typeReference(types.get(i)));
        }

        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(Numeric.toHexString(clearValues), Utils.convert(references));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed clear values", e);
        }
        if (decoded.size() != types.size()) {
            throw new IllegalArgumentException("Malformed clear values");
        }

        List<BigInteger> values = new ArrayList<>(decoded.size());
        for (Type value : decoded) {
            values.add(toBigInteger(value));
        }
        return values;
    }

    private static Type<?> toAbiType(SealedType type, BigInteger value) {
        if (!type.fits(value)) {
            throw new IllegalArgumentException("Value does not fit " + type);
        }
        return switch (type) {
            case BOOL -> new Bool(value.signum() != 0);
            case UINT8 -> new Uint8(value);
            case UINT32 -> new Uint32(value);
            case UINT64 -> new Uint64(value);
            case ADDRESS -> new Address(value);
        };
    }

    private static TypeReference<?> typeReference(SealedType type) {
        return switch (type) {
            case BOOL -> TypeReference.create(Bool.class);
            case UINT8 -> TypeReference.create(Uint8.class);
            case UINT32 -> TypeReference.create(Uint32.class);
            case UINT64 -> TypeReference.create(Uint64.class);
            case ADDRESS -> TypeReference.create(Address.class);
        };
    }

    private static BigInteger toBigInteger(Type value) {
        if (value instanceof Bool bool) {
            return bool.getValue() ? BigInteger.ONE : BigInteger.ZERO;
        }
        if (value instanceof Address address) {
            return address.toUint().getValue();
        }
        if (value instanceof NumericType numeric) {
            return numeric.getValue();
        }
        throw new IllegalArgumentException("Unsupported ABI type: " + value.getTypeAsString());
    }
}
