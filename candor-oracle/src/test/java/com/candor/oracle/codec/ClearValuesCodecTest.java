package com.candor.oracle.codec;

import com.candor.core.seal.SealedType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClearValuesCodecTest {

    private static final List<SealedType> DISCLOSED = List.of(SealedType.UINT8, SealedType.UINT32, SealedType.UINT64);

    private final ClearValuesCodec codec = new ClearValuesCodec();

    @Property(tries = 100)
    void disclosedFieldsDecodeInRequestOrder(
            @ForAll @IntRange(min = 0, max = 5) int category,
            @ForAll @IntRange(min = 1, max = 100) int severity,
            @ForAll @LongRange(min = 0, max = 4_102_444_800L) long timestamp) {
        List<BigInteger> values = List.of(
                BigInteger.valueOf(category), BigInteger.valueOf(severity), BigInteger.valueOf(timestamp));

        byte[] encoded = codec.encode(DISCLOSED, values);

        assertThat(encoded).hasSize(96);
        assertThat(codec.decode(encoded, DISCLOSED)).containsExactlyElementsOf(values);
    }

    @Test
    void eachValueTakesOneRightAlignedWord() {
        byte[] encoded = codec.encode(List.of(SealedType.UINT8, SealedType.BOOL),
                List.of(BigInteger.valueOf(5), BigInteger.ONE));

        assertThat(encoded).hasSize(64);
        assertThat(encoded[31]).isEqualTo((byte) 5);
        assertThat(encoded[63]).isEqualTo((byte) 1);
        for (int i = 0; i < 31; i++) {
            assertThat(encoded[i]).isZero();
        }
    }

    @Test
    void payloadOfWrongLengthIsRejected() {
        assertThatThrownBy(() -> codec.decode(new byte[95], DISCLOSED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(new byte[128], DISCLOSED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(null, DISCLOSED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void oversizedWordIsRejectedNotTruncated() {
        byte[] encoded = codec.encode(DISCLOSED, List.of(BigInteger.ONE, BigInteger.TEN, BigInteger.ONE));
        encoded[30] = 1; // category word now holds 257

        assertThatThrownBy(() -> codec.decode(encoded, DISCLOSED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not fit");
    }

    @Test
    void valueOutsideTypeIsNotEncoded() {
        assertThatThrownBy(() -> codec.encode(List.of(SealedType.UINT8), List.of(BigInteger.valueOf(300))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.encode(List.of(SealedType.UINT8), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
