package com.ryuqq.artledger.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Seed 테스트.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
class SeedTest {

    @Test
    void bits_ExtractsRangeFromLeastSignificantBit() {
        // given: bits [24:48) = 0xabcdef, bits [48:72) = 0x123456
        BigInteger value = new BigInteger("123456abcdef000000", 16);
        Seed seed = new Seed(value);

        // then
        assertThat(seed.bits(24, 24)).isEqualTo(0xabcdef);
        assertThat(seed.bits(48, 24)).isEqualTo(0x123456);
        assertThat(seed.bits(0, 24)).isZero();
    }

    @Test
    void mod_ReturnsRemainder() {
        assertThat(new Seed(BigInteger.valueOf(10)).mod(3)).isEqualTo(1);
        assertThat(new Seed(BigInteger.ZERO).mod(3)).isZero();
    }

    @Test
    void fromDigest_TreatsBytesAsUnsigned() {
        byte[] digest = new byte[32];
        digest[0] = (byte) 0xff;

        Seed seed = Seed.fromDigest(digest);

        assertThat(seed.value().signum()).isPositive();
        assertThat(seed.value().bitLength()).isEqualTo(256);
    }

    @Test
    void constructor_ValueWiderThan256Bits_ThrowsException() {
        assertThatThrownBy(() -> new Seed(BigInteger.ONE.shiftLeft(256)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Seed(BigInteger.valueOf(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bits_InvalidRange_ThrowsException() {
        Seed seed = new Seed(BigInteger.TEN);

        assertThatThrownBy(() -> seed.bits(250, 24)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> seed.bits(0, 32)).isInstanceOf(IllegalArgumentException.class);
    }
}
