package com.ryuqq.artledger.core.encoding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Encoders 테스트.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
@DisplayName("Encoders 테스트")
class EncodersTest {

    // ============================================================
    // 1. toHex24
    // ============================================================

    @Test
    @DisplayName("toHex24(0) 은 000000")
    void toHex24_Zero() {
        assertThat(Encoders.toHex24(0)).isEqualTo("000000");
    }

    @Test
    @DisplayName("toHex24(0xFFFFFF) 은 ffffff")
    void toHex24_Max() {
        assertThat(Encoders.toHex24(16777215)).isEqualTo("ffffff");
    }

    @Test
    @DisplayName("최상위 nibble 부터 기록하고 앞자리 0을 유지한다")
    void toHex24_MostSignificantNibbleFirst() {
        assertThat(Encoders.toHex24(0x0A0B0C)).isEqualTo("0a0b0c");
        assertThat(Encoders.toHex24(0x123456)).isEqualTo("123456");
        assertThat(Encoders.toHex24(0x00000F)).isEqualTo("00000f");
        assertThat(Encoders.toHex24(0xF00000)).isEqualTo("f00000");
    }

    @Test
    void toHex24_OutOfRange_ThrowsException() {
        assertThatThrownBy(() -> Encoders.toHex24(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("24-bit");
        assertThatThrownBy(() -> Encoders.toHex24(0x1000000))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 2. toDecimal
    // ============================================================

    @Test
    @DisplayName("toDecimal(0) 은 \"0\"")
    void toDecimal_Zero() {
        assertThat(Encoders.toDecimal(0)).isEqualTo("0");
    }

    @Test
    void toDecimal_Values() {
        assertThat(Encoders.toDecimal(123)).isEqualTo("123");
        assertThat(Encoders.toDecimal(7)).isEqualTo("7");
        assertThat(Encoders.toDecimal(10)).isEqualTo("10");
        assertThat(Encoders.toDecimal(1_000_000)).isEqualTo("1000000");
        assertThat(Encoders.toDecimal(Long.MAX_VALUE)).isEqualTo(Long.toString(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("BigInteger 10진수 변환은 long 범위를 넘는 값도 처리한다")
    void toDecimal_BigInteger() {
        assertThat(Encoders.toDecimal(BigInteger.ZERO)).isEqualTo("0");
        assertThat(Encoders.toDecimal(BigInteger.valueOf(123))).isEqualTo("123");
        assertThat(Encoders.toDecimal(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)))
            .isEqualTo("9223372036854775808");
        assertThat(Encoders.toDecimal(BigInteger.TWO.pow(256).subtract(BigInteger.ONE)))
            .isEqualTo("115792089237316195423570985008687907853269984665640564039457584007913129639935");
    }

    @Test
    void toDecimal_NegativeBigInteger_ThrowsException() {
        assertThatThrownBy(() -> Encoders.toDecimal(BigInteger.valueOf(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-negative");
    }

    @Test
    void toDecimal_Negative_ThrowsException() {
        assertThatThrownBy(() -> Encoders.toDecimal(-5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-negative");
    }

    // ============================================================
    // 3. escapeJson
    // ============================================================

    @Test
    @DisplayName("따옴표와 역슬래시만 이스케이프한다")
    void escapeJson_QuoteAndBackslash() {
        assertThat(Encoders.escapeJson("a\"b\\c")).isEqualTo("a\\\"b\\\\c");
    }

    @Test
    @DisplayName("그 외 문자는 제어 문자를 포함해 그대로 복사한다")
    void escapeJson_OtherCharactersUnchanged() {
        String input = "plain <svg fill='#fff'/> \n\t é / {}";

        assertThat(Encoders.escapeJson(input)).isEqualTo(input);
    }

    @Test
    void escapeJson_Empty() {
        assertThat(Encoders.escapeJson("")).isEmpty();
    }

    @Test
    void escapeJson_Null_ThrowsException() {
        assertThatThrownBy(() -> Encoders.escapeJson(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 4. dataUri
    // ============================================================

    @Test
    void dataUri_PrefixesMimeType() {
        assertThat(Encoders.dataUri("application/json", "{}"))
            .isEqualTo("data:application/json;utf8,{}");
    }

    @Test
    void dataUri_BlankMimeType_ThrowsException() {
        assertThatThrownBy(() -> Encoders.dataUri(" ", "{}"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
