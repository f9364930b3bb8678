package com.ryuqq.artledger.core.model;

/**
 * 자산(토큰) 식별자.
 *
 * <p>부호 없는 정수이며, 발행(mint) 시 1부터 순차적으로 할당됩니다.
 * 한 번 할당된 값은 재사용되거나 소멸되지 않습니다.</p>
 *
 * <p><strong>유효성 검증:</strong> 음수 불가. 0은 표현 가능하지만 절대 발행되지 않습니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class TokenId implements Comparable<TokenId> {

    /**
     * 첫 번째로 발행되는 식별자.
     */
    public static final TokenId FIRST = new TokenId(1L);

    private final long value;

    private TokenId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("TokenId must be non-negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * TokenId 생성.
     *
     * @param value 식별자 값
     * @return TokenId 인스턴스
     * @throws IllegalArgumentException 음수인 경우
     */
    public static TokenId of(long value) {
        return new TokenId(value);
    }

    /**
     * 다음 식별자.
     *
     * @return value + 1
     * @throws ArithmeticException long 범위를 초과하는 경우
     */
    public TokenId next() {
        return new TokenId(Math.addExact(value, 1L));
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(TokenId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenId tokenId = (TokenId) o;
        return value == tokenId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "TokenId{" + value + '}';
    }
}
