package com.ryuqq.execdb.core.model;

/**
 * 실행 엔티티 식별자의 공통 기반.
 *
 * <p>모든 식별자는 문자열 값 하나를 감싸는 불변 Value Object이며,
 * 키 네임스페이스와 인덱스의 멤버 값으로 그대로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>콜론(:) 불가 (키 구분자와 충돌)</li>
 * </ul>
 *
 * <p>동등성은 구체 타입과 값으로 판단합니다. 같은 값이라도
 * {@link ClientOrderId}와 {@link PositionId}는 서로 같지 않습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public abstract class Identifier {

    private final String value;

    protected Identifier(String value) {
        String name = getClass().getSimpleName();
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException(name + " length cannot exceed 255 characters");
        }
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(name + " cannot contain ':' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + value + '}';
    }
}
