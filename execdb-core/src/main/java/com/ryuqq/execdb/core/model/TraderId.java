package com.ryuqq.execdb.core.model;

/**
 * Trader 식별자.
 *
 * <p>Trader는 모든 키의 네임스페이스 루트입니다. 자체로 저장되지는 않습니다.</p>
 *
 * <p>값은 {@code NAME-TAG} 형식입니다 (예: {@code TESTER-000}).</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class TraderId extends Identifier {

    private TraderId(String value) {
        super(value);
        int separator = value.lastIndexOf('-');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("TraderId must be in NAME-TAG format (current: " + value + ")");
        }
    }

    /**
     * {@code NAME-TAG} 문자열로 TraderId 생성.
     *
     * @param value TraderId 값
     * @return TraderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TraderId of(String value) {
        return new TraderId(value);
    }

    /**
     * 이름과 태그로 TraderId 생성.
     *
     * @param name Trader 이름 (예: TESTER)
     * @param tag 주문 ID 태그 (예: 000)
     * @return TraderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TraderId of(String name, String tag) {
        if (name == null || tag == null) {
            throw new IllegalArgumentException("name and tag cannot be null");
        }
        return new TraderId(name + "-" + tag);
    }

    public String name() {
        return getValue().substring(0, getValue().lastIndexOf('-'));
    }

    public String tag() {
        return getValue().substring(getValue().lastIndexOf('-') + 1);
    }
}
