package com.ryuqq.execdb.core.model;

/**
 * 전략 식별자 (예: EmptyStrategy-001).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class StrategyId extends Identifier {

    private StrategyId(String value) {
        super(value);
    }

    /**
     * StrategyId 생성.
     *
     * @param value 식별자 값
     * @return StrategyId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StrategyId of(String value) {
        return new StrategyId(value);
    }
}
