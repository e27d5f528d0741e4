package com.ryuqq.execdb.core.model;

/**
 * 포지션 식별자 (예: P-1).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class PositionId extends Identifier {

    private PositionId(String value) {
        super(value);
    }

    /**
     * PositionId 생성.
     *
     * @param value 식별자 값
     * @return PositionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PositionId of(String value) {
        return new PositionId(value);
    }
}
