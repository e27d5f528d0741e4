package com.ryuqq.execdb.application.residual;

/**
 * 이전 실행에서 남은 상태 하나.
 *
 * @param type 유형
 * @param entityId 대상 주문/포지션 ID
 * @param detail 설명
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record Residual(
    Type type,
    String entityId,
    String detail
) {

    /**
     * 잔여 상태 유형.
     */
    public enum Type {

        /** 아직 WORKING 집합에 있는 주문 */
        WORKING_ORDER,

        /** 아직 OPEN 집합에 있는 포지션 */
        OPEN_POSITION,

        /** order→strategy 인덱스 항목 누락 */
        MISSING_ORDER_STRATEGY,

        /** order→position은 있으나 position→{orders}에 주문이 없음 */
        MISSING_POSITION_ORDER,

        /** position→strategy 인덱스 항목 누락 */
        MISSING_POSITION_STRATEGY;

        /**
         * 참조 무결성 위반 여부.
         *
         * @return 인덱스 누락 유형이면 true
         */
        public boolean isIntegrityViolation() {
            return this != WORKING_ORDER && this != OPEN_POSITION;
        }
    }

    public Residual {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (detail == null) {
            throw new IllegalArgumentException("detail cannot be null");
        }
    }
}
