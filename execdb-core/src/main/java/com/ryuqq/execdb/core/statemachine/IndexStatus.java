package com.ryuqq.execdb.core.statemachine;

/**
 * 상태 인덱스 집합 (Status Set).
 *
 * <p>주문과 포지션은 관측 시점마다 정확히 하나의 상태 집합에 속합니다.</p>
 *
 * <pre>
 * ORDER 계열:    WORKING ⇄ COMPLETED
 * POSITION 계열: OPEN    ⇄ CLOSED
 * </pre>
 *
 * <p>계열이 다른 집합 사이의 이동(예: WORKING → OPEN)은 허용되지 않습니다.
 * 검증은 {@link StatusTransition}이 담당합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum IndexStatus {

    /**
     * 아직 종료되지 않은 주문.
     */
    WORKING(Family.ORDER),

    /**
     * 종료된 주문 (체결 완료, 취소, 거절, 만료).
     */
    COMPLETED(Family.ORDER),

    /**
     * 수량이 남아 있는 포지션.
     */
    OPEN(Family.POSITION),

    /**
     * 수량이 0으로 돌아온 포지션.
     */
    CLOSED(Family.POSITION);

    /**
     * 상태 집합 계열.
     */
    public enum Family {
        ORDER,
        POSITION
    }

    private final Family family;

    IndexStatus(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }

    /**
     * 같은 계열의 반대 상태 집합.
     *
     * @return WORKING ↔ COMPLETED, OPEN ↔ CLOSED
     */
    public IndexStatus opposite() {
        return switch (this) {
            case WORKING -> COMPLETED;
            case COMPLETED -> WORKING;
            case OPEN -> CLOSED;
            case CLOSED -> OPEN;
        };
    }
}
