package com.ryuqq.execdb.core.domain.order;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 주문의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZED
 *    │
 *    ▼
 * SUBMITTED ──► REJECTED
 *    │
 *    ▼
 * ACCEPTED ──► WORKING ──┬─► PARTIALLY_FILLED ──► FILLED
 *    │                   ├─► FILLED
 *    │                   ├─► CANCELLED
 *    │                   └─► EXPIRED
 *    └─► (WORKING과 동일한 종료 전이)
 * </pre>
 *
 * <p>REJECTED, CANCELLED, EXPIRED, FILLED는 완료(completed) 상태이며
 * 더 이상 전이할 수 없습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum OrderState {

    INITIALIZED,
    SUBMITTED,
    ACCEPTED,
    REJECTED,
    WORKING,
    CANCELLED,
    EXPIRED,
    PARTIALLY_FILLED,
    FILLED;

    private static final Map<OrderState, Set<OrderState>> TRANSITIONS = Map.of(
        INITIALIZED, EnumSet.of(SUBMITTED),
        SUBMITTED, EnumSet.of(ACCEPTED, REJECTED),
        ACCEPTED, EnumSet.of(WORKING, PARTIALLY_FILLED, FILLED, CANCELLED, EXPIRED),
        WORKING, EnumSet.of(WORKING, PARTIALLY_FILLED, FILLED, CANCELLED, EXPIRED),
        PARTIALLY_FILLED, EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELLED, EXPIRED),
        REJECTED, EnumSet.noneOf(OrderState.class),
        CANCELLED, EnumSet.noneOf(OrderState.class),
        EXPIRED, EnumSet.noneOf(OrderState.class),
        FILLED, EnumSet.noneOf(OrderState.class)
    );

    /**
     * 완료 상태인지 확인.
     *
     * @return REJECTED, CANCELLED, EXPIRED, FILLED인 경우 true
     */
    public boolean isCompleted() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * 다음 상태로 전이 가능한지 확인.
     *
     * @param next 다음 상태
     * @return 전이 가능 여부
     */
    public boolean canTransitionTo(OrderState next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }
}
