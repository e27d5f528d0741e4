package com.ryuqq.execdb.core.domain.order;

/**
 * 주문 방향.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
