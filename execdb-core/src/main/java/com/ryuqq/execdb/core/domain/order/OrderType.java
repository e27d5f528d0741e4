package com.ryuqq.execdb.core.domain.order;

/**
 * 주문 유형.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP;

    /**
     * 가격 지정이 필요한 유형인지 확인.
     *
     * @return LIMIT 또는 STOP인 경우 true
     */
    public boolean requiresPrice() {
        return this != MARKET;
    }
}
