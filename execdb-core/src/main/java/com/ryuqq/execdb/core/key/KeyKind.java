package com.ryuqq.execdb.core.key;

/**
 * 키 템플릿 종류.
 *
 * <p>각 템플릿은 Trader 루트 키 뒤에 붙는 접미사입니다. 접미사가 {@code :}로
 * 끝나는 종류는 엔티티 ID를 덧붙여 엔티티별 키를 만듭니다.</p>
 *
 * <p>템플릿 문자열은 안정성 계약입니다. 운영 도구가 키를 독립적으로 계산하므로
 * 절대 변경하지 마십시오.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum KeyKind {

    TRADER(""),
    ACCOUNTS(":Accounts:"),
    ORDERS(":Orders:"),
    POSITIONS(":Positions:"),
    STRATEGIES(":Strategies:"),
    INDEX_ORDER_POSITION(":Index:OrderPosition"),
    INDEX_ORDER_STRATEGY(":Index:OrderStrategy"),
    INDEX_POSITION_STRATEGY(":Index:PositionStrategy"),
    INDEX_POSITION_ORDERS(":Index:PositionOrders:"),
    INDEX_STRATEGY_ORDERS(":Index:StrategyOrders:"),
    INDEX_STRATEGY_POSITIONS(":Index:StrategyPositions:"),
    INDEX_ORDERS(":Index:Orders"),
    INDEX_ORDERS_WORKING(":Index:Orders:Working"),
    INDEX_ORDERS_COMPLETED(":Index:Orders:Completed"),
    INDEX_POSITIONS(":Index:Positions"),
    INDEX_POSITIONS_OPEN(":Index:Positions:Open"),
    INDEX_POSITIONS_CLOSED(":Index:Positions:Closed");

    private final String suffix;

    KeyKind(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * 엔티티 ID를 덧붙이는 루트 템플릿인지 확인.
     *
     * @return 접미사가 ':'로 끝나면 true
     */
    public boolean isPerEntityRoot() {
        return suffix.endsWith(":");
    }
}
