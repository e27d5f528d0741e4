package com.ryuqq.execdb.testkit.stubs;

import com.ryuqq.execdb.core.domain.command.CreateOrder;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.domain.order.OrderType;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 테스트용 주문 생성기.
 *
 * <p>주문 ID는 {@code O-19700101-000000-{traderTag}-{strategyTag}-{seq}} 형식으로 순서대로 발급됩니다.
 * 포지션 ID도 같은 방식입니다 ({@code P-...}).</p>
 *
 * <p>스레드 안전하지 않습니다. 테스트 하나당 인스턴스 하나를 사용하세요.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class TestOrderFactory {

    public static final StrategyId DEFAULT_STRATEGY = StrategyId.of("EmptyStrategy-001");

    private static final String DATE_TIME = "19700101-000000";

    private final TraderId traderId;
    private final StrategyId strategyId;
    private int orderCount;
    private int positionCount;

    public TestOrderFactory() {
        this(TestStubs.TRADER_ID, DEFAULT_STRATEGY);
    }

    public TestOrderFactory(TraderId traderId, StrategyId strategyId) {
        if (traderId == null) {
            throw new IllegalArgumentException("traderId cannot be null");
        }
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }
        this.traderId = traderId;
        this.strategyId = strategyId;
    }

    public StrategyId strategyId() {
        return strategyId;
    }

    public Order market(String symbol, OrderSide side, BigDecimal quantity) {
        return create(symbol, side, OrderType.MARKET, quantity, null);
    }

    public Order limit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        return create(symbol, side, OrderType.LIMIT, quantity, price);
    }

    public Order stop(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        return create(symbol, side, OrderType.STOP, quantity, price);
    }

    public ClientOrderId nextClientOrderId() {
        return ClientOrderId.of("O-" + idSuffix(++orderCount));
    }

    public PositionId nextPositionId() {
        return PositionId.of("P-" + idSuffix(++positionCount));
    }

    private Order create(String symbol, OrderSide side, OrderType type, BigDecimal quantity, BigDecimal price) {
        return Order.create(new CreateOrder(
            nextClientOrderId(),
            strategyId,
            symbol,
            side,
            type,
            quantity,
            price,
            UUID.randomUUID(),
            TestStubs.TIMESTAMP
        ));
    }

    private String idSuffix(int sequence) {
        String strategyTag = strategyId.getValue().substring(strategyId.getValue().lastIndexOf('-') + 1);
        return DATE_TIME + "-" + traderId.tag() + "-" + strategyTag + "-" + sequence;
    }
}
