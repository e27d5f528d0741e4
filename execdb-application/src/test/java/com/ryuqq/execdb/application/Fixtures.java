package com.ryuqq.execdb.application;

import com.ryuqq.execdb.core.domain.command.CreateOrder;
import com.ryuqq.execdb.core.domain.event.OrderAccepted;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.event.OrderSubmitted;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.domain.order.OrderType;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * application 단위 테스트용 도메인 객체 생성기.
 */
public final class Fixtures {

    public static final TraderId TRADER_ID = TraderId.of("TESTER-000");
    public static final AccountId ACCOUNT_ID = AccountId.of("FXCM-D102851000");
    public static final StrategyId STRATEGY_ID = StrategyId.of("EmptyStrategy-001");
    public static final Instant NOW = Instant.parse("1970-01-01T00:00:00Z");

    private Fixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Order marketOrder(String clOrdId) {
        return Order.create(new CreateOrder(ClientOrderId.of(clOrdId), STRATEGY_ID, "AUD/USD.FXCM",
            OrderSide.BUY, OrderType.MARKET, new BigDecimal("100000"), null, UUID.randomUUID(), NOW));
    }

    public static OrderSubmitted submitted(Order order) {
        return new OrderSubmitted(order.clOrdId(), ACCOUNT_ID, UUID.randomUUID(), NOW);
    }

    public static OrderAccepted accepted(Order order) {
        return new OrderAccepted(order.clOrdId(), ACCOUNT_ID, "B-" + order.clOrdId().getValue(), UUID.randomUUID(), NOW);
    }

    public static OrderFilled filled(Order order, PositionId positionId) {
        return new OrderFilled(order.clOrdId(), ACCOUNT_ID, "B-" + order.clOrdId().getValue(),
            "E-" + order.clOrdId().getValue(), positionId, STRATEGY_ID, order.symbol(), order.side(),
            order.quantity(), BigDecimal.ZERO, new BigDecimal("1.00001"), "USD", UUID.randomUUID(), NOW);
    }

    /**
     * 제출, 수락, 체결까지 적용한 주문으로 포지션 개설.
     */
    public static Position openPosition(Order order, PositionId positionId) {
        order.apply(submitted(order));
        order.apply(accepted(order));
        OrderFilled fill = filled(order, positionId);
        order.apply(fill);
        return Position.open(fill);
    }
}
