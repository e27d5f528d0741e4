package com.ryuqq.execdb.testkit.stubs;

import com.ryuqq.execdb.core.domain.event.AccountState;
import com.ryuqq.execdb.core.domain.event.OrderAccepted;
import com.ryuqq.execdb.core.domain.event.OrderCancelled;
import com.ryuqq.execdb.core.domain.event.OrderExpired;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.event.OrderRejected;
import com.ryuqq.execdb.core.domain.event.OrderSubmitted;
import com.ryuqq.execdb.core.domain.event.OrderWorking;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.TraderId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 식별자와 이벤트 생성기.
 *
 * <p>모든 이벤트의 시각은 {@link #TIMESTAMP}로 고정되어 있어 재생 결과를 그대로 비교할 수 있습니다.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, new BigDecimal("100000"));
 * order.apply(TestStubs.submitted(order));
 * order.apply(TestStubs.accepted(order));
 * order.apply(TestStubs.filled(order, positionId, new BigDecimal("1.00001")));
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class TestStubs {

    public static final TraderId TRADER_ID = TraderId.of("TESTER-000");
    public static final AccountId ACCOUNT_ID = AccountId.of("FXCM-D102851000");
    public static final String AUDUSD = "AUD/USD.FXCM";
    public static final String USD = "USD";
    public static final Instant TIMESTAMP = Instant.parse("1970-01-01T00:00:00Z");

    private static final AtomicLong EXECUTION_SEQUENCE = new AtomicLong();

    private TestStubs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static AccountState accountState() {
        return accountState(ACCOUNT_ID, new BigDecimal("1000000.00"));
    }

    public static AccountState accountState(AccountId accountId, BigDecimal cashBalance) {
        return new AccountState(accountId, USD, cashBalance, new BigDecimal("1000000.00"),
            new BigDecimal("0.00"), UUID.randomUUID(), TIMESTAMP);
    }

    public static OrderSubmitted submitted(Order order) {
        return new OrderSubmitted(order.clOrdId(), ACCOUNT_ID, UUID.randomUUID(), TIMESTAMP);
    }

    public static OrderAccepted accepted(Order order) {
        return new OrderAccepted(order.clOrdId(), ACCOUNT_ID, brokerOrderId(order), UUID.randomUUID(), TIMESTAMP);
    }

    public static OrderRejected rejected(Order order) {
        return new OrderRejected(order.clOrdId(), ACCOUNT_ID, "ORDER_REJECTED", UUID.randomUUID(), TIMESTAMP);
    }

    /**
     * 작업 중 이벤트. 가격이 없는 MARKET 주문은 1.00000으로 표시합니다.
     */
    public static OrderWorking working(Order order) {
        BigDecimal price = order.price() != null ? order.price() : new BigDecimal("1.00000");
        return new OrderWorking(order.clOrdId(), ACCOUNT_ID, brokerOrderId(order), price, UUID.randomUUID(), TIMESTAMP);
    }

    public static OrderCancelled cancelled(Order order) {
        return new OrderCancelled(order.clOrdId(), ACCOUNT_ID, UUID.randomUUID(), TIMESTAMP);
    }

    public static OrderExpired expired(Order order) {
        return new OrderExpired(order.clOrdId(), ACCOUNT_ID, UUID.randomUUID(), TIMESTAMP);
    }

    /**
     * 전량 체결.
     *
     * @param order 주문
     * @param positionId 포지션 ID (null이면 포지션 미배정)
     * @param price 체결가
     * @return 남은 수량이 0인 체결 이벤트
     */
    public static OrderFilled filled(Order order, PositionId positionId, BigDecimal price) {
        return fill(order, positionId, order.quantity().subtract(order.filledQuantity()), price, TIMESTAMP);
    }

    /**
     * 부분 체결.
     */
    public static OrderFilled partiallyFilled(Order order, PositionId positionId, BigDecimal quantity, BigDecimal price) {
        return fill(order, positionId, quantity, price, TIMESTAMP);
    }

    public static OrderFilled fill(Order order, PositionId positionId, BigDecimal quantity,
                                   BigDecimal price, Instant timestamp) {
        BigDecimal leaves = order.quantity().subtract(order.filledQuantity()).subtract(quantity);
        return new OrderFilled(
            order.clOrdId(),
            ACCOUNT_ID,
            brokerOrderId(order),
            "E-" + EXECUTION_SEQUENCE.incrementAndGet(),
            positionId,
            order.strategyId(),
            order.symbol(),
            order.side(),
            quantity,
            leaves.max(BigDecimal.ZERO),
            price,
            USD,
            UUID.randomUUID(),
            timestamp
        );
    }

    private static String brokerOrderId(Order order) {
        return "B-" + order.clOrdId().getValue();
    }
}
