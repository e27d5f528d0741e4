package com.ryuqq.execdb.core.domain.order;

import com.ryuqq.execdb.core.domain.command.CreateOrder;
import com.ryuqq.execdb.core.domain.event.OrderAccepted;
import com.ryuqq.execdb.core.domain.event.OrderCancelled;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.event.OrderSubmitted;
import com.ryuqq.execdb.core.domain.event.OrderWorking;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 테스트.
 *
 * @author Execution Team
 * @since 1.0.0
 */
class OrderTest {

    private static final ClientOrderId CL_ORD_ID = ClientOrderId.of("O-19700101-000000-000-001-1");
    private static final AccountId ACCOUNT_ID = AccountId.of("FXCM-D102851000");
    private static final StrategyId STRATEGY_ID = StrategyId.of("EmptyStrategy-001");
    private static final Instant NOW = Instant.parse("1970-01-01T00:00:00Z");

    private CreateOrder command;

    @BeforeEach
    void setUp() {
        command = new CreateOrder(CL_ORD_ID, STRATEGY_ID, "AUD/USD.FXCM", OrderSide.BUY, OrderType.STOP,
            new BigDecimal("100000"), new BigDecimal("1.00000"), UUID.randomUUID(), NOW);
    }

    @Test
    void create_NewOrder_IsInitializedAndWorkingIndex() {
        // When
        Order order = Order.create(command);

        // Then
        assertEquals(OrderState.INITIALIZED, order.state());
        assertFalse(order.isCompleted());
        assertEquals(0, order.eventCount());
        assertTrue(order.lastEvent().isEmpty());
        assertSame(command, order.initCommand());
    }

    @Test
    void apply_SubmittedAcceptedWorking_TracksState() {
        // Given
        Order order = Order.create(command);

        // When
        order.apply(new OrderSubmitted(CL_ORD_ID, ACCOUNT_ID, UUID.randomUUID(), NOW));
        order.apply(new OrderAccepted(CL_ORD_ID, ACCOUNT_ID, "B-1", UUID.randomUUID(), NOW));
        order.apply(new OrderWorking(CL_ORD_ID, ACCOUNT_ID, "B-1", new BigDecimal("1.00000"), UUID.randomUUID(), NOW));

        // Then
        assertEquals(OrderState.WORKING, order.state());
        assertTrue(order.isWorking());
        assertEquals(3, order.eventCount());
        assertEquals(ACCOUNT_ID, order.accountId());
        assertEquals("B-1", order.orderId());
    }

    @Test
    void apply_FullFill_CompletesOrderWithPosition() {
        // Given
        Order order = Order.create(command);
        order.apply(new OrderSubmitted(CL_ORD_ID, ACCOUNT_ID, UUID.randomUUID(), NOW));
        order.apply(new OrderAccepted(CL_ORD_ID, ACCOUNT_ID, "B-1", UUID.randomUUID(), NOW));

        // When
        order.apply(fill("E-1", new BigDecimal("100000"), BigDecimal.ZERO, new BigDecimal("1.00001")));

        // Then
        assertEquals(OrderState.FILLED, order.state());
        assertTrue(order.isCompleted());
        assertEquals(PositionId.of("P-1"), order.positionId());
        assertEquals(new BigDecimal("1.00001"), order.averagePrice());
    }

    @Test
    void apply_PartialFills_WeightsAveragePrice() {
        // Given
        Order order = Order.create(command);
        order.apply(new OrderSubmitted(CL_ORD_ID, ACCOUNT_ID, UUID.randomUUID(), NOW));
        order.apply(new OrderAccepted(CL_ORD_ID, ACCOUNT_ID, "B-1", UUID.randomUUID(), NOW));

        // When
        order.apply(fill("E-1", new BigDecimal("50000"), new BigDecimal("50000"), new BigDecimal("1.0")));
        order.apply(fill("E-2", new BigDecimal("50000"), BigDecimal.ZERO, new BigDecimal("2.0")));

        // Then
        assertEquals(OrderState.FILLED, order.state());
        assertEquals(0, new BigDecimal("1.5").compareTo(order.averagePrice()));
        assertEquals(0, new BigDecimal("100000").compareTo(order.filledQuantity()));
    }

    @Test
    void apply_EventBeforeSubmitted_ThrowsException() {
        // Given
        Order order = Order.create(command);

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> order.apply(new OrderCancelled(CL_ORD_ID, ACCOUNT_ID, UUID.randomUUID(), NOW))
        );
        assertTrue(exception.getMessage().contains("Invalid order state transition"));
        assertEquals(0, order.eventCount());
    }

    @Test
    void apply_EventOfOtherOrder_ThrowsException() {
        // Given
        Order order = Order.create(command);

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> order.apply(new OrderSubmitted(ClientOrderId.of("O-2"), ACCOUNT_ID, UUID.randomUUID(), NOW)));
    }

    @Test
    void equals_SameHistory_AreEqual() {
        // Given
        OrderSubmitted submitted = new OrderSubmitted(CL_ORD_ID, ACCOUNT_ID, UUID.randomUUID(), NOW);
        Order first = Order.create(command);
        Order second = Order.create(command);

        // When
        first.apply(submitted);

        // Then
        assertNotEquals(first, second);
        second.apply(submitted);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void createOrder_MarketWithPrice_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CreateOrder(CL_ORD_ID, STRATEGY_ID, "AUD/USD.FXCM",
            OrderSide.BUY, OrderType.MARKET, BigDecimal.ONE, BigDecimal.ONE, UUID.randomUUID(), NOW));
    }

    private OrderFilled fill(String executionId, BigDecimal filled, BigDecimal leaves, BigDecimal price) {
        return new OrderFilled(CL_ORD_ID, ACCOUNT_ID, "B-1", executionId, PositionId.of("P-1"), STRATEGY_ID,
            "AUD/USD.FXCM", OrderSide.BUY, filled, leaves, price, "USD", UUID.randomUUID(), NOW);
    }
}
