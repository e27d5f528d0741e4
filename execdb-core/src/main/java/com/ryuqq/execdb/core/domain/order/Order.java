package com.ryuqq.execdb.core.domain.order;

import com.ryuqq.execdb.core.domain.command.CreateOrder;
import com.ryuqq.execdb.core.domain.event.OrderAccepted;
import com.ryuqq.execdb.core.domain.event.OrderCancelled;
import com.ryuqq.execdb.core.domain.event.OrderEvent;
import com.ryuqq.execdb.core.domain.event.OrderExpired;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.event.OrderRejected;
import com.ryuqq.execdb.core.domain.event.OrderSubmitted;
import com.ryuqq.execdb.core.domain.event.OrderWorking;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 주문 (가변 엔티티).
 *
 * <p>주문은 생성 명령 {@link CreateOrder}로 만들어지고, 이후 {@link OrderEvent}가
 * 순서대로 적용되며 상태가 바뀝니다. 같은 생성 명령에 같은 이벤트를 같은 순서로
 * 적용하면 항상 같은 주문이 만들어집니다.</p>
 *
 * <p><strong>동등성:</strong> 생성 명령, 상태, 적용된 이벤트, 체결 정보 전체를 비교합니다.
 * hashCode는 clOrdId만 사용합니다.</p>
 *
 * <p>스레드 안전하지 않습니다. 단일 writer가 소유합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class Order {

    private final CreateOrder initCommand;
    private final List<OrderEvent> events;
    private OrderState state;
    private AccountId accountId;
    private String orderId;
    private PositionId positionId;
    private BigDecimal filledQuantity;
    private BigDecimal averagePrice;

    private Order(CreateOrder initCommand) {
        this.initCommand = initCommand;
        this.events = new ArrayList<>();
        this.state = OrderState.INITIALIZED;
        this.filledQuantity = BigDecimal.ZERO;
    }

    /**
     * 생성 명령으로 주문 생성.
     *
     * @param command 생성 명령
     * @return INITIALIZED 상태의 주문
     * @throws IllegalArgumentException command가 null인 경우
     */
    public static Order create(CreateOrder command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return new Order(command);
    }

    /**
     * 이벤트 적용.
     *
     * @param event 적용할 이벤트
     * @throws IllegalArgumentException event가 null이거나 다른 주문의 이벤트인 경우
     * @throws IllegalStateException 현재 상태에서 허용되지 않는 전이인 경우
     */
    public void apply(OrderEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!event.clOrdId().equals(initCommand.clOrdId())) {
            throw new IllegalArgumentException(
                String.format("Event for %s cannot be applied to %s", event.clOrdId(), initCommand.clOrdId())
            );
        }

        OrderState next = nextState(event);
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Invalid order state transition for %s: %s → %s (%s)",
                    initCommand.clOrdId().getValue(), state, next, event.getClass().getSimpleName())
            );
        }

        accountId = event.accountId();
        if (event instanceof OrderAccepted accepted) {
            orderId = accepted.orderId();
        } else if (event instanceof OrderWorking working) {
            orderId = working.orderId();
        } else if (event instanceof OrderFilled filled) {
            orderId = filled.orderId();
            applyFill(filled);
        }

        state = next;
        events.add(event);
    }

    private OrderState nextState(OrderEvent event) {
        if (event instanceof OrderSubmitted) {
            return OrderState.SUBMITTED;
        } else if (event instanceof OrderAccepted) {
            return OrderState.ACCEPTED;
        } else if (event instanceof OrderRejected) {
            return OrderState.REJECTED;
        } else if (event instanceof OrderWorking) {
            return OrderState.WORKING;
        } else if (event instanceof OrderCancelled) {
            return OrderState.CANCELLED;
        } else if (event instanceof OrderExpired) {
            return OrderState.EXPIRED;
        } else if (event instanceof OrderFilled filled) {
            return filled.isFullFill() ? OrderState.FILLED : OrderState.PARTIALLY_FILLED;
        }
        throw new IllegalArgumentException("Unsupported order event: " + event.getClass().getName());
    }

    private void applyFill(OrderFilled fill) {
        BigDecimal total = filledQuantity.add(fill.filledQuantity());
        if (averagePrice == null) {
            averagePrice = fill.averagePrice();
        } else {
            // 체결 수량 가중 평균
            averagePrice = averagePrice.multiply(filledQuantity)
                .add(fill.averagePrice().multiply(fill.filledQuantity()))
                .divide(total, MathContext.DECIMAL64);
        }
        filledQuantity = total;
        if (fill.positionId() != null) {
            positionId = fill.positionId();
        }
    }

    public ClientOrderId clOrdId() {
        return initCommand.clOrdId();
    }

    public StrategyId strategyId() {
        return initCommand.strategyId();
    }

    public String symbol() {
        return initCommand.symbol();
    }

    public OrderSide side() {
        return initCommand.side();
    }

    public OrderType type() {
        return initCommand.type();
    }

    public BigDecimal quantity() {
        return initCommand.quantity();
    }

    /**
     * 지정가/스탑 가격.
     *
     * @return 가격 (MARKET 주문이면 null)
     */
    public BigDecimal price() {
        return initCommand.price();
    }

    public CreateOrder initCommand() {
        return initCommand;
    }

    public OrderState state() {
        return state;
    }

    public AccountId accountId() {
        return accountId;
    }

    /**
     * 브로커 주문 ID.
     *
     * @return 브로커 주문 ID (수락 전이면 null)
     */
    public String orderId() {
        return orderId;
    }

    /**
     * 체결 이벤트에 기록된 포지션 ID.
     *
     * @return 포지션 ID (체결 전이거나 배정되지 않았으면 null)
     */
    public PositionId positionId() {
        return positionId;
    }

    public BigDecimal filledQuantity() {
        return filledQuantity;
    }

    /**
     * 평균 체결가.
     *
     * @return 평균 체결가 (체결 전이면 null)
     */
    public BigDecimal averagePrice() {
        return averagePrice;
    }

    public boolean isWorking() {
        return state == OrderState.WORKING;
    }

    public boolean isCompleted() {
        return state.isCompleted();
    }

    /**
     * 적용된 이벤트 목록 (적용 순서).
     *
     * @return 읽기 전용 이벤트 목록
     */
    public List<OrderEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public int eventCount() {
        return events.size();
    }

    /**
     * 가장 최근에 적용된 이벤트.
     *
     * @return 마지막 이벤트 (적용된 이벤트가 없으면 empty)
     */
    public Optional<OrderEvent> lastEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order other = (Order) o;
        return initCommand.equals(other.initCommand)
            && state == other.state
            && events.equals(other.events)
            && Objects.equals(accountId, other.accountId)
            && Objects.equals(orderId, other.orderId)
            && Objects.equals(positionId, other.positionId)
            && filledQuantity.equals(other.filledQuantity)
            && Objects.equals(averagePrice, other.averagePrice);
    }

    @Override
    public int hashCode() {
        return initCommand.clOrdId().hashCode();
    }

    @Override
    public String toString() {
        return "Order{" + initCommand.clOrdId().getValue()
            + ", " + initCommand.side() + " " + initCommand.quantity().toPlainString()
            + " " + initCommand.symbol() + " " + initCommand.type()
            + ", state=" + state + '}';
    }
}
