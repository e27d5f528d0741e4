package com.ryuqq.execdb.core.domain.position;

import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 포지션 (가변 엔티티).
 *
 * <p>포지션은 포지션 ID가 있는 첫 체결 이벤트로 열리고, 이후 같은 종목의 체결이
 * 순서대로 적용됩니다. 부호 있는 수량이 0이 되면 닫힙니다.</p>
 *
 * <p><strong>불변 속성:</strong> id, strategyId, symbol, entry (진입 방향)</p>
 * <p><strong>추가 전용:</strong> 구성 주문 ID 집합, 체결 이벤트 목록</p>
 *
 * <p>스레드 안전하지 않습니다. 단일 writer가 소유합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class Position {

    private final PositionId id;
    private final StrategyId strategyId;
    private final String symbol;
    private final OrderSide entry;
    private final Instant openedTime;
    private final List<OrderFilled> events;
    private final Set<ClientOrderId> orderIds;
    private final List<String> executionIds;
    private BigDecimal relativeQuantity;
    private BigDecimal peakQuantity;
    private BigDecimal averageOpenPrice;
    private BigDecimal averageClosePrice;
    private BigDecimal closedQuantity;
    private BigDecimal realizedPoints;
    private Instant closedTime;

    private Position(OrderFilled opening) {
        this.id = opening.positionId();
        this.strategyId = opening.strategyId();
        this.symbol = opening.symbol();
        this.entry = opening.side();
        this.openedTime = opening.timestamp();
        this.events = new ArrayList<>();
        this.orderIds = new LinkedHashSet<>();
        this.executionIds = new ArrayList<>();
        this.relativeQuantity = BigDecimal.ZERO;
        this.peakQuantity = BigDecimal.ZERO;
        this.closedQuantity = BigDecimal.ZERO;
        this.realizedPoints = BigDecimal.ZERO;
    }

    /**
     * 첫 체결로 포지션 개설.
     *
     * @param fill 포지션 ID가 있는 체결 이벤트
     * @return 개설된 포지션
     * @throws IllegalArgumentException fill이 null이거나 포지션 ID가 없는 경우
     */
    public static Position open(OrderFilled fill) {
        if (fill == null) {
            throw new IllegalArgumentException("fill cannot be null");
        }
        if (fill.positionId() == null) {
            throw new IllegalArgumentException("fill must carry a positionId to open a position: " + fill.clOrdId());
        }
        Position position = new Position(fill);
        position.apply(fill);
        return position;
    }

    /**
     * 체결 적용.
     *
     * @param fill 체결 이벤트
     * @throws IllegalArgumentException fill이 null이거나 종목/포지션이 다른 경우
     * @throws IllegalStateException 이미 적용된 체결인 경우
     */
    public void apply(OrderFilled fill) {
        if (fill == null) {
            throw new IllegalArgumentException("fill cannot be null");
        }
        if (!symbol.equals(fill.symbol())) {
            throw new IllegalArgumentException(
                String.format("Fill for %s cannot be applied to position %s on %s", fill.symbol(), id.getValue(), symbol)
            );
        }
        if (fill.positionId() != null && !fill.positionId().equals(id)) {
            throw new IllegalArgumentException(
                String.format("Fill for %s cannot be applied to position %s", fill.positionId(), id.getValue())
            );
        }
        if (executionIds.contains(fill.executionId())) {
            throw new IllegalStateException(
                String.format("Execution %s already applied to position %s", fill.executionId(), id.getValue())
            );
        }

        BigDecimal signed = fill.signedQuantity();
        boolean increasing = relativeQuantity.signum() == 0 || relativeQuantity.signum() == signed.signum();
        if (increasing) {
            BigDecimal current = relativeQuantity.abs();
            BigDecimal total = current.add(fill.filledQuantity());
            averageOpenPrice = averageOpenPrice == null
                ? fill.averagePrice()
                : averageOpenPrice.multiply(current)
                    .add(fill.averagePrice().multiply(fill.filledQuantity()))
                    .divide(total, MathContext.DECIMAL64);
        } else {
            BigDecimal closing = fill.filledQuantity().min(relativeQuantity.abs());
            BigDecimal totalClosed = closedQuantity.add(closing);
            averageClosePrice = averageClosePrice == null
                ? fill.averagePrice()
                : averageClosePrice.multiply(closedQuantity)
                    .add(fill.averagePrice().multiply(closing))
                    .divide(totalClosed, MathContext.DECIMAL64);
            BigDecimal points = fill.averagePrice().subtract(averageOpenPrice).multiply(closing);
            realizedPoints = realizedPoints.add(entry == OrderSide.BUY ? points : points.negate());
            closedQuantity = totalClosed;
        }

        relativeQuantity = relativeQuantity.add(signed);
        peakQuantity = peakQuantity.max(relativeQuantity.abs());
        closedTime = relativeQuantity.signum() == 0 ? fill.timestamp() : null;

        orderIds.add(fill.clOrdId());
        executionIds.add(fill.executionId());
        events.add(fill);
    }

    public PositionId id() {
        return id;
    }

    public StrategyId strategyId() {
        return strategyId;
    }

    public String symbol() {
        return symbol;
    }

    public OrderSide entry() {
        return entry;
    }

    public Instant openedTime() {
        return openedTime;
    }

    /**
     * 포지션이 닫힌 시각.
     *
     * @return 닫힌 시각 (열려 있으면 empty)
     */
    public Optional<Instant> closedTime() {
        return Optional.ofNullable(closedTime);
    }

    public BigDecimal relativeQuantity() {
        return relativeQuantity;
    }

    public BigDecimal quantity() {
        return relativeQuantity.abs();
    }

    public BigDecimal peakQuantity() {
        return peakQuantity;
    }

    public BigDecimal averageOpenPrice() {
        return averageOpenPrice;
    }

    /**
     * 평균 청산가.
     *
     * @return 평균 청산가 (청산 체결이 없으면 null)
     */
    public BigDecimal averageClosePrice() {
        return averageClosePrice;
    }

    public BigDecimal realizedPoints() {
        return realizedPoints;
    }

    public MarketPosition marketPosition() {
        int sign = relativeQuantity.signum();
        return sign == 0 ? MarketPosition.FLAT : sign > 0 ? MarketPosition.LONG : MarketPosition.SHORT;
    }

    public boolean isOpen() {
        return relativeQuantity.signum() != 0;
    }

    public boolean isClosed() {
        return !isOpen();
    }

    /**
     * 구성 주문 ID (최초 체결 순서).
     *
     * @return 읽기 전용 주문 ID 집합
     */
    public Set<ClientOrderId> orderIds() {
        return Collections.unmodifiableSet(orderIds);
    }

    public List<String> executionIds() {
        return Collections.unmodifiableList(executionIds);
    }

    /**
     * 적용된 체결 이벤트 (첫 번째가 개설 이벤트).
     *
     * @return 읽기 전용 이벤트 목록
     */
    public List<OrderFilled> events() {
        return Collections.unmodifiableList(events);
    }

    public int eventCount() {
        return events.size();
    }

    public OrderFilled openingEvent() {
        return events.get(0);
    }

    public OrderFilled lastEvent() {
        return events.get(events.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Position other = (Position) o;
        return id.equals(other.id)
            && strategyId.equals(other.strategyId)
            && symbol.equals(other.symbol)
            && entry == other.entry
            && openedTime.equals(other.openedTime)
            && events.equals(other.events)
            && orderIds.equals(other.orderIds)
            && executionIds.equals(other.executionIds)
            && relativeQuantity.equals(other.relativeQuantity)
            && peakQuantity.equals(other.peakQuantity)
            && Objects.equals(averageOpenPrice, other.averageOpenPrice)
            && Objects.equals(averageClosePrice, other.averageClosePrice)
            && closedQuantity.equals(other.closedQuantity)
            && realizedPoints.equals(other.realizedPoints)
            && Objects.equals(closedTime, other.closedTime);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Position{" + id.getValue() + ", " + marketPosition() + " " + quantity().toPlainString()
            + " " + symbol + ", strategy=" + strategyId.getValue() + '}';
    }
}
