package com.ryuqq.execdb.core.domain.command;

import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.domain.order.OrderType;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.StrategyId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * 주문 생성 명령.
 *
 * <p>주문의 생성 기록(creation record)이며, {@code Order.create(...)}의 입력입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>quantity는 양수</li>
 *   <li>LIMIT/STOP 주문은 price 필수, MARKET 주문은 price 불가</li>
 * </ul>
 *
 * @param clOrdId 클라이언트 주문 ID
 * @param strategyId 주문을 생성한 전략 ID
 * @param symbol 종목
 * @param side 주문 방향
 * @param type 주문 유형
 * @param quantity 주문 수량
 * @param price 지정가/스탑 가격 (MARKET이면 null)
 * @param commandId 명령 ID
 * @param timestamp 생성 시각
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record CreateOrder(
    ClientOrderId clOrdId,
    StrategyId strategyId,
    String symbol,
    OrderSide side,
    OrderType type,
    BigDecimal quantity,
    BigDecimal price,
    UUID commandId,
    Instant timestamp
) implements Command {

    public CreateOrder {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive (current: " + quantity + ")");
        }
        if (type.requiresPrice() && price == null) {
            throw new IllegalArgumentException("price is required for " + type + " orders");
        }
        if (!type.requiresPrice() && price != null) {
            throw new IllegalArgumentException("price must be null for " + type + " orders");
        }
        if (commandId == null) {
            throw new IllegalArgumentException("commandId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
