package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * 주문이 (부분) 체결됨.
 *
 * <p>포지션을 여는 이벤트이자 포지션에 적용되는 유일한 이벤트입니다.</p>
 *
 * @param clOrdId 클라이언트 주문 ID
 * @param accountId 계좌 ID
 * @param orderId 브로커 주문 ID
 * @param executionId 체결 ID
 * @param positionId 포지션 ID (null 가능: 아직 포지션이 배정되지 않은 체결)
 * @param strategyId 전략 ID
 * @param symbol 종목 (예: AUD/USD.FXCM)
 * @param side 주문 방향
 * @param filledQuantity 이번 체결 수량
 * @param leavesQuantity 남은 수량
 * @param averagePrice 이번 체결 평균가
 * @param currency 결제 통화
 * @param eventId 이벤트 ID
 * @param timestamp 체결 시각
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderFilled(
    ClientOrderId clOrdId,
    AccountId accountId,
    String orderId,
    String executionId,
    PositionId positionId,
    StrategyId strategyId,
    String symbol,
    OrderSide side,
    BigDecimal filledQuantity,
    BigDecimal leavesQuantity,
    BigDecimal averagePrice,
    String currency,
    UUID eventId,
    Instant timestamp
) implements OrderEvent {

    public OrderFilled {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        // positionId는 null 허용
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        if (filledQuantity == null || filledQuantity.signum() <= 0) {
            throw new IllegalArgumentException("filledQuantity must be positive (current: " + filledQuantity + ")");
        }
        if (leavesQuantity == null || leavesQuantity.signum() < 0) {
            throw new IllegalArgumentException("leavesQuantity must be non-negative (current: " + leavesQuantity + ")");
        }
        if (averagePrice == null || averagePrice.signum() <= 0) {
            throw new IllegalArgumentException("averagePrice must be positive (current: " + averagePrice + ")");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency cannot be null or blank");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    /**
     * 부호 있는 체결 수량 (BUY: +, SELL: -).
     *
     * @return 부호 있는 체결 수량
     */
    public BigDecimal signedQuantity() {
        return side == OrderSide.BUY ? filledQuantity : filledQuantity.negate();
    }

    /**
     * 주문 전량 체결 여부.
     *
     * @return 남은 수량이 0이면 true
     */
    public boolean isFullFill() {
        return leavesQuantity.signum() == 0;
    }
}
