package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * 주문이 시장에서 대기 중 (지정가/스탑 주문).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderWorking(
    ClientOrderId clOrdId,
    AccountId accountId,
    String orderId,
    BigDecimal price,
    UUID eventId,
    Instant timestamp
) implements OrderEvent {

    public OrderWorking {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
