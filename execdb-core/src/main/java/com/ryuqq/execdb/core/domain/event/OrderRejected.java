package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;

import java.time.Instant;
import java.util.UUID;

/**
 * 브로커가 주문을 거절함.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderRejected(
    ClientOrderId clOrdId,
    AccountId accountId,
    String reason,
    UUID eventId,
    Instant timestamp
) implements OrderEvent {

    public OrderRejected {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
