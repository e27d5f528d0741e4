package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;

import java.time.Instant;
import java.util.UUID;

/**
 * 주문이 만료됨.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderExpired(
    ClientOrderId clOrdId,
    AccountId accountId,
    UUID eventId,
    Instant timestamp
) implements OrderEvent {

    public OrderExpired {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
