package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;

import java.time.Instant;
import java.util.UUID;

/**
 * 브로커가 주문을 수락함. {@code orderId}는 브로커가 부여한 ID입니다.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record OrderAccepted(
    ClientOrderId clOrdId,
    AccountId accountId,
    String orderId,
    UUID eventId,
    Instant timestamp
) implements OrderEvent {

    public OrderAccepted {
        if (clOrdId == null) {
            throw new IllegalArgumentException("clOrdId cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
