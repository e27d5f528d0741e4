package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;

/**
 * 주문에 적용되는 이벤트.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface OrderEvent extends Event
    permits OrderSubmitted, OrderAccepted, OrderRejected, OrderWorking,
            OrderCancelled, OrderExpired, OrderFilled {

    /**
     * 대상 주문 ID.
     *
     * @return 클라이언트 주문 ID
     */
    ClientOrderId clOrdId();

    /**
     * 주문이 속한 계좌 ID.
     *
     * @return 계좌 ID
     */
    AccountId accountId();
}
