package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.execdb.core.domain.event.AccountState;
import com.ryuqq.execdb.core.domain.event.OrderAccepted;
import com.ryuqq.execdb.core.domain.event.OrderCancelled;
import com.ryuqq.execdb.core.domain.event.OrderExpired;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.event.OrderRejected;
import com.ryuqq.execdb.core.domain.event.OrderSubmitted;
import com.ryuqq.execdb.core.domain.event.OrderWorking;

/**
 * {@code Event} 다형 타입 mix-in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OrderSubmitted.class, name = "OrderSubmitted"),
    @JsonSubTypes.Type(value = OrderAccepted.class, name = "OrderAccepted"),
    @JsonSubTypes.Type(value = OrderRejected.class, name = "OrderRejected"),
    @JsonSubTypes.Type(value = OrderWorking.class, name = "OrderWorking"),
    @JsonSubTypes.Type(value = OrderCancelled.class, name = "OrderCancelled"),
    @JsonSubTypes.Type(value = OrderExpired.class, name = "OrderExpired"),
    @JsonSubTypes.Type(value = OrderFilled.class, name = "OrderFilled"),
    @JsonSubTypes.Type(value = AccountState.class, name = "AccountState")
})
abstract class EventMixIn {
}
