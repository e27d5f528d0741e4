package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.execdb.core.domain.command.CreateOrder;

/**
 * {@code Command} 다형 타입 mix-in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CreateOrder.class, name = "CreateOrder")
})
abstract class CommandMixIn {
}
