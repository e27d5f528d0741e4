package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.Identifier;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;

import java.io.IOException;
import java.util.function.Function;

/**
 * 식별자를 JSON 문자열로 쓰고 읽는 모듈.
 *
 * <p>읽을 때 각 식별자의 {@code of(String)} 검증을 그대로 거칩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
final class IdentifierModule extends SimpleModule {

    IdentifierModule() {
        super("ExecutionIdentifierModule");
        addSerializer(Identifier.class, new IdentifierSerializer());
        addDeserializer(AccountId.class, new IdentifierDeserializer<>(AccountId.class, AccountId::of));
        addDeserializer(ClientOrderId.class, new IdentifierDeserializer<>(ClientOrderId.class, ClientOrderId::of));
        addDeserializer(PositionId.class, new IdentifierDeserializer<>(PositionId.class, PositionId::of));
        addDeserializer(StrategyId.class, new IdentifierDeserializer<>(StrategyId.class, StrategyId::of));
        addDeserializer(TraderId.class, new IdentifierDeserializer<>(TraderId.class, TraderId::of));
    }

    static final class IdentifierSerializer extends StdSerializer<Identifier> {

        IdentifierSerializer() {
            super(Identifier.class);
        }

        @Override
        public void serialize(Identifier value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.getValue());
        }
    }

    static final class IdentifierDeserializer<T extends Identifier> extends StdDeserializer<T> {

        private final transient Function<String, T> factory;

        IdentifierDeserializer(Class<T> type, Function<String, T> factory) {
            super(type);
            this.factory = factory;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                throw MismatchedInputException.from(p, handledType(),
                    "Expected a string for " + handledType().getSimpleName() + " but was " + p.currentToken());
            }
            String text = p.getText();
            try {
                return factory.apply(text);
            } catch (IllegalArgumentException e) {
                throw InvalidFormatException.from(p, e.getMessage(), text, handledType());
            }
        }
    }
}
