package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.exception.DeserializationException;

import java.io.IOException;

/**
 * JSON {@link EventCodec} (Jackson).
 *
 * <p>Stateless and thread-safe: the writer and reader are immutable.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class JacksonEventCodec implements EventCodec {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public JacksonEventCodec() {
        this(ExecutionObjectMapper.create());
    }

    /**
     * 생성자.
     *
     * @param mapper {@link ExecutionObjectMapper#create()}로 만든 ObjectMapper
     */
    public JacksonEventCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.writer = mapper.writerFor(Event.class);
        this.reader = mapper.readerFor(Event.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public byte[] encode(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        try {
            return writer.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event: " + event.eventId(), e);
        }
    }

    @Override
    public Event decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DeserializationException("Cannot decode event from empty bytes");
        }
        Event event;
        try {
            event = reader.readValue(bytes);
        } catch (IOException e) {
            throw new DeserializationException("Failed to decode event: " + e.getMessage(), e);
        }
        if (event == null) {
            throw new DeserializationException("Decoded event is null");
        }
        return event;
    }
}
