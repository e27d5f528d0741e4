package com.ryuqq.execdb.core.codec;

import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.exception.DeserializationException;

/**
 * Byte codec for {@link Event} values.
 *
 * <p>Same contract as {@link CommandCodec}: deterministic, lossless and strict.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface EventCodec {

    /**
     * Encodes an event.
     *
     * @param event the event to encode
     * @return encoded bytes
     * @throws IllegalArgumentException if event is null
     */
    byte[] encode(Event event);

    /**
     * Decodes an event.
     *
     * @param bytes encoded bytes
     * @return the decoded event
     * @throws DeserializationException if the bytes are not a valid event encoding
     */
    Event decode(byte[] bytes);
}
