package com.ryuqq.execdb.core.codec;

import com.ryuqq.execdb.core.domain.command.Command;
import com.ryuqq.execdb.core.exception.DeserializationException;

/**
 * Byte codec for {@link Command} values.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Deterministic: the same command always encodes to the same bytes</li>
 *   <li>Lossless: {@code decode(encode(c))} equals {@code c}</li>
 *   <li>Strict: malformed input raises {@link DeserializationException}, never a default value</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface CommandCodec {

    /**
     * Encodes a command.
     *
     * @param command the command to encode
     * @return encoded bytes
     * @throws IllegalArgumentException if command is null
     */
    byte[] encode(Command command);

    /**
     * Decodes a command.
     *
     * @param bytes encoded bytes
     * @return the decoded command
     * @throws DeserializationException if the bytes are not a valid command encoding
     */
    Command decode(byte[] bytes);
}
