package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.domain.command.Command;
import com.ryuqq.execdb.core.exception.DeserializationException;

import java.io.IOException;

/**
 * JSON {@link CommandCodec} (Jackson).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class JacksonCommandCodec implements CommandCodec {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public JacksonCommandCodec() {
        this(ExecutionObjectMapper.create());
    }

    public JacksonCommandCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.writer = mapper.writerFor(Command.class);
        this.reader = mapper.readerFor(Command.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public byte[] encode(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        try {
            return writer.writeValueAsBytes(command);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode command: " + command.commandId(), e);
        }
    }

    @Override
    public Command decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DeserializationException("Cannot decode command from empty bytes");
        }
        Command command;
        try {
            command = reader.readValue(bytes);
        } catch (IOException e) {
            throw new DeserializationException("Failed to decode command: " + e.getMessage(), e);
        }
        if (command == null) {
            throw new DeserializationException("Decoded command is null");
        }
        return command;
    }
}
