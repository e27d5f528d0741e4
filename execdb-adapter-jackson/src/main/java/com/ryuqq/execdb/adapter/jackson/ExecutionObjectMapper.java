package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.execdb.core.domain.command.Command;
import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.domain.event.OrderFilled;

import java.math.BigDecimal;

/**
 * 명령/이벤트 직렬화용 {@link ObjectMapper} 생성.
 *
 * <p><strong>포맷 규칙:</strong></p>
 * <ul>
 *   <li>다형 타입: {@code "@type"} 속성에 단순 클래스명 (예: {@code "OrderFilled"})</li>
 *   <li>식별자: 문자열 값 그대로</li>
 *   <li>시각: ISO-8601 문자열 ({@link JavaTimeModule})</li>
 *   <li>{@link BigDecimal}: 문자열 (scale 보존)</li>
 *   <li>레코드 하나에 JSON 값 하나. 뒤에 다른 토큰이 붙으면 실패</li>
 * </ul>
 *
 * <p>Jackson 어노테이션은 mix-in으로만 붙여 core 모듈이 Jackson에 의존하지 않게 합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class ExecutionObjectMapper {

    private ExecutionObjectMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 ObjectMapper 생성.
     *
     * @return 설정이 끝난 ObjectMapper
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new IdentifierModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .addMixIn(Event.class, EventMixIn.class)
            .addMixIn(Command.class, CommandMixIn.class)
            .addMixIn(OrderFilled.class, OrderFilledMixIn.class);
        mapper.configOverride(BigDecimal.class)
            .setFormat(JsonFormat.Value.forShape(JsonFormat.Shape.STRING));
        return mapper;
    }
}
