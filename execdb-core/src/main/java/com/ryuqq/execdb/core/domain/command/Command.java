package com.ryuqq.execdb.core.domain.command;

import java.time.Instant;
import java.util.UUID;

/**
 * 실행 엔티티를 생성한 의도(명령).
 *
 * <p>주문 이벤트 로그의 첫 번째 항목(entry 0)은 항상 Command입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface Command permits CreateOrder {

    /**
     * 명령 고유 식별자.
     *
     * @return 명령 ID
     */
    UUID commandId();

    /**
     * 명령 생성 시각.
     *
     * @return 생성 시각
     */
    Instant timestamp();
}
