package com.ryuqq.execdb.core.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * 실행 엔티티에 적용되는 이벤트.
 *
 * <p>이벤트는 불변이며, 이벤트 로그에 추가된 후에는 다시 쓰이지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link OrderEvent}: 주문 상태를 변경하는 이벤트</li>
 *   <li>{@link AccountState}: 계좌의 전체 현재 상태</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface Event permits OrderEvent, AccountState {

    /**
     * 이벤트 고유 식별자.
     *
     * @return 이벤트 ID
     */
    UUID eventId();

    /**
     * 이벤트 발생 시각.
     *
     * @return 발생 시각
     */
    Instant timestamp();
}
