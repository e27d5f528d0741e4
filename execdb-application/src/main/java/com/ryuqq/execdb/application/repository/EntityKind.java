package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.key.KeyKind;
import com.ryuqq.execdb.core.model.Identifier;
import com.ryuqq.execdb.core.statemachine.IndexStatus;

import java.util.List;

/**
 * Event-sourced 엔티티 종류별 동작 정의.
 *
 * <p>{@link EventLogRepository}는 이 인터페이스를 통해 엔티티를 식별하고,
 * 로그 항목으로 직렬화하고, 로그에서 재구성하고, 상태 집합을 분류합니다.</p>
 *
 * <p><strong>로그 규칙:</strong> 엔티티의 전체 이력은 {@link #logSize(Object)}개의 항목으로
 * 표현됩니다. 저장소에 이미 {@code persisted}개가 있으면 {@link #encodeFrom(Object, int)}는
 * 그 뒤의 항목만 반환합니다. 기존 항목은 다시 쓰지 않습니다.</p>
 *
 * @param <I> 식별자 타입
 * @param <T> 엔티티 타입
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface EntityKind<I extends Identifier, T> {

    /**
     * 로그 메시지용 이름 (예: "order").
     */
    String name();

    /**
     * 로그 키 루트 (ORDERS, POSITIONS).
     */
    KeyKind logKind();

    /**
     * 전체 ID 집합 키 종류 (INDEX_ORDERS, INDEX_POSITIONS).
     */
    KeyKind allIdsKind();

    I idOf(T entity);

    I parseId(String value);

    /**
     * 엔티티의 현재 상태 집합.
     *
     * @param entity 엔티티
     * @return WORKING/COMPLETED 또는 OPEN/CLOSED
     */
    IndexStatus statusOf(T entity);

    /**
     * 엔티티 이력 전체를 표현하는 로그 항목 수.
     */
    int logSize(T entity);

    /**
     * persisted 번째 항목부터 끝까지 인코딩.
     *
     * @param entity 엔티티
     * @param persisted 저장소에 이미 있는 항목 수
     * @return 추가할 항목 (없으면 빈 목록)
     */
    List<byte[]> encodeFrom(T entity, int persisted);

    /**
     * 로그 항목으로 엔티티 재구성.
     *
     * @param id 엔티티 ID
     * @param entries 비어 있지 않은 로그 항목 (append 순서)
     * @return 재구성된 엔티티
     * @throws DeserializationException 항목을 디코딩할 수 없거나 예상한 타입이 아닌 경우
     * @throws ReplayException 도메인 객체가 재생 이벤트를 거부한 경우
     */
    T replay(I id, List<byte[]> entries);
}
