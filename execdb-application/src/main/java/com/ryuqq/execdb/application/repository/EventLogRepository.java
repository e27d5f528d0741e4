package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.key.ExecutionKeys;
import com.ryuqq.execdb.core.model.Identifier;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;
import com.ryuqq.execdb.core.statemachine.IndexStatus;
import com.ryuqq.execdb.core.statemachine.StatusMigration;
import com.ryuqq.execdb.core.statemachine.StatusTransition;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Event-sourced 엔티티 공통 저장소.
 *
 * <p>주문과 포지션은 같은 방식으로 저장됩니다.</p>
 * <pre>
 * {root}:{Kind}:{id}         → 이벤트 로그 (append-only)
 * {root}:Index:{Kind}        → 전체 ID 집합
 * {root}:Index:{Kind}:{Status} → 상태 집합 (정확히 하나에 속함)
 * </pre>
 *
 * <p>쓰기 메서드는 직접 실행하지 않고 호출자가 넘긴 {@link WriteBatch.Builder}에
 * 연산을 추가합니다. 인덱스 갱신과 함께 하나의 배치로 원자적으로 실행하기 위함입니다.</p>
 *
 * @param <I> 식별자 타입
 * @param <T> 엔티티 타입
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class EventLogRepository<I extends Identifier, T> {

    private final RecordStore store;
    private final ExecutionKeys keys;
    private final EntityKind<I, T> kind;

    /**
     * 생성자.
     *
     * @param store 레코드 저장소
     * @param keys 키 도출기
     * @param kind 엔티티 종류
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventLogRepository(RecordStore store, ExecutionKeys keys, EntityKind<I, T> kind) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.store = store;
        this.keys = keys;
        this.kind = kind;
    }

    public EntityKind<I, T> kind() {
        return kind;
    }

    public String logKey(I id) {
        return keys.key(kind.logKind(), id);
    }

    /**
     * 신규 엔티티 등록.
     *
     * <p>엔티티가 이미 가진 이력 전체를 로그로 쓰고, 전체 ID 집합과 상태 집합에 등록합니다.</p>
     *
     * @param entity 엔티티
     * @param batch 연산을 추가할 배치
     * @throws IllegalStateException 같은 ID의 로그가 이미 있는 경우
     */
    public void add(T entity, WriteBatch.Builder batch) {
        requireArgs(entity, batch);
        I id = kind.idOf(entity);
        String logKey = logKey(id);
        if (store.logLength(logKey) > 0) {
            throw new IllegalStateException(
                String.format("%s %s already exists", capitalized(), id.getValue())
            );
        }

        for (byte[] entry : kind.encodeFrom(entity, 0)) {
            batch.append(logKey, entry);
        }
        batch.setAdd(keys.key(kind.allIdsKind()), id.getValue());
        applyMigration(id, StatusMigration.to(kind.statusOf(entity)), batch);
    }

    /**
     * 기존 엔티티 갱신.
     *
     * <p>아직 저장되지 않은 이벤트만 추가하고 상태 집합을 이동합니다.
     * 추가할 이벤트가 없으면 상태 집합 멤버십만 다시 확인합니다.</p>
     *
     * @param entity 엔티티
     * @param batch 연산을 추가할 배치
     * @return 추가한 로그 항목 수
     * @throws IllegalStateException 로그가 없거나, 엔티티가 저장된 로그보다 짧은 경우
     */
    public int update(T entity, WriteBatch.Builder batch) {
        requireArgs(entity, batch);
        I id = kind.idOf(entity);
        String logKey = logKey(id);
        long persisted = store.logLength(logKey);
        if (persisted == 0) {
            throw new IllegalStateException(
                String.format("Cannot update unknown %s %s", kind.name(), id.getValue())
            );
        }
        if (persisted > kind.logSize(entity)) {
            throw new IllegalStateException(
                String.format("%s %s is behind its log (entries: %d, persisted: %d)",
                    capitalized(), id.getValue(), kind.logSize(entity), persisted)
            );
        }

        List<byte[]> entries = kind.encodeFrom(entity, (int) persisted);
        for (byte[] entry : entries) {
            batch.append(logKey, entry);
        }

        IndexStatus target = kind.statusOf(entity);
        IndexStatus from = store.isMember(keys.key(target.opposite()), id.getValue()) ? target.opposite() : target;
        applyMigration(id, StatusTransition.migrate(from, target), batch);
        return entries.size();
    }

    /**
     * 로그 재생으로 엔티티 로드.
     *
     * @param id 엔티티 ID
     * @return 재구성된 엔티티 (로그가 없으면 empty)
     */
    public Optional<T> load(I id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        List<byte[]> entries = store.logRange(logKey(id));
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(kind.replay(id, entries));
    }

    public boolean exists(I id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return store.isMember(keys.key(kind.allIdsKind()), id.getValue());
    }

    /**
     * 등록된 전체 ID (값 순서).
     */
    public Set<I> ids() {
        return toIds(store.members(keys.key(kind.allIdsKind())));
    }

    /**
     * 상태 집합 멤버 (값 순서).
     *
     * @param status 상태 집합
     * @return ID 집합
     */
    public Set<I> withStatus(IndexStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return toIds(store.members(keys.key(status)));
    }

    Set<I> toIds(Set<String> members) {
        Set<I> ids = new LinkedHashSet<>();
        members.stream()
            .sorted(Comparator.naturalOrder())
            .forEach(member -> ids.add(kind.parseId(member)));
        return ids;
    }

    private void applyMigration(I id, StatusMigration migration, WriteBatch.Builder batch) {
        batch.setAdd(keys.key(migration.target()), id.getValue());
        batch.setRemove(keys.key(migration.opposite()), id.getValue());
    }

    private void requireArgs(T entity, WriteBatch.Builder batch) {
        if (entity == null) {
            throw new IllegalArgumentException(kind.name() + " cannot be null");
        }
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
    }

    private String capitalized() {
        String name = kind.name();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
