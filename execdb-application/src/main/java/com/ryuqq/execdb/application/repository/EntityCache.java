package com.ryuqq.execdb.application.repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 프로세스 내 id → 엔티티 캐시.
 *
 * <p>읽기 가속 전용입니다. 기록 원본(system of record)은 항상 저장소입니다.</p>
 *
 * @param <I> 식별자 타입
 * @param <T> 엔티티 타입
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class EntityCache<I, T> {

    private final Map<I, T> entries = new ConcurrentHashMap<>();
    private final Function<I, String> sortKey;

    /**
     * 생성자.
     *
     * @param sortKey {@link #values()} 정렬 기준
     */
    public EntityCache(Function<I, String> sortKey) {
        if (sortKey == null) {
            throw new IllegalArgumentException("sortKey cannot be null");
        }
        this.sortKey = sortKey;
    }

    public void put(I id, T entity) {
        entries.put(id, entity);
    }

    public Optional<T> get(I id) {
        return Optional.ofNullable(entries.get(id));
    }

    public void remove(I id) {
        entries.remove(id);
    }

    /**
     * 캐시된 엔티티 (ID 순서).
     */
    public List<T> values() {
        List<I> ids = new ArrayList<>(entries.keySet());
        ids.sort(Comparator.comparing(sortKey));
        List<T> values = new ArrayList<>(ids.size());
        for (I id : ids) {
            T entity = entries.get(id);
            if (entity != null) {
                values.add(entity);
            }
        }
        return values;
    }

    public void clear() {
        entries.clear();
    }
}
