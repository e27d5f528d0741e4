package com.ryuqq.execdb.application.index;

import com.ryuqq.execdb.core.key.ExecutionKeys;
import com.ryuqq.execdb.core.key.KeyKind;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 관계 인덱스 (주문/포지션/전략).
 *
 * <p><strong>인덱스 구조:</strong></p>
 * <pre>
 * Index:OrderPosition          hash  clOrdId    → positionId
 * Index:OrderStrategy          hash  clOrdId    → strategyId
 * Index:PositionStrategy       hash  positionId → strategyId
 * Index:PositionOrders:{pid}   set   clOrdId...
 * Index:StrategyOrders:{sid}   set   clOrdId...
 * Index:StrategyPositions:{sid} set  positionId...
 * Strategies:                  set   strategyId...
 * </pre>
 *
 * <p>인덱스는 파생 데이터이며 로그와 같은 배치로만 갱신됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class ExecutionIndex {

    private final RecordStore store;
    private final ExecutionKeys keys;

    public ExecutionIndex(RecordStore store, ExecutionKeys keys) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        this.store = store;
        this.keys = keys;
    }

    // ========== 쓰기 (배치에 연산 추가) ==========

    /**
     * 주문 관계 등록.
     *
     * @param batch 배치
     * @param clOrdId 주문 ID
     * @param positionId 포지션 ID (null이면 포지션 관계를 쓰지 않음)
     * @param strategyId 전략 ID
     */
    public void indexOrder(WriteBatch.Builder batch, ClientOrderId clOrdId, PositionId positionId, StrategyId strategyId) {
        if (batch == null || clOrdId == null || strategyId == null) {
            throw new IllegalArgumentException("batch, clOrdId and strategyId cannot be null");
        }
        batch.hashPut(keys.indexOrderStrategy(), clOrdId.getValue(), strategyId.getValue());
        batch.setAdd(keys.key(KeyKind.INDEX_STRATEGY_ORDERS, strategyId), clOrdId.getValue());
        if (positionId != null) {
            linkOrderToPosition(batch, positionId, clOrdId);
        }
    }

    /**
     * 포지션 관계 등록.
     */
    public void indexPosition(WriteBatch.Builder batch, PositionId positionId, StrategyId strategyId) {
        if (batch == null || positionId == null || strategyId == null) {
            throw new IllegalArgumentException("batch, positionId and strategyId cannot be null");
        }
        batch.hashPut(keys.indexPositionStrategy(), positionId.getValue(), strategyId.getValue());
        batch.setAdd(keys.key(KeyKind.INDEX_STRATEGY_POSITIONS, strategyId), positionId.getValue());
    }

    /**
     * 주문 ↔ 포지션 연결 (order→position, position→{orders}).
     */
    public void linkOrderToPosition(WriteBatch.Builder batch, PositionId positionId, ClientOrderId clOrdId) {
        if (batch == null || positionId == null || clOrdId == null) {
            throw new IllegalArgumentException("batch, positionId and clOrdId cannot be null");
        }
        batch.hashPut(keys.indexOrderPosition(), clOrdId.getValue(), positionId.getValue());
        batch.setAdd(keys.key(KeyKind.INDEX_POSITION_ORDERS, positionId), clOrdId.getValue());
    }

    public void registerStrategy(WriteBatch.Builder batch, StrategyId strategyId) {
        if (batch == null || strategyId == null) {
            throw new IllegalArgumentException("batch and strategyId cannot be null");
        }
        batch.setAdd(keys.strategies(), strategyId.getValue());
    }

    /**
     * 전략 레지스트리에서 제거.
     *
     * @param batch 배치
     * @param strategyId 전략 ID
     * @param pruneIndices true면 strategy→orders, strategy→positions 집합도 삭제
     */
    public void unregisterStrategy(WriteBatch.Builder batch, StrategyId strategyId, boolean pruneIndices) {
        if (batch == null || strategyId == null) {
            throw new IllegalArgumentException("batch and strategyId cannot be null");
        }
        batch.setRemove(keys.strategies(), strategyId.getValue());
        if (pruneIndices) {
            batch.delete(keys.key(KeyKind.INDEX_STRATEGY_ORDERS, strategyId));
            batch.delete(keys.key(KeyKind.INDEX_STRATEGY_POSITIONS, strategyId));
        }
    }

    // ========== 읽기 ==========

    public Set<StrategyId> strategyIds() {
        return toIds(store.members(keys.strategies()), StrategyId::of);
    }

    /**
     * order→position 인덱스 조회.
     *
     * @param clOrdId 주문 ID
     * @return 포지션 ID (인덱스 항목이 없으면 empty)
     */
    public Optional<PositionId> positionIdForOrder(ClientOrderId clOrdId) {
        return hashValue(keys.indexOrderPosition(), clOrdId.getValue()).map(PositionId::of);
    }

    public Optional<StrategyId> strategyIdForOrder(ClientOrderId clOrdId) {
        return hashValue(keys.indexOrderStrategy(), clOrdId.getValue()).map(StrategyId::of);
    }

    public Optional<StrategyId> strategyIdForPosition(PositionId positionId) {
        return hashValue(keys.indexPositionStrategy(), positionId.getValue()).map(StrategyId::of);
    }

    public Set<ClientOrderId> orderIdsForPosition(PositionId positionId) {
        return toIds(store.members(keys.key(KeyKind.INDEX_POSITION_ORDERS, positionId)), ClientOrderId::of);
    }

    public Set<ClientOrderId> orderIdsForStrategy(StrategyId strategyId) {
        return toIds(store.members(keys.key(KeyKind.INDEX_STRATEGY_ORDERS, strategyId)), ClientOrderId::of);
    }

    public Set<PositionId> positionIdsForStrategy(StrategyId strategyId) {
        return toIds(store.members(keys.key(KeyKind.INDEX_STRATEGY_POSITIONS, strategyId)), PositionId::of);
    }

    private Optional<String> hashValue(String key, String field) {
        return store.hashGet(key, field).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    private static <I> Set<I> toIds(Set<String> members, Function<String, I> factory) {
        Set<I> ids = new LinkedHashSet<>();
        members.stream().sorted().forEach(member -> ids.add(factory.apply(member)));
        return ids;
    }
}
