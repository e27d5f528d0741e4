package com.ryuqq.execdb.application.database;

import com.ryuqq.execdb.application.config.BulkLoadPolicy;
import com.ryuqq.execdb.application.config.ExecutionDatabaseConfig;
import com.ryuqq.execdb.application.index.ExecutionIndex;
import com.ryuqq.execdb.application.repository.AccountSnapshots;
import com.ryuqq.execdb.application.repository.EntityCache;
import com.ryuqq.execdb.application.repository.EventLogRepository;
import com.ryuqq.execdb.application.repository.OrderKind;
import com.ryuqq.execdb.application.repository.PositionKind;
import com.ryuqq.execdb.application.residual.ResidualChecker;
import com.ryuqq.execdb.application.residual.ResidualReport;
import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.account.Account;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.key.ExecutionKeys;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.Identifier;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;
import com.ryuqq.execdb.core.statemachine.IndexStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link ExecutionDatabase} 기본 구현.
 *
 * <p>{@link RecordStore} 하나와 명령/이벤트 코덱 한 쌍 위에서 동작합니다.
 * 모든 쓰기는 {@link WriteBatch} 하나로 모아 {@link RecordStore#execute(WriteBatch)}로
 * 원자적으로 실행하고, 성공한 뒤에만 캐시를 갱신합니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ExecutionDatabase database = new DefaultExecutionDatabase(
 *     new InMemoryRecordStore(),
 *     new JacksonCommandCodec(),
 *     new JacksonEventCodec(),
 *     new ExecutionDatabaseConfig(TraderId.of("TESTER-000"))
 * );
 *
 * database.addOrder(order, null, strategyId);
 * order.apply(submitted);
 * database.updateOrder(order);
 *
 * Order restored = database.loadOrder(order.clOrdId()).orElseThrow();
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class DefaultExecutionDatabase implements ExecutionDatabase {

    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionDatabase.class);

    private final RecordStore store;
    private final ExecutionDatabaseConfig config;
    private final ExecutionKeys keys;
    private final AccountSnapshots accountSnapshots;
    private final EventLogRepository<ClientOrderId, Order> orderRepository;
    private final EventLogRepository<PositionId, Position> positionRepository;
    private final ExecutionIndex index;
    private final ResidualChecker residualChecker;
    private final EntityCache<AccountId, Account> accountCache = new EntityCache<>(AccountId::getValue);
    private final EntityCache<ClientOrderId, Order> orderCache = new EntityCache<>(ClientOrderId::getValue);
    private final EntityCache<PositionId, Position> positionCache = new EntityCache<>(PositionId::getValue);

    /**
     * 생성자.
     *
     * @param store 레코드 저장소 (이 인스턴스가 소유하며 {@link #close()} 시 닫힘)
     * @param commandCodec 명령 코덱
     * @param eventCodec 이벤트 코덱
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultExecutionDatabase(RecordStore store,
                                    CommandCodec commandCodec,
                                    EventCodec eventCodec,
                                    ExecutionDatabaseConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (commandCodec == null) {
            throw new IllegalArgumentException("commandCodec cannot be null");
        }
        if (eventCodec == null) {
            throw new IllegalArgumentException("eventCodec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
        this.keys = new ExecutionKeys(config.traderId());
        this.accountSnapshots = new AccountSnapshots(store, keys, eventCodec);
        this.orderRepository = new EventLogRepository<>(store, keys, new OrderKind(commandCodec, eventCodec));
        this.positionRepository = new EventLogRepository<>(store, keys, new PositionKind(eventCodec));
        this.index = new ExecutionIndex(store, keys);
        this.residualChecker = new ResidualChecker(orderRepository, positionRepository, index);

        log.info("Execution database initialized for {} (bulkLoadPolicy={}, pruneStrategyIndicesOnDelete={})",
            config.traderId().getValue(), config.bulkLoadPolicy(), config.pruneStrategyIndicesOnDelete());
    }

    @Override
    public TraderId traderId() {
        return config.traderId();
    }

    @Override
    public ExecutionKeys keys() {
        return keys;
    }

    public ExecutionDatabaseConfig config() {
        return config;
    }

    // ========== 쓰기 ==========

    @Override
    public void addAccount(Account account) {
        saveAccount(account);
        log.debug("Added account {}", account.id().getValue());
    }

    @Override
    public void updateAccount(Account account) {
        saveAccount(account);
        log.debug("Updated account {}", account.id().getValue());
    }

    private void saveAccount(Account account) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        write(accountCache, account.id(), batch -> accountSnapshots.save(account, batch));
        accountCache.put(account.id(), account);
    }

    @Override
    public void addOrder(Order order, PositionId positionId, StrategyId strategyId) {
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }

        write(orderCache, order.clOrdId(), batch -> {
            orderRepository.add(order, batch);
            index.indexOrder(batch, order.clOrdId(), positionId, strategyId);
        });
        orderCache.put(order.clOrdId(), order);

        log.debug("Added order {} (position={}, strategy={}, status={})", order.clOrdId().getValue(),
            positionId == null ? "none" : positionId.getValue(), strategyId.getValue(),
            orderRepository.kind().statusOf(order));
    }

    @Override
    public void updateOrder(Order order) {
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }

        write(orderCache, order.clOrdId(), batch -> orderRepository.update(order, batch));
        orderCache.put(order.clOrdId(), order);

        log.debug("Updated order {} (events={}, state={})", order.clOrdId().getValue(), order.eventCount(), order.state());
    }

    @Override
    public void addPosition(Position position, StrategyId strategyId) {
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }
        if (!strategyId.equals(position.strategyId())) {
            throw new IllegalArgumentException(
                String.format("Position %s belongs to strategy %s, not %s",
                    position.id().getValue(), position.strategyId().getValue(), strategyId.getValue())
            );
        }

        write(positionCache, position.id(), batch -> {
            positionRepository.add(position, batch);
            index.indexPosition(batch, position.id(), strategyId);
            for (ClientOrderId clOrdId : position.orderIds()) {
                index.linkOrderToPosition(batch, position.id(), clOrdId);
            }
        });
        positionCache.put(position.id(), position);

        log.debug("Added position {} (strategy={}, orders={})",
            position.id().getValue(), strategyId.getValue(), position.orderIds().size());
    }

    @Override
    public void updatePosition(Position position) {
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }

        write(positionCache, position.id(), batch -> {
            positionRepository.update(position, batch);
            for (ClientOrderId clOrdId : position.orderIds()) {
                index.linkOrderToPosition(batch, position.id(), clOrdId);
            }
        });
        positionCache.put(position.id(), position);

        log.debug("Updated position {} (events={}, {})",
            position.id().getValue(), position.eventCount(), position.marketPosition());
    }

    @Override
    public void updateStrategy(StrategyId strategyId) {
        WriteBatch.Builder batch = WriteBatch.builder();
        index.registerStrategy(batch, strategyId);
        store.execute(batch.build());
        log.debug("Registered strategy {}", strategyId.getValue());
    }

    @Override
    public void deleteStrategy(StrategyId strategyId) {
        WriteBatch.Builder batch = WriteBatch.builder();
        index.unregisterStrategy(batch, strategyId, config.pruneStrategyIndicesOnDelete());
        store.execute(batch.build());
        log.debug("Deleted strategy {} (indices pruned: {})",
            strategyId.getValue(), config.pruneStrategyIndicesOnDelete());
    }

    /**
     * 배치를 구성해 실행. 구성이나 실행이 실패하면 캐시 항목을 제거하고 예외를 다시 던집니다.
     *
     * <p>캐시된 객체는 호출자의 객체이므로 저장되지 않은 이벤트를 담고 있을 수 있습니다.</p>
     */
    private <I extends Identifier> void write(EntityCache<I, ?> cache, I id, Consumer<WriteBatch.Builder> staging) {
        try {
            WriteBatch.Builder batch = WriteBatch.builder();
            staging.accept(batch);
            store.execute(batch.build());
        } catch (RuntimeException e) {
            cache.remove(id);
            log.warn("Write for {} failed, evicted it from the cache", id.getValue(), e);
            throw e;
        }
    }

    // ========== 로드 ==========

    @Override
    public Optional<Account> loadAccount(AccountId accountId) {
        Optional<Account> account = accountSnapshots.load(accountId);
        account.ifPresent(loaded -> accountCache.put(accountId, loaded));
        return account;
    }

    @Override
    public Map<AccountId, Account> loadAccounts() {
        Map<AccountId, byte[]> snapshots = accountSnapshots.snapshots();
        return loadAll("account", snapshots.keySet(), accountCache,
            id -> Optional.of(accountSnapshots.decode(id, snapshots.get(id))));
    }

    @Override
    public Optional<Order> loadOrder(ClientOrderId clOrdId) {
        Optional<Order> order = orderRepository.load(clOrdId);
        order.ifPresent(loaded -> orderCache.put(clOrdId, loaded));
        return order;
    }

    @Override
    public Map<ClientOrderId, Order> loadOrders() {
        return loadAll("order", orderRepository.ids(), orderCache, orderRepository::load);
    }

    @Override
    public Optional<Position> loadPosition(PositionId positionId) {
        Optional<Position> position = positionRepository.load(positionId);
        position.ifPresent(loaded -> positionCache.put(positionId, loaded));
        return position;
    }

    @Override
    public Map<PositionId, Position> loadPositions() {
        return loadAll("position", positionRepository.ids(), positionCache, positionRepository::load);
    }

    /**
     * 일괄 로드.
     *
     * <p>손상된 레코드는 {@link BulkLoadPolicy}에 따라 건너뛰거나 전파합니다.
     * 저장소 연결 실패는 정책과 무관하게 전파됩니다.</p>
     */
    private <I extends Identifier, T> Map<I, T> loadAll(String name,
                                                       Set<I> ids,
                                                       EntityCache<I, T> cache,
                                                       Function<I, Optional<T>> loader) {
        Map<I, T> loaded = new LinkedHashMap<>();
        int skipped = 0;
        for (I id : ids) {
            try {
                Optional<T> entity = loader.apply(id);
                if (entity.isPresent()) {
                    loaded.put(id, entity.get());
                    cache.put(id, entity.get());
                }
            } catch (DeserializationException | ReplayException e) {
                if (config.bulkLoadPolicy() == BulkLoadPolicy.ABORT) {
                    throw e;
                }
                skipped++;
                log.error("Skipping corrupt {} {} during bulk load", name, id.getValue(), e);
            }
        }
        log.info("Loaded {} {}(s) for {} ({} skipped)", loaded.size(), name, traderId().getValue(), skipped);
        return Collections.unmodifiableMap(loaded);
    }

    // ========== 캐시 ==========

    @Override
    public Optional<Account> account(AccountId accountId) {
        return accountCache.get(accountId);
    }

    @Override
    public List<Account> accounts() {
        return accountCache.values();
    }

    @Override
    public Optional<Order> order(ClientOrderId clOrdId) {
        return orderCache.get(clOrdId);
    }

    @Override
    public List<Order> orders() {
        return orderCache.values();
    }

    @Override
    public Optional<Position> position(PositionId positionId) {
        return positionCache.get(positionId);
    }

    @Override
    public List<Position> positions() {
        return positionCache.values();
    }

    // ========== 인덱스 조회 ==========

    @Override
    public Set<ClientOrderId> orderIds() {
        return orderRepository.ids();
    }

    @Override
    public Set<PositionId> positionIds() {
        return positionRepository.ids();
    }

    @Override
    public Set<StrategyId> strategyIds() {
        return index.strategyIds();
    }

    @Override
    public boolean orderExists(ClientOrderId clOrdId) {
        return orderRepository.exists(clOrdId);
    }

    @Override
    public boolean positionExists(PositionId positionId) {
        return positionRepository.exists(positionId);
    }

    @Override
    public boolean positionExistsForOrder(ClientOrderId clOrdId) {
        return index.positionIdForOrder(clOrdId)
            .map(positionRepository::exists)
            .orElse(false);
    }

    @Override
    public boolean positionIndexedForOrder(ClientOrderId clOrdId) {
        return index.positionIdForOrder(clOrdId).isPresent();
    }

    @Override
    public Set<ClientOrderId> ordersWorking() {
        return orderRepository.withStatus(IndexStatus.WORKING);
    }

    @Override
    public Set<ClientOrderId> ordersWorking(StrategyId strategyId) {
        return intersect(ordersWorking(), () -> index.orderIdsForStrategy(strategyId));
    }

    @Override
    public Set<ClientOrderId> ordersCompleted() {
        return orderRepository.withStatus(IndexStatus.COMPLETED);
    }

    @Override
    public Set<ClientOrderId> ordersCompleted(StrategyId strategyId) {
        return intersect(ordersCompleted(), () -> index.orderIdsForStrategy(strategyId));
    }

    @Override
    public Set<PositionId> positionsOpen() {
        return positionRepository.withStatus(IndexStatus.OPEN);
    }

    @Override
    public Set<PositionId> positionsOpen(StrategyId strategyId) {
        return intersect(positionsOpen(), () -> index.positionIdsForStrategy(strategyId));
    }

    @Override
    public Set<PositionId> positionsClosed() {
        return positionRepository.withStatus(IndexStatus.CLOSED);
    }

    @Override
    public Set<PositionId> positionsClosed(StrategyId strategyId) {
        return intersect(positionsClosed(), () -> index.positionIdsForStrategy(strategyId));
    }

    private static <I> Set<I> intersect(Set<I> global, Supplier<Set<I>> scoped) {
        if (global.isEmpty()) {
            return global;
        }
        Set<I> result = new LinkedHashSet<>(global);
        result.retainAll(scoped.get());
        return result;
    }

    // ========== 수명 주기 ==========

    @Override
    public ResidualReport checkResiduals() {
        return residualChecker.check();
    }

    @Override
    public void reset() {
        clearCaches();
        log.info("Execution database cache reset for {}", traderId().getValue());
    }

    @Override
    public void flush() {
        long deleted = store.deleteNamespace(keys.namespace());
        clearCaches();
        log.info("Flushed {} key(s) under {}", deleted, keys.namespace());
    }

    @Override
    public void close() {
        store.close();
        log.info("Execution database closed for {}", traderId().getValue());
    }

    private void clearCaches() {
        accountCache.clear();
        orderCache.clear();
        positionCache.clear();
    }
}
