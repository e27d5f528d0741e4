package com.ryuqq.execdb.testkit.contract;

import com.ryuqq.execdb.application.config.BulkLoadPolicy;
import com.ryuqq.execdb.application.config.ExecutionDatabaseConfig;
import com.ryuqq.execdb.application.database.DefaultExecutionDatabase;
import com.ryuqq.execdb.application.database.ExecutionDatabase;
import com.ryuqq.execdb.application.residual.Residual;
import com.ryuqq.execdb.application.residual.ResidualReport;
import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.account.Account;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.order.OrderSide;
import com.ryuqq.execdb.core.domain.order.OrderState;
import com.ryuqq.execdb.core.domain.position.MarketPosition;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.key.KeyKind;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;
import com.ryuqq.execdb.testkit.stubs.TestOrderFactory;
import com.ryuqq.execdb.testkit.stubs.TestStubs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the execution database over a {@link RecordStore} and a codec pair.
 *
 * <p>Runs the full write/load/query cycle against a real store, so an adapter (or a codec)
 * proves it can carry the whole database rather than only individual primitives.</p>
 *
 * <p><strong>Covered behaviour:</strong></p>
 * <ul>
 *   <li>Account snapshots round trip and overwrite</li>
 *   <li>Orders and positions replay to equal aggregates after a cache reset</li>
 *   <li>Working/Completed and Open/Closed index migration</li>
 *   <li>Strategy scoped queries and strategy deletion</li>
 *   <li>Residual reporting and namespace flush</li>
 *   <li>Corrupt log handling under both bulk load policies</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public abstract class AbstractExecutionDatabaseContractTest {

    protected static final BigDecimal QUANTITY = new BigDecimal("100000");
    protected static final BigDecimal FILL_PRICE = new BigDecimal("1.00001");

    protected RecordStore store;
    protected ExecutionDatabase database;
    protected TestOrderFactory orderFactory;

    protected abstract RecordStore createStore();

    protected abstract CommandCodec createCommandCodec();

    protected abstract EventCodec createEventCodec();

    /**
     * Creates a database over the current {@link #store}.
     */
    protected ExecutionDatabase createDatabase(ExecutionDatabaseConfig config) {
        return new DefaultExecutionDatabase(store, createCommandCodec(), createEventCodec(), config);
    }

    @BeforeEach
    void setUpDatabase() {
        store = createStore();
        database = createDatabase(new ExecutionDatabaseConfig(TestStubs.TRADER_ID));
        orderFactory = new TestOrderFactory();
    }

    @AfterEach
    void tearDownDatabase() {
        if (database != null) {
            database.close();
        }
    }

    // ========== Keys ==========

    @Test
    void keys_TraderNamespace_MatchesTraderId() {
        assertEquals("Trader-TESTER-000", database.keys().trader());
        assertEquals("Trader-TESTER-000:Orders:", database.keys().orders());
        assertEquals("Trader-TESTER-000:Index:Orders:Working", database.keys().indexOrdersWorking());
        assertEquals(TestStubs.TRADER_ID, database.traderId());
    }

    // ========== Accounts ==========

    @Test
    void addAccount_ThenLoad_ReturnsEqualAccount() {
        // Given
        Account account = Account.create(TestStubs.accountState());

        // When
        database.addAccount(account);
        database.reset();

        // Then
        assertEquals(Optional.of(account), database.loadAccount(account.id()));
        assertEquals(Optional.of(account), database.account(account.id()));
    }

    @Test
    void updateAccount_NewState_LatestSnapshotWins() {
        // Given
        Account account = Account.create(TestStubs.accountState());
        database.addAccount(account);

        // When
        account.apply(TestStubs.accountState(TestStubs.ACCOUNT_ID, new BigDecimal("999000.00")));
        database.updateAccount(account);
        database.reset();

        // Then
        Account loaded = database.loadAccount(account.id()).orElseThrow();
        assertEquals(0, new BigDecimal("999000.00").compareTo(loaded.cashBalance()));
        assertEquals(1, database.loadAccounts().size());
    }

    @Test
    void loadAccount_Unknown_ReturnsEmpty() {
        assertTrue(database.loadAccount(AccountId.of("UNKNOWN-1")).isEmpty());
        assertTrue(database.loadAccounts().isEmpty());
    }

    // ========== Orders ==========

    @Test
    void addOrder_WithoutPosition_IndexedAsWorking() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);

        // When
        database.addOrder(order, null, orderFactory.strategyId());

        // Then
        assertTrue(database.orderExists(order.clOrdId()));
        assertEquals(Set.of(order.clOrdId()), database.orderIds());
        assertEquals(Set.of(order.clOrdId()), database.ordersWorking());
        assertTrue(database.ordersCompleted().isEmpty());
        assertFalse(database.positionIndexedForOrder(order.clOrdId()));
        assertEquals(Optional.of(order), database.loadOrder(order.clOrdId()));
    }

    @Test
    void addOrder_WithPosition_IndexedButPositionNotYetExisting() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        PositionId positionId = orderFactory.nextPositionId();

        // When
        database.addOrder(order, positionId, orderFactory.strategyId());

        // Then
        assertTrue(database.positionIndexedForOrder(order.clOrdId()));
        assertFalse(database.positionExistsForOrder(order.clOrdId()));
    }

    @Test
    void addOrder_Duplicate_ThrowsAndKeepsFirst() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> database.addOrder(order, null, orderFactory.strategyId()));
        assertEquals(1L, store.logLength(database.keys().key(KeyKind.ORDERS, order.clOrdId())));
    }

    @Test
    void updateOrder_Working_StaysInWorkingIndex() {
        // Given
        Order order = orderFactory.stop(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY, new BigDecimal("1.00000"));
        database.addOrder(order, null, orderFactory.strategyId());

        // When
        order.apply(TestStubs.submitted(order));
        order.apply(TestStubs.accepted(order));
        order.apply(TestStubs.working(order));
        database.updateOrder(order);

        // Then
        assertEquals(Set.of(order.clOrdId()), database.ordersWorking());
        assertTrue(database.ordersCompleted().isEmpty());
        assertEquals(OrderState.WORKING, database.loadOrder(order.clOrdId()).orElseThrow().state());
    }

    @Test
    void updateOrder_Filled_MigratesToCompleted() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());

        // When
        order.apply(TestStubs.submitted(order));
        order.apply(TestStubs.accepted(order));
        order.apply(TestStubs.filled(order, null, FILL_PRICE));
        database.updateOrder(order);

        // Then
        assertTrue(database.ordersWorking().isEmpty());
        assertEquals(Set.of(order.clOrdId()), database.ordersCompleted());
    }

    @Test
    void updateOrder_EachEventSeparately_ReplaysToEqualOrder() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());

        // When
        order.apply(TestStubs.submitted(order));
        database.updateOrder(order);
        order.apply(TestStubs.accepted(order));
        database.updateOrder(order);
        order.apply(TestStubs.partiallyFilled(order, null, new BigDecimal("40000"), new BigDecimal("1.00000")));
        database.updateOrder(order);
        order.apply(TestStubs.filled(order, null, new BigDecimal("1.00002")));
        database.updateOrder(order);
        database.reset();

        // Then
        Order loaded = database.loadOrder(order.clOrdId()).orElseThrow();
        assertEquals(order, loaded);
        assertEquals(5L, store.logLength(database.keys().key(KeyKind.ORDERS, order.clOrdId())));
        assertEquals(OrderState.FILLED, loaded.state());
        assertEquals(0, new BigDecimal("1.000012").compareTo(loaded.averagePrice()));
    }

    @Test
    void updateOrder_NothingNew_AppendsNothing() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        order.apply(TestStubs.submitted(order));
        database.addOrder(order, null, orderFactory.strategyId());

        // When
        database.updateOrder(order);

        // Then
        assertEquals(2L, store.logLength(database.keys().key(KeyKind.ORDERS, order.clOrdId())));
        assertEquals(Set.of(order.clOrdId()), database.ordersWorking());
    }

    @Test
    void updateOrder_Rejected_MigratesToCompleted() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.SELL, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());

        // When
        order.apply(TestStubs.submitted(order));
        order.apply(TestStubs.rejected(order));
        database.updateOrder(order);

        // Then
        assertEquals(Set.of(order.clOrdId()), database.ordersCompleted());
        assertEquals(OrderState.REJECTED, database.loadOrder(order.clOrdId()).orElseThrow().state());
    }

    @Test
    void loadOrder_Unknown_ReturnsEmpty() {
        ClientOrderId unknown = ClientOrderId.of("O-UNKNOWN");

        assertTrue(database.loadOrder(unknown).isEmpty());
        assertTrue(database.order(unknown).isEmpty());
        assertFalse(database.orderExists(unknown));
        assertFalse(database.positionExistsForOrder(unknown));
    }

    // ========== Positions ==========

    @Test
    void addPosition_AfterFill_PositionExistsForOrder() {
        // Given
        PositionId positionId = orderFactory.nextPositionId();
        Order order = filledBuy(positionId);

        // When
        Position position = Position.open((OrderFilled) order.lastEvent().orElseThrow());
        database.addPosition(position, orderFactory.strategyId());

        // Then
        assertTrue(database.positionExists(positionId));
        assertTrue(database.positionExistsForOrder(order.clOrdId()));
        assertEquals(Set.of(positionId), database.positionsOpen());
        assertTrue(database.positionsClosed().isEmpty());
        assertEquals(Optional.of(position), database.loadPosition(positionId));
    }

    @Test
    void updatePosition_Closed_MigratesToClosed() {
        // Given
        PositionId positionId = orderFactory.nextPositionId();
        Position position = openPosition(positionId);

        // When
        closePosition(position);
        database.reset();

        // Then
        assertTrue(database.positionsOpen().isEmpty());
        assertEquals(Set.of(positionId), database.positionsClosed());
        Position loaded = database.loadPosition(positionId).orElseThrow();
        assertEquals(position, loaded);
        assertEquals(MarketPosition.FLAT, loaded.marketPosition());
        assertEquals(2, loaded.orderIds().size());
    }

    @Test
    void addPosition_OtherStrategy_ThrowsAndWritesNothing() {
        // Given
        PositionId positionId = orderFactory.nextPositionId();
        Order order = filledBuy(positionId);
        Position position = Position.open((OrderFilled) order.lastEvent().orElseThrow());

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> database.addPosition(position, StrategyId.of("OtherStrategy-002")));
        assertFalse(database.positionExists(positionId));
        assertTrue(database.positionsOpen().isEmpty());
        assertTrue(database.positionsOpen(StrategyId.of("OtherStrategy-002")).isEmpty());
        assertTrue(database.loadPosition(positionId).isEmpty());
    }

    @Test
    void loadPosition_Unknown_ReturnsEmpty() {
        PositionId unknown = PositionId.of("P-UNKNOWN");

        assertTrue(database.loadPosition(unknown).isEmpty());
        assertFalse(database.positionExists(unknown));
        assertTrue(database.loadPositions().isEmpty());
    }

    // ========== End to end ==========

    @Test
    void marketBuy_FilledAtPrice_FullCycle() {
        // Given
        PositionId positionId = orderFactory.nextPositionId();
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.updateStrategy(orderFactory.strategyId());
        database.addOrder(order, positionId, orderFactory.strategyId());

        // When
        order.apply(TestStubs.submitted(order));
        database.updateOrder(order);
        order.apply(TestStubs.accepted(order));
        database.updateOrder(order);
        OrderFilled fill = TestStubs.filled(order, positionId, FILL_PRICE);
        order.apply(fill);
        database.updateOrder(order);
        Position position = Position.open(fill);
        database.addPosition(position, orderFactory.strategyId());

        // Then
        assertEquals(Set.of(orderFactory.strategyId()), database.strategyIds());
        assertEquals(Set.of(order.clOrdId()), database.ordersCompleted(orderFactory.strategyId()));
        assertEquals(Set.of(positionId), database.positionsOpen(orderFactory.strategyId()));
        Position loaded = database.loadPosition(positionId).orElseThrow();
        assertEquals(MarketPosition.LONG, loaded.marketPosition());
        assertEquals(0, FILL_PRICE.compareTo(loaded.averageOpenPrice()));
        assertEquals(0, QUANTITY.compareTo(loaded.quantity()));
    }

    // ========== Strategies ==========

    @Test
    void strategyScopedQueries_OtherStrategy_Excluded() {
        // Given
        StrategyId other = StrategyId.of("OtherStrategy-002");
        Order mine = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        Order theirs = new TestOrderFactory(TestStubs.TRADER_ID, other)
            .market(TestStubs.AUDUSD, OrderSide.SELL, QUANTITY);

        // When
        database.addOrder(mine, null, orderFactory.strategyId());
        database.addOrder(theirs, null, other);

        // Then
        assertEquals(Set.of(mine.clOrdId(), theirs.clOrdId()), database.ordersWorking());
        assertEquals(Set.of(mine.clOrdId()), database.ordersWorking(orderFactory.strategyId()));
        assertEquals(Set.of(theirs.clOrdId()), database.ordersWorking(other));
        assertTrue(database.ordersCompleted(other).isEmpty());
        assertTrue(database.ordersWorking(StrategyId.of("Unknown-999")).isEmpty());
    }

    @Test
    void updateStrategy_Twice_RegisteredOnce() {
        database.updateStrategy(orderFactory.strategyId());
        database.updateStrategy(orderFactory.strategyId());

        assertEquals(Set.of(orderFactory.strategyId()), database.strategyIds());
    }

    @Test
    void deleteStrategy_DefaultConfig_OrdersAndPositionsStillLoadableAndScoped() {
        // Given
        database.updateStrategy(orderFactory.strategyId());
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());
        PositionId positionId = orderFactory.nextPositionId();
        openPosition(positionId);

        // When
        database.deleteStrategy(orderFactory.strategyId());

        // Then
        assertTrue(database.strategyIds().isEmpty());
        assertTrue(database.loadOrder(order.clOrdId()).isPresent());
        assertEquals(Set.of(order.clOrdId()), database.ordersWorking(orderFactory.strategyId()));
        assertTrue(database.loadPosition(positionId).isPresent());
        assertEquals(Set.of(positionId), database.positionsOpen(orderFactory.strategyId()));
    }

    @Test
    void deleteStrategy_DefaultConfig_ClosedPositionStillScoped() {
        // Given
        database.updateStrategy(orderFactory.strategyId());
        PositionId positionId = orderFactory.nextPositionId();
        closePosition(openPosition(positionId));
        assertEquals(Set.of(positionId), database.positionsClosed(orderFactory.strategyId()));

        // When
        database.deleteStrategy(orderFactory.strategyId());
        database.reset();

        // Then
        assertEquals(Set.of(positionId), database.positionsClosed(orderFactory.strategyId()));
        assertTrue(database.positionsOpen(orderFactory.strategyId()).isEmpty());
        assertTrue(database.positionsClosed(StrategyId.of("OtherStrategy-002")).isEmpty());
        assertTrue(database.loadPosition(positionId).isPresent());
    }

    @Test
    void deleteStrategy_PruneEnabled_ScopedQueriesEmpty() {
        // Given
        database = createDatabase(new ExecutionDatabaseConfig(TestStubs.TRADER_ID)
            .withPruneStrategyIndicesOnDelete(true));
        database.updateStrategy(orderFactory.strategyId());
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());
        PositionId positionId = orderFactory.nextPositionId();
        openPosition(positionId);

        // When
        database.deleteStrategy(orderFactory.strategyId());

        // Then
        assertTrue(database.ordersWorking(orderFactory.strategyId()).isEmpty());
        assertTrue(database.positionsOpen(orderFactory.strategyId()).isEmpty());
        assertEquals(Set.of(order.clOrdId()), database.ordersWorking());
        assertEquals(Set.of(positionId), database.positionsOpen());
        assertTrue(database.loadOrder(order.clOrdId()).isPresent());
        assertTrue(database.loadPosition(positionId).isPresent());
    }

    // ========== Bulk load ==========

    @Test
    void loadAll_AfterReset_EqualContent() {
        // Given
        Account account = Account.create(TestStubs.accountState());
        database.addAccount(account);
        PositionId positionId = orderFactory.nextPositionId();
        Position position = openPosition(positionId);
        Order working = orderFactory.stop(TestStubs.AUDUSD, OrderSide.SELL, QUANTITY, new BigDecimal("0.99000"));
        database.addOrder(working, positionId, orderFactory.strategyId());

        Map<AccountId, Account> accountsBefore = database.loadAccounts();
        Map<ClientOrderId, Order> ordersBefore = database.loadOrders();
        Map<PositionId, Position> positionsBefore = database.loadPositions();

        // When
        database.reset();

        // Then
        assertTrue(database.orders().isEmpty());
        assertTrue(database.positions().isEmpty());
        assertTrue(database.accounts().isEmpty());
        assertEquals(accountsBefore, database.loadAccounts());
        assertEquals(ordersBefore, database.loadOrders());
        assertEquals(positionsBefore, database.loadPositions());
        assertEquals(2, database.orders().size());
        assertEquals(List.of(position), database.positions());
    }

    @Test
    void loadOrders_CorruptLogUnderSkip_SkipsIt() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());
        ClientOrderId corrupt = writeCorruptOrder();

        // When
        Map<ClientOrderId, Order> loaded = database.loadOrders();

        // Then
        assertEquals(Set.of(order.clOrdId()), loaded.keySet());
        assertTrue(database.orderExists(corrupt));
        assertThrows(DeserializationException.class, () -> database.loadOrder(corrupt));
    }

    @Test
    void loadOrders_CorruptLogUnderAbort_Throws() {
        // Given
        database = createDatabase(new ExecutionDatabaseConfig(TestStubs.TRADER_ID)
            .withBulkLoadPolicy(BulkLoadPolicy.ABORT));
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, null, orderFactory.strategyId());
        writeCorruptOrder();

        // When & Then
        assertThrows(DeserializationException.class, () -> database.loadOrders());
    }

    // ========== Residuals ==========

    @Test
    void checkResiduals_EmptyDatabase_Clean() {
        ResidualReport report = database.checkResiduals();

        assertTrue(report.isClean());
        assertTrue(report.complete());
    }

    @Test
    void checkResiduals_WorkingOrderAndOpenPosition_Reported() {
        // Given
        PositionId positionId = orderFactory.nextPositionId();
        openPosition(positionId);
        Order working = orderFactory.stop(TestStubs.AUDUSD, OrderSide.SELL, QUANTITY, new BigDecimal("0.99000"));
        database.addOrder(working, null, orderFactory.strategyId());

        // When
        ResidualReport report = database.checkResiduals();

        // Then
        assertTrue(report.complete());
        assertFalse(report.isClean());
        assertEquals(1, report.ofType(Residual.Type.WORKING_ORDER).size());
        assertEquals(1, report.ofType(Residual.Type.OPEN_POSITION).size());
        assertTrue(report.integrityViolations().isEmpty());
    }

    @Test
    void checkResiduals_OrderLinkedToUnpopulatedPosition_IntegrityViolation() {
        // Given
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        PositionId positionId = orderFactory.nextPositionId();
        database.addOrder(order, positionId, orderFactory.strategyId());
        store.execute(WriteBatch.builder()
            .setRemove(database.keys().key(KeyKind.INDEX_POSITION_ORDERS, positionId), order.clOrdId().getValue())
            .build());

        // When
        ResidualReport report = database.checkResiduals();

        // Then
        assertEquals(1, report.ofType(Residual.Type.MISSING_POSITION_ORDER).size());
        assertEquals(order.clOrdId().getValue(), report.integrityViolations().get(0).entityId());
    }

    // ========== Flush ==========

    @Test
    void flush_RemovesEverythingAndIsRepeatable() {
        // Given
        database.addAccount(Account.create(TestStubs.accountState()));
        openPosition(orderFactory.nextPositionId());
        database.updateStrategy(orderFactory.strategyId());

        // When
        database.flush();
        database.flush();

        // Then
        assertTrue(database.orderIds().isEmpty());
        assertTrue(database.positionIds().isEmpty());
        assertTrue(database.strategyIds().isEmpty());
        assertTrue(database.ordersWorking().isEmpty());
        assertTrue(database.ordersCompleted().isEmpty());
        assertTrue(database.positionsOpen().isEmpty());
        assertTrue(database.loadAccounts().isEmpty());
        assertTrue(database.orders().isEmpty());
        assertEquals(0L, store.deleteNamespace(database.keys().namespace()));
    }

    @Test
    void flush_OtherTrader_Untouched() {
        // Given
        ExecutionDatabase other = createDatabase(new ExecutionDatabaseConfig(TraderId.of("TESTER-001")));
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        other.addOrder(order, null, orderFactory.strategyId());

        // When
        database.flush();

        // Then
        assertEquals(Set.of(order.clOrdId()), other.orderIds());
    }

    // ========== Helpers ==========

    /**
     * Market BUY filled in full at {@link #FILL_PRICE}, persisted with its position link.
     */
    protected Order filledBuy(PositionId positionId) {
        Order order = orderFactory.market(TestStubs.AUDUSD, OrderSide.BUY, QUANTITY);
        database.addOrder(order, positionId, orderFactory.strategyId());
        order.apply(TestStubs.submitted(order));
        order.apply(TestStubs.accepted(order));
        order.apply(TestStubs.filled(order, positionId, FILL_PRICE));
        database.updateOrder(order);
        return order;
    }

    /**
     * Persists a filled BUY order and the long position it opens.
     */
    protected Position openPosition(PositionId positionId) {
        Order order = filledBuy(positionId);
        Position position = Position.open((OrderFilled) order.lastEvent().orElseThrow());
        database.addPosition(position, orderFactory.strategyId());
        return position;
    }

    /**
     * Persists a SELL order filling the whole of the given long position, then the closed position.
     */
    protected Position closePosition(Position position) {
        Order exit = orderFactory.market(TestStubs.AUDUSD, OrderSide.SELL, QUANTITY);
        database.addOrder(exit, position.id(), orderFactory.strategyId());
        exit.apply(TestStubs.submitted(exit));
        exit.apply(TestStubs.accepted(exit));
        OrderFilled closingFill = TestStubs.filled(exit, position.id(), new BigDecimal("1.00011"));
        exit.apply(closingFill);
        database.updateOrder(exit);
        position.apply(closingFill);
        database.updatePosition(position);
        return position;
    }

    /**
     * Registers an order whose log starts with bytes no codec can decode.
     */
    protected ClientOrderId writeCorruptOrder() {
        ClientOrderId corrupt = ClientOrderId.of("O-CORRUPT");
        store.execute(WriteBatch.builder()
            .append(database.keys().key(KeyKind.ORDERS, corrupt), "\u0000corrupt".getBytes(StandardCharsets.UTF_8))
            .setAdd(database.keys().indexOrders(), corrupt.getValue())
            .setAdd(database.keys().indexOrdersWorking(), corrupt.getValue())
            .build());
        return corrupt;
    }
}
