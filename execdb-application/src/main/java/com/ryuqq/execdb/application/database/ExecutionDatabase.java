package com.ryuqq.execdb.application.database;

import com.ryuqq.execdb.application.residual.ResidualReport;
import com.ryuqq.execdb.core.domain.account.Account;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.exception.StoreUnavailableException;
import com.ryuqq.execdb.core.key.ExecutionKeys;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.model.StrategyId;
import com.ryuqq.execdb.core.model.TraderId;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Execution Database.
 *
 * <p>한 Trader의 계좌, 주문, 포지션, 전략 기록을 키-값 저장소에 보관하는
 * event-sourced 영속성 계층입니다.</p>
 *
 * <p><strong>저장 방식:</strong></p>
 * <ul>
 *   <li>계좌: 최신 상태 스냅샷 (upsert)</li>
 *   <li>주문: 생성 명령 + 적용된 이벤트 로그 (append-only)</li>
 *   <li>포지션: 체결 이벤트 로그 (append-only)</li>
 *   <li>전략: 레지스트리 멤버십</li>
 * </ul>
 *
 * <p><strong>원자성:</strong> 모든 쓰기는 로그와 인덱스를 하나의 배치로 원자적으로 갱신합니다.
 * {@link StoreUnavailableException}이 발생한 쓰기는 아무 효과도 없습니다.</p>
 *
 * <p><strong>재생 결정성:</strong> {@code loadOrder(id)}는 마지막으로 {@code updateOrder}에
 * 넘긴 주문과 구조적으로 같은 객체를 반환합니다. 포지션도 마찬가지입니다.</p>
 *
 * <p><strong>부재:</strong> 없는 ID의 로드는 예외가 아니라 {@code Optional.empty()}입니다.</p>
 *
 * <p>단일 writer를 가정합니다. 읽기는 동시에 수행될 수 있습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface ExecutionDatabase extends AutoCloseable {

    TraderId traderId();

    ExecutionKeys keys();

    // ========== 쓰기 ==========

    /**
     * 계좌 스냅샷 upsert.
     *
     * @param account 계좌
     */
    void addAccount(Account account);

    /**
     * 계좌 스냅샷 upsert ({@link #addAccount(Account)}와 동일).
     *
     * @param account 계좌
     */
    void updateAccount(Account account);

    /**
     * 신규 주문 등록.
     *
     * @param order 주문
     * @param positionId 포지션 ID (아직 배정되지 않았으면 null)
     * @param strategyId 전략 ID
     * @throws IllegalStateException 이미 등록된 주문인 경우
     */
    void addOrder(Order order, PositionId positionId, StrategyId strategyId);

    /**
     * 주문 갱신: 저장되지 않은 이벤트 추가 및 WORKING/COMPLETED 이동.
     *
     * @param order 주문
     * @throws IllegalStateException 등록되지 않은 주문인 경우
     */
    void updateOrder(Order order);

    /**
     * 신규 포지션 등록.
     *
     * @param position 포지션
     * @param strategyId 전략 ID
     * @throws IllegalStateException 이미 등록된 포지션인 경우
     */
    void addPosition(Position position, StrategyId strategyId);

    /**
     * 포지션 갱신: 저장되지 않은 체결 추가, 구성 주문 인덱스 확장, OPEN/CLOSED 이동.
     *
     * @param position 포지션
     * @throws IllegalStateException 등록되지 않은 포지션인 경우
     */
    void updatePosition(Position position);

    void updateStrategy(StrategyId strategyId);

    /**
     * 전략 레지스트리에서 제거. 주문/포지션 로그는 건드리지 않습니다.
     *
     * @param strategyId 전략 ID
     */
    void deleteStrategy(StrategyId strategyId);

    // ========== 로드 ==========

    Optional<Account> loadAccount(AccountId accountId);

    /**
     * 전체 계좌 로드 및 캐시 적재.
     *
     * @return 계좌 ID → 계좌 (ID 순서)
     * @throws DeserializationException ABORT 정책에서 손상된 스냅샷을 만난 경우
     */
    Map<AccountId, Account> loadAccounts();

    /**
     * 주문 로그 재생.
     *
     * @param clOrdId 주문 ID
     * @return 재구성된 주문 (없으면 empty)
     * @throws DeserializationException 로그를 디코딩할 수 없는 경우
     * @throws ReplayException 도메인이 재생 이벤트를 거부한 경우
     */
    Optional<Order> loadOrder(ClientOrderId clOrdId);

    Map<ClientOrderId, Order> loadOrders();

    Optional<Position> loadPosition(PositionId positionId);

    Map<PositionId, Position> loadPositions();

    // ========== 캐시 ==========

    Optional<Account> account(AccountId accountId);

    List<Account> accounts();

    Optional<Order> order(ClientOrderId clOrdId);

    List<Order> orders();

    Optional<Position> position(PositionId positionId);

    List<Position> positions();

    // ========== 인덱스 조회 ==========

    Set<ClientOrderId> orderIds();

    Set<PositionId> positionIds();

    Set<StrategyId> strategyIds();

    boolean orderExists(ClientOrderId clOrdId);

    boolean positionExists(PositionId positionId);

    /**
     * order→position 값이 있고 그 포지션이 등록되어 있는지 확인.
     */
    boolean positionExistsForOrder(ClientOrderId clOrdId);

    /**
     * order→position 항목 존재 여부 (포지션 등록 여부와 무관).
     */
    boolean positionIndexedForOrder(ClientOrderId clOrdId);

    Set<ClientOrderId> ordersWorking();

    Set<ClientOrderId> ordersWorking(StrategyId strategyId);

    Set<ClientOrderId> ordersCompleted();

    Set<ClientOrderId> ordersCompleted(StrategyId strategyId);

    Set<PositionId> positionsOpen();

    Set<PositionId> positionsOpen(StrategyId strategyId);

    Set<PositionId> positionsClosed();

    Set<PositionId> positionsClosed(StrategyId strategyId);

    // ========== 수명 주기 ==========

    /**
     * 잔여 상태 점검. 예외를 던지지 않습니다.
     *
     * @return 점검 결과
     */
    ResidualReport checkResiduals();

    /**
     * 캐시만 비웁니다. 저장된 데이터는 그대로입니다.
     */
    void reset();

    /**
     * Trader 네임스페이스의 모든 키 삭제 (되돌릴 수 없음). 캐시도 비웁니다.
     */
    void flush();

    @Override
    void close();
}
