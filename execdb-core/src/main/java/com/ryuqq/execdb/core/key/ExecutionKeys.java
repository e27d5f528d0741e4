package com.ryuqq.execdb.core.key;

import com.ryuqq.execdb.core.model.Identifier;
import com.ryuqq.execdb.core.model.TraderId;
import com.ryuqq.execdb.core.statemachine.IndexStatus;

/**
 * Trader 네임스페이스 키 도출기.
 *
 * <p>(traderId, kind, id?) → 키 문자열의 순수 함수입니다. Trader {@code TESTER-000}의 예:</p>
 * <pre>
 * trader()              → Trader-TESTER-000
 * orders()              → Trader-TESTER-000:Orders:
 * order(O-1)            → Trader-TESTER-000:Orders:O-1
 * indexOrdersWorking()  → Trader-TESTER-000:Index:Orders:Working
 * namespace()           → Trader-TESTER-000:
 * </pre>
 *
 * <p>Trader ID는 프로세스 전역 상태가 아니라 명시적인 값으로 주입됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class ExecutionKeys {

    private static final String TRADER_PREFIX = "Trader-";

    private final TraderId traderId;
    private final String root;

    /**
     * 생성자.
     *
     * @param traderId Trader ID
     * @throws IllegalArgumentException traderId가 null인 경우
     */
    public ExecutionKeys(TraderId traderId) {
        if (traderId == null) {
            throw new IllegalArgumentException("traderId cannot be null");
        }
        this.traderId = traderId;
        this.root = TRADER_PREFIX + traderId.getValue();
    }

    /**
     * 고정 키 도출.
     *
     * @param kind 키 종류
     * @return 키 문자열
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public String key(KeyKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return root + kind.suffix();
    }

    /**
     * 엔티티별 키 도출.
     *
     * @param kind 엔티티별 루트 키 종류 (접미사가 ':'로 끝나야 함)
     * @param id 엔티티 ID
     * @return 키 문자열
     * @throws IllegalArgumentException kind 또는 id가 null이거나, kind가 엔티티별 루트가 아닌 경우
     */
    public String key(KeyKind kind, Identifier id) {
        if (kind == null || id == null) {
            throw new IllegalArgumentException("kind and id cannot be null");
        }
        if (!kind.isPerEntityRoot()) {
            throw new IllegalArgumentException(kind + " does not take an entity id");
        }
        return root + kind.suffix() + id.getValue();
    }

    /**
     * 상태 집합 키 도출.
     *
     * @param status 상태 집합
     * @return 상태 집합 키
     */
    public String key(IndexStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return switch (status) {
            case WORKING -> key(KeyKind.INDEX_ORDERS_WORKING);
            case COMPLETED -> key(KeyKind.INDEX_ORDERS_COMPLETED);
            case OPEN -> key(KeyKind.INDEX_POSITIONS_OPEN);
            case CLOSED -> key(KeyKind.INDEX_POSITIONS_CLOSED);
        };
    }

    /**
     * Flush 대상 네임스페이스 접두사.
     *
     * <p>루트 키 뒤에 ':'를 붙여 {@code TESTER-000}과 {@code TESTER-0001}이 겹치지 않게 합니다.</p>
     *
     * @return 네임스페이스 접두사
     */
    public String namespace() {
        return root + ":";
    }

    public TraderId traderId() {
        return traderId;
    }

    public String trader() {
        return key(KeyKind.TRADER);
    }

    public String accounts() {
        return key(KeyKind.ACCOUNTS);
    }

    public String orders() {
        return key(KeyKind.ORDERS);
    }

    public String positions() {
        return key(KeyKind.POSITIONS);
    }

    public String strategies() {
        return key(KeyKind.STRATEGIES);
    }

    public String indexOrderPosition() {
        return key(KeyKind.INDEX_ORDER_POSITION);
    }

    public String indexOrderStrategy() {
        return key(KeyKind.INDEX_ORDER_STRATEGY);
    }

    public String indexPositionStrategy() {
        return key(KeyKind.INDEX_POSITION_STRATEGY);
    }

    public String indexPositionOrders() {
        return key(KeyKind.INDEX_POSITION_ORDERS);
    }

    public String indexStrategyOrders() {
        return key(KeyKind.INDEX_STRATEGY_ORDERS);
    }

    public String indexStrategyPositions() {
        return key(KeyKind.INDEX_STRATEGY_POSITIONS);
    }

    public String indexOrders() {
        return key(KeyKind.INDEX_ORDERS);
    }

    public String indexOrdersWorking() {
        return key(KeyKind.INDEX_ORDERS_WORKING);
    }

    public String indexOrdersCompleted() {
        return key(KeyKind.INDEX_ORDERS_COMPLETED);
    }

    public String indexPositions() {
        return key(KeyKind.INDEX_POSITIONS);
    }

    public String indexPositionsOpen() {
        return key(KeyKind.INDEX_POSITIONS_OPEN);
    }

    public String indexPositionsClosed() {
        return key(KeyKind.INDEX_POSITIONS_CLOSED);
    }
}
