package com.ryuqq.execdb.application.residual;

import com.ryuqq.execdb.application.index.ExecutionIndex;
import com.ryuqq.execdb.application.repository.EventLogRepository;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.statemachine.IndexStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 잔여 상태 점검기.
 *
 * <p>비정상 종료 후 남아 있는 WORKING 주문과 OPEN 포지션을 찾아내고,
 * 각 항목의 인덱스 참조 무결성을 확인합니다. 주로 프로세스 시작 시 실행됩니다.</p>
 *
 * <p><strong>점검 흐름:</strong></p>
 * <pre>
 * 1. WORKING 집합의 각 주문:
 *    a. WORKING_ORDER 보고
 *    b. order→strategy 없음       → MISSING_ORDER_STRATEGY
 *    c. order→position 있으나 position→{orders}에 없음 → MISSING_POSITION_ORDER
 * 2. OPEN 집합의 각 포지션:
 *    a. OPEN_POSITION 보고
 *    b. position→strategy 없음    → MISSING_POSITION_STRATEGY
 * 3. 발견 항목 WARN 로그
 * </pre>
 *
 * <p><strong>예외를 던지지 않습니다.</strong> 저장소 오류는 ERROR 로그로 남기고
 * 그 시점까지의 부분 결과를 반환합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class ResidualChecker {

    private static final Logger log = LoggerFactory.getLogger(ResidualChecker.class);

    private final EventLogRepository<ClientOrderId, Order> orders;
    private final EventLogRepository<PositionId, Position> positions;
    private final ExecutionIndex index;

    /**
     * 생성자.
     *
     * @param orders 주문 저장소
     * @param positions 포지션 저장소
     * @param index 관계 인덱스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResidualChecker(EventLogRepository<ClientOrderId, Order> orders,
                           EventLogRepository<PositionId, Position> positions,
                           ExecutionIndex index) {
        if (orders == null) {
            throw new IllegalArgumentException("orders cannot be null");
        }
        if (positions == null) {
            throw new IllegalArgumentException("positions cannot be null");
        }
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
        this.orders = orders;
        this.positions = positions;
        this.index = index;
    }

    /**
     * 잔여 상태 점검.
     *
     * @return 점검 결과 (저장소 오류 시 complete=false인 부분 결과)
     */
    public ResidualReport check() {
        List<Residual> residuals = new ArrayList<>();
        boolean complete = true;

        try {
            for (ClientOrderId clOrdId : orders.withStatus(IndexStatus.WORKING)) {
                checkOrder(clOrdId, residuals);
            }
            for (PositionId positionId : positions.withStatus(IndexStatus.OPEN)) {
                checkPosition(positionId, residuals);
            }
        } catch (RuntimeException e) {
            log.error("Residual check aborted after {} finding(s)", residuals.size(), e);
            complete = false;
        }

        for (Residual residual : residuals) {
            log.warn("Residual {} {}: {}", residual.type(), residual.entityId(), residual.detail());
        }
        if (complete && residuals.isEmpty()) {
            log.info("Residual check completed: no residual state");
        } else {
            log.info("Residual check completed: {} finding(s), complete={}", residuals.size(), complete);
        }
        return new ResidualReport(residuals, complete);
    }

    private void checkOrder(ClientOrderId clOrdId, List<Residual> residuals) {
        String id = clOrdId.getValue();
        residuals.add(new Residual(Residual.Type.WORKING_ORDER, id, "order still working"));

        if (index.strategyIdForOrder(clOrdId).isEmpty()) {
            residuals.add(new Residual(Residual.Type.MISSING_ORDER_STRATEGY, id, "no order→strategy entry"));
        }

        Optional<PositionId> positionId = index.positionIdForOrder(clOrdId);
        if (positionId.isPresent() && !index.orderIdsForPosition(positionId.get()).contains(clOrdId)) {
            residuals.add(new Residual(Residual.Type.MISSING_POSITION_ORDER, id,
                "not a member of position→orders for " + positionId.get().getValue()));
        }
    }

    private void checkPosition(PositionId positionId, List<Residual> residuals) {
        String id = positionId.getValue();
        residuals.add(new Residual(Residual.Type.OPEN_POSITION, id, "position still open"));

        if (index.strategyIdForPosition(positionId).isEmpty()) {
            residuals.add(new Residual(Residual.Type.MISSING_POSITION_STRATEGY, id, "no position→strategy entry"));
        }
    }
}
