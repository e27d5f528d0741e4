package com.ryuqq.execdb.application.residual;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 잔여 상태 점검 결과.
 *
 * <p>{@code complete}가 false면 저장소 오류로 점검이 중간에 멈춘 부분 결과입니다.</p>
 *
 * @param residuals 발견된 잔여 상태 (발견 순서)
 * @param complete 점검 완료 여부
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record ResidualReport(
    List<Residual> residuals,
    boolean complete
) {

    public ResidualReport {
        if (residuals == null) {
            throw new IllegalArgumentException("residuals cannot be null");
        }
        residuals = Collections.unmodifiableList(new ArrayList<>(residuals));
    }

    public boolean isClean() {
        return complete && residuals.isEmpty();
    }

    public List<Residual> ofType(Residual.Type type) {
        return residuals.stream()
            .filter(residual -> residual.type() == type)
            .collect(Collectors.toList());
    }

    public List<Residual> integrityViolations() {
        return residuals.stream()
            .filter(residual -> residual.type().isIntegrityViolation())
            .collect(Collectors.toList());
    }
}
