package com.ryuqq.execdb.core.domain.event;

import com.ryuqq.execdb.core.model.AccountId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * 계좌의 전체 현재 상태.
 *
 * <p>계좌는 이벤트 로그가 아니라 최신 스냅샷으로 저장되며,
 * 스냅샷은 가장 최근의 AccountState 하나입니다.</p>
 *
 * @param accountId 계좌 ID
 * @param currency 계좌 통화
 * @param cashBalance 현금 잔고
 * @param cashStartDay 당일 시작 잔고
 * @param marginUsed 사용 중인 증거금
 * @param eventId 이벤트 ID
 * @param timestamp 발생 시각
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record AccountState(
    AccountId accountId,
    String currency,
    BigDecimal cashBalance,
    BigDecimal cashStartDay,
    BigDecimal marginUsed,
    UUID eventId,
    Instant timestamp
) implements Event {

    public AccountState {
        if (accountId == null) {
            throw new IllegalArgumentException("accountId cannot be null");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency cannot be null or blank");
        }
        if (cashBalance == null || cashStartDay == null || marginUsed == null) {
            throw new IllegalArgumentException("balances cannot be null");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
