package com.ryuqq.execdb.core.domain.account;

import com.ryuqq.execdb.core.domain.event.AccountState;
import com.ryuqq.execdb.core.model.AccountId;

import java.math.BigDecimal;

/**
 * 계좌.
 *
 * <p>계좌의 상태는 가장 최근에 적용된 {@link AccountState}로 완전히 결정됩니다.
 * 따라서 저장소에는 이력이 아니라 최신 스냅샷만 남습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class Account {

    private final AccountId id;
    private final String currency;
    private AccountState lastEvent;

    private Account(AccountState event) {
        this.id = event.accountId();
        this.currency = event.currency();
        this.lastEvent = event;
    }

    /**
     * 계좌 상태 이벤트로 계좌 생성.
     *
     * @param event 계좌 상태
     * @return Account 인스턴스
     * @throws IllegalArgumentException event가 null인 경우
     */
    public static Account create(AccountState event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return new Account(event);
    }

    /**
     * 새 계좌 상태 적용.
     *
     * @param event 계좌 상태
     * @throws IllegalArgumentException event가 null이거나 다른 계좌/통화의 이벤트인 경우
     */
    public void apply(AccountState event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!event.accountId().equals(id)) {
            throw new IllegalArgumentException(
                String.format("Event for %s cannot be applied to %s", event.accountId(), id)
            );
        }
        if (!event.currency().equals(currency)) {
            throw new IllegalArgumentException(
                String.format("Currency %s does not match account currency %s", event.currency(), currency)
            );
        }
        this.lastEvent = event;
    }

    public AccountId id() {
        return id;
    }

    public String currency() {
        return currency;
    }

    public BigDecimal cashBalance() {
        return lastEvent.cashBalance();
    }

    public BigDecimal cashStartDay() {
        return lastEvent.cashStartDay();
    }

    public BigDecimal marginUsed() {
        return lastEvent.marginUsed();
    }

    public BigDecimal freeEquity() {
        return lastEvent.cashBalance().subtract(lastEvent.marginUsed());
    }

    public AccountState lastEvent() {
        return lastEvent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account other = (Account) o;
        return id.equals(other.id) && lastEvent.equals(other.lastEvent);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Account{" + id.getValue() + ", " + lastEvent.cashBalance().toPlainString() + " " + currency + '}';
    }
}
