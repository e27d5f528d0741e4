package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.account.Account;
import com.ryuqq.execdb.core.domain.event.AccountState;
import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.key.ExecutionKeys;
import com.ryuqq.execdb.core.model.AccountId;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 계좌 스냅샷 저장소.
 *
 * <p>계좌는 이력이 아니라 최신 {@link AccountState} 하나로 저장됩니다.
 * {@code {root}:Accounts:} 해시의 필드가 계좌 ID입니다. 저장은 덮어쓰기(upsert)입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class AccountSnapshots {

    private final RecordStore store;
    private final ExecutionKeys keys;
    private final EventCodec eventCodec;

    public AccountSnapshots(RecordStore store, ExecutionKeys keys, EventCodec eventCodec) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (eventCodec == null) {
            throw new IllegalArgumentException("eventCodec cannot be null");
        }
        this.store = store;
        this.keys = keys;
        this.eventCodec = eventCodec;
    }

    /**
     * 계좌 스냅샷 upsert 연산 추가.
     *
     * @param account 계좌
     * @param batch 연산을 추가할 배치
     */
    public void save(Account account, WriteBatch.Builder batch) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        batch.hashPut(keys.accounts(), account.id().getValue(), eventCodec.encode(account.lastEvent()));
    }

    /**
     * 계좌 로드.
     *
     * @param id 계좌 ID
     * @return 계좌 (없으면 empty)
     * @throws DeserializationException 스냅샷을 디코딩할 수 없는 경우
     */
    public Optional<Account> load(AccountId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return store.hashGet(keys.accounts(), id.getValue()).map(bytes -> decode(id, bytes));
    }

    /**
     * 저장된 전체 스냅샷 원본 (계좌 ID 순서).
     *
     * <p>디코딩은 호출자가 {@link #decode(AccountId, byte[])}로 개별 수행합니다.</p>
     *
     * @return 계좌 ID → 인코딩된 스냅샷
     */
    public Map<AccountId, byte[]> snapshots() {
        Map<AccountId, byte[]> snapshots = new LinkedHashMap<>();
        new TreeMap<>(store.hashGetAll(keys.accounts()))
            .forEach((field, bytes) -> snapshots.put(AccountId.of(field), bytes));
        return snapshots;
    }

    /**
     * 인코딩된 스냅샷을 계좌로 복원.
     *
     * @param id 계좌 ID
     * @param bytes 인코딩된 AccountState
     * @return 계좌
     * @throws DeserializationException 디코딩 실패, AccountState가 아니거나 다른 계좌의 상태인 경우
     */
    public Account decode(AccountId id, byte[] bytes) {
        Event event = eventCodec.decode(bytes);
        if (!(event instanceof AccountState state)) {
            throw new DeserializationException(
                String.format("Account %s snapshot is not an AccountState: %s",
                    id.getValue(), event.getClass().getSimpleName())
            );
        }
        if (!state.accountId().equals(id)) {
            throw new DeserializationException(
                String.format("Account %s snapshot belongs to %s", id.getValue(), state.accountId().getValue())
            );
        }
        return Account.create(state);
    }
}
