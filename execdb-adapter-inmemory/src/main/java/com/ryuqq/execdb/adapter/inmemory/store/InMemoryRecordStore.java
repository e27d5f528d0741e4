package com.ryuqq.execdb.adapter.inmemory.store;

import com.ryuqq.execdb.core.exception.StoreUnavailableException;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.core.spi.WriteBatch;
import com.ryuqq.execdb.core.spi.WriteOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link RecordStore} SPI for testing and reference purposes.
 *
 * <p>Every key holds exactly one structure: an append-only log, a set or a hash. A single
 * {@link ReentrantReadWriteLock} guards all three maps, so a {@link WriteBatch} becomes
 * visible to readers all at once.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>logs:</strong> HashMap&lt;String, List&lt;byte[]&gt;&gt; - Append-only entries in insertion order</li>
 *   <li><strong>sets:</strong> HashMap&lt;String, LinkedHashSet&lt;String&gt;&gt; - Unordered membership</li>
 *   <li><strong>hashes:</strong> HashMap&lt;String, LinkedHashMap&lt;String, byte[]&gt;&gt; - Field to value</li>
 * </ul>
 *
 * <p><strong>Batch Execution:</strong></p>
 * <ol>
 *   <li>Validate every operation against the structure its key holds (including keys
 *       created or deleted earlier in the same batch)</li>
 *   <li>Apply all operations under the write lock</li>
 * </ol>
 * <p>Validation fails with {@link IllegalStateException} before anything is applied.</p>
 *
 * <p><strong>Empty Structures:</strong> a set or hash whose last member is removed disappears,
 * so absent keys and empty structures are indistinguishable to readers and to
 * {@link #deleteNamespace(String)}.</p>
 *
 * <p><strong>Outage Simulation:</strong> {@link #simulateOutage()} makes every call fail with
 * {@link StoreUnavailableException} until {@link #restore()} is called. Tests use it to verify
 * that a failed write leaves neither the store nor the database cache modified.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordStore store = new InMemoryRecordStore();
 *
 * store.execute(WriteBatch.builder()
 *     .append("Trader-TESTER-000:Orders:O-1", encodedCommand)
 *     .setAdd("Trader-TESTER-000:Index:Orders", "O-1")
 *     .build());
 *
 * List&lt;byte[]&gt; entries = store.logRange("Trader-TESTER-000:Orders:O-1");
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private enum Structure {
        LOG, SET, HASH
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Append-only logs.
     * Key: full key, Value: entries in insertion order
     */
    private final Map<String, List<byte[]>> logs = new HashMap<>();

    /**
     * Sets.
     * Key: full key, Value: members
     */
    private final Map<String, Set<String>> sets = new HashMap<>();

    /**
     * Hashes.
     * Key: full key, Value: field to value
     */
    private final Map<String, Map<String, byte[]>> hashes = new HashMap<>();

    private volatile boolean unavailable;
    private volatile boolean closed;

    /**
     * Creates a new InMemoryRecordStore with empty storage.
     */
    public InMemoryRecordStore() {
    }

    // ========== Writes ==========

    @Override
    public void execute(WriteBatch batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        checkAvailable();
        if (batch.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            validate(batch);
            for (WriteOp op : batch.operations()) {
                apply(op);
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Executed batch of {} operation(s) over {} key(s)", batch.size(), batch.keys().size());
    }

    /**
     * Checks every operation against the structure its key will hold when the operation runs.
     */
    private void validate(WriteBatch batch) {
        Map<String, Structure> pending = new HashMap<>();
        for (WriteOp op : batch.operations()) {
            String key = op.key();
            Structure current = pending.containsKey(key) ? pending.get(key) : structureOf(key);

            if (op instanceof WriteOp.Delete) {
                pending.put(key, null);
                continue;
            }

            Structure required = requiredStructure(op);
            if (current != null && current != required) {
                throw new IllegalStateException(
                    String.format("WRONGTYPE key %s holds a %s, cannot apply %s", key, current,
                        op.getClass().getSimpleName())
                );
            }
            if (current == null && creates(op)) {
                pending.put(key, required);
            }
        }
    }

    private void apply(WriteOp op) {
        String key = op.key();
        if (op instanceof WriteOp.Append append) {
            logs.computeIfAbsent(key, k -> new ArrayList<>()).add(append.value().clone());
        } else if (op instanceof WriteOp.SetAdd setAdd) {
            sets.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(setAdd.member());
        } else if (op instanceof WriteOp.SetRemove setRemove) {
            Set<String> members = sets.get(key);
            if (members != null && members.remove(setRemove.member()) && members.isEmpty()) {
                sets.remove(key);
            }
        } else if (op instanceof WriteOp.HashPut hashPut) {
            hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(hashPut.field(), hashPut.value().clone());
        } else if (op instanceof WriteOp.HashRemove hashRemove) {
            Map<String, byte[]> fields = hashes.get(key);
            if (fields != null && fields.remove(hashRemove.field()) != null && fields.isEmpty()) {
                hashes.remove(key);
            }
        } else if (op instanceof WriteOp.Delete) {
            removeKey(key);
        } else {
            throw new IllegalStateException("Unsupported write operation: " + op);
        }
    }

    private static Structure requiredStructure(WriteOp op) {
        if (op instanceof WriteOp.Append) {
            return Structure.LOG;
        }
        if (op instanceof WriteOp.SetAdd || op instanceof WriteOp.SetRemove) {
            return Structure.SET;
        }
        if (op instanceof WriteOp.HashPut || op instanceof WriteOp.HashRemove) {
            return Structure.HASH;
        }
        throw new IllegalStateException("Unsupported write operation: " + op);
    }

    private static boolean creates(WriteOp op) {
        return op instanceof WriteOp.Append || op instanceof WriteOp.SetAdd || op instanceof WriteOp.HashPut;
    }

    // ========== Reads ==========

    @Override
    public List<byte[]> logRange(String key) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.LOG);
            List<byte[]> entries = logs.get(key);
            if (entries == null) {
                return List.of();
            }
            List<byte[]> copy = new ArrayList<>(entries.size());
            for (byte[] entry : entries) {
                copy.add(entry.clone());
            }
            return Collections.unmodifiableList(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long logLength(String key) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.LOG);
            List<byte[]> entries = logs.get(key);
            return entries == null ? 0L : entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> members(String key) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.SET);
            Set<String> members = sets.get(key);
            return members == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(members));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isMember(String key, String member) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.SET);
            Set<String> members = sets.get(key);
            return members != null && members.contains(member);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> hashGet(String key, String field) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.HASH);
            Map<String, byte[]> fields = hashes.get(key);
            if (fields == null) {
                return Optional.empty();
            }
            byte[] value = fields.get(field);
            return value == null ? Optional.empty() : Optional.of(value.clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, byte[]> hashGetAll(String key) {
        requireKey(key);
        checkAvailable();
        lock.readLock().lock();
        try {
            requireStructure(key, Structure.HASH);
            Map<String, byte[]> fields = hashes.get(key);
            if (fields == null) {
                return Map.of();
            }
            Map<String, byte[]> copy = new LinkedHashMap<>();
            fields.forEach((field, value) -> copy.put(field, value.clone()));
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========== Maintenance ==========

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Scans the key sets of all three maps</li>
     *   <li>Idempotent: a second call with the same prefix returns 0</li>
     * </ul>
     */
    @Override
    public long deleteNamespace(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        checkAvailable();

        long deleted;
        lock.writeLock().lock();
        try {
            deleted = removePrefixed(logs, prefix) + removePrefixed(sets, prefix) + removePrefixed(hashes, prefix);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Deleted {} key(s) under namespace {}", deleted, prefix);
        return deleted;
    }

    private static long removePrefixed(Map<String, ?> structures, String prefix) {
        long removed = 0;
        Iterator<String> keys = structures.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Marks the store closed. Further calls fail with {@link StoreUnavailableException}.
     *
     * <p>Idempotent. Stored data is kept so a closed store can still be inspected through
     * {@link #keyCount()}.</p>
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("In-memory record store closed ({} key(s) retained)", keyCount());
        }
    }

    // ========== Test Support ==========

    /**
     * Makes every subsequent call fail with {@link StoreUnavailableException}.
     */
    public void simulateOutage() {
        unavailable = true;
        log.warn("In-memory record store outage simulated");
    }

    /**
     * Ends a simulated outage.
     */
    public void restore() {
        unavailable = false;
        log.info("In-memory record store restored");
    }

    /**
     * Number of keys currently held, across all structures.
     */
    public int keyCount() {
        lock.readLock().lock();
        try {
            return logs.size() + sets.size() + hashes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears all data (for testing).
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            logs.clear();
            sets.clear();
            hashes.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========== Helpers ==========

    private void checkAvailable() {
        if (closed) {
            throw new StoreUnavailableException("In-memory record store is closed");
        }
        if (unavailable) {
            throw new StoreUnavailableException("In-memory record store is unavailable (simulated outage)");
        }
    }

    private Structure structureOf(String key) {
        if (logs.containsKey(key)) {
            return Structure.LOG;
        }
        if (sets.containsKey(key)) {
            return Structure.SET;
        }
        if (hashes.containsKey(key)) {
            return Structure.HASH;
        }
        return null;
    }

    private void requireStructure(String key, Structure expected) {
        Structure actual = structureOf(key);
        if (actual != null && actual != expected) {
            throw new IllegalStateException(
                String.format("WRONGTYPE key %s holds a %s, expected a %s", key, actual, expected)
            );
        }
    }

    private void removeKey(String key) {
        logs.remove(key);
        sets.remove(key);
        hashes.remove(key);
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    @Override
    public String toString() {
        return "InMemoryRecordStore{keys=" + keyCount() + ", unavailable=" + unavailable + ", closed=" + closed + '}';
    }
}
