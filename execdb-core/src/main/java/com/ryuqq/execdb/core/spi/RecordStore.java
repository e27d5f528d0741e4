package com.ryuqq.execdb.core.spi;

import com.ryuqq.execdb.core.exception.StoreUnavailableException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Record Store SPI over a key-value backing store.
 *
 * <p>This interface provides the primitive structures the execution database
 * needs: ordered logs, sets and hashes, addressed by string keys.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Ordered log append (through batches) and full read in append order</li>
 *   <li>Set add/remove (through batches), members and membership</li>
 *   <li>Hash field set/remove (through batches), get and get-all</li>
 *   <li>Whole-namespace delete</li>
 *   <li>Atomic multi-operation execution</li>
 * </ul>
 *
 * <p><strong>Atomicity Contract:</strong></p>
 * <pre>
 * execute(batch):
 *   all operations applied  → visible to readers together
 *   any operation rejected  → nothing applied
 * </pre>
 * <p>No reader may observe a log updated without its matching index update or
 * vice versa. A networked in-memory data-structure store with MULTI/EXEC style
 * transactions is a typical conforming implementation.</p>
 *
 * <p><strong>Key Structure:</strong> a key holds exactly one structure (log, set or hash)
 * for its lifetime. A batch that would use a key as a different structure is rejected
 * with {@link IllegalStateException} before any operation is applied.</p>
 *
 * <p><strong>Failure:</strong> every method raises {@link StoreUnavailableException} when
 * the backing store cannot be reached. A write that raised it had no effect.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent readers alongside a single writer</li>
 *   <li>Absent keys read as empty structures, never as errors</li>
 *   <li>Returned collections and arrays are copies, safe to mutate</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Executes a batch of writes atomically.
     *
     * <p>An empty batch is a no-op.</p>
     *
     * @param batch the batch to execute
     * @throws IllegalArgumentException if batch is null
     * @throws IllegalStateException if an operation targets a key holding another structure
     * @throws StoreUnavailableException if the store cannot be reached
     */
    void execute(WriteBatch batch);

    /**
     * Reads an ordered log in append order.
     *
     * @param key the log key
     * @return all entries, oldest first (empty if the key does not exist)
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if the key holds another structure
     */
    List<byte[]> logRange(String key);

    /**
     * Returns the number of entries in an ordered log.
     *
     * @param key the log key
     * @return entry count (0 if the key does not exist)
     */
    long logLength(String key);

    /**
     * Returns the members of a set.
     *
     * @param key the set key
     * @return members (empty if the key does not exist)
     */
    Set<String> members(String key);

    /**
     * Checks set membership.
     *
     * @param key the set key
     * @param member the member to check
     * @return true if the set exists and contains member
     */
    boolean isMember(String key, String member);

    /**
     * Reads a hash field.
     *
     * @param key the hash key
     * @param field the field name
     * @return field value, or empty if the hash or field does not exist
     */
    Optional<byte[]> hashGet(String key, String field);

    /**
     * Reads all fields of a hash.
     *
     * @param key the hash key
     * @return field → value (empty if the key does not exist)
     */
    Map<String, byte[]> hashGetAll(String key);

    /**
     * Deletes every key starting with the given prefix.
     *
     * <p>Irreversible. Deleting an empty namespace is a no-op, not an error.</p>
     *
     * @param prefix the namespace prefix (e.g. {@code Trader-TESTER-000:})
     * @return number of keys deleted
     * @throws IllegalArgumentException if prefix is null or blank
     */
    long deleteNamespace(String prefix);

    /**
     * Releases the store connection.
     */
    @Override
    void close();
}
