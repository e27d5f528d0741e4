package com.ryuqq.execdb.core.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered group of {@link WriteOp}s executed atomically by {@link RecordStore#execute(WriteBatch)}.
 *
 * <p>Immutable once built. Operations are applied in insertion order.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * WriteBatch batch = WriteBatch.builder()
 *     .append(keys.key(KeyKind.ORDERS, orderId), eventBytes)
 *     .setAdd(keys.indexOrdersCompleted(), orderId.getValue())
 *     .setRemove(keys.indexOrdersWorking(), orderId.getValue())
 *     .build();
 * store.execute(batch);
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class WriteBatch {

    private final List<WriteOp> operations;

    private WriteBatch(List<WriteOp> operations) {
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<WriteOp> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    /**
     * Distinct keys touched by this batch, in first-touch order.
     *
     * @return touched keys
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (WriteOp op : operations) {
            keys.add(op.key());
        }
        return keys;
    }

    @Override
    public String toString() {
        return "WriteBatch{" + operations + '}';
    }

    /**
     * Builder for {@link WriteBatch}.
     */
    public static final class Builder {

        private final List<WriteOp> operations = new ArrayList<>();

        private Builder() {
        }

        public Builder add(WriteOp op) {
            if (op == null) {
                throw new IllegalArgumentException("op cannot be null");
            }
            operations.add(op);
            return this;
        }

        public Builder append(String key, byte[] value) {
            return add(new WriteOp.Append(key, value));
        }

        public Builder setAdd(String key, String member) {
            return add(new WriteOp.SetAdd(key, member));
        }

        public Builder setRemove(String key, String member) {
            return add(new WriteOp.SetRemove(key, member));
        }

        public Builder hashPut(String key, String field, byte[] value) {
            return add(new WriteOp.HashPut(key, field, value));
        }

        public Builder hashPut(String key, String field, String value) {
            return add(WriteOp.HashPut.ofString(key, field, value));
        }

        public Builder hashRemove(String key, String field) {
            return add(new WriteOp.HashRemove(key, field));
        }

        public Builder delete(String key) {
            return add(new WriteOp.Delete(key));
        }

        public WriteBatch build() {
            return new WriteBatch(operations);
        }
    }
}
