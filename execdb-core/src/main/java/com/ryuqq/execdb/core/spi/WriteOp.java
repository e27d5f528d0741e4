package com.ryuqq.execdb.core.spi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single write primitive inside a {@link WriteBatch}.
 *
 * <p>Each operation targets exactly one key. Operations never fail because
 * the target is absent: removing a missing set member or hash field is a no-op.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface WriteOp {

    /**
     * Returns the key this operation writes to.
     *
     * @return target key
     */
    String key();

    /**
     * Appends an entry to the tail of an ordered log.
     */
    record Append(String key, byte[] value) implements WriteOp {
        public Append {
            requireKey(key);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Append other)) return false;
            return key.equals(other.key) && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Append{" + key + ", " + value.length + " bytes}";
        }
    }

    /**
     * Adds a member to a set.
     */
    record SetAdd(String key, String member) implements WriteOp {
        public SetAdd {
            requireKey(key);
            requireName(member, "member");
        }
    }

    /**
     * Removes a member from a set.
     */
    record SetRemove(String key, String member) implements WriteOp {
        public SetRemove {
            requireKey(key);
            requireName(member, "member");
        }
    }

    /**
     * Sets (upserts) a hash field.
     */
    record HashPut(String key, String field, byte[] value) implements WriteOp {
        public HashPut {
            requireKey(key);
            requireName(field, "field");
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        public static HashPut ofString(String key, String field, String value) {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
            return new HashPut(key, field, value.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof HashPut other)) return false;
            return key.equals(other.key) && field.equals(other.field) && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * key.hashCode() + field.hashCode()) + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "HashPut{" + key + ", " + field + ", " + value.length + " bytes}";
        }
    }

    /**
     * Removes a hash field.
     */
    record HashRemove(String key, String field) implements WriteOp {
        public HashRemove {
            requireKey(key);
            requireName(field, "field");
        }
    }

    /**
     * Deletes a whole key regardless of its structure.
     */
    record Delete(String key) implements WriteOp {
        public Delete {
            requireKey(key);
        }
    }

    private static void requireKey(String key) {
        requireName(key, "key");
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
