package com.respkv.core;

import java.util.Arrays;

/**
 * A stored value together with its optional deadline.
 *
 * The deadline is an absolute {@link System#nanoTime()} reading, so it is only
 * meaningful inside this process and must be compared by subtraction.
 */
final class StoredEntry {

    private final byte[] value;
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private StoredEntry(byte[] value, long deadlineNanos, boolean hasDeadline) {
        this.value = value;
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    static StoredEntry permanent(byte[] value) {
        return new StoredEntry(value, 0, false);
    }

    static StoredEntry expiringAt(byte[] value, long deadlineNanos) {
        return new StoredEntry(value, deadlineNanos, true);
    }

    /**
     * Get the raw value bytes without copying.
     */
    byte[] valueUnsafe() {
        return value;
    }

    boolean hasDeadline() {
        return hasDeadline;
    }

    long deadlineNanos() {
        return deadlineNanos;
    }

    boolean isExpired(long nowNanos) {
        return hasDeadline && deadlineNanos - nowNanos <= 0;
    }

    @Override
    public String toString() {
        return "StoredEntry{" +
               "valueLength=" + value.length +
               (hasDeadline ? ", deadlineNanos=" + deadlineNanos : "") +
               '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredEntry that = (StoredEntry) o;
        return deadlineNanos == that.deadlineNanos &&
               hasDeadline == that.hasDeadline &&
               Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(deadlineNanos) * 31 + Boolean.hashCode(hasDeadline);
        return 31 * result + Arrays.hashCode(value);
    }
}
