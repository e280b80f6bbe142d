package com.respkv.core;

import java.util.Objects;

/**
 * Entry of the expiration index: a deadline and the key it belongs to.
 * Ordered by deadline, then by key so that equal deadlines stay distinct.
 */
public final class ExpirationKey implements Comparable<ExpirationKey> {

    private final long deadlineNanos;
    private final String key;

    public ExpirationKey(long deadlineNanos, String key) {
        this.deadlineNanos = deadlineNanos;
        this.key = Objects.requireNonNull(key, "key");
    }

    /**
     * Get the deadline as a {@link System#nanoTime()} reading.
     */
    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    public String getKey() {
        return key;
    }

    @Override
    public int compareTo(ExpirationKey other) {
        // nanoTime values may wrap, only their difference is meaningful
        long diff = deadlineNanos - other.deadlineNanos;
        if (diff != 0) {
            return diff < 0 ? -1 : 1;
        }
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpirationKey that = (ExpirationKey) o;
        return deadlineNanos == that.deadlineNanos && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deadlineNanos, key);
    }

    @Override
    public String toString() {
        return "ExpirationKey{deadlineNanos=" + deadlineNanos + ", key='" + key + "'}";
    }
}
