package com.respkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Thread-safe in-memory key-value store with per-key expiration.
 *
 * Entries live in a hash map; every entry that carries a deadline also has one
 * {@link ExpirationKey} in a sorted index, and both structures are only changed
 * together while holding {@link #lock}. A single reaper thread removes due
 * entries, then sleeps until the earliest remaining deadline. A write that
 * introduces a new earliest deadline wakes it early.
 *
 * Reads never return an expired entry: if the reaper has not reached it yet,
 * the read removes it itself.
 */
public class ExpiringStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(ExpiringStore.class);

    // Keeps deadline arithmetic far away from nanoTime wrap-around (about 73 years)
    static final long MAX_TTL_NANOS = Long.MAX_VALUE / 4;
    private static final long NO_DEADLINE = -1;

    private final Map<String, StoredEntry> entries = new HashMap<>();
    private final NavigableSet<ExpirationKey> expirations = new TreeSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    // Wake signal for the reaper. Separate from the data lock so writers signal
    // after releasing it; the flag keeps a signal sent before the reaper waits.
    private final Object wakeMonitor = new Object();
    private boolean wakeRequested = false;

    private final LongSupplier clock;
    private final AtomicLong expiredCount = new AtomicLong();
    private final Thread reaper;
    private volatile boolean running = true;

    /**
     * Create a store and start its reaper thread.
     */
    public ExpiringStore() {
        this(System::nanoTime);
    }

    /**
     * Create a store reading time from the given monotonic nanosecond clock.
     */
    ExpiringStore(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reaper = new Thread(this::reapLoop, "respkv-reaper");
        this.reaper.setDaemon(true);
        this.reaper.start();
    }

    @Override
    public void set(String key, byte[] value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        validateKey(key);
        Objects.requireNonNull(value, "value");
        long ttlNanos = ttl != null ? toTtlNanos(ttl) : NO_DEADLINE;
        byte[] copy = Arrays.copyOf(value, value.length);

        boolean newEarliest = false;
        lock.lock();
        try {
            StoredEntry entry = ttlNanos == NO_DEADLINE
                ? StoredEntry.permanent(copy)
                : StoredEntry.expiringAt(copy, clock.getAsLong() + ttlNanos);

            StoredEntry previous = entries.put(key, entry);
            if (previous != null && previous.hasDeadline()) {
                expirations.remove(new ExpirationKey(previous.deadlineNanos(), key));
            }
            if (entry.hasDeadline()) {
                ExpirationKey expiration = new ExpirationKey(entry.deadlineNanos(), key);
                expirations.add(expiration);
                newEarliest = expirations.first().equals(expiration);
            }
        } finally {
            lock.unlock();
        }

        if (newEarliest) {
            wakeReaper();
        }
        logger.trace("SET key={}, valueSize={}, ttl={}", key, value.length, ttl);
    }

    @Override
    public Optional<byte[]> get(String key) {
        validateKey(key);
        byte[] value;
        lock.lock();
        try {
            StoredEntry entry = entries.get(key);
            if (entry == null) {
                logger.trace("GET key={} -> NOT_FOUND", key);
                return Optional.empty();
            }
            if (entry.isExpired(clock.getAsLong())) {
                removeExpiredLocked(key, entry);
                logger.trace("GET key={} -> EXPIRED", key);
                return Optional.empty();
            }
            value = entry.valueUnsafe();
        } finally {
            lock.unlock();
        }
        logger.trace("GET key={} -> FOUND", key);
        // Stored arrays are never mutated, so the copy can happen outside the lock
        return Optional.of(Arrays.copyOf(value, value.length));
    }

    @Override
    public boolean delete(String key) {
        validateKey(key);
        boolean removedLive;
        lock.lock();
        try {
            StoredEntry removed = entries.remove(key);
            if (removed == null) {
                removedLive = false;
            } else {
                if (removed.hasDeadline()) {
                    expirations.remove(new ExpirationKey(removed.deadlineNanos(), key));
                }
                removedLive = !removed.isExpired(clock.getAsLong());
            }
        } finally {
            lock.unlock();
        }
        logger.trace("DELETE key={} -> {}", key, removedLive ? "DELETED" : "NOT_FOUND");
        return removedLive;
    }

    @Override
    public boolean exists(String key) {
        validateKey(key);
        lock.lock();
        try {
            StoredEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpired(clock.getAsLong())) {
                removeExpiredLocked(key, entry);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            // Expired-but-unreaped entries sit at the head of the index
            long now = clock.getAsLong();
            int pending = 0;
            for (ExpirationKey expiration : expirations) {
                if (expiration.getDeadlineNanos() - now > 0) {
                    break;
                }
                pending++;
            }
            return entries.size() - pending;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            expirations.clear();
        } finally {
            lock.unlock();
        }
        logger.debug("Store cleared");
    }

    /**
     * Get the number of entries held, including expired ones the reaper has not removed yet.
     */
    public int rawSize() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get a snapshot of the expiration index, earliest deadline first.
     * Copies the whole index; meant for diagnostics and tests.
     */
    public NavigableSet<ExpirationKey> expirationIndex() {
        lock.lock();
        try {
            return new TreeSet<>(expirations);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the number of entries removed because their deadline passed.
     */
    public long expiredCount() {
        return expiredCount.get();
    }

    /**
     * Stop the reaper thread. Entries are kept and lazy expiry on read still applies.
     */
    public void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        wakeReaper();
        if (reaper != Thread.currentThread()) {
            try {
                reaper.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("ExpiringStore shutdown complete");
    }

    /**
     * Check whether the reaper thread is still running.
     */
    public boolean isReaperAlive() {
        return reaper.isAlive();
    }

    // ==================== Reaper ====================

    private void reapLoop() {
        logger.debug("Expiration reaper started");
        while (running) {
            long delayNanos;
            try {
                delayNanos = purgeExpired();
            } catch (RuntimeException e) {
                logger.error("Expiration sweep failed: {}", e.getMessage(), e);
                delayNanos = TimeUnit.SECONDS.toNanos(1);
            }
            if (!awaitWake(delayNanos)) {
                break;
            }
        }
        logger.debug("Expiration reaper stopped");
    }

    /**
     * Remove every entry whose deadline has passed.
     *
     * @return nanoseconds until the next deadline, or NO_DEADLINE if the index is empty
     */
    long purgeExpired() {
        int removed = 0;
        long delayNanos;
        lock.lock();
        try {
            long now = clock.getAsLong();
            while (!expirations.isEmpty()) {
                ExpirationKey first = expirations.first();
                if (first.getDeadlineNanos() - now > 0) {
                    break;
                }
                expirations.pollFirst();
                entries.remove(first.getKey());
                removed++;
            }
            delayNanos = expirations.isEmpty()
                ? NO_DEADLINE
                : expirations.first().getDeadlineNanos() - now;
        } finally {
            lock.unlock();
        }

        if (removed > 0) {
            expiredCount.addAndGet(removed);
            logger.debug("Reaped {} expired entries", removed);
        }
        return delayNanos;
    }

    /**
     * Sleep until the delay elapses or a writer signals a new earliest deadline.
     *
     * @return false if the thread was interrupted
     */
    private boolean awaitWake(long delayNanos) {
        synchronized (wakeMonitor) {
            try {
                if (!wakeRequested && running) {
                    if (delayNanos == NO_DEADLINE) {
                        wakeMonitor.wait();
                    } else {
                        TimeUnit.NANOSECONDS.timedWait(wakeMonitor, delayNanos);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } finally {
                wakeRequested = false;
            }
        }
        return true;
    }

    private void wakeReaper() {
        synchronized (wakeMonitor) {
            wakeRequested = true;
            wakeMonitor.notifyAll();
        }
    }

    // ==================== Helpers ====================

    private void removeExpiredLocked(String key, StoredEntry entry) {
        entries.remove(key);
        expirations.remove(new ExpirationKey(entry.deadlineNanos(), key));
        expiredCount.incrementAndGet();
    }

    private static long toTtlNanos(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        if (ttl.compareTo(Duration.ofNanos(MAX_TTL_NANOS)) > 0) {
            return MAX_TTL_NANOS;
        }
        return ttl.toNanos();
    }

    private static void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }
}
