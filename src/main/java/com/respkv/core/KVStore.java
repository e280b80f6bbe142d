package com.respkv.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Core storage interface for the key-value store.
 * All implementations must be thread-safe.
 */
public interface KVStore {

    /**
     * Store a value with no expiration, replacing any previous value and its TTL.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    void set(String key, byte[] value);

    /**
     * Store a value that expires after the given TTL, replacing any previous value.
     *
     * @param key   the key to store
     * @param value the value to store
     * @param ttl   time-to-live, must be positive; null for no expiration
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * Retrieve the value for a given key.
     *
     * @param key the key to look up
     * @return the value if found and not expired, empty otherwise
     */
    Optional<byte[]> get(String key);

    /**
     * Delete a key and its expiration, if any.
     *
     * @param key the key to delete
     * @return true if a live entry was removed
     */
    boolean delete(String key);

    /**
     * Check if a key exists and is not expired.
     *
     * @param key the key to check
     * @return true if the key exists and is not expired
     */
    boolean exists(String key);

    /**
     * Get the number of entries in the store.
     *
     * @return the number of non-expired entries
     */
    int size();

    /**
     * Clear all entries from the store.
     */
    void clear();
}
