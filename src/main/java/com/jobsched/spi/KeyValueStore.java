package com.jobsched.spi;

import java.util.List;
import java.util.Optional;

/**
 * Persistent key-value store with per-key expiry.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * @param ttlSeconds Time to live, 0 or less for no expiry
     */
    void set(String key, String value, long ttlSeconds);

    /**
     * @return true if a live entry was removed
     */
    boolean delete(String key);

    List<String> listKeysByPrefix(String prefix);
}
