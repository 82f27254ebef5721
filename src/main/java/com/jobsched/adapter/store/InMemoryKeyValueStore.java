package com.jobsched.adapter.store;

import com.jobsched.spi.KeyValueStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link KeyValueStore}. Expired entries are dropped lazily on access.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        Instant expiresAt = ttlSeconds > 0 ? clock.instant().plusSeconds(ttlSeconds) : null;
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public List<String> listKeysByPrefix(String prefix) {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return entries.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .toList();
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
