package com.jobsched.adapter.store;

import com.jobsched.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private final MutableClock clock = MutableClock.at("2024-06-03T08:00:00Z");
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

    @Test
    @DisplayName("Entries expire once their time to live has elapsed")
    void expiry() {
        store.set("k", "v", 60);

        clock.advance(Duration.ofSeconds(59));
        assertEquals("v", store.get("k").orElseThrow());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.get("k").isEmpty());
        assertFalse(store.delete("k"));
    }

    @Test
    @DisplayName("A non-positive time to live never expires")
    void noExpiry() {
        store.set("k", "v", 0);
        clock.advance(Duration.ofDays(365));

        assertEquals("v", store.get("k").orElseThrow());
        assertTrue(store.delete("k"));
        assertTrue(store.get("k").isEmpty());
    }

    @Test
    @DisplayName("Prefix listing is sorted and skips expired keys")
    void listByPrefix() {
        store.set("scheduler:job:b", "2", 0);
        store.set("scheduler:job:a", "1", 0);
        store.set("scheduler:job:old", "x", 10);
        store.set("other:c", "3", 0);
        clock.advance(Duration.ofSeconds(10));

        assertEquals(List.of("scheduler:job:a", "scheduler:job:b"), store.listKeysByPrefix("scheduler:job:"));
    }
}
