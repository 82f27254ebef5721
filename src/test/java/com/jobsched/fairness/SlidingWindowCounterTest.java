package com.jobsched.fairness;

import com.jobsched.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SlidingWindowCounter.
 */
class SlidingWindowCounterTest {

    private MutableClock clock;
    private SlidingWindowCounter counter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        counter = new SlidingWindowCounter(1000, clock); // 1 second window
    }

    @Test
    @DisplayName("Should count submissions in the window")
    void shouldAddAndCount() {
        counter.add();
        counter.add();
        counter.add();

        assertEquals(3, counter.count());
    }

    @Test
    @DisplayName("Should clear all entries")
    void shouldClearAll() {
        counter.add();
        counter.add();
        assertEquals(2, counter.count());

        counter.clear();
        assertEquals(0, counter.count());
    }

    @Test
    @DisplayName("Should expire entries after window")
    void shouldExpireAfterWindow() {
        counter.add();
        clock.advance(Duration.ofMillis(600));
        counter.add();
        assertEquals(2, counter.count());

        clock.advance(Duration.ofMillis(400));
        assertEquals(1, counter.count());

        clock.advance(Duration.ofMillis(600));
        assertEquals(0, counter.count());
    }

    @Test
    @DisplayName("Should throw on invalid window size")
    void shouldThrowOnInvalidWindowSize() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowCounter(0, clock));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowCounter(-100, clock));
    }

    @Test
    @DisplayName("Should return correct window size")
    void shouldReturnWindowSize() {
        assertEquals(1000, counter.getWindowSizeMs());
    }

    @Test
    @DisplayName("Should handle concurrent additions")
    void shouldHandleConcurrentAdditions() throws InterruptedException {
        SlidingWindowCounter shared = new SlidingWindowCounter(60_000, Clock.systemUTC());
        int threadCount = 10;
        int additionsPerThread = 100;
        Thread[] threads = new Thread[threadCount];

        for (int i = 0; i < threadCount; i++) {
            threads[i] = new Thread(() -> {
                for (int j = 0; j < additionsPerThread; j++) {
                    shared.add();
                }
            });
        }

        for (Thread t : threads) t.start();
        for (Thread t : threads) t.join();

        assertEquals(threadCount * additionsPerThread, shared.count());
    }
}
