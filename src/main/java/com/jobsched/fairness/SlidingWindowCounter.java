package com.jobsched.fairness;

import java.time.Clock;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sliding window counter of submission timestamps.
 * A time-ordered queue holds the entries; expired entries are drained from its head
 * on every operation, so counting never scans the window.
 */
public class SlidingWindowCounter {

    private final long windowSizeMs;
    private final Clock clock;

    // oldest entries at the head
    private final ConcurrentLinkedQueue<Long> timestamps = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger(0);

    public SlidingWindowCounter(long windowSizeMs, Clock clock) {
        if (windowSizeMs <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        this.windowSizeMs = windowSizeMs;
        this.clock = clock;
    }

    public void add() {
        evictExpired();
        timestamps.offer(clock.millis());
        size.incrementAndGet();
    }

    /**
     * Entries currently in the window.
     */
    public int count() {
        evictExpired();
        return size.get();
    }

    public void clear() {
        timestamps.clear();
        size.set(0);
    }

    public long getWindowSizeMs() {
        return windowSizeMs;
    }

    private void evictExpired() {
        long windowStart = clock.millis() - windowSizeMs;
        Long head;
        while ((head = timestamps.peek()) != null && head <= windowStart) {
            if (timestamps.poll() == null) {
                break;
            }
            size.decrementAndGet();
        }
    }
}
