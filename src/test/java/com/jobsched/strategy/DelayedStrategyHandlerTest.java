package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.support.TestJobs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DelayedStrategyHandlerTest {

    private final StrategyHarness harness = new StrategyHarness();
    private final DelayedStrategyHandler handler = harness.delayed();

    @Test
    @DisplayName("A delayed job is dispatched once its delay has passed")
    void firesAfterDelay() {
        ScheduledJobConfig job = harness.register(TestJobs.delayed("email", 60_000));

        handler.schedule(job);
        assertTrue(harness.tasks.isArmed(TaskKind.SCHEDULED, job.id()));

        harness.timer.advance(Duration.ofSeconds(59));
        assertEquals(0, harness.submissions("email"));

        harness.timer.advance(Duration.ofSeconds(1));
        assertEquals(1, harness.submissions("email"));
        assertFalse(harness.tasks.isArmed(TaskKind.SCHEDULED, job.id()));
        assertEquals(Instant.parse("2024-06-03T08:01:00Z"), harness.results.get(job.id()).orElseThrow().executedAt());
    }

    @Test
    @DisplayName("An explicit execution time wins over the delay")
    void executeAtWinsOverDelay() {
        ScheduledJobConfig job = harness.register(TestJobs.request("email")
                .strategy(SchedulingStrategy.DELAYED)
                .executeAt(Instant.parse("2024-06-03T08:00:10Z"))
                .delayMs(3_600_000L)
                .build());

        handler.schedule(job);
        harness.timer.advance(Duration.ofSeconds(10));

        assertEquals(1, harness.submissions("email"));
    }

    @Test
    @DisplayName("A fire time already in the past dispatches on the next timer tick")
    void pastFireTimeFiresImmediately() {
        ScheduledJobConfig job = harness.register(TestJobs.request("email")
                .strategy(SchedulingStrategy.DELAYED)
                .executeAt(Instant.parse("2024-06-03T07:00:00Z"))
                .build());

        handler.schedule(job);
        harness.timer.runDue();

        assertEquals(1, harness.submissions("email"));
    }

    @Test
    @DisplayName("Cancelling the timer prevents the dispatch")
    void cancelPreventsFire() {
        ScheduledJobConfig job = harness.register(TestJobs.delayed("email", 60_000));
        handler.schedule(job);

        assertTrue(harness.tasks.cancel(TaskKind.SCHEDULED, job.id()));
        harness.timer.advance(Duration.ofMinutes(5));

        assertEquals(0, harness.submissions("email"));
        assertEquals(0, harness.timer.pendingCount());
    }

    @Test
    @DisplayName("A job removed from the registry is skipped when its timer fires")
    void removedJobIsSkipped() {
        ScheduledJobConfig job = harness.register(TestJobs.delayed("email", 60_000));
        handler.schedule(job);

        harness.registry.remove(job.id());
        harness.timer.advance(Duration.ofMinutes(2));

        assertEquals(0, harness.submissions("email"));
        assertTrue(harness.results.get(job.id()).isEmpty());
    }

    @Test
    @DisplayName("A failed dispatch is recorded and does not escape the timer")
    void failedDispatchIsRecorded() {
        StrategyHarness failing = new StrategyHarness((queue, payload, options) -> {
            throw new IllegalStateException("rejected");
        });
        ScheduledJobConfig job = failing.register(TestJobs.delayed("email", 1_000));
        failing.delayed().schedule(job);

        assertDoesNotThrow(() -> failing.timer.advance(Duration.ofSeconds(1)));

        assertFalse(failing.results.isCompleted(job.id()));
        assertEquals(1, failing.stats.snapshot().totalJobsFailed());
    }

    @Test
    @DisplayName("Restoring a job whose fire time passed during downtime does not replay it")
    void restoreSkipsMissedFire() {
        ScheduledJobConfig job = harness.register(TestJobs.delayed("email", 60_000));
        harness.clock.advance(Duration.ofMinutes(10));

        handler.restore(job);
        harness.timer.advance(Duration.ofMinutes(10));

        assertFalse(harness.tasks.isArmed(TaskKind.SCHEDULED, job.id()));
        assertEquals(0, harness.submissions("email"));
    }

    @Test
    @DisplayName("Restoring a job with a future fire time re-arms it for the remaining delay")
    void restoreRearmsFutureFire() {
        ScheduledJobConfig job = harness.register(TestJobs.delayed("email", 600_000));
        harness.clock.advance(Duration.ofMinutes(4));

        handler.restore(job);
        harness.timer.advance(Duration.ofMinutes(5));
        assertEquals(0, harness.submissions("email"));

        harness.timer.advance(Duration.ofMinutes(1));
        assertEquals(1, harness.submissions("email"));
    }
}
