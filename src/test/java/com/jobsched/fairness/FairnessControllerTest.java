package com.jobsched.fairness;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.PriorityQueueConfigPatch;
import com.jobsched.config.RateLimitConfig;
import com.jobsched.core.JobPriority;
import com.jobsched.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FairnessController.
 */
class FairnessControllerTest {

    private MutableClock clock;
    private FairnessController controller;
    private PriorityQueueConfig queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        controller = new FairnessController(new StarvationTracker(clock.instant()), new RateLimiter(clock));
        queue = PriorityQueueConfig.defaults("email")
                .apply(new PriorityQueueConfigPatch(null, null, null, 1000, null));
    }

    @Test
    @DisplayName("An empty queue yields no delay")
    void emptyQueueNoDelay() {
        assertEquals(0, controller.calculateDelay(queue, 1, 0));
        assertEquals(0, controller.calculateDelay(queue, 5, 0));
    }

    @Test
    @DisplayName("Fairness delay scales with score, backlog and ratio")
    void fairnessDelayFormula() {
        // 1000 * (3-1)*0.5 * min(10, 500/100) * 0.3
        assertEquals(1500, FairnessController.fairnessDelay(queue, 3, 500), 1e-9);
        // depth multiplier caps at 10
        assertEquals(3000, FairnessController.fairnessDelay(queue, 3, 5000), 1e-9);
        // the most urgent score never waits on fairness
        assertEquals(0, FairnessController.fairnessDelay(queue, 1, 5000), 1e-9);
    }

    @Test
    @DisplayName("A zero fairness ratio disables the fairness delay")
    void zeroRatioDisablesFairness() {
        PriorityQueueConfig unfair = queue.apply(PriorityQueueConfigPatch.fairnessRatio(0));
        assertEquals(0, FairnessController.fairnessDelay(unfair, 5, 500), 1e-9);
    }

    @Test
    @DisplayName("Capacity delay starts above 80% of the queue size")
    void capacityDelayThreshold() {
        assertEquals(0, FairnessController.capacityDelay(queue, 800), 1e-9);
        assertEquals(1000, FairnessController.capacityDelay(queue, 900), 1e-6);
        assertEquals(2000, FairnessController.capacityDelay(queue, 1000), 1e-6);
    }

    @Test
    @DisplayName("A 90% full queue delays an urgent job by at least the capacity delay")
    void nearlyFullQueueDelaysUrgentJob() {
        long delay = controller.calculateDelay(queue, 1.9, 900);

        assertTrue(delay >= 1000, "delay was " + delay);
        assertEquals(Math.round(Math.max(FairnessController.fairnessDelay(queue, 1.9, 900),
                FairnessController.capacityDelay(queue, 900))), delay);
    }

    @Test
    @DisplayName("A full rate window pushes the job past the window")
    void rateLimitDelay() {
        PriorityQueueConfig limited = queue.apply(new PriorityQueueConfigPatch(
                null, null, null, null, new RateLimitConfig(30_000, 2)));
        controller.recordSubmission(limited, JobPriority.NORMAL, clock.instant());
        assertEquals(0, controller.calculateDelay(limited, 1, 0));

        controller.recordSubmission(limited, JobPriority.NORMAL, clock.instant());
        assertEquals(30_000, controller.calculateDelay(limited, 1, 0));
    }

    @Test
    @DisplayName("Starvation boost follows the queue's prevention flag")
    void starvationBoostHonoursFlag() {
        controller.recordSubmission(queue, JobPriority.LOW, clock.instant());
        clock.advance(Duration.ofMinutes(10));

        assertEquals(1.0, controller.starvationBoost(queue, JobPriority.LOW, clock.instant()), 1e-9);
        PriorityQueueConfig disabled = queue.apply(PriorityQueueConfigPatch.starvationPrevention(false));
        assertEquals(0, controller.starvationBoost(disabled, JobPriority.LOW, clock.instant()));
    }

    @Test
    @DisplayName("An unknown queue configuration yields no delay")
    void nullConfigNoDelay() {
        assertEquals(0, controller.calculateDelay(null, 5, 10_000));
    }

    @ParameterizedTest(name = "score={0}, backlog={1}, ratio={2}")
    @CsvSource({
            "1, 0, 0",
            "1, -5, 0.3",
            "0.5, 100, 1",
            "7, 0, 1",
            "7, 20000, 1",
            "2.5, 850, 0.3",
            "1, 1000000, 0"
    })
    @DisplayName("The delay is never negative")
    void delayIsNeverNegative(double score, long backlog, double ratio) {
        PriorityQueueConfig config = queue.apply(PriorityQueueConfigPatch.fairnessRatio(ratio));
        assertTrue(controller.calculateDelay(config, score, backlog) >= 0);
    }
}
