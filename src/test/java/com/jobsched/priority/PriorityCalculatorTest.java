package com.jobsched.priority;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.PriorityQueueConfigPatch;
import com.jobsched.core.JobPriority;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.fairness.FairnessController;
import com.jobsched.fairness.RateLimiter;
import com.jobsched.fairness.StarvationTracker;
import com.jobsched.support.MutableClock;
import com.jobsched.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PriorityCalculator.
 */
class PriorityCalculatorTest {

    private MutableClock clock;
    private FairnessController fairness;
    private PriorityCalculator calculator;
    private PriorityQueueConfig queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        fairness = new FairnessController(new StarvationTracker(clock.instant()), new RateLimiter(clock));
        calculator = new PriorityCalculator(fairness);
        queue = PriorityQueueConfig.defaults("email");
    }

    private ScheduledJobConfig job(JobPriority priority) {
        return TestJobs.immediate("email", priority).withIdentity("job-1", clock.instant());
    }

    @Test
    @DisplayName("Tier weights are strictly ordered from urgent to deferred")
    void tierWeightsAreOrdered() {
        JobPriority[] tiers = JobPriority.values();
        for (int i = 1; i < tiers.length; i++) {
            assertTrue(tiers[i - 1].weight() < tiers[i].weight());
        }
        assertEquals(JobPriority.URGENT, tiers[0]);
        assertEquals(JobPriority.DEFERRED, tiers[tiers.length - 1]);
    }

    @Test
    @DisplayName("A fresh urgent job on an empty queue scores 1")
    void freshUrgentJobScoresOne() {
        PriorityScore score = calculator.calculate(job(JobPriority.URGENT), queue, 0, clock.instant());

        assertEquals(1, score.score(), 1e-9);
        assertEquals(1, score.rounded());
        assertEquals(0, score.ageBoost(), 1e-9);
        assertEquals(0, score.loadPenalty(), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(JobPriority.class)
    @DisplayName("A fresh job on an empty queue scores its tier weight")
    void freshJobScoresWeight(JobPriority priority) {
        PriorityScore score = calculator.calculate(job(priority), queue, 0, clock.instant());
        assertEquals(priority.weight(), score.score(), 1e-9);
    }

    @Test
    @DisplayName("Age lowers the score by up to one point over an hour")
    void ageBoostCapsAfterAnHour() {
        ScheduledJobConfig job = job(JobPriority.NORMAL);
        Instant created = clock.instant();

        assertEquals(2.5, calculator.calculate(job, queue, 0, created.plus(Duration.ofMinutes(30))).score(), 1e-9);
        assertEquals(2.0, calculator.calculate(job, queue, 0, created.plus(Duration.ofHours(1))).score(), 1e-9);
        assertEquals(2.0, calculator.calculate(job, queue, 0, created.plus(Duration.ofDays(3))).score(), 1e-9);
    }

    @Test
    @DisplayName("The score never increases as the job ages")
    void scoreIsMonotoneInAge() {
        ScheduledJobConfig job = job(JobPriority.LOW);
        double previous = Double.MAX_VALUE;
        for (int minutes = 0; minutes <= 120; minutes += 5) {
            double score = calculator.calculate(job, queue, 400, clock.instant().plus(Duration.ofMinutes(minutes))).score();
            assertTrue(score <= previous, "score rose at minute " + minutes);
            assertTrue(score >= 1);
            previous = score;
        }
    }

    @Test
    @DisplayName("Backlog adds up to two points")
    void loadPenaltyCaps() {
        ScheduledJobConfig job = job(JobPriority.HIGH);

        assertEquals(2.5, calculator.calculate(job, queue, 500, clock.instant()).score(), 1e-9);
        assertEquals(4.0, calculator.calculate(job, queue, 2000, clock.instant()).score(), 1e-9);
        assertEquals(4.0, calculator.calculate(job, queue, 50_000, clock.instant()).score(), 1e-9);
    }

    @Test
    @DisplayName("A starved tier gains urgency")
    void starvedTierGainsUrgency() {
        fairness.recordSubmission(queue, JobPriority.LOW, clock.instant());
        clock.advance(Duration.ofMinutes(15));
        ScheduledJobConfig job = TestJobs.immediate("email", JobPriority.LOW).withIdentity("late", clock.instant());

        PriorityScore score = calculator.calculate(job, queue, 0, clock.instant());

        assertEquals(1.5, score.starvationBoost(), 1e-9);
        assertEquals(2.5, score.score(), 1e-9);
        PriorityQueueConfig noPrevention = queue.apply(PriorityQueueConfigPatch.starvationPrevention(false));
        assertEquals(4.0, calculator.calculate(job, noPrevention, 0, clock.instant()).score(), 1e-9);
    }

    @Test
    @DisplayName("The score is floored at 1")
    void scoreIsFloored() {
        fairness.recordSubmission(queue, JobPriority.HIGH, clock.instant());
        clock.advance(Duration.ofHours(2));
        ScheduledJobConfig job = job(JobPriority.HIGH);

        PriorityScore score = calculator.calculate(job, queue, 0, clock.instant().plus(Duration.ofHours(2)));

        assertEquals(1, score.score(), 1e-9);
    }
}
