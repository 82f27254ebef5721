package com.jobsched.scheduler;

import com.jobsched.adapter.executor.InMemoryJobExecutor;
import com.jobsched.adapter.store.InMemoryKeyValueStore;
import com.jobsched.config.ConfigLoader;
import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.PriorityQueueConfigPatch;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.core.BackoffType;
import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobCondition;
import com.jobsched.core.JobExecutionResult;
import com.jobsched.core.JobPriority;
import com.jobsched.core.RepeatConfig;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.ConfigurationException;
import com.jobsched.exception.DispatchException;
import com.jobsched.exception.SchedulerException;
import com.jobsched.exception.ValidationException;
import com.jobsched.registry.JobFilter;
import com.jobsched.spi.SubmitOptions;
import com.jobsched.strategy.ConditionalStrategyHandler;
import com.jobsched.support.ManualTaskTimer;
import com.jobsched.support.MutableClock;
import com.jobsched.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the scheduler facade over the in-process adapters.
 */
class DefaultJobSchedulerTest {

    private static final SchedulerConfig CONFIG = ConfigLoader.load("classpath:scheduler-test.yaml");

    private MutableClock clock;
    private ManualTaskTimer timer;
    private InMemoryKeyValueStore store;
    private InMemoryJobExecutor executor;
    private DefaultJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-03T08:00:00Z");
        timer = new ManualTaskTimer(clock);
        store = new InMemoryKeyValueStore(clock);
        executor = new InMemoryJobExecutor(CONFIG.queueNames(), clock);
        scheduler = newScheduler(executor, timer);
        scheduler.start();
    }

    private DefaultJobScheduler newScheduler(InMemoryJobExecutor jobExecutor, ManualTaskTimer taskTimer) {
        return new JobSchedulerBuilder(CONFIG)
                .clock(clock)
                .executor(jobExecutor)
                .store(store)
                .timer(taskTimer)
                .systemLoadProvider(() -> 0.5)
                .build();
    }

    private void fillQueue(String queue, int waiting) {
        SubmitOptions options = new SubmitOptions(3, 0, 1, 1000, BackoffType.FIXED, 5000);
        for (int i = 0; i < waiting; i++) {
            executor.submit(queue, Map.of(), options);
        }
    }

    private SubmitOptions lastOptions(String queue) {
        List<InMemoryJobExecutor.Submission> submissions = executor.submissions(queue);
        return submissions.get(submissions.size() - 1).options();
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("A tier left unserved since start earns the starvation boost on its first job")
        void unservedTierIsBoosted() {
            clock.advance(Duration.ofMinutes(20));

            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.LOW));

            assertEquals(2, lastOptions("email").priority());
        }

        @Test
        @DisplayName("An urgent immediate job on an empty queue gets score 1 and no delay")
        void urgentOnEmptyQueue() {
            String id = scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.URGENT));

            assertEquals(1, lastOptions("email").priority());
            assertEquals(0, lastOptions("email").delayMs());
            assertEquals(2, lastOptions("email").attempts());
            assertEquals(60_000, lastOptions("email").timeoutMs());
            assertTrue(scheduler.getJobExecutionResult(id).orElseThrow().isCompleted());
            assertEquals(1, scheduler.getSchedulingStats().totalJobsScheduled());
            assertEquals(1, scheduler.getSchedulingStats().totalJobsExecuted());
        }

        @Test
        @DisplayName("A 90% full queue delays the job by at least the capacity delay")
        void nearlyFullQueue() {
            fillQueue("email", 900);

            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.URGENT));

            assertTrue(lastOptions("email").delayMs() >= 1000);
        }

        @Test
        @DisplayName("A full rate window pushes the next submission past the window")
        void rateLimit() {
            for (int i = 0; i < 3; i++) {
                scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.URGENT));
                assertEquals(0, lastOptions("email").delayMs());
            }

            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.URGENT));
            assertEquals(60_000, lastOptions("email").delayMs());

            clock.advance(Duration.ofSeconds(61));
            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.URGENT));
            assertTrue(lastOptions("email").delayMs() < 60_000);
        }

        @Test
        @DisplayName("A queue patch applies to the next dispatch")
        void queuePatchApplies() {
            fillQueue("media", 90);
            scheduler.scheduleJob(TestJobs.immediate("media", JobPriority.URGENT));
            assertTrue(lastOptions("media").delayMs() < 1000);

            PriorityQueueConfig patched = scheduler.updatePriorityQueueConfig("media",
                    PriorityQueueConfigPatch.maxQueueSize(100)).orElseThrow();
            assertEquals(100, patched.maxQueueSize());

            scheduler.scheduleJob(TestJobs.immediate("media", JobPriority.URGENT));
            assertTrue(lastOptions("media").delayMs() >= 1000);
        }

        @Test
        @DisplayName("Patching an unknown queue returns empty and an invalid patch is rejected")
        void queuePatchErrors() {
            assertTrue(scheduler.updatePriorityQueueConfig("video", PriorityQueueConfigPatch.fairnessRatio(0.2))
                    .isEmpty());
            assertThrows(ConfigurationException.class,
                    () -> scheduler.updatePriorityQueueConfig("email", PriorityQueueConfigPatch.fairnessRatio(1.5)));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("A recurring job without a pattern is rejected before anything is stored")
        void invalidJobIsNotPersisted() {
            ScheduledJobConfig request = TestJobs.request("email")
                    .strategy(SchedulingStrategy.RECURRING)
                    .repeat(new RepeatConfig(null, null, null, null))
                    .build();

            assertThrows(ValidationException.class, () -> scheduler.scheduleJob(request));

            assertTrue(scheduler.listScheduledJobs(JobFilter.all()).isEmpty());
            assertTrue(store.listKeysByPrefix("scheduler:job:").isEmpty());
            assertEquals(0, scheduler.getSchedulingStats().totalJobsScheduled());
        }

        @Test
        @DisplayName("A conditional job waits for its dependency and is released once")
        void conditionalWaitsForDependency() {
            String dependency = scheduler.scheduleJob(TestJobs.delayed("email", 60_000));
            String dependent = scheduler.scheduleJob(
                    TestJobs.conditional("media", JobCondition.dependsOn(dependency)));
            assertEquals(Set.of(dependent), scheduler.getDependentJobs(dependency));

            timer.advance(Duration.ofSeconds(59));
            assertEquals(0, executor.submissions("media").size());

            timer.advance(Duration.ofSeconds(2));
            assertEquals(1, executor.submissions("email").size());
            assertEquals(1, executor.submissions("media").size());

            timer.advance(Duration.ofMinutes(5));
            assertEquals(1, executor.submissions("media").size());
            assertTrue(scheduler.getDependentJobs(dependency).isEmpty());
        }

        @Test
        @DisplayName("Cancelling a delayed job removes it and disarms its timer")
        void cancelDelayedJob() {
            String id = scheduler.scheduleJob(TestJobs.delayed("email", 60_000));

            assertTrue(scheduler.cancelScheduledJob(id));
            assertFalse(scheduler.cancelScheduledJob(id));
            timer.advance(Duration.ofMinutes(2));

            assertTrue(scheduler.getScheduledJob(id).isEmpty());
            assertTrue(executor.submissions("email").isEmpty());
            assertTrue(store.get("scheduler:job:" + id).isEmpty());
        }

        @Test
        @DisplayName("Listing filters by strategy and queue")
        void listing() {
            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.LOW));
            String delayed = scheduler.scheduleJob(TestJobs.delayed("media", 1_000));

            List<ScheduledJobConfig> delayedJobs = scheduler.listScheduledJobs(
                    JobFilter.byStrategy(SchedulingStrategy.DELAYED));
            assertEquals(List.of(delayed), delayedJobs.stream().map(ScheduledJobConfig::id).toList());
            assertEquals(1, scheduler.listScheduledJobs(JobFilter.byQueue("email")).size());
        }

        @Test
        @DisplayName("After shutdown new jobs are rejected and timers are stopped")
        void shutdownRejectsJobs() {
            scheduler.scheduleJob(TestJobs.delayed("email", 60_000));

            scheduler.shutdown();
            scheduler.shutdown();

            assertTrue(scheduler.isShutdown());
            assertTrue(timer.isShutdown());
            assertEquals(0, timer.pendingCount());
            assertThrows(SchedulerException.class,
                    () -> scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH)));
            assertThrows(SchedulerException.class, scheduler::start);
        }

        @Test
        @DisplayName("A restarted scheduler resumes persisted jobs and does not release a conditional job twice")
        void restartRestoresJobs() {
            String delayed = scheduler.scheduleJob(TestJobs.delayed("email", 600_000));
            String recurring = scheduler.scheduleJob(TestJobs.recurring("email",
                    new RepeatConfig("*/15 * * * *", 1, null, null)));
            scheduler.scheduleJob(TestJobs.immediate("media", JobPriority.NORMAL));
            String conditional = scheduler.scheduleJob(
                    TestJobs.conditional("media", new JobCondition(null, List.of(), null)));
            timer.advance(Duration.ofSeconds(1));
            assertEquals(2, executor.submissions("media").size());
            scheduler.shutdown();
            clock.advance(Duration.ofMinutes(1));

            InMemoryJobExecutor restartedExecutor = new InMemoryJobExecutor(CONFIG.queueNames(), clock);
            ManualTaskTimer restartedTimer = new ManualTaskTimer(clock);
            DefaultJobScheduler restarted = newScheduler(restartedExecutor, restartedTimer);
            restarted.start();

            assertTrue(restarted.getScheduledJob(delayed).isPresent());
            assertTrue(restarted.getScheduledJob(recurring).isPresent());
            restartedTimer.advance(Duration.ofMinutes(30));

            assertEquals(2, restartedExecutor.submissions("email").size());
            assertTrue(restartedExecutor.submissions("media").isEmpty());
            assertTrue(ConditionalStrategyHandler.isReleased(restarted.getScheduledJob(conditional).orElseThrow()));
            assertTrue(restarted.getJobExecutionResult(delayed).orElseThrow().isCompleted());
        }
    }

    @Nested
    @DisplayName("Outcomes and health")
    class OutcomesAndHealth {

        @Test
        @DisplayName("A reported outcome updates the result and the averages")
        void recordOutcome() {
            String id = scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH));
            clock.advance(Duration.ofSeconds(2));

            JobExecutionResult result = scheduler.recordExecutionOutcome(id, ExecutionStatus.FAILED, 1500L, "smtp down")
                    .orElseThrow();

            assertEquals(ExecutionStatus.FAILED, result.status());
            assertEquals(clock.instant(), result.completedAt());
            assertEquals("smtp down", result.error());
            assertEquals(1500, scheduler.getSchedulingStats().averageExecutionTime(), 1e-9);
            assertTrue(scheduler.recordExecutionOutcome("ghost", ExecutionStatus.COMPLETED, 1L, null).isEmpty());
        }

        @Test
        @DisplayName("A fresh scheduler is healthy")
        void healthy() {
            HealthReport report = scheduler.healthCheck();

            assertEquals(HealthStatus.HEALTHY, report.status());
            assertTrue(report.issues().isEmpty());
        }

        @Test
        @DisplayName("Slow executions make the scheduler report a warning")
        void slowExecutionsWarn() {
            String id = scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH));
            scheduler.recordExecutionOutcome(id, ExecutionStatus.COMPLETED, 400_000L, null);

            HealthReport report = scheduler.healthCheck();

            assertEquals(HealthStatus.WARNING, report.status());
            assertEquals(1, report.issues().size());
        }

        @Test
        @DisplayName("A failure rate above 10% is critical")
        void failuresAreCritical() {
            DefaultJobScheduler failing = new JobSchedulerBuilder(CONFIG)
                    .clock(clock)
                    .executor((queue, payload, options) -> {
                        throw new IllegalStateException("executor down");
                    })
                    .queueHealthProvider(executor)
                    .store(store)
                    .timer(new ManualTaskTimer(clock))
                    .build();

            assertThrows(DispatchException.class,
                    () -> failing.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH)));

            HealthReport report = failing.healthCheck();
            assertEquals(HealthStatus.CRITICAL, report.status());
            assertEquals(1.0, report.failureRate(), 1e-9);
            assertEquals(1, report.scheduledJobs());
        }

        @Test
        @DisplayName("An executor without queue stats needs an explicit health provider")
        void executorWithoutHealthProvider() {
            JobSchedulerBuilder builder = new JobSchedulerBuilder(CONFIG)
                    .clock(clock)
                    .executor((queue, payload, options) -> "x")
                    .timer(new ManualTaskTimer(clock));

            assertThrows(IllegalStateException.class, builder::build);
        }

        @Test
        @DisplayName("The periodic sweep refreshes queue throughput")
        void healthSweep() {
            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH));
            scheduler.scheduleJob(TestJobs.immediate("email", JobPriority.HIGH));

            timer.advance(Duration.ofSeconds(60));

            assertEquals(2.0, scheduler.getSchedulingStats().queue("email").throughput(), 1e-9);
        }
    }
}
