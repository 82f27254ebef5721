package com.jobsched.scheduler;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.PriorityQueueConfigPatch;
import com.jobsched.config.QueueConfigRegistry;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobExecutionResult;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.SchedulerException;
import com.jobsched.registry.JobFilter;
import com.jobsched.registry.JobRegistry;
import com.jobsched.spi.TaskTimer;
import com.jobsched.spi.TimerHandle;
import com.jobsched.stats.ExecutionResultTracker;
import com.jobsched.stats.SchedulingStats;
import com.jobsched.stats.StatsCollector;
import com.jobsched.strategy.StrategyDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link JobScheduler}. Created through {@link JobSchedulerBuilder}.
 */
public class DefaultJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    static final int MAX_SCHEDULED_JOBS = 10_000;
    static final int MAX_PENDING_JOBS = 1_000;
    static final double MAX_FAILURE_RATE = 0.1;
    static final double MAX_AVG_EXECUTION_MS = 300_000;

    private final SchedulerConfig config;
    private final JobRegistry registry;
    private final StrategyDispatcher strategyDispatcher;
    private final QueueConfigRegistry queueConfigs;
    private final ExecutionResultTracker resultTracker;
    private final StatsCollector statsCollector;
    private final TaskTimer timer;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile TimerHandle healthSweep;

    DefaultJobScheduler(SchedulerConfig config,
                        JobRegistry registry,
                        StrategyDispatcher strategyDispatcher,
                        QueueConfigRegistry queueConfigs,
                        ExecutionResultTracker resultTracker,
                        StatsCollector statsCollector,
                        TaskTimer timer,
                        Clock clock) {
        this.config = config;
        this.registry = registry;
        this.strategyDispatcher = strategyDispatcher;
        this.queueConfigs = queueConfigs;
        this.resultTracker = resultTracker;
        this.statsCollector = statsCollector;
        this.timer = timer;
        this.clock = clock;
        log.info("Job scheduler '{}' initialized with queues {}", config.name(), queueConfigs.queueNames());
    }

    @Override
    public String scheduleJob(ScheduledJobConfig request) {
        if (shutdown.get()) {
            throw new SchedulerException("Scheduler is shut down, rejecting job " + request);
        }
        ScheduledJobConfig job = registry.register(request);
        statsCollector.recordScheduled(job);
        log.info("Scheduled job {} ('{}') on queue {} with priority {} and strategy {}",
                job.id(), job.name(), job.queueName(), job.priority().key(), job.strategy().key());
        strategyDispatcher.schedule(job);
        return job.id();
    }

    @Override
    public Optional<ScheduledJobConfig> getScheduledJob(String jobId) {
        return registry.get(jobId);
    }

    @Override
    public List<ScheduledJobConfig> listScheduledJobs(JobFilter filter) {
        return registry.list(filter);
    }

    @Override
    public boolean cancelScheduledJob(String jobId) {
        boolean removed = registry.remove(jobId);
        boolean timerCancelled = strategyDispatcher.cancel(jobId);
        if (removed) {
            log.info("Cancelled job {}{}", jobId, timerCancelled ? " and its pending timer" : "");
        }
        return removed;
    }

    @Override
    public SchedulingStats getSchedulingStats() {
        return statsCollector.snapshot();
    }

    @Override
    public Optional<JobExecutionResult> getJobExecutionResult(String jobId) {
        return resultTracker.get(jobId);
    }

    @Override
    public Optional<JobExecutionResult> recordExecutionOutcome(String jobId, ExecutionStatus status,
                                                               Long durationMs, String error) {
        Optional<JobExecutionResult> previous = resultTracker.get(jobId);
        if (previous.isEmpty()) {
            log.warn("Ignoring outcome for job {} that was never dispatched", jobId);
            return Optional.empty();
        }
        Optional<JobExecutionResult> updated = resultTracker.recordOutcome(jobId, status, clock.instant(),
                durationMs, error, previous.get().retryCount());
        registry.get(jobId).ifPresent(job -> statsCollector.recordOutcome(job, status, durationMs));
        return updated;
    }

    @Override
    public Set<String> getDependentJobs(String jobId) {
        return strategyDispatcher.dependentsOf(jobId);
    }

    @Override
    public Optional<PriorityQueueConfig> updatePriorityQueueConfig(String queueName,
                                                                   PriorityQueueConfigPatch patch) {
        return queueConfigs.update(queueName, patch);
    }

    @Override
    public HealthReport healthCheck() {
        try {
            SchedulingStats stats = statsCollector.snapshot();
            int scheduledJobs = registry.size();
            int pendingJobs = strategyDispatcher.pendingTasks();
            double failureRate = stats.failureRate();
            double avgExecutionTime = stats.averageExecutionTime();

            List<String> issues = new ArrayList<>();
            HealthStatus status = HealthStatus.HEALTHY;
            if (scheduledJobs > MAX_SCHEDULED_JOBS) {
                issues.add("High number of scheduled jobs: " + scheduledJobs);
                status = worst(status, HealthStatus.WARNING);
            }
            if (pendingJobs > MAX_PENDING_JOBS) {
                issues.add("High number of pending scheduler jobs: " + pendingJobs);
                status = worst(status, HealthStatus.WARNING);
            }
            if (failureRate > MAX_FAILURE_RATE) {
                issues.add(String.format("High failure rate: %.1f%%", failureRate * 100));
                status = HealthStatus.CRITICAL;
            }
            if (avgExecutionTime > MAX_AVG_EXECUTION_MS) {
                issues.add(String.format("High average execution time: %.1fs", avgExecutionTime / 1000));
                status = worst(status, HealthStatus.WARNING);
            }
            return new HealthReport(status, scheduledJobs, pendingJobs, failureRate, avgExecutionTime, issues);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return HealthReport.failed();
        }
    }

    private static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public void start() {
        if (shutdown.get()) {
            throw new SchedulerException("Scheduler is shut down");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (ScheduledJobConfig job : registry.loadPersisted()) {
            try {
                strategyDispatcher.restore(job);
            } catch (RuntimeException e) {
                log.warn("Could not resume persisted job {}: {}", job.id(), e.getMessage());
            }
        }
        healthSweep = timer.scheduleAtFixedRate(statsCollector::sweepQueueHealth,
                Duration.ofMillis(config.healthSweepIntervalMs()));
        log.info("Job scheduler '{}' started", config.name());
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        TimerHandle sweep = healthSweep;
        if (sweep != null) {
            sweep.cancel();
        }
        strategyDispatcher.cancelEverything();
        timer.shutdown();
        log.info("Job scheduler '{}' shut down", config.name());
    }

    @Override
    public boolean isShutdown() {
        return shutdown.get();
    }
}
