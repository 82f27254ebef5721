package com.jobsched.strategy;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.QueueConfigRegistry;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.core.BackoffType;
import com.jobsched.core.JobExecutionResult;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.DispatchException;
import com.jobsched.fairness.FairnessController;
import com.jobsched.priority.PriorityCalculator;
import com.jobsched.priority.PriorityScore;
import com.jobsched.spi.JobExecutor;
import com.jobsched.spi.QueueHealthProvider;
import com.jobsched.spi.SubmitOptions;
import com.jobsched.stats.ExecutionResultTracker;
import com.jobsched.stats.StatsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The immediate path: compute priority and delay, submit to the executor, record the attempt.
 * Every strategy that ends in an executor submission goes through here.
 */
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    static final String SCHEDULED_JOB_ID_KEY = "scheduledJobId";

    private final QueueConfigRegistry queueConfigs;
    private final QueueHealthProvider queueHealthProvider;
    private final PriorityCalculator priorityCalculator;
    private final FairnessController fairnessController;
    private final JobExecutor executor;
    private final ExecutionResultTracker resultTracker;
    private final StatsCollector statsCollector;
    private final SchedulerConfig schedulerConfig;
    private final Clock clock;

    public JobDispatcher(QueueConfigRegistry queueConfigs,
                         QueueHealthProvider queueHealthProvider,
                         PriorityCalculator priorityCalculator,
                         FairnessController fairnessController,
                         JobExecutor executor,
                         ExecutionResultTracker resultTracker,
                         StatsCollector statsCollector,
                         SchedulerConfig schedulerConfig,
                         Clock clock) {
        this.queueConfigs = queueConfigs;
        this.queueHealthProvider = queueHealthProvider;
        this.priorityCalculator = priorityCalculator;
        this.fairnessController = fairnessController;
        this.executor = executor;
        this.resultTracker = resultTracker;
        this.statsCollector = statsCollector;
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
    }

    /**
     * Submit a job now.
     *
     * @return The recorded attempt
     * @throws DispatchException if the queue is unknown or the executor rejects the job; the
     *                           failure is recorded before it is thrown
     */
    public JobExecutionResult dispatch(ScheduledJobConfig job) {
        Instant now = clock.instant();
        PriorityQueueConfig queueConfig = queueConfigs.get(job.queueName()).orElse(null);
        if (queueConfig == null) {
            throw fail(job, now, new DispatchException(job.id(), "Unknown queue: " + job.queueName()));
        }

        long backlog = backlog(job.queueName());
        statsCollector.recordBacklog(job.queueName(), backlog);
        PriorityScore score = priorityCalculator.calculate(job, queueConfig, backlog, now);
        long delay = fairnessController.calculateDelay(queueConfig, score.score(), backlog);
        SubmitOptions options = submitOptions(job, score, delay);
        log.debug("Dispatching job {}: score={} (base={}, age=-{}, starvation=-{}, load=+{}), delay={}ms",
                job.id(), score.score(), score.base(), score.ageBoost(), score.starvationBoost(),
                score.loadPenalty(), delay);

        String executorJobId;
        try {
            executorJobId = executor.submit(job.queueName(), payload(job), options);
        } catch (RuntimeException e) {
            throw fail(job, now, new DispatchException(job.id(),
                    "Executor rejected job " + job.id() + ": " + e.getMessage(), e));
        }

        fairnessController.recordSubmission(queueConfig, job.priority(), now);
        JobExecutionResult result = resultTracker.recordSubmitted(job.id(), executorJobId, now);
        statsCollector.recordExecuted(job, job.ageAt(now).toMillis());
        log.debug("Job {} submitted to queue {} as {}", job.id(), job.queueName(), executorJobId);
        return result;
    }

    /**
     * Record a failed attempt made through another collaborator (such as the batch processor).
     */
    DispatchException fail(ScheduledJobConfig job, Instant at, DispatchException error) {
        resultTracker.recordFailure(job.id(), at, error.getMessage());
        statsCollector.recordFailed(job);
        log.error("Dispatch of job {} to queue {} failed: {}", job.id(), job.queueName(), error.getMessage());
        return error;
    }

    /**
     * Record a successful attempt made through another collaborator.
     */
    JobExecutionResult succeed(ScheduledJobConfig job, String externalId, Instant at) {
        JobExecutionResult result = resultTracker.recordSubmitted(job.id(), externalId, at);
        statsCollector.recordExecuted(job, job.ageAt(at).toMillis());
        return result;
    }

    private long backlog(String queueName) {
        try {
            return Math.max(0, queueHealthProvider.getQueueStats(queueName).waiting());
        } catch (RuntimeException e) {
            log.warn("Queue stats unavailable for {}, assuming empty backlog: {}", queueName, e.getMessage());
            return 0;
        }
    }

    private SubmitOptions submitOptions(ScheduledJobConfig job, PriorityScore score, long delay) {
        BackoffType backoff = job.backoff() == BackoffType.EXPONENTIAL ? BackoffType.EXPONENTIAL : BackoffType.FIXED;
        return new SubmitOptions(
                score.rounded(),
                delay,
                job.retries() != null ? job.retries() : schedulerConfig.defaultRetries(),
                job.timeoutMs() != null ? job.timeoutMs() : schedulerConfig.defaultTimeoutMs(),
                backoff,
                backoff.baseDelayMs()
        );
    }

    private static Map<String, Object> payload(ScheduledJobConfig job) {
        Map<String, Object> payload = new LinkedHashMap<>(job.data());
        payload.putIfAbsent(SCHEDULED_JOB_ID_KEY, job.id());
        return payload;
    }
}
