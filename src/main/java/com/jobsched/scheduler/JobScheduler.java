package com.jobsched.scheduler;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.config.PriorityQueueConfigPatch;
import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobExecutionResult;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.registry.JobFilter;
import com.jobsched.stats.SchedulingStats;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Priority-based job scheduler.
 * Decides when a job is handed to its execution queue, at what priority and after what delay.
 */
public interface JobScheduler {

    /**
     * Validate, store and start scheduling a job.
     *
     * @param request Job request; id and timestamps are assigned here
     * @return Id of the scheduled job
     * @throws com.jobsched.exception.ValidationException if the request is invalid; nothing is stored
     * @throws com.jobsched.exception.DispatchException   if the first dispatch of an immediate or batch
     *                                                    job fails
     * @throws com.jobsched.exception.SchedulerException  if the scheduler has been shut down
     */
    String scheduleJob(ScheduledJobConfig request);

    Optional<ScheduledJobConfig> getScheduledJob(String jobId);

    List<ScheduledJobConfig> listScheduledJobs(JobFilter filter);

    /**
     * Remove a job and cancel its outstanding timers. Work already handed to the executor is not recalled.
     *
     * @return true if the job existed
     */
    boolean cancelScheduledJob(String jobId);

    SchedulingStats getSchedulingStats();

    /**
     * Latest dispatch attempt of a job.
     */
    Optional<JobExecutionResult> getJobExecutionResult(String jobId);

    /**
     * Report the real outcome of a job handed to the executor.
     *
     * @return The updated result, or empty if the job was never dispatched
     */
    Optional<JobExecutionResult> recordExecutionOutcome(String jobId, ExecutionStatus status,
                                                        Long durationMs, String error);

    /**
     * Conditional jobs still waiting on the given job.
     */
    Set<String> getDependentJobs(String jobId);

    /**
     * @return The new queue configuration, or empty if the queue is unknown
     * @throws com.jobsched.exception.ConfigurationException if the patched configuration is invalid
     */
    Optional<PriorityQueueConfig> updatePriorityQueueConfig(String queueName, PriorityQueueConfigPatch patch);

    HealthReport healthCheck();

    /**
     * Reload persisted jobs, resume their timers and start the health sweep.
     */
    void start();

    /**
     * Cancel every outstanding timer. Later calls to {@link #scheduleJob} are rejected.
     */
    void shutdown();

    boolean isShutdown();
}
