package com.jobsched.stats;

import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobExecutionResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds the latest {@link JobExecutionResult} per scheduled job.
 * A new dispatch attempt replaces the previous result instead of merging with it.
 */
public class ExecutionResultTracker {

    private final ConcurrentMap<String, JobExecutionResult> results = new ConcurrentHashMap<>();

    public JobExecutionResult recordSubmitted(String scheduledJobId, String executorJobId, Instant at) {
        JobExecutionResult result = JobExecutionResult.submitted(executorJobId, scheduledJobId, at);
        results.put(scheduledJobId, result);
        return result;
    }

    public JobExecutionResult recordFailure(String scheduledJobId, Instant at, String error) {
        JobExecutionResult result = JobExecutionResult.failed(scheduledJobId, at, error);
        results.put(scheduledJobId, result);
        return result;
    }

    public void recordNextExecution(String scheduledJobId, Instant next) {
        results.computeIfPresent(scheduledJobId, (id, result) -> result.withNextExecution(next));
    }

    /**
     * Apply a worker-reported outcome to the stored attempt.
     *
     * @return Updated result, or empty if the job was never dispatched
     */
    public Optional<JobExecutionResult> recordOutcome(String scheduledJobId, ExecutionStatus status,
                                                      Instant completedAt, Long durationMs,
                                                      String error, int retryCount) {
        return Optional.ofNullable(results.computeIfPresent(scheduledJobId,
                (id, result) -> result.withOutcome(status, completedAt, durationMs, error, retryCount)));
    }

    public Optional<JobExecutionResult> get(String scheduledJobId) {
        return Optional.ofNullable(results.get(scheduledJobId));
    }

    /**
     * True only when the latest attempt of the job is recorded as completed.
     */
    public boolean isCompleted(String scheduledJobId) {
        JobExecutionResult result = results.get(scheduledJobId);
        return result != null && result.isCompleted();
    }

    public int size() {
        return results.size();
    }
}
