package com.jobsched.core;

import java.time.Instant;

/**
 * Outcome of one dispatch attempt of a scheduled job.
 * A later attempt for the same scheduled job supersedes the previous result.
 *
 * @param jobId          Executor-assigned id (empty when submission itself failed)
 * @param scheduledJobId Id of the scheduled job
 * @param status         Attempt status
 * @param executedAt     Time of the dispatch attempt
 * @param completedAt    Time the worker reported completion, if reported
 * @param durationMs     Execution duration reported by the worker, if reported
 * @param error          Failure message, if any
 * @param retryCount     Retries consumed by the worker
 * @param nextExecution  Next fire time for recurring jobs, if any
 */
public record JobExecutionResult(
        String jobId,
        String scheduledJobId,
        ExecutionStatus status,
        Instant executedAt,
        Instant completedAt,
        Long durationMs,
        String error,
        int retryCount,
        Instant nextExecution
) {
    public static JobExecutionResult submitted(String executorJobId, String scheduledJobId, Instant executedAt) {
        return new JobExecutionResult(executorJobId, scheduledJobId, ExecutionStatus.COMPLETED,
                executedAt, null, null, null, 0, null);
    }

    public static JobExecutionResult failed(String scheduledJobId, Instant executedAt, String error) {
        return new JobExecutionResult("", scheduledJobId, ExecutionStatus.FAILED,
                executedAt, null, null, error, 0, null);
    }

    public JobExecutionResult withNextExecution(Instant next) {
        return new JobExecutionResult(jobId, scheduledJobId, status, executedAt, completedAt,
                durationMs, error, retryCount, next);
    }

    public JobExecutionResult withOutcome(ExecutionStatus newStatus, Instant completed, Long duration,
                                          String failure, int retries) {
        return new JobExecutionResult(jobId, scheduledJobId, newStatus, executedAt, completed,
                duration, failure, retries, nextExecution);
    }

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }
}
