package com.jobsched.spi;

import com.jobsched.core.BackoffType;

/**
 * Options passed with each executor submission.
 *
 * @param priority  Rounded dynamic priority score, lower is more urgent
 * @param delayMs   Delay before the executor makes the job available
 * @param attempts  Attempts the executor may make
 * @param timeoutMs Execution timeout enforced by the executor
 * @param backoff   Retry backoff kind
 * @param backoffMs Base backoff delay
 */
public record SubmitOptions(
        int priority,
        long delayMs,
        int attempts,
        long timeoutMs,
        BackoffType backoff,
        long backoffMs
) {
}
