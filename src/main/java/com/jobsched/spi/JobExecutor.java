package com.jobsched.spi;

import java.util.Map;

/**
 * Execution queue that runs job payloads. Owns retries, timeouts and in-flight cancellation.
 */
public interface JobExecutor {

    /**
     * Hand a payload to a queue.
     *
     * @return Executor-assigned job id
     * @throws RuntimeException if the executor rejects the submission
     */
    String submit(String queueName, Map<String, Object> payload, SubmitOptions options);
}
