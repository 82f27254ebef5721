package com.jobsched.registry;

import com.jobsched.core.ScheduledJobConfig;

import java.util.List;
import java.util.Optional;

/**
 * Owner of scheduled job records.
 */
public interface JobRegistry {

    /**
     * Validate a job request, assign its id and timestamps, then store and persist it.
     *
     * @return The stored job
     * @throws com.jobsched.exception.ValidationException if the request is invalid; nothing is stored
     */
    ScheduledJobConfig register(ScheduledJobConfig request);

    Optional<ScheduledJobConfig> get(String jobId);

    List<ScheduledJobConfig> list(JobFilter filter);

    /**
     * Add or replace one metadata entry of a stored job.
     *
     * @return The updated job, or empty if the job is unknown
     */
    Optional<ScheduledJobConfig> updateMetadata(String jobId, String key, Object value);

    /**
     * @return true if the job was known
     */
    boolean remove(String jobId);

    /**
     * Reload every persisted job into memory. Malformed records are skipped.
     *
     * @return The restored jobs
     */
    List<ScheduledJobConfig> loadPersisted();

    int size();
}
