package com.jobsched.spi;

import com.jobsched.core.JobPriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Work handed to the batch collaborator for a batch job.
 *
 * @param processor   Name of the item processor
 * @param scheduledAt Requested start, or null for now
 */
public record BatchRequest(
        String jobType,
        List<Object> items,
        String processor,
        JobPriority priority,
        int batchSize,
        int concurrency,
        Instant scheduledAt,
        Map<String, Object> metadata
) {
    public BatchRequest {
        items = Collections.unmodifiableList(new ArrayList<>(items));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
