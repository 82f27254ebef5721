package com.jobsched.registry;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.SchedulerException;
import com.jobsched.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory job index backed by a {@link KeyValueStore}.
 * The memory copy is authoritative while the process runs; the store is written through so jobs
 * survive a restart. Store failures are logged and do not fail the caller.
 */
public class DefaultJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultJobRegistry.class);

    static final String KEY_PREFIX = "scheduler:job:";

    private final ConcurrentMap<String, ScheduledJobConfig> jobs = new ConcurrentHashMap<>();
    private final KeyValueStore store;
    private final JobValidator validator;
    private final JobConfigCodec codec;
    private final long ttlSeconds;
    private final Clock clock;

    public DefaultJobRegistry(KeyValueStore store, JobValidator validator, JobConfigCodec codec,
                              long ttlSeconds, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.codec = codec;
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
    }

    @Override
    public ScheduledJobConfig register(ScheduledJobConfig request) {
        validator.validate(request);
        ScheduledJobConfig job = request.withIdentity(UUID.randomUUID().toString(), clock.instant());
        jobs.put(job.id(), job);
        persist(job);
        return job;
    }

    @Override
    public Optional<ScheduledJobConfig> get(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<ScheduledJobConfig> list(JobFilter filter) {
        JobFilter criteria = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
                .filter(criteria::matches)
                .sorted(Comparator.comparing(ScheduledJobConfig::createdAt))
                .toList();
    }

    @Override
    public Optional<ScheduledJobConfig> updateMetadata(String jobId, String key, Object value) {
        ScheduledJobConfig updated = jobs.computeIfPresent(jobId,
                (id, job) -> job.withMetadata(key, value, clock.instant()));
        if (updated != null) {
            persist(updated);
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean remove(String jobId) {
        ScheduledJobConfig removed = jobs.remove(jobId);
        if (removed == null) {
            return false;
        }
        try {
            store.delete(KEY_PREFIX + jobId);
        } catch (RuntimeException e) {
            log.warn("Failed to delete persisted job {}: {}", jobId, e.getMessage());
        }
        return true;
    }

    @Override
    public List<ScheduledJobConfig> loadPersisted() {
        List<ScheduledJobConfig> restored = new ArrayList<>();
        for (String key : store.listKeysByPrefix(KEY_PREFIX)) {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                continue;
            }
            try {
                ScheduledJobConfig job = codec.decode(json.get());
                if (job.id() == null || !key.equals(KEY_PREFIX + job.id())) {
                    log.warn("Skipping persisted job under {}: id does not match key", key);
                    continue;
                }
                jobs.put(job.id(), job);
                restored.add(job);
            } catch (SchedulerException e) {
                log.warn("Skipping persisted job under {}: {}", key, e.getMessage());
            }
        }
        log.info("Restored {} persisted jobs", restored.size());
        return restored;
    }

    @Override
    public int size() {
        return jobs.size();
    }

    private void persist(ScheduledJobConfig job) {
        try {
            store.set(KEY_PREFIX + job.id(), codec.encode(job), ttlSeconds);
        } catch (RuntimeException e) {
            log.warn("Failed to persist job {}: {}", job.id(), e.getMessage());
        }
    }
}
