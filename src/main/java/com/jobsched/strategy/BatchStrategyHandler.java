package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.DispatchException;
import com.jobsched.registry.JobRegistry;
import com.jobsched.spi.BatchProcessor;
import com.jobsched.spi.BatchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands the job's items to the batch collaborator and stores the batch id in the job's metadata.
 */
public class BatchStrategyHandler implements StrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(BatchStrategyHandler.class);

    public static final String BATCH_ID_KEY = "batchId";
    static final int DEFAULT_BATCH_SIZE = 100;
    static final int DEFAULT_CONCURRENCY = 5;

    private final BatchProcessor batchProcessor;
    private final JobDispatcher dispatcher;
    private final JobRegistry registry;
    private final Clock clock;

    public BatchStrategyHandler(BatchProcessor batchProcessor, JobDispatcher dispatcher,
                                JobRegistry registry, Clock clock) {
        this.batchProcessor = batchProcessor;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public SchedulingStrategy strategy() {
        return SchedulingStrategy.BATCH;
    }

    @Override
    public void schedule(ScheduledJobConfig job) {
        Instant now = clock.instant();
        BatchRequest request = toRequest(job);
        String batchId;
        try {
            batchId = batchProcessor.submitBatch(request);
        } catch (RuntimeException e) {
            throw dispatcher.fail(job, now, new DispatchException(job.id(),
                    "Batch collaborator rejected job " + job.id() + ": " + e.getMessage(), e));
        }
        dispatcher.succeed(job, batchId, now);
        registry.updateMetadata(job.id(), BATCH_ID_KEY, batchId);
        log.info("Batch job {} submitted as {} with {} items", job.id(), batchId, request.items().size());
    }

    static BatchRequest toRequest(ScheduledJobConfig job) {
        Map<String, Object> data = job.data();
        List<Object> items = data.get("items") instanceof List<?> list
                ? new ArrayList<>(list)
                : List.of(data);
        String processor = data.get("processor") instanceof String name && !name.isBlank()
                ? name
                : job.jobType();
        Map<String, Object> metadata = new LinkedHashMap<>(job.metadata());
        metadata.put("originalJobId", job.id());
        return new BatchRequest(
                job.jobType(),
                items,
                processor,
                job.priority(),
                positiveInt(data.get("batchSize"), DEFAULT_BATCH_SIZE),
                positiveInt(data.get("concurrency"), DEFAULT_CONCURRENCY),
                job.executeAt(),
                metadata
        );
    }

    private static int positiveInt(Object value, int fallback) {
        return value instanceof Number n && n.intValue() > 0 ? n.intValue() : fallback;
    }
}
