package com.jobsched.strategy;

import com.jobsched.core.JobPriority;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.DispatchException;
import com.jobsched.spi.BatchRequest;
import com.jobsched.support.TestJobs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchStrategyHandlerTest {

    private final StrategyHarness harness = new StrategyHarness();
    private final BatchStrategyHandler handler = harness.batch(harness.batchProcessor);

    private ScheduledJobConfig batchJob(ScheduledJobConfig.Builder builder) {
        return harness.register(builder.strategy(SchedulingStrategy.BATCH).build());
    }

    @Test
    @DisplayName("Items are handed to the batch collaborator and the batch id lands in metadata")
    void submitsBatch() {
        ScheduledJobConfig job = batchJob(TestJobs.request("media")
                .priority(JobPriority.LOW)
                .data("items", List.of("a.png", "b.png", "c.png"))
                .data("processor", "thumbnail")
                .data("batchSize", 2));

        handler.schedule(job);

        assertEquals(List.of("batch_1"), harness.batchProcessor.batchIds());
        BatchRequest request = harness.batchProcessor.get("batch_1").orElseThrow();
        assertEquals(List.of("a.png", "b.png", "c.png"), request.items());
        assertEquals("thumbnail", request.processor());
        assertEquals(2, request.batchSize());
        assertEquals(JobPriority.LOW, request.priority());

        ScheduledJobConfig stored = harness.registry.get(job.id()).orElseThrow();
        assertEquals("batch_1", stored.metadata().get(BatchStrategyHandler.BATCH_ID_KEY));
        assertEquals("batch_1", harness.results.get(job.id()).orElseThrow().jobId());
        assertTrue(harness.results.isCompleted(job.id()));
        assertEquals(1, harness.stats.snapshot().totalJobsExecuted());
        assertEquals(0, harness.submissions("media"));
    }

    @Test
    @DisplayName("Without an items list the whole payload is a single item")
    void requestDefaults() {
        ScheduledJobConfig job = TestJobs.request("media")
                .strategy(SchedulingStrategy.BATCH)
                .data("path", "/tmp/x")
                .data("concurrency", 0)
                .build()
                .withIdentity("job-1", harness.clock.instant());

        BatchRequest request = BatchStrategyHandler.toRequest(job);

        assertEquals(1, request.items().size());
        assertEquals(job.data(), request.items().get(0));
        assertEquals("test", request.processor());
        assertEquals(BatchStrategyHandler.DEFAULT_BATCH_SIZE, request.batchSize());
        assertEquals(BatchStrategyHandler.DEFAULT_CONCURRENCY, request.concurrency());
        assertEquals("job-1", request.metadata().get("originalJobId"));
    }

    @Test
    @DisplayName("A rejected batch is recorded as a failed attempt and rethrown")
    void rejectedBatch() {
        ScheduledJobConfig job = batchJob(TestJobs.request("media").data("items", List.of()));

        DispatchException e = assertThrows(DispatchException.class, () -> handler.schedule(job));

        assertEquals(job.id(), e.getScheduledJobId());
        assertFalse(harness.results.isCompleted(job.id()));
        assertEquals(1, harness.stats.snapshot().totalJobsFailed());
        assertNull(harness.registry.get(job.id()).orElseThrow().metadata().get(BatchStrategyHandler.BATCH_ID_KEY));
    }
}
