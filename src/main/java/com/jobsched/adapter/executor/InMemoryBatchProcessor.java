package com.jobsched.adapter.executor;

import com.jobsched.spi.BatchProcessor;
import com.jobsched.spi.BatchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local batch collaborator that records accepted batches.
 */
public class InMemoryBatchProcessor implements BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBatchProcessor.class);

    private final Map<String, BatchRequest> batches = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String submitBatch(BatchRequest request) {
        if (request.items().isEmpty()) {
            throw new IllegalArgumentException("Batch for " + request.jobType() + " has no items");
        }
        String batchId = "batch_" + sequence.incrementAndGet();
        batches.put(batchId, request);
        int chunks = (request.items().size() + request.batchSize() - 1) / request.batchSize();
        log.info("Accepted {} with {} items in {} chunks for processor {}",
                batchId, request.items().size(), chunks, request.processor());
        return batchId;
    }

    public Optional<BatchRequest> get(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public List<String> batchIds() {
        return batches.keySet().stream().sorted().toList();
    }
}
