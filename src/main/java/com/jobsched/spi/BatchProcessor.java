package com.jobsched.spi;

/**
 * Splits a list of items into batches and processes them.
 */
public interface BatchProcessor {

    /**
     * @return Batch identifier
     */
    String submitBatch(BatchRequest request);
}
