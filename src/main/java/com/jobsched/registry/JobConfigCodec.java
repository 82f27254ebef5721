package com.jobsched.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.SchedulerException;

/**
 * JSON form of a {@link ScheduledJobConfig} in the key-value store.
 */
public class JobConfigCodec {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String encode(ScheduledJobConfig job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new SchedulerException("Failed to encode job " + job.id(), e);
        }
    }

    /**
     * @throws SchedulerException if the stored record is not a valid job
     */
    public ScheduledJobConfig decode(String json) {
        try {
            return objectMapper.readValue(json, ScheduledJobConfig.class);
        } catch (JsonProcessingException e) {
            throw new SchedulerException("Malformed job record: " + e.getOriginalMessage(), e);
        }
    }
}
