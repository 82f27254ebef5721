package com.jobsched.variable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.stats.PriorityStats;
import com.jobsched.stats.QueueHealth;
import com.jobsched.stats.SchedulingStats;
import com.jobsched.stats.StrategyStats;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link EvaluationContext} a condition expression sees.
 * Only whitelisted job fields, stats counters and clock values are copied in. Payload and
 * metadata are converted to plain maps, lists and scalars and flattened with dot notation
 * (e.g. {@code {"x":{"y":"z"}}} becomes {@code data.x.y -> "z"}).
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private final Clock clock;

    public EvaluationContextFactory(Clock clock) {
        this.clock = clock;
    }

    public EvaluationContext create(ScheduledJobConfig job, SchedulingStats stats) {
        return new EvaluationContext(jobVariables(job), statsVariables(stats), systemVariables());
    }

    private Map<String, Object> jobVariables(ScheduledJobConfig job) {
        Map<String, Object> vars = new HashMap<>();
        Instant now = clock.instant();
        putIfPresent(vars, "id", job.id());
        putIfPresent(vars, "name", job.name());
        putIfPresent(vars, "queueName", job.queueName());
        putIfPresent(vars, "jobType", job.jobType());
        putIfPresent(vars, "createdBy", job.createdBy());
        if (job.priority() != null) {
            vars.put("priority", job.priority().key());
        }
        if (job.strategy() != null) {
            vars.put("strategy", job.strategy().key());
        }
        vars.put("tags", List.copyOf(job.tags()));
        vars.put("ageMs", job.ageAt(now).toMillis());
        flattenInto("data", job.data(), vars);
        flattenInto("metadata", job.metadata(), vars);
        return vars;
    }

    private Map<String, Object> statsVariables(SchedulingStats stats) {
        Map<String, Object> vars = new HashMap<>();
        if (stats == null) {
            return vars;
        }
        vars.put("totalJobsScheduled", stats.totalJobsScheduled());
        vars.put("totalJobsExecuted", stats.totalJobsExecuted());
        vars.put("totalJobsFailed", stats.totalJobsFailed());
        vars.put("averageExecutionTime", stats.averageExecutionTime());

        stats.byPriority().forEach((priority, s) -> putPriority(vars, "byPriority." + priority.key(), s));
        stats.byStrategy().forEach((strategy, s) -> putStrategy(vars, "byStrategy." + strategy.key(), s));
        stats.queueHealth().forEach((queue, h) -> putQueue(vars, "queueHealth." + queue, h));
        return vars;
    }

    private Map<String, Object> systemVariables() {
        Map<String, Object> vars = new HashMap<>();
        ZonedDateTime now = ZonedDateTime.now(clock);
        vars.put("time.now", clock.millis());
        vars.put("time.hour", now.getHour());
        vars.put("time.minute", now.getMinute());
        vars.put("time.dayOfWeek", now.getDayOfWeek().getValue());
        return vars;
    }

    private static void putPriority(Map<String, Object> vars, String prefix, PriorityStats s) {
        vars.put(prefix + ".scheduled", s.scheduled());
        vars.put(prefix + ".executed", s.executed());
        vars.put(prefix + ".failed", s.failed());
        vars.put(prefix + ".avgWaitTime", s.avgWaitTime());
        vars.put(prefix + ".avgExecutionTime", s.avgExecutionTime());
    }

    private static void putStrategy(Map<String, Object> vars, String prefix, StrategyStats s) {
        vars.put(prefix + ".scheduled", s.scheduled());
        vars.put(prefix + ".executed", s.executed());
        vars.put(prefix + ".failed", s.failed());
    }

    private static void putQueue(Map<String, Object> vars, String prefix, QueueHealth h) {
        vars.put(prefix + ".backlog", h.backlog());
        vars.put(prefix + ".avgProcessingTime", h.avgProcessingTime());
        vars.put(prefix + ".errorRate", h.errorRate());
        vars.put(prefix + ".throughput", h.throughput());
        vars.put(prefix + ".trend", h.trend().name().toLowerCase());
    }

    private static void putIfPresent(Map<String, Object> vars, String key, Object value) {
        if (value != null) {
            vars.put(key, value);
        }
    }

    private static void flattenInto(String prefix, Map<String, Object> source, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            flattenValue(prefix + "." + entry.getKey(), plain(entry.getValue()), result);
        }
    }

    @SuppressWarnings("unchecked")
    private static void flattenValue(String key, Object value, Map<String, Object> result) {
        if (value instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                flattenValue(key + "." + entry.getKey(), entry.getValue(), result);
            }
        } else if (value != null) {
            // Lists are kept as-is
            result.put(key, value);
        }
    }

    /**
     * Reduce an arbitrary payload value to maps, lists, strings, numbers and booleans.
     */
    private static Object plain(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(EvaluationContextFactory::plain).toList();
        }
        return objectMapper.convertValue(value, Object.class);
    }
}
