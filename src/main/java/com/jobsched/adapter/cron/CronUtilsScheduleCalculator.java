package com.jobsched.adapter.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.jobsched.exception.CronParseException;
import com.jobsched.spi.ScheduleCalculator;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ScheduleCalculator} over cron-utils with the five-field UNIX definition.
 */
public class CronUtilsScheduleCalculator implements ScheduleCalculator {

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private final CronParser parser = new CronParser(DEFINITION);
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();
    private final ZoneId defaultZone;

    public CronUtilsScheduleCalculator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    @Override
    public Optional<Instant> nextFireTime(String pattern, String timezone, Instant after) {
        ExecutionTime executionTime = executionTime(pattern);
        ZonedDateTime base = ZonedDateTime.ofInstant(after, zone(pattern, timezone));
        return executionTime.nextExecution(base).map(ZonedDateTime::toInstant);
    }

    private ExecutionTime executionTime(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new CronParseException(String.valueOf(pattern), "pattern is required");
        }
        String expr = pattern.trim();
        ExecutionTime cached = cache.get(expr);
        if (cached != null) {
            return cached;
        }
        try {
            Cron cron = parser.parse(expr);
            cron.validate();
            ExecutionTime executionTime = ExecutionTime.forCron(cron);
            cache.put(expr, executionTime);
            return executionTime;
        } catch (IllegalArgumentException e) {
            throw new CronParseException(expr, e.getMessage(), e);
        }
    }

    private ZoneId zone(String pattern, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new CronParseException(pattern, "unknown time zone '" + timezone + "'", e);
        }
    }
}
