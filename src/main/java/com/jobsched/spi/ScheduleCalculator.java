package com.jobsched.spi;

import java.time.Instant;
import java.util.Optional;

/**
 * Cron pattern evaluation.
 */
public interface ScheduleCalculator {

    /**
     * Next fire time strictly after the given instant.
     *
     * @param pattern  Five-field cron pattern
     * @param timezone IANA zone id, or null for the calculator's default zone
     * @return Next fire time, or empty if the pattern never fires again
     * @throws com.jobsched.exception.CronParseException if the pattern or zone is malformed
     */
    Optional<Instant> nextFireTime(String pattern, String timezone, Instant after);

    /**
     * @throws com.jobsched.exception.CronParseException if the pattern or zone is malformed
     */
    default void validate(String pattern, String timezone) {
        nextFireTime(pattern, timezone, Instant.now());
    }
}
