package com.jobsched.condition;

import com.jobsched.exception.ValidationException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive HH:mm window at minute precision.
 * A window whose start is after its end wraps around midnight.
 */
public final class LocalTimeWindow {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final LocalTime start;
    private final LocalTime end;

    private LocalTimeWindow(LocalTime start, LocalTime end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws ValidationException if either bound is not zero-padded HH:mm
     */
    public static LocalTimeWindow parse(String start, String end) {
        return new LocalTimeWindow(parseBound(start), parseBound(end));
    }

    private static LocalTime parseBound(String value) {
        if (value == null) {
            throw new ValidationException("Time window bound is required");
        }
        try {
            return LocalTime.parse(value.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Time window bound '" + value + "' is not HH:mm", e);
        }
    }

    public boolean contains(LocalTime time) {
        LocalTime t = time.truncatedTo(ChronoUnit.MINUTES);
        if (!wrapsMidnight()) {
            return !t.isBefore(start) && !t.isAfter(end);
        }
        return !t.isBefore(start) || !t.isAfter(end);
    }

    boolean wrapsMidnight() {
        return start.isAfter(end);
    }

    @Override
    public String toString() {
        return FORMAT.format(start) + "-" + FORMAT.format(end);
    }
}
