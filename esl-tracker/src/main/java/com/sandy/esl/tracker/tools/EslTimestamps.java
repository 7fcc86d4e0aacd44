package com.sandy.esl.tracker.tools;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Date handling shared by both stores for date-range lookups.
 */
public final class EslTimestamps {

    /** Range bound format, Postgres {@code YYYY-MM-DD HH24:MI:SS:MS}. */
    public static final DateTimeFormatter RANGE_BOUND_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss:SSS");

    /** Parse Platform date format, always UTC. */
    public static final DateTimeFormatter PARSE_ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");

    private EslTimestamps() {
    }

    /**
     * Parses a date-range bound such as {@code "2024-03-01 10:15:30:000"}.
     *
     * @throws IllegalArgumentException if the value is null or not in {@link #RANGE_BOUND_FORMAT}
     */
    public static LocalDateTime parseRangeBound(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Date bound must not be null");
        }
        try {
            return LocalDateTime.parse(value.trim(), RANGE_BOUND_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date bound '" + value + "', expected yyyy-MM-dd HH:mm:ss:SSS", e);
        }
    }

    public static String formatRangeBound(LocalDateTime value) {
        return RANGE_BOUND_FORMAT.format(value);
    }

    public static String toParseIso(LocalDateTime value) {
        return PARSE_ISO_FORMAT.format(value);
    }
}
