package com.sidecar.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Absolute point in time with millisecond precision, counted from the Unix epoch.
 * Rendered as an ISO-8601 UTC instant that always carries three fraction digits.
 */
public record Timestamp(long millis) {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public Timestamp {
        if (millis < 0) {
            throw new IllegalArgumentException("Timestamp must not be before the epoch: " + millis);
        }
    }

    public static Timestamp of(Instant instant) {
        return new Timestamp(instant.toEpochMilli());
    }

    public static Timestamp parse(String text) {
        return of(Instant.parse(text));
    }

    public Instant toInstant() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public String toString() {
        return FORMAT.format(toInstant());
    }
}
