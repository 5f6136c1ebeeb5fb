package com.sidecar.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A span of time in milliseconds, rendered in compact human-readable form such as
 * {@code "1h 30m"} or {@code "2d 5s 250ms"}.
 */
public record TimeDiff(long millis) {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|d|h|m|s)");

    public TimeDiff {
        if (millis < 0) {
            throw new IllegalArgumentException("Time diff must not be negative: " + millis);
        }
    }

    public static TimeDiff ofMinutes(long minutes) {
        return new TimeDiff(minutes * MINUTE);
    }

    public static TimeDiff parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty time diff");
        }
        long total = 0;
        for (String part : trimmed.split("\\s+")) {
            Matcher m = PART.matcher(part);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid time diff component '" + part + "' in '" + text + "'");
            }
            long amount = Long.parseLong(m.group(1));
            total = Math.addExact(total, Math.multiplyExact(amount, unit(m.group(2))));
        }
        return new TimeDiff(total);
    }

    private static long unit(String suffix) {
        return switch (suffix) {
            case "d" -> DAY;
            case "h" -> HOUR;
            case "m" -> MINUTE;
            case "s" -> SECOND;
            case "ms" -> 1L;
            default -> throw new IllegalArgumentException("Unknown unit " + suffix);
        };
    }

    @Override
    public String toString() {
        if (millis == 0) {
            return "0ms";
        }
        StringBuilder sb = new StringBuilder();
        long remaining = millis;
        remaining = append(sb, remaining, DAY, "d");
        remaining = append(sb, remaining, HOUR, "h");
        remaining = append(sb, remaining, MINUTE, "m");
        remaining = append(sb, remaining, SECOND, "s");
        append(sb, remaining, 1L, "ms");
        return sb.toString();
    }

    private static long append(StringBuilder sb, long remaining, long unit, String suffix) {
        long count = remaining / unit;
        if (count > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(count).append(suffix);
        }
        return remaining % unit;
    }
}
