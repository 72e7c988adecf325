package hrl.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Usage aggregation window, aligned to UTC calendar boundaries.
 */
public enum WindowType {
    HOURLY("hourly"),
    DAILY("daily"),
    MONTHLY("monthly");

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final String wireValue;

    WindowType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static WindowType fromWire(String value) {
        for (WindowType type : values()) {
            if (type.wireValue.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown window type: " + value);
    }

    /** ISO-8601 start of the window containing {@code epochMillis}. */
    public String windowStart(long epochMillis) {
        return FORMAT.format(startOf(epochMillis));
    }

    /** ISO-8601 end (exclusive) of the window containing {@code epochMillis}. */
    public String windowEnd(long epochMillis) {
        ZonedDateTime start = startOf(epochMillis);
        ZonedDateTime end;
        switch (this) {
            case HOURLY:
                end = start.plusHours(1);
                break;
            case DAILY:
                end = start.plusDays(1);
                break;
            default:
                end = start.plusMonths(1);
                break;
        }
        return FORMAT.format(end);
    }

    private ZonedDateTime startOf(long epochMillis) {
        ZonedDateTime t = Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC);
        switch (this) {
            case HOURLY:
                return t.truncatedTo(ChronoUnit.HOURS);
            case DAILY:
                return t.truncatedTo(ChronoUnit.DAYS);
            default:
                return t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        }
    }
}
