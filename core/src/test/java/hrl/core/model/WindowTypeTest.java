package hrl.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WindowTypeTest {

    private static final long T = Instant.parse("2024-01-31T14:35:12Z").toEpochMilli();

    @Test
    void alignsToCalendarBoundaries() {
        assertEquals("2024-01-31T14:00:00Z", WindowType.HOURLY.windowStart(T));
        assertEquals("2024-01-31T00:00:00Z", WindowType.DAILY.windowStart(T));
        assertEquals("2024-01-01T00:00:00Z", WindowType.MONTHLY.windowStart(T));
    }

    @Test
    void windowEndRollsOver() {
        assertEquals("2024-01-31T15:00:00Z", WindowType.HOURLY.windowEnd(T));
        assertEquals("2024-02-01T00:00:00Z", WindowType.DAILY.windowEnd(T));
        assertEquals("2024-02-01T00:00:00Z", WindowType.MONTHLY.windowEnd(T));
    }

    @Test
    void wireValues() {
        assertEquals(WindowType.DAILY, WindowType.fromWire("daily"));
        assertThrows(IllegalArgumentException.class, () -> WindowType.fromWire("weekly"));
    }
}
