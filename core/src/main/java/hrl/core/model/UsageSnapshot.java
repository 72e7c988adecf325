package hrl.core.model;

import java.util.Map;

/**
 * Consumption aggregated over one time window.
 *
 * @param windowType "hourly", "daily" or "monthly"
 * @param counters limit name to whole tokens consumed in the window
 */
public record UsageSnapshot(
    String entityId,
    String resource,
    String windowType,
    String windowStart,
    String windowEnd,
    Map<String, Long> counters,
    long totalEvents
) {
    public UsageSnapshot {
        counters = Map.copyOf(counters);
    }
}
