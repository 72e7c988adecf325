package hrl.java.store;

import hrl.core.model.UsageSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attribute layout of usage snapshot items. Counters are flat
 * {@code u_{limit}} attributes holding whole tokens.
 */
public final class UsageRecords {

    public static final String COUNTER_PREFIX = "u_";
    public static final String WINDOW = "window";
    public static final String WINDOW_START = "window_start";
    public static final String WINDOW_END = "window_end";
    public static final String TOTAL_EVENTS = "total_events";

    private UsageRecords() {
    }

    public static String counter(String limitName) {
        return COUNTER_PREFIX + limitName;
    }

    public static UsageSnapshot decode(Item item) {
        Map<String, Long> counters = new LinkedHashMap<>();
        for (String name : item.names()) {
            if (name.startsWith(COUNTER_PREFIX) && name.length() > COUNTER_PREFIX.length()) {
                counters.put(name.substring(COUNTER_PREFIX.length()), item.getLong(name, 0L));
            }
        }
        return new UsageSnapshot(
            item.getString(Schema.ATTR_ENTITY_ID),
            item.getString(Schema.ATTR_RESOURCE),
            item.getString(WINDOW),
            item.getString(WINDOW_START),
            item.getString(WINDOW_END),
            counters,
            item.getLong(TOTAL_EVENTS, 0L)
        );
    }
}
