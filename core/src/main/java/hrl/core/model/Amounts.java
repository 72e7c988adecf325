package hrl.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.LongUnaryOperator;

/**
 * Immutable, insertion-ordered mapping of limit name to quantity.
 *
 * <p>Used for consumption requests (whole tokens) and lease bookkeeping. Keys are
 * validated limit names; values may be negative for refunds.
 */
public final class Amounts {

    private static final Amounts EMPTY = new Amounts(new LinkedHashMap<>());

    private final Map<String, Long> values;

    private Amounts(LinkedHashMap<String, Long> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Amounts empty() {
        return EMPTY;
    }

    public static Amounts of(String name, long amount) {
        LinkedHashMap<String, Long> map = new LinkedHashMap<>();
        map.put(Identifiers.limitName(name), amount);
        return new Amounts(map);
    }

    public static Amounts of(String name1, long amount1, String name2, long amount2) {
        LinkedHashMap<String, Long> map = new LinkedHashMap<>();
        map.put(Identifiers.limitName(name1), amount1);
        map.put(Identifiers.limitName(name2), amount2);
        return new Amounts(map);
    }

    public static Amounts copyOf(Map<String, ? extends Number> source) {
        LinkedHashMap<String, Long> map = new LinkedHashMap<>();
        source.forEach((name, amount) -> map.put(Identifiers.limitName(name), amount.longValue()));
        return new Amounts(map);
    }

    public long get(String name) {
        return values.getOrDefault(name, 0L);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Long> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Amounts negated() {
        return map(v -> -v);
    }

    /** Whole tokens to millitokens. */
    public Amounts toMilli() {
        return map(v -> v * Limit.MILLI);
    }

    /** Sum per name; names only in {@code other} are appended in its order. */
    public Amounts plus(Amounts other) {
        LinkedHashMap<String, Long> map = new LinkedHashMap<>(values);
        other.values.forEach((name, amount) -> map.merge(name, amount, Long::sum));
        return new Amounts(map);
    }

    private Amounts map(LongUnaryOperator op) {
        LinkedHashMap<String, Long> map = new LinkedHashMap<>();
        values.forEach((name, amount) -> map.put(name, op.applyAsLong(amount)));
        return new Amounts(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Amounts)) return false;
        return values.equals(((Amounts) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
