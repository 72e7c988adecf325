package hrl.java.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable attribute map of one stored item.
 *
 * <p>Attribute values are {@code String}, {@code Long}, {@code Boolean} or
 * {@code Map<String, String>}; those are the types every backing store supports.
 */
public final class Item {

    public static final String PK = "PK";
    public static final String SK = "SK";

    private final Map<String, Object> attributes;

    private Item(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Item of(Map<String, ?> attributes) {
        Builder builder = builder();
        attributes.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(new LinkedHashMap<>());
    }

    public Builder toBuilder() {
        return new Builder(new LinkedHashMap<>(attributes));
    }

    public ItemKey key() {
        return new ItemKey(getString(PK), getString(SK));
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    /** Numeric attribute, or {@code null} when absent. */
    public Long getLong(String name) {
        Object value = attributes.get(name);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    public long getLong(String name, long defaultValue) {
        Long value = getLong(name);
        return value == null ? defaultValue : value;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = attributes.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getMap(String name) {
        Object value = attributes.get(name);
        if (value instanceof Map) return (Map<String, String>) value;
        return Map.of();
    }

    public Set<String> names() {
        return attributes.keySet();
    }

    public Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        return attributes.equals(((Item) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Item" + attributes;
    }

    public static final class Builder {
        private final LinkedHashMap<String, Object> attributes;

        private Builder(LinkedHashMap<String, Object> attributes) {
            this.attributes = attributes;
        }

        public Builder key(ItemKey key) {
            attributes.put(PK, key.partition());
            attributes.put(SK, key.sort());
            return this;
        }

        /** Puts a value; {@code null} removes the attribute. */
        public Builder put(String name, Object value) {
            if (value == null) {
                attributes.remove(name);
                return this;
            }
            attributes.put(name, normalize(name, value));
            return this;
        }

        public Builder remove(String name) {
            attributes.remove(name);
            return this;
        }

        public Item build() {
            return new Item(new LinkedHashMap<>(attributes));
        }

        private static Object normalize(String name, Object value) {
            if (value instanceof String || value instanceof Long || value instanceof Boolean) return value;
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof Map) {
                Map<String, String> copy = new LinkedHashMap<>();
                ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), String.valueOf(v)));
                return Collections.unmodifiableMap(copy);
            }
            throw new IllegalArgumentException("Unsupported attribute type for " + name + ": " + value.getClass().getName());
        }
    }
}
