package hrl.java.store;

import java.util.List;

/**
 * Guard evaluated against the current image of an item before a write.
 * A request's conditions are combined with AND.
 */
public interface Condition {

    /**
     * @param current current image, {@code null} when the item does not exist
     */
    boolean test(Item current);

    String attribute();

    static Condition equalTo(String attribute, Object value) {
        return new Equals(attribute, value instanceof Integer ? Long.valueOf((Integer) value) : value);
    }

    static Condition atLeast(String attribute, long value) {
        return new AtLeast(attribute, value);
    }

    static Condition exists(String attribute) {
        return new Exists(attribute);
    }

    static Condition notExists(String attribute) {
        return new NotExists(attribute);
    }

    static boolean all(List<Condition> conditions, Item current) {
        for (Condition condition : conditions) {
            if (!condition.test(current)) return false;
        }
        return true;
    }

    record Equals(String attribute, Object value) implements Condition {
        @Override
        public boolean test(Item current) {
            return current != null && value.equals(current.get(attribute));
        }
    }

    record AtLeast(String attribute, long value) implements Condition {
        @Override
        public boolean test(Item current) {
            if (current == null) return false;
            Long actual = current.getLong(attribute);
            return actual != null && actual >= value;
        }
    }

    record Exists(String attribute) implements Condition {
        @Override
        public boolean test(Item current) {
            return current != null && current.has(attribute);
        }
    }

    record NotExists(String attribute) implements Condition {
        @Override
        public boolean test(Item current) {
            return current == null || !current.has(attribute);
        }
    }
}
