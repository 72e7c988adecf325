package hrl.java.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conditional in-place update of one item.
 *
 * <p>Actions mirror what a conditional key-value store offers natively: SET,
 * SET-if-absent, atomic numeric ADD and REMOVE. ADD on a missing attribute
 * starts from zero; an update on a missing item creates it unless a condition
 * forbids that.
 */
public final class UpdateRequest implements WriteRequest {

    private final ItemKey key;
    private final List<Condition> conditions;
    private final Map<String, Object> set;
    private final Map<String, Object> setIfAbsent;
    private final Map<String, Long> add;
    private final Set<String> remove;
    private final boolean returnNew;
    private final boolean returnOldOnFailure;

    private UpdateRequest(Builder b) {
        this.key = b.key;
        this.conditions = Collections.unmodifiableList(new ArrayList<>(b.conditions));
        this.set = Collections.unmodifiableMap(new LinkedHashMap<>(b.set));
        this.setIfAbsent = Collections.unmodifiableMap(new LinkedHashMap<>(b.setIfAbsent));
        this.add = Collections.unmodifiableMap(new LinkedHashMap<>(b.add));
        this.remove = Collections.unmodifiableSet(new LinkedHashSet<>(b.remove));
        this.returnNew = b.returnNew;
        this.returnOldOnFailure = b.returnOldOnFailure;
    }

    public static Builder builder(ItemKey key) {
        return new Builder(key);
    }

    @Override
    public ItemKey key() {
        return key;
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public Map<String, Object> set() {
        return set;
    }

    public Map<String, Object> setIfAbsent() {
        return setIfAbsent;
    }

    public Map<String, Long> add() {
        return add;
    }

    public Set<String> remove() {
        return remove;
    }

    /** Whether the post-update image is returned on success. */
    public boolean returnNew() {
        return returnNew;
    }

    /** Whether a failed condition carries the pre-update image. */
    public boolean returnOldOnFailure() {
        return returnOldOnFailure;
    }

    /**
     * Applies the actions to {@code current} (which may be {@code null}).
     * Conditions are not evaluated here.
     */
    public Item applyTo(Item current) {
        Item.Builder b = current == null ? Item.builder().key(key) : current.toBuilder();
        Item base = current == null ? Item.builder().key(key).build() : current;
        set.forEach(b::put);
        setIfAbsent.forEach((name, value) -> {
            if (!base.has(name)) b.put(name, value);
        });
        add.forEach((name, delta) -> b.put(name, base.getLong(name, 0L) + delta));
        remove.forEach(b::remove);
        return b.build();
    }

    @Override
    public String toString() {
        return "UpdateRequest{key=" + key + ", conditions=" + conditions + ", set=" + set
            + ", setIfAbsent=" + setIfAbsent + ", add=" + add + ", remove=" + remove + "}";
    }

    public static final class Builder {
        private final ItemKey key;
        private final List<Condition> conditions = new ArrayList<>();
        private final Map<String, Object> set = new LinkedHashMap<>();
        private final Map<String, Object> setIfAbsent = new LinkedHashMap<>();
        private final Map<String, Long> add = new LinkedHashMap<>();
        private final Set<String> remove = new LinkedHashSet<>();
        private boolean returnNew;
        private boolean returnOldOnFailure;

        private Builder(ItemKey key) {
            if (key == null) throw new IllegalArgumentException("key cannot be null");
            this.key = key;
        }

        public Builder condition(Condition condition) {
            conditions.add(condition);
            return this;
        }

        public Builder set(String name, Object value) {
            set.put(name, value);
            return this;
        }

        public Builder setIfAbsent(String name, Object value) {
            setIfAbsent.put(name, value);
            return this;
        }

        public Builder add(String name, long delta) {
            add.merge(name, delta, Long::sum);
            return this;
        }

        public Builder remove(String name) {
            remove.add(name);
            return this;
        }

        public Builder returnNew() {
            this.returnNew = true;
            return this;
        }

        public Builder returnOldOnFailure() {
            this.returnOldOnFailure = true;
            return this;
        }

        public UpdateRequest build() {
            if (set.isEmpty() && setIfAbsent.isEmpty() && add.isEmpty() && remove.isEmpty()) {
                throw new IllegalArgumentException("update has no actions");
            }
            return new UpdateRequest(this);
        }
    }
}
