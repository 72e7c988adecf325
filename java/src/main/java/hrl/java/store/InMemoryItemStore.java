package hrl.java.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Item store held in process memory.
 *
 * <p>Writes are linearizable per item: conditions are evaluated and actions applied
 * inside a single {@link ConcurrentHashMap#compute} call, so two conditional writers
 * racing on one key behave as they would against the real store. Index queries scan
 * all items; this store is sized for tests, local runs and benchmarks.
 *
 * <p>With change recording enabled, every mutation is appended to a change stream
 * in per-item commit order.
 */
public final class InMemoryItemStore implements ItemStore, ChangeStream {

    private static final Comparator<Item> BY_SORT_KEY = Comparator.comparing(i -> i.getString(Item.SK));

    private final ConcurrentHashMap<ItemKey, Item> items = new ConcurrentHashMap<>();
    private final Queue<ChangeEvent> changes = new ConcurrentLinkedQueue<>();
    private final boolean recordChanges;

    public InMemoryItemStore() {
        this(false);
    }

    /**
     * @param recordChanges whether to publish mutations to {@link #poll(int)}
     */
    public InMemoryItemStore(boolean recordChanges) {
        this.recordChanges = recordChanges;
    }

    @Override
    public Optional<Item> get(ItemKey key) {
        return Optional.ofNullable(items.get(key));
    }

    @Override
    public List<Item> batchGet(List<ItemKey> keys) {
        List<Item> found = new ArrayList<>(keys.size());
        for (ItemKey key : keys) {
            Item item = items.get(key);
            if (item != null) found.add(item);
        }
        return found;
    }

    @Override
    public Optional<Item> write(WriteRequest request) {
        if (request instanceof PutRequest) {
            put((PutRequest) request);
            return Optional.empty();
        }
        UpdateRequest update = (UpdateRequest) request;
        AtomicReference<Item> result = new AtomicReference<>();
        items.compute(update.key(), (key, current) -> {
            if (!Condition.all(update.conditions(), current)) {
                throw new ConditionFailedException(key, update.returnOldOnFailure() ? current : null);
            }
            Item updated = update.applyTo(current);
            record(key, current, updated);
            result.set(updated);
            return updated;
        });
        return update.returnNew() ? Optional.of(result.get()) : Optional.empty();
    }

    private void put(PutRequest put) {
        items.compute(put.key(), (key, current) -> {
            if (put.ifNotExists() && current != null) {
                throw new ConditionFailedException(key, null);
            }
            record(key, current, put.item());
            return put.item();
        });
    }

    @Override
    public void delete(ItemKey key) {
        items.computeIfPresent(key, (k, current) -> {
            record(k, current, null);
            return null;
        });
    }

    @Override
    public List<Item> query(String partition, String sortPrefix) {
        List<Item> found = new ArrayList<>();
        for (Map.Entry<ItemKey, Item> e : items.entrySet()) {
            ItemKey key = e.getKey();
            if (key.partition().equals(partition) && key.sort().startsWith(sortPrefix)) {
                found.add(e.getValue());
            }
        }
        found.sort(BY_SORT_KEY);
        return found;
    }

    @Override
    public List<Item> queryIndex(Index index, String partition, String sortPrefix) {
        List<Item> found = new ArrayList<>();
        for (Item item : items.values()) {
            String pk = item.getString(index.partitionAttribute());
            String sk = item.getString(index.sortAttribute());
            if (partition.equals(pk) && sk != null && sk.startsWith(sortPrefix)) {
                found.add(item);
            }
        }
        found.sort(Comparator.comparing(i -> i.getString(index.sortAttribute())));
        return found;
    }

    /**
     * Removes items whose {@code ttl} attribute (epoch seconds) is in the past,
     * the way a store with per-item expiry eventually would.
     *
     * @return number of items removed
     */
    public int expire(long nowSeconds) {
        int removed = 0;
        for (Map.Entry<ItemKey, Item> e : items.entrySet()) {
            Long ttl = e.getValue().getLong("ttl");
            if (ttl != null && ttl < nowSeconds) {
                Item gone = items.computeIfPresent(e.getKey(), (k, current) -> {
                    Long currentTtl = current.getLong("ttl");
                    if (currentTtl == null || currentTtl >= nowSeconds) return current;
                    record(k, current, null);
                    return null;
                });
                if (gone == null) removed++;
            }
        }
        return removed;
    }

    @Override
    public List<ChangeEvent> poll(int maxEvents) {
        List<ChangeEvent> batch = new ArrayList<>(Math.min(maxEvents, 128));
        ChangeEvent event;
        while (batch.size() < maxEvents && (event = changes.poll()) != null) {
            batch.add(event);
        }
        return batch;
    }

    public int size() {
        return items.size();
    }

    public void clear() {
        items.clear();
        changes.clear();
    }

    private void record(ItemKey key, Item before, Item after) {
        if (!recordChanges) return;
        ChangeEvent.Type type = before == null ? ChangeEvent.Type.INSERT
            : after == null ? ChangeEvent.Type.REMOVE : ChangeEvent.Type.MODIFY;
        changes.add(new ChangeEvent(type, key, before, after));
    }
}
