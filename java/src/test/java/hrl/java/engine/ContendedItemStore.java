package hrl.java.engine;

import hrl.java.store.BucketCodec;
import hrl.java.store.Condition;
import hrl.java.store.ConditionFailedException;
import hrl.java.store.InMemoryItemStore;
import hrl.java.store.Index;
import hrl.java.store.Item;
import hrl.java.store.ItemKey;
import hrl.java.store.ItemStore;
import hrl.java.store.UpdateRequest;
import hrl.java.store.WriteRequest;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulates a competing writer: just before every refill-locked update, the
 * record's refill timestamp is moved, so the update loses its lock.
 */
final class ContendedItemStore implements ItemStore {

    private final InMemoryItemStore delegate = new InMemoryItemStore();
    private final AtomicInteger lockedWrites = new AtomicInteger();
    private final AtomicInteger retryWrites = new AtomicInteger();
    private volatile boolean rejectRetries;

    void rejectRetries(boolean reject) {
        this.rejectRetries = reject;
    }

    int lockedWrites() {
        return lockedWrites.get();
    }

    int retryWrites() {
        return retryWrites.get();
    }

    @Override
    public Optional<Item> write(WriteRequest request) {
        if (request instanceof UpdateRequest) {
            UpdateRequest update = (UpdateRequest) request;
            if (isLocked(update)) {
                lockedWrites.incrementAndGet();
                Item current = delegate.get(update.key()).orElseThrow();
                delegate.write(UpdateRequest.builder(update.key())
                    .set(BucketCodec.REFILL, current.getLong(BucketCodec.REFILL) - 1)
                    .build());
            } else if (isRetry(update)) {
                retryWrites.incrementAndGet();
                if (rejectRetries) {
                    throw new ConditionFailedException(update.key(), null);
                }
            }
        }
        return delegate.write(request);
    }

    private static boolean isLocked(UpdateRequest update) {
        for (Condition c : update.conditions()) {
            if (c instanceof Condition.Equals && c.attribute().equals(BucketCodec.REFILL)) return true;
        }
        return false;
    }

    private static boolean isRetry(UpdateRequest update) {
        boolean hasExists = false;
        boolean hasFloor = false;
        for (Condition c : update.conditions()) {
            if (c instanceof Condition.Exists && c.attribute().equals(BucketCodec.REFILL)) hasExists = true;
            if (c instanceof Condition.AtLeast) hasFloor = true;
        }
        return hasExists && hasFloor && !update.returnNew();
    }

    @Override
    public Optional<Item> get(ItemKey key) {
        return delegate.get(key);
    }

    @Override
    public List<Item> batchGet(List<ItemKey> keys) {
        return delegate.batchGet(keys);
    }

    @Override
    public void delete(ItemKey key) {
        delegate.delete(key);
    }

    @Override
    public List<Item> query(String partition, String sortPrefix) {
        return delegate.query(partition, sortPrefix);
    }

    @Override
    public List<Item> queryIndex(Index index, String partition, String sortPrefix) {
        return delegate.queryIndex(index, partition, sortPrefix);
    }
}
