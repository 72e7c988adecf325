package hrl.java.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a store and, while failing, throws {@link StoreException} from every call.
 * Counts batch reads.
 */
public final class FailingItemStore implements ItemStore {

    private final ItemStore delegate;
    private final AtomicBoolean failing = new AtomicBoolean();
    private final AtomicInteger batchGets = new AtomicInteger();

    public FailingItemStore(ItemStore delegate) {
        this.delegate = delegate;
    }

    public void setFailing(boolean fail) {
        failing.set(fail);
    }

    public int batchGets() {
        return batchGets.get();
    }

    private void check() {
        if (failing.get()) {
            throw new StoreException("simulated outage");
        }
    }

    @Override
    public Optional<Item> get(ItemKey key) {
        check();
        return delegate.get(key);
    }

    @Override
    public List<Item> batchGet(List<ItemKey> keys) {
        check();
        batchGets.incrementAndGet();
        return delegate.batchGet(keys);
    }

    @Override
    public Optional<Item> write(WriteRequest request) {
        check();
        return delegate.write(request);
    }

    @Override
    public void delete(ItemKey key) {
        check();
        delegate.delete(key);
    }

    @Override
    public List<Item> query(String partition, String sortPrefix) {
        check();
        return delegate.query(partition, sortPrefix);
    }

    @Override
    public List<Item> queryIndex(Index index, String partition, String sortPrefix) {
        check();
        return delegate.queryIndex(index, partition, sortPrefix);
    }
}
