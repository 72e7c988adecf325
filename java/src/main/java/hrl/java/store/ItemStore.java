package hrl.java.store;

import java.util.List;
import java.util.Optional;

/**
 * What the rate limiter needs from its key-value backing store: strongly
 * consistent point reads, conditional single-item writes with atomic ADD, and
 * prefix queries over the table and its secondary indexes.
 *
 * <p>Infrastructure failures surface as {@link StoreException}; failed write
 * conditions as {@link ConditionFailedException}.
 */
public interface ItemStore extends AutoCloseable {

    Optional<Item> get(ItemKey key);

    /** Items for the keys that exist; order is unspecified. */
    List<Item> batchGet(List<ItemKey> keys);

    /**
     * Applies a conditional write.
     *
     * @return the post-update image if the request asked for it, otherwise empty
     * @throws ConditionFailedException if a condition did not hold
     */
    Optional<Item> write(WriteRequest request);

    void delete(ItemKey key);

    /** Items in {@code partition} whose sort key starts with {@code sortPrefix}, by sort key. */
    List<Item> query(String partition, String sortPrefix);

    List<Item> queryIndex(Index index, String partition, String sortPrefix);

    @Override
    default void close() {
    }
}
