package hrl.java.store;

/**
 * A single conditional write against one item.
 */
public interface WriteRequest {

    ItemKey key();
}
