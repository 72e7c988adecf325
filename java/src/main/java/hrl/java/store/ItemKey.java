package hrl.java.store;

/**
 * Primary key of a stored item: partition plus sort key.
 */
public record ItemKey(String partition, String sort) {
    public ItemKey {
        if (partition == null || partition.isEmpty()) throw new IllegalArgumentException("partition cannot be empty");
        if (sort == null || sort.isEmpty()) throw new IllegalArgumentException("sort cannot be empty");
    }

    @Override
    public String toString() {
        return partition + " / " + sort;
    }
}
