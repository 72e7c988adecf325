package hrl.java.store;

/**
 * Writes a whole item.
 *
 * @param ifNotExists fail with {@link ConditionFailedException} when the key is already present
 */
public record PutRequest(Item item, boolean ifNotExists) implements WriteRequest {

    public PutRequest {
        if (item == null) throw new IllegalArgumentException("item cannot be null");
        item.key();
    }

    public static PutRequest create(Item item) {
        return new PutRequest(item, true);
    }

    public static PutRequest overwrite(Item item) {
        return new PutRequest(item, false);
    }

    @Override
    public ItemKey key() {
        return item.key();
    }
}
