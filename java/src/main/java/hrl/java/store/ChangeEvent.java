package hrl.java.store;

import java.util.Optional;

/**
 * One entry of the store's change stream: the item's images before and after a mutation.
 */
public record ChangeEvent(Type type, ItemKey key, Item oldImage, Item newImage) {

    public enum Type {
        INSERT,
        MODIFY,
        REMOVE
    }

    public Optional<Item> before() {
        return Optional.ofNullable(oldImage);
    }

    public Optional<Item> after() {
        return Optional.ofNullable(newImage);
    }
}
