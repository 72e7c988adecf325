package hrl.java.store;

import java.util.Optional;

/**
 * A write's condition did not hold. The store does not say which clause failed;
 * callers compare the returned image against their request to tell.
 */
public class ConditionFailedException extends RuntimeException {

    private final transient Item oldImage;

    public ConditionFailedException(ItemKey key, Item oldImage) {
        super("Condition failed for " + key);
        this.oldImage = oldImage;
    }

    /** Pre-update image when it was requested and the item existed. */
    public Optional<Item> oldImage() {
        return Optional.ofNullable(oldImage);
    }
}
