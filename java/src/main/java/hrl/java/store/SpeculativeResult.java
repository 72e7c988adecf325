package hrl.java.store;

import hrl.core.model.CompositeBucket;

import java.util.Optional;

/**
 * Outcome of a speculative consume.
 *
 * @param success whether every limit had enough tokens and was debited
 * @param bucket post-update image on success, pre-update image on failure,
 *               {@code null} when the bucket record does not exist
 */
public record SpeculativeResult(boolean success, CompositeBucket bucket) {

    public static SpeculativeResult admitted(CompositeBucket after) {
        return new SpeculativeResult(true, after);
    }

    public static SpeculativeResult rejected(CompositeBucket before) {
        return new SpeculativeResult(false, before);
    }

    public static SpeculativeResult missing() {
        return new SpeculativeResult(false, null);
    }

    public boolean recordExists() {
        return bucket != null;
    }

    public Optional<CompositeBucket> image() {
        return Optional.ofNullable(bucket);
    }
}
