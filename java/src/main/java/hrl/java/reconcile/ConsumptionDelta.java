package hrl.java.reconcile;

/**
 * Change of one limit's consumption counter between two images of a bucket.
 *
 * @param tokensDeltaMilli positive for net consumption, negative for net refund
 * @param timestampMs refill timestamp of the newer image; places the delta in a usage window
 */
public record ConsumptionDelta(
    String namespaceId,
    String entityId,
    String resource,
    String limitName,
    long tokensDeltaMilli,
    long timestampMs
) {
}
