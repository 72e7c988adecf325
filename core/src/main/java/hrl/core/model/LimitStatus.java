package hrl.core.model;

/**
 * Outcome of checking one limit.
 *
 * @param available whole tokens available at check time (can be negative)
 * @param requested whole tokens requested
 * @param retryAfterSeconds time until {@code requested} is available, 0 when not exceeded
 */
public record LimitStatus(
    String entityId,
    String resource,
    String limitName,
    Limit limit,
    long available,
    long requested,
    boolean exceeded,
    double retryAfterSeconds
) {
    /** Tokens short of the request, 0 when satisfiable. */
    public long deficit() {
        return Math.max(0, requested - available);
    }
}
