package hrl.java.engine;

import hrl.core.error.RateLimitExceededException;
import hrl.core.error.RateLimiterUnavailableException;
import hrl.core.model.Amounts;
import hrl.core.model.FailureMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokens taken by a successful acquire, revisable until the lease is finished.
 *
 * <p>The admission debit is already persisted when the lease is handed out, so
 * {@link #commit()} writes nothing. {@link #rollback()} returns everything the
 * lease took, including later {@link #consume}, {@link #adjust} and
 * {@link #release} calls, on every bucket the lease touched. Closing a lease
 * that was never committed rolls it back, so a try-with-resources block undoes
 * the debit when its body throws:
 * <pre>
 * try (Lease lease = engine.acquire(request)) {
 *     Response r = callModel();
 *     lease.adjust(Amounts.of("tpm", r.tokens() - estimate));
 *     lease.commit();
 * }
 * </pre>
 *
 * <p>Thread-safety: methods are synchronized; a lease is normally owned by one caller.
 */
public final class Lease implements AutoCloseable {

    private enum State { OPEN, COMMITTED, ROLLED_BACK }

    private final RateLimiterEngine engine;
    private final String entityId;
    private final String resource;
    private final List<Target> targets;
    private final FailureMode failureMode;

    private Amounts entries;
    private State state = State.OPEN;

    Lease(RateLimiterEngine engine, String entityId, String resource, List<Target> targets,
          Amounts admitted, FailureMode failureMode) {
        this.engine = engine;
        this.entityId = entityId;
        this.resource = resource;
        this.targets = List.copyOf(targets);
        this.entries = admitted;
        this.failureMode = failureMode;
    }

    /** A lease that reserved nothing, handed out when the store is down and the failure mode is fail-open. */
    static Lease noop(String entityId, String resource) {
        return new Lease(null, entityId, resource, List.of(), Amounts.empty(), null);
    }

    /**
     * Takes more tokens, checked against current capacity on every bucket of the lease.
     *
     * @throws RateLimitExceededException if any bucket lacks the tokens; the lease is unchanged
     * @throws RateLimiterUnavailableException if the store is down and the failure mode is fail-closed
     */
    public synchronized void consume(Amounts extra) {
        checkOpen();
        if (isNoop() || extra.isEmpty()) return;
        engine.validateNames(targets.get(0), extra);
        if (engine.leaseAdmit(this, extra)) {
            entries = entries.plus(extra);
        }
    }

    public void consume(String limitName, long amount) {
        consume(Amounts.of(limitName, amount));
    }

    /**
     * Unchecked correction. Positive amounts take tokens, negative ones return
     * them; balances may go below zero.
     */
    public synchronized void adjust(Amounts delta) {
        checkOpen();
        if (isNoop() || delta.isEmpty()) return;
        engine.validateNames(targets.get(0), delta);
        if (engine.leaseAdjust(this, delta)) {
            entries = entries.plus(delta);
        }
    }

    public void adjust(String limitName, long delta) {
        adjust(Amounts.of(limitName, delta));
    }

    /** Returns tokens. Not floored at the original reservation. */
    public void release(Amounts amount) {
        adjust(amount.negated());
    }

    public void release(String limitName, long amount) {
        release(Amounts.of(limitName, amount));
    }

    /** Keeps the consumption. Nothing is written. */
    public synchronized void commit() {
        checkOpen();
        state = State.COMMITTED;
    }

    /**
     * Reverses every entry of the lease on every bucket it touched.
     *
     * @throws RateLimiterUnavailableException if the reversal could not be written
     *                                         and the failure mode is fail-closed
     */
    public synchronized void rollback() {
        checkOpen();
        state = State.ROLLED_BACK;
        if (isNoop() || entries.isEmpty()) return;
        engine.leaseAdjust(this, entries.negated());
    }

    @Override
    public synchronized void close() {
        if (state == State.OPEN) {
            rollback();
        }
    }

    /** Net tokens taken through this lease, per limit name. */
    public synchronized Amounts consumed() {
        return entries;
    }

    /** Net tokens this lease took from {@code entityId}'s bucket. */
    public synchronized Amounts entityConsumed(String entityId) {
        for (Target target : targets) {
            if (target.entityId().equals(entityId)) {
                return target.select(entries);
            }
        }
        return Amounts.empty();
    }

    /** Entities whose buckets this lease debits, the requesting entity first. */
    public List<String> entityIds() {
        List<String> ids = new ArrayList<>(targets.size());
        for (Target target : targets) {
            ids.add(target.entityId());
        }
        return ids;
    }

    public boolean isNoop() {
        return engine == null;
    }

    public synchronized boolean isOpen() {
        return state == State.OPEN;
    }

    public String entityId() {
        return entityId;
    }

    public String resource() {
        return resource;
    }

    List<Target> targets() {
        return targets;
    }

    FailureMode failureMode() {
        return failureMode;
    }

    private void checkOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("lease already " + (state == State.COMMITTED ? "committed" : "rolled back"));
        }
    }
}
