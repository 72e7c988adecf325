package hrl.java.engine;

/**
 * Work done while holding a {@link Lease}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface LeaseCallback<T, E extends Exception> {
    T apply(Lease lease) throws E;
}
