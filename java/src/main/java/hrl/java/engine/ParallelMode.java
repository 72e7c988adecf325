package hrl.java.engine;

/**
 * How the engine issues the independent store calls of one cascade admission.
 */
public enum ParallelMode {
    /** One leg after another on the calling thread. */
    SERIAL,
    /** Legs in parallel on a bounded, engine-owned thread pool. */
    POOL
}
