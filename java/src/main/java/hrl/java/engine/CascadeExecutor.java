package hrl.java.engine;

import hrl.java.store.StoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the legs of a cascade admission. Every leg runs to completion, and a
 * leg's failure is reported in its {@link Leg}, never thrown, so the caller can
 * compensate the legs that succeeded. An interrupt does not cut the wait short;
 * it is restored once every leg has reported.
 */
abstract class CascadeExecutor implements AutoCloseable {

    /** Outcome of one leg: a value, or the exception it threw. */
    record Leg<T>(T value, RuntimeException error) {
        boolean failed() {
            return error != null;
        }
    }

    static CascadeExecutor create(ParallelMode mode, int parallelism) {
        switch (mode) {
            case POOL:
                return new Pooled(parallelism);
            case SERIAL:
            default:
                return new Serial();
        }
    }

    /** Results in task order. */
    abstract <T> List<Leg<T>> runAll(List<Supplier<T>> tasks);

    @Override
    public void close() {
    }

    static <T> Leg<T> runInline(Supplier<T> task) {
        try {
            return new Leg<>(task.get(), null);
        } catch (RuntimeException e) {
            return new Leg<>(null, e);
        }
    }

    static final class Serial extends CascadeExecutor {
        @Override
        <T> List<Leg<T>> runAll(List<Supplier<T>> tasks) {
            List<Leg<T>> legs = new ArrayList<>(tasks.size());
            for (Supplier<T> task : tasks) {
                legs.add(runInline(task));
            }
            return legs;
        }
    }

    static final class Pooled extends CascadeExecutor {

        private final ExecutorService pool;

        Pooled(int threads) {
            AtomicInteger counter = new AtomicInteger();
            ThreadFactory factory = r -> {
                Thread t = new Thread(r, "hrl-cascade-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
            this.pool = Executors.newFixedThreadPool(threads, factory);
        }

        @Override
        <T> List<Leg<T>> runAll(List<Supplier<T>> tasks) {
            if (tasks.size() == 1) {
                return List.of(runInline(tasks.get(0)));
            }
            List<Future<Leg<T>>> futures = new ArrayList<>(tasks.size());
            for (Supplier<T> task : tasks) {
                futures.add(pool.submit(() -> runInline(task)));
            }
            List<Leg<T>> legs = new ArrayList<>(tasks.size());
            boolean interrupted = false;
            for (Future<Leg<T>> future : futures) {
                while (true) {
                    try {
                        legs.add(outcome(future));
                        break;
                    } catch (InterruptedException e) {
                        // The leg keeps running; wait for what it actually did.
                        interrupted = true;
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return legs;
        }

        private static <T> Leg<T> outcome(Future<Leg<T>> future) throws InterruptedException {
            try {
                return future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                RuntimeException error = cause instanceof RuntimeException
                    ? (RuntimeException) cause
                    : new StoreException("cascade leg failed", cause);
                return new Leg<>(null, error);
            }
        }

        @Override
        public void close() {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
