package com.vigil.batch;

import com.vigil.check.DaemonThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of worker threads over an unbounded FIFO queue.
 * <p>
 * At most {@link #maxWorkers()} units run at the same time; everything else waits in the queue.
 * Every unit is wrapped so a thrown exception is logged and stays confined to that unit.
 * Worker threads are daemon threads: a unit that ignores interruption (blocked in I/O without its
 * own timeout) never keeps the JVM alive.
 * <p>
 * A pool is either owned by a single batch run or shared between runs by its creator; see
 * {@link BatchCoordinator}.
 */
public final class BoundedWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    /** Default time {@link #close()} waits for in-flight units. */
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public static final String DEFAULT_THREAD_PREFIX = "vigil-worker";

    private final int maxWorkers;
    private final Duration shutdownGrace;
    private final ThreadPoolExecutor executor;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();

    /**
     * Creates a pool with the default thread prefix and shutdown grace.
     */
    public BoundedWorkerPool(int maxWorkers) {
        this(maxWorkers, DEFAULT_THREAD_PREFIX, DEFAULT_SHUTDOWN_GRACE);
    }

    /**
     * Creates a pool.
     *
     * @param maxWorkers    number of worker threads (must be positive)
     * @param threadPrefix  worker threads are named {@code <prefix>-<n>}
     * @param shutdownGrace how long {@link #close()} waits for in-flight units
     */
    public BoundedWorkerPool(int maxWorkers, String threadPrefix, Duration shutdownGrace) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, got " + maxWorkers);
        }
        if (threadPrefix == null || threadPrefix.isBlank()) {
            throw new IllegalArgumentException("threadPrefix must not be null or blank");
        }
        if (shutdownGrace == null || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be null or negative");
        }
        this.maxWorkers = maxWorkers;
        this.shutdownGrace = shutdownGrace;
        this.executor = new ThreadPoolExecutor(maxWorkers, maxWorkers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), DaemonThreads.named(threadPrefix));
    }

    /**
     * Default worker count: {@code min(32, availableProcessors + 4)}, sized for I/O-bound checks.
     */
    public static int defaultMaxWorkers() {
        return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
    }

    /**
     * Queues a unit of work.
     *
     * @param unit the work; exceptions it throws are logged and isolated
     * @return a future that can be used to cancel (and interrupt) the unit
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public Future<?> submit(Runnable unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit must not be null");
        }
        return executor.submit(() -> runUnit(unit));
    }

    /** Number of units currently executing. */
    public int activeCount() {
        return active.get();
    }

    /** Highest number of simultaneously executing units since the pool was created. */
    public int peakActiveCount() {
        return peakActive.get();
    }

    /** Number of units waiting for a free worker. */
    public int queuedCount() {
        return executor.getQueue().size();
    }

    /** Number of units that ran to completion, normally or by throwing. */
    public long completedCount() {
        return completed.get();
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stops accepting units and waits up to the shutdown grace for queued and running units to
     * finish. Units still running after the grace are interrupted and abandoned.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = executor.shutdownNow();
                log.warn("Worker pool did not drain within {}ms: abandoned {} running and {} queued units",
                        shutdownGrace.toMillis(), active.get(), dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Shuts down without waiting: queued units are discarded and running units are interrupted.
     *
     * @return number of queued units that never ran
     */
    public int abandon() {
        List<Runnable> dropped = executor.shutdownNow();
        if (active.get() > 0 || !dropped.isEmpty()) {
            log.debug("Abandoned worker pool with {} running and {} queued units", active.get(), dropped.size());
        }
        return dropped.size();
    }

    private void runUnit(Runnable unit) {
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
        try {
            unit.run();
        } catch (RuntimeException e) {
            log.error("Worker unit failed on {}", Thread.currentThread().getName(), e);
        } finally {
            active.decrementAndGet();
            completed.incrementAndGet();
        }
    }
}
