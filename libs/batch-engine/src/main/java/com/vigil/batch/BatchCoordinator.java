package com.vigil.batch;

import com.vigil.check.CheckInvoker;
import com.vigil.check.CheckOutcome;
import com.vigil.check.CheckRequest;
import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a batch of heterogeneous checks in parallel and returns their outcomes in submission order.
 * <p>
 * A batch never fails because of its checks: unknown types, bad configuration, exceptions,
 * per-check timeouts, a batch timeout and cancellation all end up as ERROR entries in the result.
 * Only a broken call ({@code null} request list, {@code null} options or shared pool) throws.
 * <p>
 * Timeouts bound how long the coordinator waits, not how long a worker thread lives: a check stuck
 * in I/O is interrupted on a best-effort basis and its late result discarded. To get a check's
 * thread back, give the check its own I/O timeout.
 * <p>
 * Cancellation: interrupt the thread blocked in {@link #runBatch}. Unresolved checks are reported
 * as cancelled, the interrupt flag is restored and the partial result is returned.
 */
public final class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final String REJECTED_REQUEST = "RejectedRequest";
    public static final String CHECK_TIMEOUT = "CheckTimeout";
    public static final String BATCH_TIMEOUT = "BatchTimeout";
    public static final String BATCH_CANCELLED = "BatchCancelled";

    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 2;
    private static final Duration MAX_TIMEOUT = Duration.ofNanos(MAX_TIMEOUT_NANOS);

    private final CheckInvoker invoker;
    private final BatchMetrics metrics;
    private final ResultAggregator aggregator = new ResultAggregator();

    public BatchCoordinator(CheckInvoker invoker) {
        this(invoker, BatchMetrics.standalone());
    }

    public BatchCoordinator(CheckInvoker invoker, BatchMetrics metrics) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.invoker = invoker;
        this.metrics = metrics;
    }

    /**
     * Runs the batch on a pool of {@code options.maxWorkers()} threads created for this call.
     */
    public BatchResult runBatch(List<CheckRequest> requests, BatchOptions options) {
        return run(requests, options, null);
    }

    /**
     * Runs the batch on a pool owned by the caller. The pool is never shut down here, and
     * {@code options.maxWorkers()} is ignored in favour of the pool's own size.
     */
    public BatchResult runBatch(List<CheckRequest> requests, BatchOptions options, BoundedWorkerPool sharedPool) {
        if (sharedPool == null) {
            throw new IllegalArgumentException("sharedPool must not be null");
        }
        return run(requests, options, sharedPool);
    }

    private BatchResult run(List<CheckRequest> requests, BatchOptions options, BoundedWorkerPool sharedPool) {
        if (requests == null) {
            throw new IllegalArgumentException("requests must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        long startNanos = System.nanoTime();
        String batchId = UUID.randomUUID().toString();
        CorrelationContext batchContext = CorrelationContextHolder.get()
                .orElseGet(() -> CorrelationContext.of(batchId))
                .forBatch(batchId);
        return CorrelationContextHolder.supplyWithContext(batchContext,
                () -> execute(new Run(batchId, batchContext, requests, options, startNanos), sharedPool));
    }

    private BatchResult execute(Run run, BoundedWorkerPool sharedPool) {
        List<Integer> accepted = new ArrayList<>();
        for (int i = 0; i < run.requests.size(); i++) {
            String problem = rejectionReason(run.requests.get(i));
            if (problem != null) {
                run.outcomes[i] = CheckOutcome.syntheticError(REJECTED_REQUEST, "Rejected request: " + problem,
                        Duration.ZERO, Map.of());
            } else {
                accepted.add(i);
            }
        }
        List<List<Integer>> chunks = chunk(accepted, run.options.batchSize());
        log.info("Starting batch {}: {} checks ({} rejected) in {} chunk(s)",
                run.batchId, run.requests.size(), run.requests.size() - accepted.size(), chunks.size());

        BoundedWorkerPool pool = null;
        Termination termination = null;
        boolean abandoned = false;
        try {
            if (!accepted.isEmpty()) {
                pool = sharedPool != null ? sharedPool
                        : new BoundedWorkerPool(run.options.maxWorkers(), "vigil-batch-" + run.batchId.substring(0, 8),
                        BoundedWorkerPool.DEFAULT_SHUTDOWN_GRACE);
            }
            for (int c = 0; c < chunks.size() && termination == null; c++) {
                List<Integer> chunk = chunks.get(c);
                if (chunks.size() > 1) {
                    log.info("Batch {} chunk {}/{}: {} checks", run.batchId, c + 1, chunks.size(), chunk.size());
                }
                List<Unit> units = new ArrayList<>(chunk.size());
                for (int index : chunk) {
                    units.add(submit(run, index, pool));
                }
                termination = await(units, run);
                for (Unit unit : units) {
                    if (termination != null && unit.resolve(terminationOutcome(termination, run, unit))) {
                        unit.abort();
                        metrics.recordTimeout(termination.scope);
                        log.warn("Check {} ({}) {}", unit.identity(), unit.request.checkType(), termination.verb);
                    }
                    CheckOutcome settled = settle(unit);
                    run.outcomes[unit.index] = settled;
                    abandoned |= !unit.finished && settled == unit.synthetic.get();
                }
            }
            if (termination != null) {
                for (int index : accepted) {
                    if (run.outcomes[index] == null) {
                        run.outcomes[index] = terminationOutcome(termination, run, null);
                        metrics.recordTimeout(termination.scope);
                    }
                }
            }
        } finally {
            if (pool != null && pool != sharedPool) {
                if (abandoned || termination != null) {
                    pool.abandon();
                } else {
                    pool.close();
                }
            }
        }

        BatchResult result = aggregator.aggregate(run.batchId, run.requests, Arrays.asList(run.outcomes), run.startNanos);
        result.results().forEach(entry -> metrics.recordOutcome(entry.checkType(), entry.outcome()));
        metrics.recordBatch(result.size(), result.totalElapsed());
        log.info("Finished batch {}: {} checks, summary={}, elapsed={}ms",
                run.batchId, result.size(), result.summary().asMap(), result.totalElapsed().toMillis());
        if (termination == Termination.CANCELLED) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    private Unit submit(Run run, int index, BoundedWorkerPool pool) {
        Unit unit = new Unit(index, run.requests.get(index));
        CorrelationContext checkContext = run.context.forCheck(run.batchId, unit.identity(), unit.request.checkType());
        try {
            unit.task = pool.submit(() -> work(unit, checkContext, run.options.perCheckTimeout()));
        } catch (RuntimeException e) {
            unit.outcome.completeExceptionally(e);
        }
        return unit;
    }

    private void work(Unit unit, CorrelationContext context, Duration perCheckTimeout) {
        if (unit.outcome.isDone()) {
            return;
        }
        unit.startNanos = System.nanoTime();
        unit.started = true;
        metrics.unitStarted();
        try {
            if (perCheckTimeout != null) {
                // the copy's timer is cancelled as soon as the check completes
                unit.outcome.copy()
                        .orTimeout(cappedNanos(perCheckTimeout), TimeUnit.NANOSECONDS)
                        .whenComplete((late, failure) -> {
                            if (failure instanceof TimeoutException) {
                                checkTimedOut(unit, perCheckTimeout);
                            }
                        });
            }
            CheckOutcome outcome = CorrelationContextHolder.supplyWithContext(context,
                    () -> invoker.invoke(unit.request.checkType(), unit.request.config()));
            if (!unit.outcome.complete(outcome)) {
                log.debug("Discarding late outcome of check {} ({})", unit.identity(), outcome.kind());
            }
        } catch (RuntimeException | Error e) {
            unit.outcome.completeExceptionally(e);
            throw e;
        } finally {
            unit.finished = true;
            metrics.unitFinished();
        }
    }

    private void checkTimedOut(Unit unit, Duration timeout) {
        CheckOutcome timedOut = CheckOutcome.timedOut(CHECK_TIMEOUT,
                "Check timed out after " + seconds(timeout) + "s", timeout);
        if (unit.resolve(timedOut)) {
            metrics.recordTimeout("check");
            log.warn("Check {} ({}) timed out after {}s", unit.identity(), unit.request.checkType(), seconds(timeout));
            unit.abort();
        }
    }

    private static Termination await(List<Unit> units, Run run) {
        CompletableFuture<?>[] futures = units.stream().map(u -> u.outcome).toArray(CompletableFuture[]::new);
        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        try {
            if (run.deadlineNanos == null) {
                all.get();
            } else {
                long remaining = run.deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    throw new TimeoutException();
                }
                all.get(remaining, TimeUnit.NANOSECONDS);
            }
            return null;
        } catch (TimeoutException e) {
            return Termination.EXPIRED;
        } catch (InterruptedException e) {
            return Termination.CANCELLED;
        } catch (ExecutionException e) {
            // every unit is done; failures are converted in settle()
            return null;
        }
    }

    private static CheckOutcome settle(Unit unit) {
        try {
            return unit.outcome.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Check {} ({}) failed outside the invoker", unit.identity(), unit.request.checkType(), cause);
            return CheckOutcome.failure(cause, unit.elapsed());
        }
    }

    private CheckOutcome terminationOutcome(Termination termination, Run run, Unit unit) {
        Duration elapsed = unit != null ? unit.elapsed() : Duration.ZERO;
        String message = termination == Termination.EXPIRED
                ? "Batch timed out after " + seconds(run.options.batchTimeout()) + "s before check completed"
                : "Batch cancelled before check completed";
        return CheckOutcome.timedOut(termination.errorType, message, elapsed);
    }

    private static String rejectionReason(CheckRequest request) {
        if (request == null) {
            return "request must not be null";
        }
        if (request.checkType() == null || request.checkType().isBlank()) {
            return "check_type is required";
        }
        return null;
    }

    private static List<List<Integer>> chunk(List<Integer> indices, Integer batchSize) {
        if (indices.isEmpty()) {
            return List.of();
        }
        if (batchSize == null || indices.size() <= batchSize) {
            return List.of(indices);
        }
        List<List<Integer>> chunks = new ArrayList<>();
        for (int from = 0; from < indices.size(); from += batchSize) {
            chunks.add(indices.subList(from, Math.min(from + batchSize, indices.size())));
        }
        return chunks;
    }

    static String seconds(Duration duration) {
        return BigDecimal.valueOf(duration.getSeconds())
                .add(BigDecimal.valueOf(duration.getNano(), 9))
                .stripTrailingZeros()
                .toPlainString();
    }

    /**
     * Nanoseconds of a timeout, capped at half the {@code nanoTime} range so that deadlines
     * derived from it stay comparable.
     */
    static long cappedNanos(Duration timeout) {
        if (timeout.compareTo(MAX_TIMEOUT) >= 0) {
            return MAX_TIMEOUT_NANOS;
        }
        return timeout.toNanos();
    }

    private enum Termination {
        EXPIRED(BatchCoordinator.BATCH_TIMEOUT, "batch", "abandoned: batch timed out"),
        CANCELLED(BatchCoordinator.BATCH_CANCELLED, "cancelled", "abandoned: batch cancelled");

        private final String errorType;
        private final String scope;
        private final String verb;

        Termination(String errorType, String scope, String verb) {
            this.errorType = errorType;
            this.scope = scope;
            this.verb = verb;
        }
    }

    /** State of one {@code runBatch} call. */
    private static final class Run {
        final String batchId;
        final CorrelationContext context;
        final List<CheckRequest> requests;
        final BatchOptions options;
        final long startNanos;
        final Long deadlineNanos;
        final CheckOutcome[] outcomes;

        Run(String batchId, CorrelationContext context, List<CheckRequest> requests, BatchOptions options,
            long startNanos) {
            this.batchId = batchId;
            this.context = context;
            this.requests = withIdentities(requests);
            this.options = options;
            this.startNanos = startNanos;
            this.deadlineNanos = options.batchTimeout() == null ? null : startNanos + cappedNanos(options.batchTimeout());
            this.outcomes = new CheckOutcome[requests.size()];
        }

        private static List<CheckRequest> withIdentities(List<CheckRequest> requests) {
            List<CheckRequest> identified = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                CheckRequest request = requests.get(i);
                String ordinal = "check-" + i;
                if (request == null) {
                    identified.add(new CheckRequest(ordinal, null, null));
                } else {
                    identified.add(request.hasIdentity() ? request : request.withIdentity(ordinal));
                }
            }
            return identified;
        }
    }

    /** One accepted request on its way through the pool. */
    private static final class Unit {
        final int index;
        final CheckRequest request;
        final CompletableFuture<CheckOutcome> outcome = new CompletableFuture<>();
        volatile Future<?> task;
        volatile long startNanos;
        volatile boolean started;
        volatile boolean finished;
        final AtomicReference<CheckOutcome> synthetic = new AtomicReference<>();

        Unit(int index, CheckRequest request) {
            this.index = index;
            this.request = request;
        }

        String identity() {
            return request.identity();
        }

        Duration elapsed() {
            return started ? Duration.ofNanos(System.nanoTime() - startNanos) : Duration.ZERO;
        }

        /**
         * Resolves the unit with an outcome made up by the coordinator. Returns false if the
         * check had already produced its own.
         */
        boolean resolve(CheckOutcome made) {
            // marked before completing so whoever joins the outcome sees the mark
            if (!synthetic.compareAndSet(null, made)) {
                return false;
            }
            if (outcome.complete(made)) {
                return true;
            }
            synthetic.set(null);
            return false;
        }

        void abort() {
            Future<?> running = task;
            if (running != null) {
                running.cancel(true);
            }
        }
    }
}
