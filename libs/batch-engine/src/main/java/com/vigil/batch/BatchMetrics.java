package com.vigil.batch;

import com.vigil.check.CheckOutcome;
import com.vigil.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer instruments of the batch engine.
 */
public final class BatchMetrics {

    public static final String CHECK_OUTCOMES = "vigil.check.outcomes";
    public static final String CHECK_DURATION = "vigil.check.duration";
    public static final String CHECK_TIMEOUTS = "vigil.check.timeouts";
    public static final String BATCH_DURATION = "vigil.batch.duration";
    public static final String BATCH_SIZE = "vigil.batch.size";
    public static final String POOL_ACTIVE = "vigil.pool.active";

    static final String UNKNOWN_TYPE = "unknown";

    private final MetricFactory metrics;
    private final Timer batchDuration;
    private final AtomicLong poolActive;

    public BatchMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
        this.batchDuration = metrics.timer(BATCH_DURATION, "Wall-clock time of a batch run");
        this.poolActive = metrics.gauge(POOL_ACTIVE, "Checks currently executing on worker threads");
    }

    /**
     * Metrics backed by a private in-memory registry.
     */
    public static BatchMetrics standalone() {
        return new BatchMetrics(MetricFactory.standalone("batch-engine"));
    }

    void recordOutcome(String checkType, CheckOutcome outcome) {
        String type = checkType == null || checkType.isBlank() ? UNKNOWN_TYPE : checkType;
        metrics.counter(CHECK_OUTCOMES, "Check outcomes by type and kind",
                "check_type", type, "outcome", outcome.kind().wireName()).increment();
        metrics.timer(CHECK_DURATION, "Execution time of a single check", "check_type", type)
                .record(outcome.elapsed().toNanos(), TimeUnit.NANOSECONDS);
    }

    void recordTimeout(String scope) {
        metrics.counter(CHECK_TIMEOUTS, "Checks reported as timed out or cancelled", "scope", scope).increment();
    }

    void recordBatch(int size, Duration elapsed) {
        metrics.distributionSummary(BATCH_SIZE, "Number of checks per batch").record(size);
        batchDuration.record(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }

    void unitStarted() {
        poolActive.incrementAndGet();
    }

    void unitFinished() {
        poolActive.decrementAndGet();
    }

    public MetricFactory metricFactory() {
        return metrics;
    }
}
