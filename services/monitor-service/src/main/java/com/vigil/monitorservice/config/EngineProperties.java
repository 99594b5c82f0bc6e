package com.vigil.monitorservice.config;

import com.vigil.batch.BatchOptions;
import com.vigil.batch.BoundedWorkerPool;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default batch knobs, bound from {@code vigil.engine.*}. Each request may override them.
 *
 * <pre>
 * vigil:
 *   engine:
 *     max-workers: 16
 *     batch-size: 50
 *     per-check-timeout: 30s
 *     batch-timeout: 5m
 *     max-checks-per-request: 1000
 * </pre>
 *
 * @param maxWorkers worker threads per batch; defaults to {@code min(32, cpus + 4)}
 * @param batchSize checks per chunk, or unset to run a batch as one chunk
 * @param perCheckTimeout budget for one check, or unset for none
 * @param batchTimeout budget for a whole batch, or unset for none
 * @param maxChecksPerRequest upper bound on the number of checks in one HTTP request
 */
@ConfigurationProperties(prefix = "vigil.engine")
@Validated
public record EngineProperties(
        @Positive Integer maxWorkers,
        @Positive Integer batchSize,
        Duration perCheckTimeout,
        Duration batchTimeout,
        @Positive Integer maxChecksPerRequest) {

    public static final int DEFAULT_MAX_CHECKS_PER_REQUEST = 1000;

    public EngineProperties {
        if (maxWorkers == null) {
            maxWorkers = BoundedWorkerPool.defaultMaxWorkers();
        }
        if (maxChecksPerRequest == null) {
            maxChecksPerRequest = DEFAULT_MAX_CHECKS_PER_REQUEST;
        }
    }

    /** Options used when a request sets no knob of its own. */
    public BatchOptions toOptions() {
        return new BatchOptions(maxWorkers, batchSize, perCheckTimeout, batchTimeout);
    }
}
