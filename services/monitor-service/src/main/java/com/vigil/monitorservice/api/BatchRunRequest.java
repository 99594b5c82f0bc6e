package com.vigil.monitorservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.batch.BatchJson;
import com.vigil.batch.BatchOptions;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;

/**
 * Body of {@code POST /api/v1/batch/run}. Unset knobs fall back to the configured defaults.
 *
 * @param checks the requests to run, in result order
 * @param maxWorkers worker threads for this batch
 * @param batchSize checks per chunk
 * @param perCheckTimeout seconds allowed per check
 * @param batchTimeout seconds allowed for the whole batch
 */
public record BatchRunRequest(
        @NotNull List<BatchJson.RequestDocument> checks,
        @JsonProperty("max_workers") @Positive Integer maxWorkers,
        @JsonProperty("batch_size") @Positive Integer batchSize,
        @JsonProperty("per_check_timeout") @Positive Double perCheckTimeout,
        @JsonProperty("batch_timeout") @Positive Double batchTimeout) {

    /** Overlays this request's knobs on the defaults. */
    public BatchOptions applyTo(BatchOptions defaults) {
        BatchOptions options = defaults;
        if (maxWorkers != null) {
            options = options.withMaxWorkers(maxWorkers);
        }
        if (batchSize != null) {
            options = options.withBatchSize(batchSize);
        }
        if (perCheckTimeout != null) {
            options = options.withPerCheckTimeout(seconds(perCheckTimeout));
        }
        if (batchTimeout != null) {
            options = options.withBatchTimeout(seconds(batchTimeout));
        }
        return options;
    }

    private static Duration seconds(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000_000L));
    }
}
