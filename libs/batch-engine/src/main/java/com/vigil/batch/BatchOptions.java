package com.vigil.batch;

import java.time.Duration;

/**
 * Knobs for one {@link BatchCoordinator#runBatch} call.
 *
 * @param maxWorkers      number of worker threads of the owned pool (ignored with a shared pool)
 * @param batchSize       maximum number of checks per chunk, or null to run all checks as one chunk
 * @param perCheckTimeout budget for one check from the moment it starts executing, or null for none
 * @param batchTimeout    budget for the whole batch from the moment it starts, or null for none
 */
public record BatchOptions(
        int maxWorkers,
        Integer batchSize,
        Duration perCheckTimeout,
        Duration batchTimeout
) {

    public BatchOptions {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, got " + maxWorkers);
        }
        if (batchSize != null && batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        requirePositive("perCheckTimeout", perCheckTimeout);
        requirePositive("batchTimeout", batchTimeout);
    }

    /**
     * Default options: {@link BoundedWorkerPool#defaultMaxWorkers()} workers, no chunking, no
     * timeouts.
     */
    public static BatchOptions defaults() {
        return new BatchOptions(BoundedWorkerPool.defaultMaxWorkers(), null, null, null);
    }

    public BatchOptions withMaxWorkers(int newMaxWorkers) {
        return new BatchOptions(newMaxWorkers, batchSize, perCheckTimeout, batchTimeout);
    }

    public BatchOptions withBatchSize(Integer newBatchSize) {
        return new BatchOptions(maxWorkers, newBatchSize, perCheckTimeout, batchTimeout);
    }

    public BatchOptions withPerCheckTimeout(Duration newPerCheckTimeout) {
        return new BatchOptions(maxWorkers, batchSize, newPerCheckTimeout, batchTimeout);
    }

    public BatchOptions withBatchTimeout(Duration newBatchTimeout) {
        return new BatchOptions(maxWorkers, batchSize, perCheckTimeout, newBatchTimeout);
    }

    private static void requirePositive(String name, Duration value) {
        if (value != null && (value.isNegative() || value.isZero())) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
