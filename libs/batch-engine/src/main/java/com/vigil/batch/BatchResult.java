package com.vigil.batch;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one batch run, in submission order.
 *
 * @param batchId      identifier of the run (also used as MDC {@code batchId})
 * @param results      one entry per request, in the order the requests were given
 * @param summary      counts per outcome kind over {@code results}
 * @param totalElapsed wall-clock time from batch start to aggregation, queueing included
 */
public record BatchResult(
        String batchId,
        List<CheckResultEntry> results,
        OutcomeSummary summary,
        Duration totalElapsed
) {

    public BatchResult {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("batchId must not be null or blank");
        }
        results = results == null ? List.of() : List.copyOf(results);
        if (summary == null || summary.total() != results.size()) {
            throw new IllegalArgumentException("summary must count every result");
        }
        if (totalElapsed == null || totalElapsed.isNegative()) {
            totalElapsed = Duration.ZERO;
        }
    }

    public int size() {
        return results.size();
    }

    public double totalElapsedSeconds() {
        return totalElapsed.toNanos() / 1_000_000_000.0;
    }
}
