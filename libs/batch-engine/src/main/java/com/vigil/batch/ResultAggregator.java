package com.vigil.batch;

import com.vigil.check.CheckOutcome;
import com.vigil.check.CheckRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles outcomes into an ordered {@link BatchResult}.
 * <p>
 * Outcomes are matched to requests by position, never by identity, so duplicate identities are
 * harmless. A slot without an outcome is reported as an error rather than dropped.
 */
public final class ResultAggregator {

    public static final String MISSING_OUTCOME = "MissingOutcome";

    /**
     * @param batchId    identifier of the run
     * @param requests   the requests, identities already assigned
     * @param outcomes   outcomes by request index; may be shorter or contain nulls
     * @param startNanos {@link System#nanoTime()} at batch start
     */
    public BatchResult aggregate(String batchId, List<CheckRequest> requests, List<CheckOutcome> outcomes,
                                 long startNanos) {
        if (requests == null) {
            throw new IllegalArgumentException("requests must not be null");
        }
        List<CheckResultEntry> entries = new ArrayList<>(requests.size());
        OutcomeSummary summary = OutcomeSummary.empty();
        for (int i = 0; i < requests.size(); i++) {
            CheckRequest request = requests.get(i);
            CheckOutcome outcome = outcomes != null && i < outcomes.size() ? outcomes.get(i) : null;
            if (outcome == null) {
                outcome = CheckOutcome.syntheticError(MISSING_OUTCOME, "No outcome recorded", Duration.ZERO, Map.of());
            }
            entries.add(new CheckResultEntry(request.identity(), request.checkType(), outcome));
            summary = summary.plus(outcome.kind());
        }
        return new BatchResult(batchId, entries, summary, Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
