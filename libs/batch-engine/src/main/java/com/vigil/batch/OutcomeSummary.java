package com.vigil.batch;

import com.vigil.check.OutcomeKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-kind counts of a batch.
 */
public record OutcomeSummary(int success, int warning, int error) {

    public OutcomeSummary {
        if (success < 0 || warning < 0 || error < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
    }

    public static OutcomeSummary empty() {
        return new OutcomeSummary(0, 0, 0);
    }

    /**
     * Returns a summary with one more outcome of the given kind.
     */
    public OutcomeSummary plus(OutcomeKind kind) {
        return switch (kind) {
            case SUCCESS -> new OutcomeSummary(success + 1, warning, error);
            case WARNING -> new OutcomeSummary(success, warning + 1, error);
            case ERROR -> new OutcomeSummary(success, warning, error + 1);
        };
    }

    public int total() {
        return success + warning + error;
    }

    /**
     * Overall severity: ERROR if any error, else WARNING if any warning, else SUCCESS (also for an
     * empty batch).
     */
    public OutcomeKind worst() {
        if (error > 0) {
            return OutcomeKind.ERROR;
        }
        return warning > 0 ? OutcomeKind.WARNING : OutcomeKind.SUCCESS;
    }

    /**
     * Returns the counts keyed by wire name; all three keys are always present.
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(OutcomeKind.SUCCESS.wireName(), success);
        counts.put(OutcomeKind.WARNING.wireName(), warning);
        counts.put(OutcomeKind.ERROR.wireName(), error);
        return counts;
    }
}
