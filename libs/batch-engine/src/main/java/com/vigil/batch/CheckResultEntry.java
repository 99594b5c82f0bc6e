package com.vigil.batch;

import com.vigil.check.CheckOutcome;

/**
 * One slot of a batch result.
 *
 * @param identity  identity of the request (caller-supplied or assigned)
 * @param checkType check type tag of the request, null if the request had none
 * @param outcome   the outcome reported for the request
 */
public record CheckResultEntry(String identity, String checkType, CheckOutcome outcome) {

    public CheckResultEntry {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
    }
}
