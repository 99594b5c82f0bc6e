package com.vigil.check;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized result of a single check invocation.
 *
 * @param kind      severity of the outcome (never null)
 * @param message   human-readable message
 * @param elapsed   wall-clock duration of the invocation, excluding pool queueing (never negative)
 * @param rawData   check-specific diagnostic payload, not interpreted by the engine
 * @param timestamp when the outcome was produced
 */
public record CheckOutcome(
        OutcomeKind kind,
        String message,
        Duration elapsed,
        Map<String, Object> rawData,
        Instant timestamp
) {

    /** Raw data key carrying the description of a caught failure. */
    public static final String ERROR_KEY = "error";

    /** Raw data key carrying the simple class name (or synthetic category) of a failure. */
    public static final String ERROR_TYPE_KEY = "error_type";

    public CheckOutcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null) {
            message = "";
        }
        if (elapsed == null || elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        rawData = rawData == null || rawData.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rawData));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /** Creates a success outcome. */
    public static CheckOutcome success(String message, Duration elapsed, Map<String, Object> rawData) {
        return new CheckOutcome(OutcomeKind.SUCCESS, message, elapsed, rawData, Instant.now());
    }

    /** Creates a warning outcome. */
    public static CheckOutcome warning(String message, Duration elapsed, Map<String, Object> rawData) {
        return new CheckOutcome(OutcomeKind.WARNING, message, elapsed, rawData, Instant.now());
    }

    /** Creates an error outcome. */
    public static CheckOutcome error(String message, Duration elapsed, Map<String, Object> rawData) {
        return new CheckOutcome(OutcomeKind.ERROR, message, elapsed, rawData, Instant.now());
    }

    /**
     * Converts a caught failure into an error outcome whose raw data carries the failure's type
     * name and description.
     */
    public static CheckOutcome failure(Throwable failure, Duration elapsed) {
        String description = describe(failure);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(ERROR_KEY, description);
        raw.put(ERROR_TYPE_KEY, failure.getClass().getSimpleName());
        return error("Exception running check: " + description, elapsed, raw);
    }

    /**
     * Creates an error outcome for a synthetic failure category (timeout, rejection, ...).
     */
    public static CheckOutcome syntheticError(String errorType, String message, Duration elapsed,
                                              Map<String, Object> extra) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(ERROR_KEY, message);
        raw.put(ERROR_TYPE_KEY, errorType);
        if (extra != null) {
            raw.putAll(extra);
        }
        return error(message, elapsed, raw);
    }

    /**
     * Creates the error outcome reported in place of a check that did not finish in time.
     *
     * @param errorType timeout category (per check, per batch, cancelled)
     * @param message   message naming the budget that expired
     * @param elapsed   time waited before giving up
     */
    public static CheckOutcome timedOut(String errorType, String message, Duration elapsed) {
        return syntheticError(errorType, message, elapsed, Map.of());
    }

    /**
     * Returns a copy with the given elapsed time.
     */
    public CheckOutcome withElapsed(Duration newElapsed) {
        return new CheckOutcome(kind, message, newElapsed, rawData, timestamp);
    }

    /**
     * Returns the elapsed time in fractional seconds.
     */
    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }

    public boolean isWarning() {
        return kind == OutcomeKind.WARNING;
    }

    public boolean isError() {
        return kind == OutcomeKind.ERROR;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getName() : message;
    }
}
