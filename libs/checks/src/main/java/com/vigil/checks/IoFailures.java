package com.vigil.checks;

import com.vigil.check.CheckOutcome;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error outcomes for expected I/O failures (refused connections, timeouts, handshake errors) that
 * the built-in checks report themselves instead of letting the invoker wrap them.
 */
final class IoFailures {

    private IoFailures() {
    }

    static CheckOutcome error(String message, Exception failure) {
        return error(message, failure, Map.of());
    }

    static CheckOutcome error(String message, Exception failure, Map<String, Object> context) {
        Map<String, Object> raw = new LinkedHashMap<>(context);
        raw.put(CheckOutcome.ERROR_KEY, String.valueOf(failure.getMessage()));
        raw.put(CheckOutcome.ERROR_TYPE_KEY, failure.getClass().getSimpleName());
        return CheckOutcome.error(message, Duration.ZERO, raw);
    }
}
