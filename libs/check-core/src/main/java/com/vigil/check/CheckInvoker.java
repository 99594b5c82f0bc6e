package com.vigil.check;

import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one check by type tag and always returns an outcome.
 * <p>
 * This is the first containment boundary of the engine: an unknown type, a configuration that
 * fails validation, an exception thrown by the check, or a check returning {@code null} all become
 * ERROR outcomes here. Nothing a check does can escape {@link #invoke}.
 * <p>
 * The elapsed time stamped on the outcome is measured here, around validation and execution, so it
 * never includes time spent waiting in the worker pool queue.
 */
public final class CheckInvoker {

    private static final Logger log = LoggerFactory.getLogger(CheckInvoker.class);

    public static final String SPAN_NAME = "check.invoke";
    public static final String UNKNOWN_CHECK_TYPE = "UnknownCheckType";
    public static final String INVALID_CONFIGURATION = "InvalidConfiguration";
    public static final String NO_OUTCOME = "NoOutcome";

    private final CheckRegistry registry;
    private final SpanHelper spanHelper;
    private final SensitiveDataRedactor redactor;

    /**
     * Creates an invoker with no-op tracing and the default redaction patterns.
     */
    public CheckInvoker(CheckRegistry registry) {
        this(registry, SpanHelper.noop(), new SensitiveDataRedactor());
    }

    public CheckInvoker(CheckRegistry registry, SpanHelper spanHelper, SensitiveDataRedactor redactor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (spanHelper == null) {
            throw new IllegalArgumentException("spanHelper must not be null");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.registry = registry;
        this.spanHelper = spanHelper;
        this.redactor = redactor;
    }

    /**
     * Runs the check registered under {@code checkType} with the given configuration.
     *
     * @param checkType check type tag
     * @param config    raw configuration (may be null)
     * @return the outcome; never null, never thrown
     */
    public CheckOutcome invoke(String checkType, Map<String, Object> config) {
        String type = checkType == null ? "" : checkType;
        return spanHelper.inSpan(SPAN_NAME, Map.of("check.type", type), span -> {
            CheckOutcome outcome = invokeTimed(type, CheckConfig.of(config));
            span.setAttribute("check.outcome", outcome.kind().wireName());
            if (outcome.isError()) {
                span.setStatus(StatusCode.ERROR, outcome.message());
            } else {
                span.setStatus(StatusCode.OK);
            }
            log.debug("Check {} finished: {} in {}ms", type, outcome.kind(), outcome.elapsed().toMillis());
            return outcome;
        });
    }

    /**
     * Returns the registry this invoker resolves check types against.
     */
    public CheckRegistry registry() {
        return registry;
    }

    private CheckOutcome invokeTimed(String type, CheckConfig config) {
        long start = System.nanoTime();
        CheckOutcome outcome = run(type, config, start);
        return outcome.withElapsed(Duration.ofNanos(System.nanoTime() - start));
    }

    private CheckOutcome run(String type, CheckConfig config, long start) {
        Check check = registry.find(type).orElse(null);
        if (check == null) {
            log.warn("Unknown check type: {}", type);
            return CheckOutcome.syntheticError(UNKNOWN_CHECK_TYPE, "Unknown check type: " + type,
                    Duration.ZERO, Map.of("available_types", registry.types()));
        }
        try {
            ValidationResult validation = check.validate(type, config);
            if (!validation.valid()) {
                log.warn("Invalid configuration for check type {}: {}", type, validation.summary());
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put("errors", validation.errors());
                extra.put("config", redactor.redact(config.asMap()));
                return CheckOutcome.syntheticError(INVALID_CONFIGURATION,
                        "Invalid configuration for check type " + type + ": " + validation.summary(),
                        Duration.ZERO, extra);
            }
            CheckOutcome outcome = check.execute(config);
            if (outcome == null) {
                log.warn("Check {} returned no outcome", type);
                return CheckOutcome.syntheticError(NO_OUTCOME, "Check " + type + " returned no outcome",
                        Duration.ZERO, Map.of());
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Check {} interrupted after {}ms", type, elapsedMillis(start));
            return CheckOutcome.failure(e, Duration.ZERO);
        } catch (Exception e) {
            log.warn("Check {} failed after {}ms: {}", type, elapsedMillis(start), e.toString());
            Span.current().recordException(e);
            return CheckOutcome.failure(e, Duration.ZERO);
        }
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
