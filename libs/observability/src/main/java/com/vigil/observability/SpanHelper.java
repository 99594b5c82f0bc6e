package com.vigil.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Function;

/**
 * Runs work inside an OpenTelemetry span tagged with the current {@link CorrelationContext}.
 * <p>
 * Span attributes taken from the context: {@code correlation.id}, {@code batch.id},
 * {@code check.id} and {@code check.type}. The SDK (exporter, sampler) is configured by the
 * application; {@link #noop()} records nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("vigil"));
    }

    /**
     * Runs {@code work} with a new INTERNAL span made current. The work receives the span and is
     * responsible for its status; this suits callers that convert every failure into a value, as
     * check invocation does.
     *
     * @param spanName   name for the span
     * @param attributes attributes set before the span starts
     * @param work       the work to execute
     * @param <T>        result type
     * @return the work's result
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Function<Span, T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        CorrelationContextHolder.get().ifPresent(context -> tag(builder, context));
        Span span = builder.startSpan();
        try (Scope ignored = span.makeCurrent()) {
            return work.apply(span);
        } finally {
            span.end();
        }
    }

    private static void tag(SpanBuilder builder, CorrelationContext context) {
        builder.setAttribute("correlation.id", context.correlationId());
        setIfPresent(builder, "batch.id", context.batchId());
        setIfPresent(builder, "check.id", context.checkId());
        setIfPresent(builder, "check.type", context.checkType());
    }

    private static void setIfPresent(SpanBuilder builder, String key, String value) {
        if (value != null) {
            builder.setAttribute(key, value);
        }
    }
}
