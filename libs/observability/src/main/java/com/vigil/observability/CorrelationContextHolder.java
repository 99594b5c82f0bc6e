package com.vigil.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-thread {@link CorrelationContext}, kept in step with SLF4J MDC so log lines carry the
 * correlation, batch and check identity.
 * <p>
 * Pool threads do not inherit the submitting thread's context; the batch coordinator installs one
 * per unit with {@link #runWithContext}, which restores whatever the worker held before.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Installs a context on the current thread.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        context.mdcEntries().forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys; other MDC entries are left alone. */
    public static void clear() {
        CONTEXT.remove();
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }

    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        supplyWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Runs {@code supplier} under {@code context}, then reinstates the previous context, or clears
     * the thread if there was none.
     */
    public static <T> T supplyWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        try {
            return supplier.get();
        } finally {
            if (previous == null) {
                clear();
            } else {
                set(previous);
            }
        }
    }
}
