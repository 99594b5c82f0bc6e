package com.vigil.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity of the work a thread is doing, mirrored into SLF4J MDC by
 * {@link CorrelationContextHolder}.
 * <p>
 * A caller (an HTTP request, a test) starts with {@link #of(String)}; the batch coordinator
 * narrows it with {@link #forBatch} and then {@link #forCheck} for each unit it hands to a worker.
 *
 * @param correlationId ID of the calling flow; required
 * @param batchId       batch being executed, or null
 * @param checkId       identity of the check being executed, or null
 * @param checkType     type tag of the check being executed, or null
 */
public record CorrelationContext(String correlationId, String batchId, String checkId, String checkType) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_BATCH_ID = "batchId";
    public static final String MDC_CHECK_ID = "checkId";
    public static final String MDC_CHECK_TYPE = "checkType";

    /** Every MDC key a context may populate. */
    public static final List<String> MDC_KEYS =
            List.of(MDC_CORRELATION_ID, MDC_BATCH_ID, MDC_CHECK_ID, MDC_CHECK_TYPE);

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    public CorrelationContext forBatch(String newBatchId) {
        return new CorrelationContext(correlationId, newBatchId, null, null);
    }

    public CorrelationContext forCheck(String newBatchId, String newCheckId, String newCheckType) {
        return new CorrelationContext(correlationId, newBatchId, newCheckId, newCheckType);
    }

    /**
     * MDC entries for this context, keyed by {@link #MDC_KEYS}; absent fields map to null.
     */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        entries.put(MDC_BATCH_ID, batchId);
        entries.put(MDC_CHECK_ID, checkId);
        entries.put(MDC_CHECK_TYPE, checkType);
        return entries;
    }
}
