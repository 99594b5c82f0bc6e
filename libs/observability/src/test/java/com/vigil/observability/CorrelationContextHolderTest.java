package com.vigil.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: checks ThreadLocal storage,
 * MDC bridge, context clearing, and scoped execution on pool threads.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "batch-1", "check-0", "dns_record");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).isPresent().contains(ctx);
        }

        @Test
        @DisplayName("should clear context")
        void shouldClearContext() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "batch-1", "web-1", "website_status"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("batchId")).isEqualTo("batch-1");
            assertThat(MDC.get("checkId")).isEqualTo("web-1");
            assertThat(MDC.get("checkType")).isEqualTo("website_status");
        }

        @Test
        @DisplayName("should remove stale check keys when a batch-only context replaces a check context")
        void shouldRemoveStaleKeys() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "batch-1", "web-1", "website_status"));
            CorrelationContextHolder.set(CorrelationContext.of("corr-1").forBatch("batch-1"));

            assertThat(MDC.get("batchId")).isEqualTo("batch-1");
            assertThat(MDC.get("checkId")).isNull();
            assertThat(MDC.get("checkType")).isNull();
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "batch-1", "web-1", "website_status"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("batchId")).isNull();
            assertThat(MDC.get("checkId")).isNull();
            assertThat(MDC.get("checkType")).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class ScopedExecution {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            var outer = CorrelationContext.of("outer-corr");
            var inner = outer.forCheck("batch-1", "c-1", "ssl_certificate");
            CorrelationContextHolder.set(outer);

            AtomicReference<String> capturedCheckId = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(inner, () ->
                    capturedCheckId.set(MDC.get("checkId")));

            assertThat(capturedCheckId.get()).isEqualTo("c-1");
            assertThat(CorrelationContextHolder.get()).contains(outer);
            assertThat(MDC.get("checkId")).isNull();
        }

        @Test
        @DisplayName("should return the supplier's value and clear when no previous context existed")
        void shouldReturnValueAndClear() {
            String result = CorrelationContextHolder.supplyWithContext(
                    CorrelationContext.of("temp"), () -> MDC.get("correlationId"));

            assertThat(result).isEqualTo("temp");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even if the work throws")
        void shouldRestoreOnException() {
            var outer = CorrelationContext.of("outer-corr");
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(
                    CorrelationContext.of("inner-corr"), () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should hand the context over to a pool thread and leave it clean afterwards")
        void shouldHandOverToPoolThread() throws Exception {
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                var ctx = CorrelationContext.of("corr-7").forCheck("b", "c", "t");

                String seen = pool.submit(() -> CorrelationContextHolder.supplyWithContext(
                        ctx, () -> MDC.get("correlationId"))).get(5, TimeUnit.SECONDS);
                Boolean leaked = pool.submit(() -> CorrelationContextHolder.get().isPresent())
                        .get(5, TimeUnit.SECONDS);

                assertThat(seen).isEqualTo("corr-7");
                assertThat(leaked).isFalse();
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
