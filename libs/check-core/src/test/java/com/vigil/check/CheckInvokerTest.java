package com.vigil.check;

import com.vigil.check.testing.InMemoryCheck;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link CheckInvoker}: every failure mode of a check must come back as an outcome.
 */
@DisplayName("CheckInvoker")
class CheckInvokerTest {

    private InMemorySpanExporter spanExporter;
    private CheckRegistry registry;
    private CheckInvoker invoker;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        registry = new CheckRegistry();
        invoker = new CheckInvoker(registry, new SpanHelper(otelSdk.getTracer("test-tracer")),
                new SensitiveDataRedactor());
    }

    @AfterEach
    void cleanup() {
        Thread.interrupted();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null collaborators")
    void shouldRejectNullCollaborators() {
        assertThatThrownBy(() -> new CheckInvoker(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CheckInvoker(registry, null, new SensitiveDataRedactor()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Normal execution")
    class NormalExecution {

        @Test
        @DisplayName("should return the check's outcome with measured elapsed time")
        void shouldReturnOutcome() {
            registry.register("slow", new InMemoryCheck().warnWith("degraded").withDelay(Duration.ofMillis(50)));

            CheckOutcome outcome = invoker.invoke("slow", Map.of());

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.WARNING);
            assertThat(outcome.message()).isEqualTo("degraded");
            assertThat(outcome.elapsed()).isGreaterThanOrEqualTo(Duration.ofMillis(50));
        }

        @Test
        @DisplayName("should be idempotent for a read-only config")
        void shouldBeIdempotent() {
            registry.register("ok", new InMemoryCheck());
            Map<String, Object> config = Map.of("url", "https://example.com");

            assertThat(invoker.invoke("ok", config).kind()).isEqualTo(invoker.invoke("ok", config).kind());
        }

        @Test
        @DisplayName("should record a check.invoke span with the outcome")
        void shouldRecordSpan() {
            registry.register("ok", new InMemoryCheck());

            invoker.invoke("ok", Map.of());

            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            SpanData span = spans.get(0);
            assertThat(span.getName()).isEqualTo(CheckInvoker.SPAN_NAME);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("check.type"))).isEqualTo("ok");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("check.outcome"))).isEqualTo("success");
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }
    }

    @Nested
    @DisplayName("Containment")
    class Containment {

        @Test
        @DisplayName("should report unknown check type with available types")
        void shouldReportUnknownType() {
            registry.register("dns_record", new InMemoryCheck());

            CheckOutcome outcome = invoker.invoke("ftp_server", Map.of());

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.message()).isEqualTo("Unknown check type: ftp_server");
            assertThat(outcome.rawData())
                    .containsEntry(CheckOutcome.ERROR_TYPE_KEY, CheckInvoker.UNKNOWN_CHECK_TYPE)
                    .containsEntry("available_types", List.of("dns_record"));
        }

        @Test
        @DisplayName("should report invalid configuration with redacted config")
        void shouldReportInvalidConfiguration() {
            registry.register("mail_server", new InMemoryCheck("Mail probe", List.of("hostname", "protocol")));

            CheckOutcome outcome = invoker.invoke("mail_server", Map.of("protocol", "smtp", "password", "hunter2"));

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.message())
                    .isEqualTo("Invalid configuration for check type mail_server: Missing required configuration: hostname");
            @SuppressWarnings("unchecked")
            Map<String, Object> echoed = (Map<String, Object>) outcome.rawData().get("config");
            assertThat(echoed).containsEntry("password", SensitiveDataRedactor.REDACTED)
                    .containsEntry("protocol", "smtp");
        }

        @Test
        @DisplayName("should convert a thrown exception into an error outcome")
        void shouldConvertException() {
            registry.register("boom", new InMemoryCheck().throwing(new IllegalStateException("kaput")));

            CheckOutcome outcome = invoker.invoke("boom", Map.of());

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.rawData())
                    .containsEntry(CheckOutcome.ERROR_KEY, "kaput")
                    .containsEntry(CheckOutcome.ERROR_TYPE_KEY, "IllegalStateException");
            assertThat(spanExporter.getFinishedSpanItems().get(0).getStatus().getStatusCode())
                    .isEqualTo(StatusCode.ERROR);
        }

        @Test
        @DisplayName("should convert a config shape error into an error outcome")
        void shouldConvertConfigShapeError() {
            registry.register("port", config -> CheckOutcome.success("port " + config.getInt("port", 80), null, null));

            CheckOutcome outcome = invoker.invoke("port", Map.of("port", "eighty"));

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.rawData()).containsEntry(CheckOutcome.ERROR_TYPE_KEY, "IllegalArgumentException");
        }

        @Test
        @DisplayName("should report a null outcome as an error")
        void shouldReportNullOutcome() {
            registry.register("silent", new InMemoryCheck().returningNull());

            CheckOutcome outcome = invoker.invoke("silent", Map.of());

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.message()).isEqualTo("Check silent returned no outcome");
        }

        @Test
        @DisplayName("should restore the interrupt flag when the check is interrupted")
        void shouldRestoreInterruptFlag() {
            registry.register("sleepy", new InMemoryCheck().withDelay(Duration.ofSeconds(5)));
            Thread.currentThread().interrupt();

            CheckOutcome outcome = invoker.invoke("sleepy", Map.of());

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.rawData()).containsEntry(CheckOutcome.ERROR_TYPE_KEY, "InterruptedException");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        }

        @Test
        @DisplayName("should treat a null check type as unknown")
        void shouldTreatNullTypeAsUnknown() {
            assertThat(invoker.invoke(null, null).rawData())
                    .containsEntry(CheckOutcome.ERROR_TYPE_KEY, CheckInvoker.UNKNOWN_CHECK_TYPE);
        }
    }

    @Nested
    @DisplayName("Check lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should validate before executing, with the same configuration view")
        void shouldValidateThenExecute() throws Exception {
            Check check = mock(Check.class);
            when(check.validate(eq("probe"), any(CheckConfig.class))).thenReturn(ValidationResult.ok());
            when(check.execute(any(CheckConfig.class)))
                    .thenReturn(CheckOutcome.success("up", Duration.ZERO, Map.of()));
            registry.register("probe", check);

            CheckOutcome outcome = invoker.invoke("probe", Map.of("hostname", "mail.example.com"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
            InOrder order = inOrder(check);
            order.verify(check).validate(eq("probe"), argThat(c -> "mail.example.com".equals(c.require("hostname"))));
            order.verify(check).execute(argThat(c -> "mail.example.com".equals(c.require("hostname"))));
        }

        @Test
        @DisplayName("should never execute a check whose configuration is invalid")
        void shouldSkipExecutionWhenInvalid() throws Exception {
            Check check = mock(Check.class);
            when(check.validate(eq("probe"), any(CheckConfig.class)))
                    .thenReturn(ValidationResult.fail("Missing required configuration: hostname"));
            registry.register("probe", check);

            CheckOutcome outcome = invoker.invoke("probe", Map.of("password", "hunter2"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.message()).contains("Missing required configuration: hostname");
            assertThat(outcome.toString()).doesNotContain("hunter2");
            verify(check, never()).execute(any());
        }
    }
}
