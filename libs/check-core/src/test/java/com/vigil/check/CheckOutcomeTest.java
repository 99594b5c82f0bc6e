package com.vigil.check;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CheckOutcome")
class CheckOutcomeTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null kind")
        void shouldRejectNullKind() {
            assertThatThrownBy(() -> new CheckOutcome(null, "m", Duration.ZERO, Map.of(), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should clamp negative elapsed to zero")
        void shouldClampNegativeElapsed() {
            var outcome = CheckOutcome.success("ok", Duration.ofMillis(-5), null);

            assertThat(outcome.elapsed()).isEqualTo(Duration.ZERO);
            assertThat(outcome.rawData()).isEmpty();
            assertThat(outcome.timestamp()).isNotNull();
        }

        @Test
        @DisplayName("should defensively copy raw data")
        void shouldCopyRawData() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("status_code", 200);
            var outcome = CheckOutcome.success("ok", Duration.ZERO, raw);
            raw.put("status_code", 500);

            assertThat(outcome.rawData()).containsEntry("status_code", 200);
            assertThatThrownBy(() -> outcome.rawData().put("x", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("failure should carry error description and type")
        void failureShouldCarryErrorDetails() {
            var outcome = CheckOutcome.failure(new IOException("connection refused"), Duration.ofMillis(10));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.message()).isEqualTo("Exception running check: connection refused");
            assertThat(outcome.rawData())
                    .containsEntry(CheckOutcome.ERROR_KEY, "connection refused")
                    .containsEntry(CheckOutcome.ERROR_TYPE_KEY, "IOException");
        }

        @Test
        @DisplayName("failure without message should fall back to class name")
        void failureWithoutMessage() {
            var outcome = CheckOutcome.failure(new IllegalStateException(), Duration.ZERO);

            assertThat(outcome.message()).isEqualTo("Exception running check: java.lang.IllegalStateException");
        }

        @Test
        @DisplayName("timedOut should produce an error with the timeout category")
        void timedOutShouldProduceError() {
            var outcome = CheckOutcome.timedOut("CheckTimeout", "Check timed out after 1.0s", Duration.ofSeconds(1));

            assertThat(outcome.isError()).isTrue();
            assertThat(outcome.rawData()).containsEntry(CheckOutcome.ERROR_TYPE_KEY, "CheckTimeout");
            assertThat(outcome.elapsedSeconds()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("withElapsed should keep everything else")
        void withElapsedShouldKeepFields() {
            var original = CheckOutcome.warning("slow", Duration.ZERO, Map.of("k", "v"));
            var copy = original.withElapsed(Duration.ofMillis(250));

            assertThat(copy.kind()).isEqualTo(OutcomeKind.WARNING);
            assertThat(copy.message()).isEqualTo("slow");
            assertThat(copy.rawData()).isEqualTo(original.rawData());
            assertThat(copy.timestamp()).isEqualTo(original.timestamp());
            assertThat(copy.elapsed()).isEqualTo(Duration.ofMillis(250));
        }
    }

    @Nested
    @DisplayName("OutcomeKind")
    class Kinds {

        @Test
        @DisplayName("worse should return the more severe kind")
        void worseShouldReturnMoreSevere() {
            assertThat(OutcomeKind.SUCCESS.worse(OutcomeKind.WARNING)).isEqualTo(OutcomeKind.WARNING);
            assertThat(OutcomeKind.ERROR.worse(OutcomeKind.WARNING)).isEqualTo(OutcomeKind.ERROR);
            assertThat(OutcomeKind.SUCCESS.worse(OutcomeKind.SUCCESS)).isEqualTo(OutcomeKind.SUCCESS);
        }

        @Test
        @DisplayName("should map wire names both ways")
        void shouldMapWireNames() {
            assertThat(OutcomeKind.WARNING.wireName()).isEqualTo("warning");
            assertThat(OutcomeKind.fromWireName("error")).isEqualTo(OutcomeKind.ERROR);
            assertThatThrownBy(() -> OutcomeKind.fromWireName("degraded"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
