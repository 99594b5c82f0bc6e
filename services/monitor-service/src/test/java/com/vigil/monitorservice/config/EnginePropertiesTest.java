package com.vigil.monitorservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.batch.BatchOptions;
import com.vigil.batch.BoundedWorkerPool;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EngineProperties")
class EnginePropertiesTest {

    @Test
    @DisplayName("defaults worker count and request limit when unset")
    void appliesDefaults() {
        var props = new EngineProperties(null, null, null, null, null);

        assertThat(props.maxWorkers()).isEqualTo(BoundedWorkerPool.defaultMaxWorkers());
        assertThat(props.maxChecksPerRequest()).isEqualTo(EngineProperties.DEFAULT_MAX_CHECKS_PER_REQUEST);
    }

    @Test
    @DisplayName("converts to batch options")
    void convertsToOptions() {
        var props = new EngineProperties(8, 25, Duration.ofSeconds(10), Duration.ofMinutes(2), 100);

        assertThat(props.toOptions())
                .isEqualTo(new BatchOptions(8, 25, Duration.ofSeconds(10), Duration.ofMinutes(2)));
    }

    @Test
    @DisplayName("rejects non-positive timeouts when converting")
    void rejectsZeroTimeout() {
        var props = new EngineProperties(8, null, Duration.ZERO, null, null);

        assertThatThrownBy(props::toOptions).isInstanceOf(IllegalArgumentException.class);
    }
}
