package com.vigil.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out Micrometer meters that all carry an {@code engine} tag.
 * <p>
 * Check meters are looked up per check type and outcome from worker threads. The registry
 * returns the existing meter for an identical id, so lookups may repeat. Gauge values are held
 * here since Micrometer only keeps a weak reference to them.
 */
public final class MetricFactory {

    public static final String TAG_ENGINE = "engine";

    private final MeterRegistry registry;
    private final String engineName;
    private final Tags engineTags;
    private final Map<GaugeKey, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    public MetricFactory(MeterRegistry registry, String engineName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (engineName == null || engineName.isBlank()) {
            throw new IllegalArgumentException("engineName must not be null or blank");
        }
        this.registry = registry;
        this.engineName = engineName;
        this.engineTags = Tags.of(TAG_ENGINE, engineName);
    }

    /**
     * Factory over its own {@link SimpleMeterRegistry}, for engines whose metrics are not exported.
     */
    public static MetricFactory standalone(String engineName) {
        return new MetricFactory(new SimpleMeterRegistry(), engineName);
    }

    /**
     * @param tags alternating tag keys and values, added to the engine tag
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    /**
     * Returns the value behind a gauge, registering the gauge the first time a name and tag set
     * is seen. The same name and tags always give the same {@link AtomicLong}.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        return gaugeValues.computeIfAbsent(new GaugeKey(name, List.of(tags)), key -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(tagged(tags))
                    .register(registry);
            return value;
        });
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String engineName() {
        return engineName;
    }

    private Tags tagged(String... tags) {
        return tags.length == 0 ? engineTags : engineTags.and(tags);
    }

    private record GaugeKey(String name, List<String> tags) {
    }
}
