package com.metricalerts.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Category of backing data a rule's metric is computed from.
 *
 * <p>Rules store the source as its plain string key so that a rule
 * authored with an unsupported source still loads; {@link #fromKey(String)}
 * returns empty for such values and the rule resolves to "metric unavailable".
 */
public enum MetricSource {
    /** Aggregates over pipeline processing events (success/error rates, durations). */
    PIPELINE_EVENTS("pipeline_events"),
    /** Latest in-window sample from the generic performance metrics table. */
    PERFORMANCE_METRICS("performance_metrics"),
    /** Health values computed on demand at evaluation time. */
    SYSTEM_HEALTH("system_health");

    private final String key;

    MetricSource(String key) {
        this.key = key;
    }

    public static Optional<MetricSource> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(source -> source.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
