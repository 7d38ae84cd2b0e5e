package com.metricalerts.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the common {@code application} tag on every meter. The evaluation meters
 * themselves live in {@link com.metricalerts.observability.EvaluationMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "metric-alerts");
    }
}
