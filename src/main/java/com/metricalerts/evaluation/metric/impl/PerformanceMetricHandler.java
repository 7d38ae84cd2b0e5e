package com.metricalerts.evaluation.metric.impl;

import com.metricalerts.domain.enums.MetricSource;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.entity.PerformanceMetricEntity;
import com.metricalerts.evaluation.metric.MetricSourceHandler;
import com.metricalerts.repository.jpa.PerformanceMetricJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Returns the most recent sample of the rule's metric name recorded inside the window.
 * Samples older than the window are never used; with no in-window sample the metric is
 * unavailable.
 */
@Component
public class PerformanceMetricHandler implements MetricSourceHandler {

    private final PerformanceMetricJpaRepository performanceMetricJpaRepository;

    public PerformanceMetricHandler(PerformanceMetricJpaRepository performanceMetricJpaRepository) {
        this.performanceMetricJpaRepository = performanceMetricJpaRepository;
    }

    @Override
    public Optional<BigDecimal> resolve(AlertRule alertRule, LocalDateTime windowStart) {
        if (alertRule.getMetricName() == null) {
            return Optional.empty();
        }
        return performanceMetricJpaRepository
                .findFirstByMetricNameAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        alertRule.getMetricName(), windowStart)
                .map(PerformanceMetricEntity::getMetricValue);
    }

    @Override
    public MetricSource getSource() {
        return MetricSource.PERFORMANCE_METRICS;
    }
}
