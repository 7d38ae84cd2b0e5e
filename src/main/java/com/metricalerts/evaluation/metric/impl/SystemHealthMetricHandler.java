package com.metricalerts.evaluation.metric.impl;

import com.metricalerts.domain.enums.MetricSource;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.evaluation.AlertEvaluationConfig;
import com.metricalerts.evaluation.metric.MetricSourceHandler;
import com.metricalerts.repository.jpa.AlertRuleJpaRepository;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * System health metrics computed at evaluation time rather than read from history.
 *
 * <p>{@code api_response_time} times a trivial count query against the rule store and
 * reports the round-trip in milliseconds. The query carries a timeout hint, so a stalled
 * store surfaces as an exception instead of blocking the worker. {@code health_score}
 * reports {@link AlertEvaluationConfig#getHealthScorePlaceholder()} until a real health
 * aggregate exists. The evaluation window is ignored.
 */
@Component
public class SystemHealthMetricHandler implements MetricSourceHandler {

    public static final String API_RESPONSE_TIME = "api_response_time";
    public static final String HEALTH_SCORE = "health_score";

    private static final Logger log = LoggerFactory.getLogger(SystemHealthMetricHandler.class);

    private final AlertRuleJpaRepository alertRuleJpaRepository;
    private final AlertEvaluationConfig alertEvaluationConfig;

    public SystemHealthMetricHandler(
            AlertRuleJpaRepository alertRuleJpaRepository, AlertEvaluationConfig alertEvaluationConfig) {
        this.alertRuleJpaRepository = alertRuleJpaRepository;
        this.alertEvaluationConfig = alertEvaluationConfig;
    }

    @Override
    public Optional<BigDecimal> resolve(AlertRule alertRule, LocalDateTime windowStart) {
        String metricName = alertRule.getMetricName();
        if (API_RESPONSE_TIME.equals(metricName)) {
            return Optional.of(measureStoreLatency());
        }
        if (HEALTH_SCORE.equals(metricName)) {
            return Optional.ofNullable(alertEvaluationConfig.getHealthScorePlaceholder());
        }
        log.warn("Unknown system health metric '{}' on rule {}", metricName, alertRule.getId());
        return Optional.empty();
    }

    @Override
    public MetricSource getSource() {
        return MetricSource.SYSTEM_HEALTH;
    }

    private BigDecimal measureStoreLatency() {
        long startNanos = System.nanoTime();
        alertRuleJpaRepository.pingRuleCount();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        log.debug("Store latency ping took {} ms", elapsedMs);
        return BigDecimal.valueOf(elapsedMs);
    }
}
