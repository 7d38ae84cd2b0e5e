package com.metricalerts.domain.model;

import com.metricalerts.domain.enums.AlertSeverity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Domain model for a metric alert rule.
 *
 * <p>A rule defines: IF metric (from source, over the trailing window) compares to
 * threshold via operator THEN raise an alert of the given severity, at most once per
 * cooldown window. Rules are authored externally and are read-only to the evaluation
 * engine.
 *
 * <p>{@code metricSource} and {@code thresholdOperator} are kept as the raw stored
 * strings. A value the engine does not recognise is a configuration problem for that
 * one rule and must never fail loading of the whole rule set.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRule {

    private String id;
    private String name;
    private String description;

    // What to measure
    private String metricName;
    /** Source key, e.g. "pipeline_events". See {@link com.metricalerts.domain.enums.MetricSource}. */
    private String metricSource;

    @Builder.Default
    private Integer evaluationWindowMinutes = 5;

    // Threshold
    private BigDecimal thresholdValue;
    /** Operator symbol, e.g. ">=". See {@link com.metricalerts.domain.enums.ThresholdOperator}. */
    private String thresholdOperator;
    /** Display only (e.g. "ms", "percentage"). */
    private String thresholdUnit;

    private AlertSeverity severity;

    @Builder.Default
    private boolean enabled = true;

    // Suppression
    @Builder.Default
    private Integer cooldownMinutes = 15;
    /** Max alerts created per hour (null = unlimited). */
    private Integer maxAlertsPerHour;

    /** Owning team; null means the rule is global. */
    private String teamId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
