package com.metricalerts.entity;

import com.metricalerts.domain.enums.AlertSeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alert_rules table.
 *
 * <p>Each rule watches one named metric from one metric source over a trailing
 * window and compares it against a threshold. metric_source and threshold_operator
 * are stored as plain strings; interpretation happens at evaluation time so that an
 * unsupported value only affects its own rule.
 */
@Entity
@Table(name = "alert_rules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRuleEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "metric_source", nullable = false, length = 100)
    private String metricSource;

    @Builder.Default
    @Column(name = "evaluation_window_minutes")
    private Integer evaluationWindowMinutes = 5;

    @Column(name = "threshold_value", nullable = false, precision = 15, scale = 4)
    private BigDecimal thresholdValue;

    @Column(name = "threshold_operator", nullable = false, length = 10)
    private String thresholdOperator;

    @Column(name = "threshold_unit", length = 20)
    private String thresholdUnit;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, columnDefinition = "varchar(20)")
    private AlertSeverity severity;

    @Builder.Default
    @Column(name = "enabled")
    private boolean enabled = true;

    @Builder.Default
    @Column(name = "cooldown_minutes")
    private Integer cooldownMinutes = 15;

    @Column(name = "max_alerts_per_hour")
    private Integer maxAlertsPerHour;

    @Column(name = "team_id", length = 36)
    private String teamId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
