package com.metricalerts.entity;

import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.AlertStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alerts table.
 *
 * <p>Rows are inserted by the AlertTrigger when a rule fires and are never modified by
 * the evaluation engine afterwards. The downstream delivery system watches this table
 * for new ACTIVE rows. The context column holds a JSON object describing the firing.
 */
@Entity
@Table(
        name = "alerts",
        indexes = {
            @Index(name = "idx_alerts_rule_created", columnList = "alert_rule_id, created_at"),
            @Index(name = "idx_alerts_rule_status", columnList = "alert_rule_id, status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "alert_rule_id", nullable = false, length = 36)
    private String alertRuleId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, columnDefinition = "varchar(20)")
    private AlertSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private AlertStatus status;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "metric_value", precision = 15, scale = 4)
    private BigDecimal metricValue;

    @Column(name = "threshold_value", precision = 15, scale = 4)
    private BigDecimal thresholdValue;

    @Column(name = "threshold_operator", length = 10)
    private String thresholdOperator;

    @Column(name = "context", columnDefinition = "TEXT")
    private String context;

    @Column(name = "team_id", length = 36)
    private String teamId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
