package com.metricalerts.domain.model;

import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.AlertStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Domain model for an alert raised by a rule.
 *
 * <p>Severity, threshold and operator are snapshots taken when the alert fired, not
 * live references to the rule. {@code context} holds the structured payload written at
 * fire time (rule name, window, source, fire timestamp, trigger mechanism).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    private String id;
    private String alertRuleId;

    private String title;
    private String description;
    private AlertSeverity severity;
    private AlertStatus status;

    private String metricName;
    private BigDecimal metricValue;
    private BigDecimal thresholdValue;
    private String thresholdOperator;

    private Map<String, Object> context;

    private String teamId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime acknowledgedAt;
    private LocalDateTime resolvedAt;
}
