package com.metricalerts.api.dto.response;

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
 * REST API response DTO for an alert row.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertResponse {

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
    private LocalDateTime resolvedAt;
}
