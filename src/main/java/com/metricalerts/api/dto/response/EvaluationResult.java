package com.metricalerts.api.dto.response;

import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.EvaluationOutcome;
import com.metricalerts.domain.enums.TriggerOutcome;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of evaluating one rule in one run. Ephemeral, never persisted.
 *
 * <p>{@code triggered} reflects whether the condition held, not whether a new alert
 * row was written; {@code triggerOutcome} tells the two apart. {@code success} is false
 * only for missing data and evaluation errors. A cooldown suppression is a successful
 * evaluation.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResult {

    public static final String REASON_METRIC_UNAVAILABLE = "metric unavailable";
    public static final String REASON_COOLDOWN = "cooldown";

    private boolean success;
    private String ruleId;
    private String ruleName;
    private boolean triggered;
    private EvaluationOutcome outcome;
    /** Null when the metric could not be resolved or evaluation failed before resolving it. */
    private BigDecimal metricValue;
    private BigDecimal thresholdValue;
    private String thresholdOperator;
    private AlertSeverity severity;
    /** Set only when the alert trigger was invoked. */
    private TriggerOutcome triggerOutcome;
    private String reason;
    private long evaluationTimeMs;
}
