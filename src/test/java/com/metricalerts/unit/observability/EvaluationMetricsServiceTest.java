package com.metricalerts.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.metricalerts.api.dto.response.EvaluationResponse;
import com.metricalerts.api.dto.response.EvaluationResult;
import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.EvaluationOutcome;
import com.metricalerts.domain.model.Alert;
import com.metricalerts.event.AlertCreatedEvent;
import com.metricalerts.event.EvaluationCompletedEvent;
import com.metricalerts.observability.EvaluationMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EvaluationMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private EvaluationMetricsService evaluationMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        evaluationMetricsService = new EvaluationMetricsService(meterRegistry);
    }

    private static EvaluationResult result(EvaluationOutcome outcome) {
        return EvaluationResult.builder().ruleId("r").outcome(outcome).build();
    }

    @Test
    @DisplayName("alert.evaluation.rules counts each result by outcome")
    void countsRulesByOutcome() {
        EvaluationResponse response = EvaluationResponse.builder()
                .success(true)
                .results(List.of(
                        result(EvaluationOutcome.TRIGGERED),
                        result(EvaluationOutcome.BELOW_THRESHOLD),
                        result(EvaluationOutcome.BELOW_THRESHOLD),
                        result(EvaluationOutcome.FAILED)))
                .summary(EvaluationResponse.Summary.builder()
                        .totalRules(4)
                        .triggeredAlerts(1)
                        .evaluationTimeMs(120)
                        .build())
                .build();

        evaluationMetricsService.onEvaluationCompleted(new EvaluationCompletedEvent(this, response, "webhook"));

        assertThat(meterRegistry.get("alert.evaluation.rules").tag("outcome", "below_threshold").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("alert.evaluation.rules").tag("outcome", "triggered").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("alert.evaluation.rules").tag("outcome", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("alert.evaluation.run.duration records the run's evaluation time")
    void recordsRunDuration() {
        EvaluationResponse response = EvaluationResponse.builder()
                .success(true)
                .results(List.of())
                .summary(EvaluationResponse.Summary.builder().evaluationTimeMs(250).build())
                .build();

        evaluationMetricsService.onEvaluationCompleted(new EvaluationCompletedEvent(this, response, "cron"));

        assertThat(meterRegistry.get("alert.evaluation.run.duration").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.get("alert.evaluation.run.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(250.0);
    }

    @Test
    @DisplayName("alert.evaluation.alerts.created counts new alerts by severity")
    void countsCreatedAlerts() {
        Alert alert = Alert.builder().id("a1").severity(AlertSeverity.CRITICAL).build();

        evaluationMetricsService.onAlertCreated(new AlertCreatedEvent(this, alert));
        evaluationMetricsService.onAlertCreated(new AlertCreatedEvent(this, alert));

        assertThat(meterRegistry.get("alert.evaluation.alerts.created").tag("severity", "critical").counter().count())
                .isEqualTo(2.0);
    }
}
