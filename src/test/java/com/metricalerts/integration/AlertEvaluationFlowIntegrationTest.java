package com.metricalerts.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.metricalerts.api.dto.request.EvaluationRequest;
import com.metricalerts.api.dto.response.EvaluationResponse;
import com.metricalerts.api.dto.response.EvaluationResult;
import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.AlertStatus;
import com.metricalerts.domain.enums.EvaluationOutcome;
import com.metricalerts.domain.enums.PipelineEventStatus;
import com.metricalerts.domain.enums.TriggerOutcome;
import com.metricalerts.entity.AlertEntity;
import com.metricalerts.entity.AlertHistoryEntity;
import com.metricalerts.entity.AlertRuleEntity;
import com.metricalerts.evaluation.AlertEvaluationConfig;
import com.metricalerts.evaluation.AlertEvaluationEngine;
import com.metricalerts.evaluation.AlertTrigger;
import com.metricalerts.evaluation.ConditionEvaluator;
import com.metricalerts.evaluation.CooldownGate;
import com.metricalerts.evaluation.metric.MetricResolver;
import com.metricalerts.evaluation.metric.impl.PerformanceMetricHandler;
import com.metricalerts.evaluation.metric.impl.PipelineEventMetricHandler;
import com.metricalerts.evaluation.metric.impl.SystemHealthMetricHandler;
import com.metricalerts.event.AlertCreatedEvent;
import com.metricalerts.event.EvaluationCompletedEvent;
import com.metricalerts.observability.EvaluationMetricsService;
import com.metricalerts.repository.jpa.AlertHistoryJpaRepository;
import com.metricalerts.repository.jpa.AlertJpaRepository;
import com.metricalerts.repository.jpa.AlertRuleJpaRepository;
import com.metricalerts.repository.jpa.PerformanceMetricJpaRepository;
import com.metricalerts.repository.jpa.PipelineEventMetricJpaRepository;
import com.metricalerts.repository.jpa.PipelineEventMetricJpaRepository.StatusCounts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Cross-service test of a full evaluation flow. Wires the real engine, resolver, handlers,
 * cooldown gate, trigger and metrics listener together; repositories are mocked, with the
 * alert table backed by an in-memory list so cooldown and deduplication see earlier runs.
 *
 * <p>Lenient strictness because the in-memory repository answers are registered once for
 * every scenario.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AlertEvaluationFlowIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private AlertRuleJpaRepository alertRuleJpaRepository;

    @Mock
    private AlertJpaRepository alertJpaRepository;

    @Mock
    private AlertHistoryJpaRepository alertHistoryJpaRepository;

    @Mock
    private PipelineEventMetricJpaRepository pipelineEventMetricJpaRepository;

    @Mock
    private PerformanceMetricJpaRepository performanceMetricJpaRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final List<AlertEntity> alertTable = new ArrayList<>();
    private final List<AlertHistoryEntity> historyTable = new ArrayList<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private MovableClock clock;
    private AlertEvaluationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MovableClock(START);
        AlertEvaluationConfig config = new AlertEvaluationConfig();
        EvaluationMetricsService metricsService = new EvaluationMetricsService(meterRegistry);
        ApplicationEventPublisher publisher = event -> {
            if (event instanceof AlertCreatedEvent alertCreatedEvent) {
                metricsService.onAlertCreated(alertCreatedEvent);
            } else if (event instanceof EvaluationCompletedEvent completedEvent) {
                metricsService.onEvaluationCompleted(completedEvent);
            }
        };

        MetricResolver metricResolver = new MetricResolver(
                List.of(
                        new PipelineEventMetricHandler(pipelineEventMetricJpaRepository),
                        new PerformanceMetricHandler(performanceMetricJpaRepository),
                        new SystemHealthMetricHandler(alertRuleJpaRepository, config)),
                clock);
        AlertTrigger alertTrigger = new AlertTrigger(
                alertJpaRepository, alertHistoryJpaRepository, config, publisher, transactionManager, clock);
        engine = new AlertEvaluationEngine(
                alertRuleJpaRepository,
                metricResolver,
                new CooldownGate(alertJpaRepository, clock),
                new ConditionEvaluator(),
                alertTrigger,
                config,
                publisher,
                Runnable::run,
                clock);

        wireAlertTable();
        // 20 events in the window, 3 of them FAILED or TIMEOUT
        StatusCounts counts = mock(StatusCounts.class);
        when(counts.getTotal()).thenReturn(20L);
        when(counts.getMatching()).thenReturn(3L);
        when(pipelineEventMetricJpaRepository.countStatusesSince(eq(PipelineEventStatus.ERROR_STATUSES), any()))
                .thenReturn(counts);
    }

    private void wireAlertTable() {
        when(alertJpaRepository.saveAndFlush(any(AlertEntity.class))).thenAnswer(invocation -> {
            AlertEntity alert = invocation.getArgument(0);
            alertTable.add(alert);
            return alert;
        });
        when(alertHistoryJpaRepository.saveAndFlush(any(AlertHistoryEntity.class))).thenAnswer(invocation -> {
            AlertHistoryEntity history = invocation.getArgument(0);
            historyTable.add(history);
            return history;
        });
        when(alertJpaRepository.findFirstByAlertRuleIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        anyString(), any(LocalDateTime.class)))
                .thenAnswer(invocation -> {
                    String ruleId = invocation.getArgument(0);
                    LocalDateTime since = invocation.getArgument(1);
                    return alertTable.stream()
                            .filter(a -> a.getAlertRuleId().equals(ruleId) && !a.getCreatedAt().isBefore(since))
                            .max(Comparator.comparing(AlertEntity::getCreatedAt));
                });
        when(alertJpaRepository.findByAlertRuleIdAndStatusIn(anyString(), anyCollection()))
                .thenAnswer(invocation -> {
                    String ruleId = invocation.getArgument(0);
                    Collection<AlertStatus> statuses = invocation.getArgument(1);
                    return alertTable.stream()
                            .filter(a -> a.getAlertRuleId().equals(ruleId) && statuses.contains(a.getStatus()))
                            .toList();
                });
        when(alertJpaRepository.countByAlertRuleIdAndCreatedAtGreaterThanEqual(anyString(), any(LocalDateTime.class)))
                .thenAnswer(invocation -> {
                    String ruleId = invocation.getArgument(0);
                    LocalDateTime since = invocation.getArgument(1);
                    return alertTable.stream()
                            .filter(a -> a.getAlertRuleId().equals(ruleId) && !a.getCreatedAt().isBefore(since))
                            .count();
                });
    }

    private static AlertRuleEntity errorRateRule(int cooldownMinutes, Integer maxAlertsPerHour) {
        return AlertRuleEntity.builder()
                .id("rule-error-rate")
                .name("High pipeline error rate")
                .metricName("error_rate")
                .metricSource("pipeline_events")
                .evaluationWindowMinutes(15)
                .thresholdValue(new BigDecimal("10"))
                .thresholdOperator(">")
                .thresholdUnit("%")
                .severity(AlertSeverity.HIGH)
                .cooldownMinutes(cooldownMinutes)
                .maxAlertsPerHour(maxAlertsPerHour)
                .build();
    }

    private EvaluationResult runSingle() {
        EvaluationResponse response = engine.runEvaluation(new EvaluationRequest());
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResults()).hasSize(1);
        return response.getResults().get(0);
    }

    @Test
    @DisplayName("Threshold breach creates an alert, cooldown suppresses, resolution plus cooldown expiry re-alerts")
    void alertLifecycle() {
        when(alertRuleJpaRepository.findByEnabledTrue()).thenReturn(List.of(errorRateRule(60, null)));

        EvaluationResult first = runSingle();
        assertThat(first.isTriggered()).isTrue();
        assertThat(first.getTriggerOutcome()).isEqualTo(TriggerOutcome.CREATED);
        assertThat(first.getMetricValue()).isEqualByComparingTo("15");
        assertThat(alertTable).hasSize(1);
        AlertEntity alert = alertTable.get(0);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getMetricValue()).isEqualByComparingTo("15");
        assertThat(alert.getTitle()).isEqualTo("High pipeline error rate - Threshold > 10");
        assertThat(historyTable).extracting(AlertHistoryEntity::getAlertId).containsExactly(alert.getId());

        clock.advance(Duration.ofMinutes(5));
        EvaluationResult second = runSingle();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isTriggered()).isFalse();
        assertThat(second.getOutcome()).isEqualTo(EvaluationOutcome.COOLDOWN);
        assertThat(alertTable).hasSize(1);

        alert.setStatus(AlertStatus.RESOLVED);
        clock.advance(Duration.ofMinutes(85));
        EvaluationResult third = runSingle();
        assertThat(third.getTriggerOutcome()).isEqualTo(TriggerOutcome.CREATED);
        assertThat(alertTable).hasSize(2);
        assertThat(alertTable.get(1).getCreatedAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 11, 30));

        assertThat(meterRegistry.get("alert.evaluation.alerts.created").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("alert.evaluation.rules").tag("outcome", "cooldown").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repeated breach without cooldown keeps a single unresolved alert")
    void deduplication() {
        when(alertRuleJpaRepository.findByEnabledTrue()).thenReturn(List.of(errorRateRule(0, null)));

        EvaluationResult first = runSingle();
        clock.advance(Duration.ofMinutes(5));
        EvaluationResult second = runSingle();

        assertThat(first.getTriggerOutcome()).isEqualTo(TriggerOutcome.CREATED);
        assertThat(second.isTriggered()).isTrue();
        assertThat(second.getTriggerOutcome()).isEqualTo(TriggerOutcome.ALREADY_ACTIVE);
        assertThat(alertTable).hasSize(1);
    }

    @Test
    @DisplayName("Acknowledged alert still blocks a new one")
    void acknowledgedBlocks() {
        when(alertRuleJpaRepository.findByEnabledTrue()).thenReturn(List.of(errorRateRule(0, null)));

        runSingle();
        alertTable.get(0).setStatus(AlertStatus.ACKNOWLEDGED);
        clock.advance(Duration.ofMinutes(1));

        assertThat(runSingle().getTriggerOutcome()).isEqualTo(TriggerOutcome.ALREADY_ACTIVE);
        assertThat(alertTable).hasSize(1);
    }

    @Test
    @DisplayName("Hourly budget stops further alerts after resolution")
    void rateLimit() {
        when(alertRuleJpaRepository.findByEnabledTrue()).thenReturn(List.of(errorRateRule(0, 1)));

        runSingle();
        alertTable.get(0).setStatus(AlertStatus.RESOLVED);
        clock.advance(Duration.ofMinutes(10));
        assertThat(runSingle().getTriggerOutcome()).isEqualTo(TriggerOutcome.RATE_LIMITED);

        clock.advance(Duration.ofMinutes(55));
        assertThat(runSingle().getTriggerOutcome()).isEqualTo(TriggerOutcome.CREATED);
        assertThat(alertTable).hasSize(2);
    }

    @Test
    @DisplayName("Batch with a misconfigured rule still evaluates every rule")
    void mixedBatch() {
        AlertRuleEntity unknownSource = errorRateRule(0, null);
        unknownSource.setId("rule-unknown");
        unknownSource.setMetricSource("prometheus");
        AlertRuleEntity latency = AlertRuleEntity.builder()
                .id("rule-latency")
                .name("Slow responses")
                .metricName("p95_latency_ms")
                .metricSource("performance_metrics")
                .evaluationWindowMinutes(5)
                .thresholdValue(new BigDecimal("500"))
                .thresholdOperator(">")
                .severity(AlertSeverity.MEDIUM)
                .build();
        when(alertRuleJpaRepository.findByEnabledTrue())
                .thenReturn(List.of(errorRateRule(60, null), unknownSource, latency));
        when(performanceMetricJpaRepository.findFirstByMetricNameAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        anyString(), any(LocalDateTime.class)))
                .thenReturn(Optional.empty());

        EvaluationResponse response = engine.runEvaluation(
                EvaluationRequest.builder().source("cron").build());

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResults())
                .extracting(EvaluationResult::getRuleId)
                .containsExactly("rule-error-rate", "rule-unknown", "rule-latency");
        assertThat(response.getResults())
                .extracting(EvaluationResult::isSuccess)
                .containsExactly(true, false, false);
        assertThat(response.getSummary().getTotalRules()).isEqualTo(3);
        assertThat(response.getSummary().getTriggeredAlerts()).isEqualTo(1);
        assertThat(alertTable).hasSize(1);
    }

    /** Clock whose instant tests move forward explicitly. */
    private static final class MovableClock extends Clock {

        private Instant instant;

        MovableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
