package com.metricalerts.evaluation;

import com.metricalerts.api.dto.request.EvaluationRequest;
import com.metricalerts.api.dto.response.EvaluationResponse;
import com.metricalerts.api.dto.response.EvaluationResult;
import com.metricalerts.config.EvaluationExecutorConfig;
import com.metricalerts.domain.enums.EvaluationOutcome;
import com.metricalerts.domain.enums.TriggerOutcome;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.evaluation.metric.MetricResolver;
import com.metricalerts.event.EvaluationCompletedEvent;
import com.metricalerts.exception.RuleSetUnavailableException;
import com.metricalerts.mapper.AlertRuleMapper;
import com.metricalerts.repository.jpa.AlertRuleJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs one evaluation pass over the requested rule set.
 *
 * <p>Per rule: resolve the metric, check cooldown, compare against the threshold and, if
 * the condition holds, hand over to {@link AlertTrigger}. Rules are evaluated
 * concurrently on the bounded evaluation executor and reported in rule-set order.
 *
 * <p>A rule that fails is reported as {@code success=false} with the failure reason and
 * never aborts the run. The run as a whole fails only when the rule set itself cannot be
 * fetched.
 */
@Service
public class AlertEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluationEngine.class);

    static final String DISABLED_MESSAGE = "Alert evaluation is disabled";

    private final AlertRuleJpaRepository alertRuleJpaRepository;
    private final MetricResolver metricResolver;
    private final CooldownGate cooldownGate;
    private final ConditionEvaluator conditionEvaluator;
    private final AlertTrigger alertTrigger;
    private final AlertEvaluationConfig alertEvaluationConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Executor evaluationExecutor;
    private final Clock clock;
    private final AlertRuleMapper alertRuleMapper = Mappers.getMapper(AlertRuleMapper.class);

    public AlertEvaluationEngine(
            AlertRuleJpaRepository alertRuleJpaRepository,
            MetricResolver metricResolver,
            CooldownGate cooldownGate,
            ConditionEvaluator conditionEvaluator,
            AlertTrigger alertTrigger,
            AlertEvaluationConfig alertEvaluationConfig,
            ApplicationEventPublisher applicationEventPublisher,
            @Qualifier(EvaluationExecutorConfig.EVALUATION_EXECUTOR) Executor evaluationExecutor,
            Clock clock) {
        this.alertRuleJpaRepository = alertRuleJpaRepository;
        this.metricResolver = metricResolver;
        this.cooldownGate = cooldownGate;
        this.conditionEvaluator = conditionEvaluator;
        this.alertTrigger = alertTrigger;
        this.alertEvaluationConfig = alertEvaluationConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.evaluationExecutor = evaluationExecutor;
        this.clock = clock;
    }

    public EvaluationResponse runEvaluation(EvaluationRequest request) {
        long startNanos = System.nanoTime();
        String invocationSource = request.getSourceOrDefault();
        log.info("Alert evaluation requested: ruleId={}, teamId={}, force={}, source={}",
                request.getRuleId(), request.getTeamId(), request.isForce(), invocationSource);

        if (!alertEvaluationConfig.isEnabled()) {
            log.info("Alert evaluation disabled, skipping run");
            return response(true, DISABLED_MESSAGE, List.of(), startNanos);
        }

        List<AlertRule> rules;
        try {
            rules = resolveRuleSet(request);
        } catch (RuleSetUnavailableException e) {
            log.error("Alert evaluation failed: {}", e.getMessage(), e);
            return response(false, "Alert evaluation failed: " + e.getMessage(), List.of(), startNanos);
        }

        List<CompletableFuture<EvaluationResult>> futures =
                rules.stream().map(this::submitRule).toList();
        List<EvaluationResult> results =
                futures.stream().map(CompletableFuture::join).toList();

        EvaluationResponse response =
                response(true, "Evaluated " + results.size() + " alert rules", results, startNanos);
        log.info("Alert evaluation completed: {} rules, {} triggered, {} ms",
                response.getSummary().getTotalRules(),
                response.getSummary().getTriggeredAlerts(),
                response.getSummary().getEvaluationTimeMs());
        applicationEventPublisher.publishEvent(new EvaluationCompletedEvent(this, response, invocationSource));
        return response;
    }

    private List<AlertRule> resolveRuleSet(EvaluationRequest request) {
        try {
            if (hasText(request.getRuleId())) {
                Optional<AlertRule> rule = alertRuleJpaRepository
                        .findByIdAndEnabledTrue(request.getRuleId())
                        .map(alertRuleMapper::toDomain);
                if (rule.isEmpty()) {
                    log.warn("Alert rule {} not found or disabled", request.getRuleId());
                }
                return rule.map(List::of).orElse(List.of());
            }
            if (hasText(request.getTeamId())) {
                return alertRuleMapper.toDomainList(
                        alertRuleJpaRepository.findByEnabledTrueAndTeamId(request.getTeamId()));
            }
            return alertRuleMapper.toDomainList(alertRuleJpaRepository.findByEnabledTrue());
        } catch (DataAccessException e) {
            throw new RuleSetUnavailableException("Failed to fetch alert rules: " + e.getMessage(), e);
        }
    }

    private CompletableFuture<EvaluationResult> submitRule(AlertRule rule) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluateRule(rule), evaluationExecutor)
                    .exceptionally(ex -> failedResult(rule, null, ex, System.nanoTime()));
        } catch (RejectedExecutionException e) {
            // a rejected task never completes its future, so fail the rule here
            return CompletableFuture.completedFuture(failedResult(rule, null, e, System.nanoTime()));
        }
    }

    private EvaluationResult evaluateRule(AlertRule rule) {
        long startNanos = System.nanoTime();
        BigDecimal metricValue = null;
        try {
            Optional<BigDecimal> resolved = metricResolver.resolve(rule);
            if (resolved.isEmpty()) {
                log.debug("Metric {}/{} unavailable for rule {}", rule.getMetricSource(), rule.getMetricName(), rule.getId());
                return baseResult(rule, startNanos)
                        .success(false)
                        .outcome(EvaluationOutcome.METRIC_UNAVAILABLE)
                        .reason(EvaluationResult.REASON_METRIC_UNAVAILABLE)
                        .build();
            }
            metricValue = resolved.get();

            if (cooldownGate.isInCooldown(rule)) {
                return baseResult(rule, startNanos)
                        .success(true)
                        .metricValue(metricValue)
                        .outcome(EvaluationOutcome.COOLDOWN)
                        .reason(EvaluationResult.REASON_COOLDOWN)
                        .build();
            }

            if (!conditionEvaluator.evaluate(metricValue, rule.getThresholdValue(), rule.getThresholdOperator())) {
                return baseResult(rule, startNanos)
                        .success(true)
                        .metricValue(metricValue)
                        .outcome(EvaluationOutcome.BELOW_THRESHOLD)
                        .build();
            }

            TriggerOutcome triggerOutcome = alertTrigger.trigger(rule, metricValue);
            return baseResult(rule, startNanos)
                    .success(true)
                    .triggered(true)
                    .metricValue(metricValue)
                    .outcome(EvaluationOutcome.TRIGGERED)
                    .triggerOutcome(triggerOutcome)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Error evaluating rule {} ({}): {}", rule.getId(), rule.getName(), e.getMessage(), e);
            return failedResult(rule, metricValue, e, startNanos);
        }
    }

    private EvaluationResult failedResult(AlertRule rule, BigDecimal metricValue, Throwable error, long startNanos) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        return baseResult(rule, startNanos)
                .success(false)
                .metricValue(metricValue)
                .outcome(EvaluationOutcome.FAILED)
                .reason("Evaluation error: " + cause.getMessage())
                .build();
    }

    private EvaluationResult.EvaluationResultBuilder baseResult(AlertRule rule, long startNanos) {
        return EvaluationResult.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .thresholdValue(rule.getThresholdValue())
                .thresholdOperator(rule.getThresholdOperator())
                .severity(rule.getSeverity())
                .evaluationTimeMs(elapsedMs(startNanos));
    }

    private EvaluationResponse response(
            boolean success, String message, List<EvaluationResult> results, long startNanos) {
        int triggered = (int) results.stream().filter(EvaluationResult::isTriggered).count();
        return EvaluationResponse.builder()
                .success(success)
                .message(message)
                .results(results)
                .summary(EvaluationResponse.Summary.builder()
                        .totalRules(results.size())
                        .triggeredAlerts(triggered)
                        .evaluationTimeMs(elapsedMs(startNanos))
                        .build())
                .timestamp(clock.instant())
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
