package com.metricalerts.evaluation;

import com.metricalerts.domain.enums.AlertStatus;
import com.metricalerts.domain.enums.TriggerOutcome;
import com.metricalerts.domain.model.Alert;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.entity.AlertEntity;
import com.metricalerts.entity.AlertHistoryEntity;
import com.metricalerts.event.AlertCreatedEvent;
import com.metricalerts.exception.AlertPersistenceException;
import com.metricalerts.mapper.AlertMapper;
import com.metricalerts.mapper.JsonHelper;
import com.metricalerts.repository.jpa.AlertHistoryJpaRepository;
import com.metricalerts.repository.jpa.AlertJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates an alert for a rule whose condition held, unless the rule already has an
 * unresolved alert or has reached its hourly alert budget.
 *
 * <p>The alert row and its "created" history row are written in one transaction, flushed
 * row by row and committed inside this class, so store failures at insert, flush or commit
 * all surface as {@link AlertPersistenceException}. Publishes {@link AlertCreatedEvent}
 * after commit for every new alert.
 *
 * <p>Deduplication is read-then-write without a lock. Two concurrent runs evaluating
 * the same rule can both pass the unresolved check; the window is a single rule's
 * evaluation time.
 */
@Service
public class AlertTrigger {

    private static final Logger log = LoggerFactory.getLogger(AlertTrigger.class);

    private final AlertJpaRepository alertJpaRepository;
    private final AlertHistoryJpaRepository alertHistoryJpaRepository;
    private final AlertEvaluationConfig alertEvaluationConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public AlertTrigger(
            AlertJpaRepository alertJpaRepository,
            AlertHistoryJpaRepository alertHistoryJpaRepository,
            AlertEvaluationConfig alertEvaluationConfig,
            ApplicationEventPublisher applicationEventPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.alertJpaRepository = alertJpaRepository;
        this.alertHistoryJpaRepository = alertHistoryJpaRepository;
        this.alertEvaluationConfig = alertEvaluationConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Records an alert for the rule at the given metric value.
     *
     * <p>The transaction commits before this method returns; {@link AlertCreatedEvent} is
     * only published for a committed alert.
     *
     * @return CREATED if a new alert was written, ALREADY_ACTIVE if an unresolved alert
     *     exists, RATE_LIMITED if the rule's hourly budget is spent
     * @throws AlertPersistenceException if reading, writing or committing to the alert store fails
     */
    public TriggerOutcome trigger(AlertRule alertRule, BigDecimal metricValue) {
        TriggerAttempt attempt;
        try {
            attempt = transactionTemplate.execute(status -> attemptTrigger(alertRule, metricValue));
        } catch (DataAccessException | TransactionException e) {
            throw new AlertPersistenceException(alertRule.getId(), "Failed to create alert: " + e.getMessage(), e);
        }
        if (attempt == null) {
            throw new AlertPersistenceException(alertRule.getId(), "Failed to create alert: no transaction result", null);
        }

        Alert alert = attempt.alert();
        if (alert != null) {
            log.info("Alert {} created for rule {} ({}): {}",
                    alert.getId(), alertRule.getId(), alert.getSeverity(), alert.getTitle());
            applicationEventPublisher.publishEvent(new AlertCreatedEvent(this, alert));
        }
        return attempt.outcome();
    }

    private TriggerAttempt attemptTrigger(AlertRule alertRule, BigDecimal metricValue) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<AlertEntity> unresolved =
                alertJpaRepository.findByAlertRuleIdAndStatusIn(alertRule.getId(), AlertStatus.UNRESOLVED);
        if (!unresolved.isEmpty()) {
            log.debug("Rule {} already has unresolved alert {}", alertRule.getId(), unresolved.get(0).getId());
            return new TriggerAttempt(TriggerOutcome.ALREADY_ACTIVE, null);
        }

        if (isRateLimited(alertRule, now)) {
            log.warn("Rule {} reached max {} alerts per window, skipping alert",
                    alertRule.getId(), alertRule.getMaxAlertsPerHour());
            return new TriggerAttempt(TriggerOutcome.RATE_LIMITED, null);
        }

        Alert alert = buildAlert(alertRule, metricValue, now);
        alertJpaRepository.saveAndFlush(alertMapper.toEntity(alert));
        alertHistoryJpaRepository.saveAndFlush(AlertHistoryEntity.builder()
                .alertId(alert.getId())
                .eventType(AlertHistoryEntity.EVENT_CREATED)
                .eventDescription("Alert created: " + alert.getTitle())
                .newStatus(AlertStatus.ACTIVE)
                .metadata(JsonHelper.toJson(historyMetadata(alert)))
                .createdAt(now)
                .build());
        return new TriggerAttempt(TriggerOutcome.CREATED, alert);
    }

    private boolean isRateLimited(AlertRule alertRule, LocalDateTime now) {
        Integer maxAlerts = alertRule.getMaxAlertsPerHour();
        if (maxAlerts == null || maxAlerts <= 0) {
            return false;
        }
        LocalDateTime windowStart = now.minusMinutes(alertEvaluationConfig.getRateLimitWindowMinutes());
        return alertJpaRepository.countByAlertRuleIdAndCreatedAtGreaterThanEqual(alertRule.getId(), windowStart)
                >= maxAlerts;
    }

    private Alert buildAlert(AlertRule alertRule, BigDecimal metricValue, LocalDateTime now) {
        String operator = alertRule.getThresholdOperator();
        String threshold = format(alertRule.getThresholdValue());
        String unit = alertRule.getThresholdUnit() == null ? "" : " " + alertRule.getThresholdUnit();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rule_name", alertRule.getName());
        context.put("evaluation_window_minutes", alertRule.getEvaluationWindowMinutes());
        context.put("metric_source", alertRule.getMetricSource());
        context.put("triggered_at", now.toString());
        context.put("triggered_by", alertEvaluationConfig.getTriggeredBy());

        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .alertRuleId(alertRule.getId())
                .title(alertRule.getName() + " - Threshold " + operator + " " + threshold)
                .description("Metric " + alertRule.getMetricName() + " is " + format(metricValue) + unit
                        + ", which " + operator + " threshold of " + threshold + unit)
                .severity(alertRule.getSeverity())
                .status(AlertStatus.ACTIVE)
                .metricName(alertRule.getMetricName())
                .metricValue(metricValue)
                .thresholdValue(alertRule.getThresholdValue())
                .thresholdOperator(operator)
                .context(context)
                .teamId(alertRule.getTeamId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static Map<String, Object> historyMetadata(Alert alert) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric_value", format(alert.getMetricValue()));
        metadata.put("threshold_value", format(alert.getThresholdValue()));
        metadata.put("threshold_operator", alert.getThresholdOperator());
        metadata.put("evaluated_at", alert.getCreatedAt().toString());
        return metadata;
    }

    private record TriggerAttempt(TriggerOutcome outcome, Alert alert) {}

    private static String format(BigDecimal value) {
        return value == null ? "null" : value.stripTrailingZeros().toPlainString();
    }
}
