package com.metricalerts.evaluation.metric.impl;

import com.metricalerts.domain.enums.MetricSource;
import com.metricalerts.domain.enums.PipelineEventStatus;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.evaluation.metric.MetricSourceHandler;
import com.metricalerts.repository.jpa.PipelineEventMetricJpaRepository;
import com.metricalerts.repository.jpa.PipelineEventMetricJpaRepository.StatusCounts;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aggregates pipeline events inside the rule's window.
 *
 * <p>Supported metric names:
 * <ul>
 *   <li>{@code success_rate} -- SUCCESS events as a percentage of all events; 100 for an empty window</li>
 *   <li>{@code error_rate} -- FAILED and TIMEOUT events as a percentage of all events; 0 for an empty window</li>
 *   <li>{@code avg_duration} -- mean total_duration_ms of events with a duration; empty if there are none</li>
 * </ul>
 *
 * <p>An empty window reports the healthy value for rates: no traffic must not page anyone.
 * Rules with a team only see that team's events; global rules (no team) aggregate across
 * all teams.
 */
@Component
public class PipelineEventMetricHandler implements MetricSourceHandler {

    public static final String SUCCESS_RATE = "success_rate";
    public static final String ERROR_RATE = "error_rate";
    public static final String AVG_DURATION = "avg_duration";

    private static final Logger log = LoggerFactory.getLogger(PipelineEventMetricHandler.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 4;

    private final PipelineEventMetricJpaRepository pipelineEventMetricJpaRepository;

    public PipelineEventMetricHandler(PipelineEventMetricJpaRepository pipelineEventMetricJpaRepository) {
        this.pipelineEventMetricJpaRepository = pipelineEventMetricJpaRepository;
    }

    @Override
    public Optional<BigDecimal> resolve(AlertRule alertRule, LocalDateTime windowStart) {
        String metricName = alertRule.getMetricName();
        if (metricName == null) {
            return Optional.empty();
        }

        String teamId = alertRule.getTeamId();
        return switch (metricName) {
            case SUCCESS_RATE -> Optional.of(rate(teamId, List.of(PipelineEventStatus.SUCCESS), windowStart, HUNDRED));
            case ERROR_RATE -> Optional.of(
                    rate(teamId, PipelineEventStatus.ERROR_STATUSES, windowStart, BigDecimal.ZERO));
            case AVG_DURATION -> averageDuration(teamId, windowStart);
            default -> {
                log.warn("Unknown pipeline event metric '{}' on rule {}", metricName, alertRule.getId());
                yield Optional.empty();
            }
        };
    }

    @Override
    public MetricSource getSource() {
        return MetricSource.PIPELINE_EVENTS;
    }

    private BigDecimal rate(
            String teamId, List<PipelineEventStatus> statuses, LocalDateTime windowStart, BigDecimal emptyValue) {
        StatusCounts counts = teamId == null
                ? pipelineEventMetricJpaRepository.countStatusesSince(statuses, windowStart)
                : pipelineEventMetricJpaRepository.countStatusesForTeamSince(teamId, statuses, windowStart);
        long total = counts == null || counts.getTotal() == null ? 0 : counts.getTotal();
        if (total == 0) {
            return emptyValue;
        }

        long matching = counts.getMatching() == null ? 0 : counts.getMatching();
        return BigDecimal.valueOf(matching)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), SCALE, RoundingMode.HALF_UP);
    }

    private Optional<BigDecimal> averageDuration(String teamId, LocalDateTime windowStart) {
        Double average = teamId == null
                ? pipelineEventMetricJpaRepository.averageDurationSince(windowStart)
                : pipelineEventMetricJpaRepository.averageDurationForTeamSince(teamId, windowStart);
        if (average == null) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(average).setScale(SCALE, RoundingMode.HALF_UP));
    }
}
