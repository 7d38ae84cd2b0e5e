package com.metricalerts.evaluation.metric;

import com.metricalerts.domain.enums.MetricSource;
import com.metricalerts.domain.model.AlertRule;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a rule's current metric value by dispatching to the {@link MetricSourceHandler}
 * registered for the rule's metric source.
 *
 * <p>Spring auto-discovers all handler beans and this resolver indexes them by source at
 * construction time. Registering two handlers for the same source is a startup error.
 *
 * <p>An unknown source string, a source without a handler, or a non-positive window are
 * rule configuration problems and resolve to empty. Store errors raised by a handler are
 * not caught here.
 */
@Component
public class MetricResolver {

    private static final Logger log = LoggerFactory.getLogger(MetricResolver.class);

    private final Map<MetricSource, MetricSourceHandler> handlersBySource = new EnumMap<>(MetricSource.class);
    private final Clock clock;

    public MetricResolver(List<MetricSourceHandler> metricSourceHandlers, Clock clock) {
        for (MetricSourceHandler handler : metricSourceHandlers) {
            MetricSourceHandler previous = handlersBySource.put(handler.getSource(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate metric handler for source " + handler.getSource() + ": "
                        + previous.getClass().getSimpleName() + ", "
                        + handler.getClass().getSimpleName());
            }
        }
        this.clock = clock;
    }

    public Optional<BigDecimal> resolve(AlertRule alertRule) {
        Optional<MetricSource> metricSource = MetricSource.fromKey(alertRule.getMetricSource());
        if (metricSource.isEmpty()) {
            log.warn("Unknown metric source '{}' on rule {}", alertRule.getMetricSource(), alertRule.getId());
            return Optional.empty();
        }

        MetricSourceHandler handler = handlersBySource.get(metricSource.get());
        if (handler == null) {
            log.warn("No metric handler registered for source {} (rule {})", metricSource.get(), alertRule.getId());
            return Optional.empty();
        }

        Integer windowMinutes = alertRule.getEvaluationWindowMinutes();
        if (windowMinutes == null || windowMinutes <= 0) {
            log.warn("Rule {} has invalid evaluation window: {}", alertRule.getId(), windowMinutes);
            return Optional.empty();
        }

        LocalDateTime windowStart = LocalDateTime.now(clock).minusMinutes(windowMinutes);
        return handler.resolve(alertRule, windowStart);
    }
}
