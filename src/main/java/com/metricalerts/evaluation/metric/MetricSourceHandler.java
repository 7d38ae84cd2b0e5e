package com.metricalerts.evaluation.metric;

import com.metricalerts.domain.enums.MetricSource;
import com.metricalerts.domain.model.AlertRule;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Computes a rule's current metric value for one {@link MetricSource}.
 *
 * <p>Three implementations exist:
 * <ul>
 *   <li>{@link com.metricalerts.evaluation.metric.impl.PipelineEventMetricHandler} -- rates and
 *       averages aggregated over pipeline events in the window</li>
 *   <li>{@link com.metricalerts.evaluation.metric.impl.PerformanceMetricHandler} -- latest
 *       in-window sample of a named performance metric</li>
 *   <li>{@link com.metricalerts.evaluation.metric.impl.SystemHealthMetricHandler} -- pings
 *       computed on demand, ignoring the window</li>
 * </ul>
 *
 * <p>Resolved by {@link MetricResolver} based on the rule's metric source. Adding a source
 * means adding an enum constant and a handler bean; the evaluation engine does not change.
 */
public interface MetricSourceHandler {

    /**
     * Resolves the metric named by the rule.
     *
     * @param alertRule the rule being evaluated (metric name, team scope)
     * @param windowStart inclusive start of the rule's evaluation window
     * @return the value, or empty when the metric name is unknown to this source or no data
     *     exists; store errors propagate as exceptions
     */
    Optional<BigDecimal> resolve(AlertRule alertRule, LocalDateTime windowStart);

    /**
     * Returns the source this implementation handles.
     */
    MetricSource getSource();
}
