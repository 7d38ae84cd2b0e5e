package com.metricalerts.observability;

import com.metricalerts.api.dto.response.EvaluationResult;
import com.metricalerts.event.AlertCreatedEvent;
import com.metricalerts.event.EvaluationCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for alert evaluation, fed by application events.
 * <ul>
 *   <li><b>alert.evaluation.rules</b> (counter, tag outcome): one increment per evaluated rule</li>
 *   <li><b>alert.evaluation.alerts.created</b> (counter, tag severity): new alert rows</li>
 *   <li><b>alert.evaluation.run.duration</b> (timer): wall-clock time of a completed run</li>
 * </ul>
 */
@Service
public class EvaluationMetricsService {

    static final String RULES_COUNTER = "alert.evaluation.rules";
    static final String ALERTS_CREATED_COUNTER = "alert.evaluation.alerts.created";
    static final String RUN_DURATION_TIMER = "alert.evaluation.run.duration";

    private final MeterRegistry meterRegistry;
    private final Timer runDurationTimer;

    public EvaluationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runDurationTimer = Timer.builder(RUN_DURATION_TIMER)
                .description("Wall-clock duration of an alert evaluation run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onEvaluationCompleted(EvaluationCompletedEvent event) {
        for (EvaluationResult result : event.getEvaluationResponse().getResults()) {
            if (result.getOutcome() == null) {
                continue;
            }
            Counter.builder(RULES_COUNTER)
                    .description("Rules evaluated, by outcome")
                    .tag("outcome", result.getOutcome().name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry)
                    .increment();
        }
        runDurationTimer.record(event.getEvaluationResponse().getSummary().getEvaluationTimeMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onAlertCreated(AlertCreatedEvent event) {
        String severity = event.getAlert().getSeverity() == null
                ? "unknown"
                : event.getAlert().getSeverity().name().toLowerCase(Locale.ROOT);
        Counter.builder(ALERTS_CREATED_COUNTER)
                .description("Alerts created by the evaluation engine")
                .tag("severity", severity)
                .register(meterRegistry)
                .increment();
    }
}
