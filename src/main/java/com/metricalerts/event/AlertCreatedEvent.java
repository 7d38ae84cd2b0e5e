package com.metricalerts.event;

import com.metricalerts.domain.model.Alert;
import org.springframework.context.ApplicationEvent;

/**
 * Published after the AlertTrigger has persisted a new ACTIVE alert.
 *
 * <p>Consumed by {@code EvaluationMetricsService} to count created alerts. Delivery to
 * humans is not driven by this event; the delivery system watches the alerts table.
 */
public class AlertCreatedEvent extends ApplicationEvent {

    private final Alert alert;

    public AlertCreatedEvent(Object source, Alert alert) {
        super(source);
        this.alert = alert;
    }

    public Alert getAlert() {
        return alert;
    }
}
