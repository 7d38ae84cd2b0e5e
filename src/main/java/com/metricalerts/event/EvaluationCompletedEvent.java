package com.metricalerts.event;

import com.metricalerts.api.dto.response.EvaluationResponse;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the AlertEvaluationEngine at the end of every run that obtained its rule
 * set, carrying the full response including per-rule results.
 */
public class EvaluationCompletedEvent extends ApplicationEvent {

    private final EvaluationResponse evaluationResponse;
    private final String invocationSource;

    public EvaluationCompletedEvent(Object source, EvaluationResponse evaluationResponse, String invocationSource) {
        super(source);
        this.evaluationResponse = evaluationResponse;
        this.invocationSource = invocationSource;
    }

    public EvaluationResponse getEvaluationResponse() {
        return evaluationResponse;
    }

    public String getInvocationSource() {
        return invocationSource;
    }
}
