package com.metricalerts.api.controller;

import com.metricalerts.api.dto.request.EvaluationRequest;
import com.metricalerts.api.dto.response.EvaluationResponse;
import com.metricalerts.evaluation.AlertEvaluationEngine;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Invocation endpoint for evaluation runs, called by schedulers and webhooks.
 *
 * <p>POST /api/alert-evaluations -- body optional. Returns the run's response as-is:
 * 200 when the run completed (individual rule failures included), 500 when the rule set
 * could not be fetched.
 */
@RestController
@RequestMapping("/api/alert-evaluations")
public class AlertEvaluationController {

    private final AlertEvaluationEngine alertEvaluationEngine;

    public AlertEvaluationController(AlertEvaluationEngine alertEvaluationEngine) {
        this.alertEvaluationEngine = alertEvaluationEngine;
    }

    @PostMapping
    public ResponseEntity<EvaluationResponse> evaluate(@Valid @RequestBody(required = false) EvaluationRequest request) {
        EvaluationResponse response =
                alertEvaluationEngine.runEvaluation(request != null ? request : new EvaluationRequest());
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }
}
