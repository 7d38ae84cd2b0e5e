package com.metricalerts.api.dto.response;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Aggregated result of one evaluation run.
 *
 * <p>{@code success} is false only when the run could not start (the rule set was not
 * obtainable); the result list is then empty. A run in which individual rules failed is
 * still successful at the top level.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResponse {

    private boolean success;
    private String message;
    private List<EvaluationResult> results;
    private Summary summary;
    private Instant timestamp;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Summary {
        private int totalRules;
        private int triggeredAlerts;
        private long evaluationTimeMs;
    }
}
