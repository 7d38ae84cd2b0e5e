package com.metricalerts.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Invocation payload for an evaluation run. Every field is optional.
 *
 * <p>Rule-set resolution: {@code ruleId} (a single enabled rule) takes precedence over
 * {@code teamId} (all enabled rules of that team); with neither, all enabled rules are
 * evaluated. {@code force} and {@code source} are only echoed into logs.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRequest {

    public static final String DEFAULT_SOURCE = "webhook";

    @Size(max = 36)
    private String ruleId;

    @Size(max = 36)
    private String teamId;

    private boolean force;

    @Size(max = 100)
    private String source;

    public String getSourceOrDefault() {
        return source == null || source.isBlank() ? DEFAULT_SOURCE : source;
    }
}
