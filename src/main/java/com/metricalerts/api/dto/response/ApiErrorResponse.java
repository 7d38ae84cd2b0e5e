package com.metricalerts.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.metricalerts.exception.ErrorCode;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope for the read and evaluation endpoints:
 * {@code {success: false, error: {code, status, message, details, path, timestamp}}}.
 *
 * <p>The timestamp comes from the application clock so error bodies line up with the
 * evaluation timestamps and alert rows written in the same instant.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.success = false;
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Clock clock) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(clock.instant())
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
