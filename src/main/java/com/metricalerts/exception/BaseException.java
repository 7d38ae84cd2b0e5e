package com.metricalerts.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's runtime exceptions. Carries an {@link ErrorCode} that decides
 * the HTTP status when the exception reaches the REST layer.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
