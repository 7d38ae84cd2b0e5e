package com.metricalerts.exception;

import java.util.Map;

public class AlertPersistenceException extends BaseException {

    public AlertPersistenceException(String ruleId, String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, Map.of("ruleId", ruleId), cause);
    }
}
