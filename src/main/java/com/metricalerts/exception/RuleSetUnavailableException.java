package com.metricalerts.exception;

/**
 * Thrown when the set of rules to evaluate cannot be read from the rule store.
 *
 * <p>This is the only failure that aborts a whole evaluation run; per-rule failures
 * are recorded on that rule's result instead.
 */
public class RuleSetUnavailableException extends BaseException {

    public RuleSetUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
