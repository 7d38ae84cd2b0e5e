package com.metricalerts.domain.enums;

/**
 * Why a rule did or did not fire during one evaluation run.
 *
 * <p>Each value is an operationally distinct answer to "why didn't I get paged":
 * below threshold, suppressed by cooldown, missing data, or evaluation failure.
 */
public enum EvaluationOutcome {
    /** Condition held; the alert trigger was invoked. */
    TRIGGERED,
    /** Metric resolved but the condition did not hold. */
    BELOW_THRESHOLD,
    /** A recent alert for the rule is still inside its cooldown window. */
    COOLDOWN,
    /** No metric value could be resolved (unknown source/name or empty sample window). */
    METRIC_UNAVAILABLE,
    /** An unexpected error (typically a store error) aborted this rule's evaluation. */
    FAILED
}
