package com.metricalerts.domain.enums;

/**
 * Result of asking the alert trigger to fire for a rule.
 */
public enum TriggerOutcome {
    /** A new ACTIVE alert was persisted. */
    CREATED,
    /** An unresolved alert already exists for the rule; nothing was written. */
    ALREADY_ACTIVE,
    /** The rule reached its max alerts per hour; nothing was written. */
    RATE_LIMITED
}
