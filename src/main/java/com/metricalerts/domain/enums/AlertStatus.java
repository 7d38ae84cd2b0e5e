package com.metricalerts.domain.enums;

import java.util.List;

/**
 * Lifecycle status of an alert.
 *
 * <p>The evaluation engine only ever creates ACTIVE alerts. Transitions to
 * ACKNOWLEDGED, RESOLVED, SUPPRESSED or EXPIRED are made by operator tooling.
 * ACTIVE and ACKNOWLEDGED alerts are "unresolved" and block a new alert for
 * the same rule.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED,
    EXPIRED;

    /** Statuses that count as an open incident for deduplication. */
    public static final List<AlertStatus> UNRESOLVED = List.of(ACTIVE, ACKNOWLEDGED);
}
