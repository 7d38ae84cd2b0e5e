package com.metricalerts.domain.enums;

/**
 * Severity level of an alert rule and of the alerts it creates.
 *
 * <p>Declared from most to least urgent, so ordinal ordering can be used by
 * downstream consumers that prioritise delivery. The severity is copied onto
 * every alert at fire time; later rule edits do not change existing alerts.
 */
public enum AlertSeverity {

    /** Requires immediate attention. */
    CRITICAL,

    HIGH,

    MEDIUM,

    LOW,

    /** Informational, no action required. */
    INFO
}
