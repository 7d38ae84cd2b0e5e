package com.metricalerts.domain.enums;

import java.util.List;

/**
 * Processing status recorded for each pipeline event.
 *
 * <p>FAILED and TIMEOUT both count as errors for the {@code error_rate} metric.
 * PENDING and PROCESSING rows count toward the total but are neither successes
 * nor errors.
 */
public enum PipelineEventStatus {
    PENDING,
    PROCESSING,
    SUCCESS,
    FAILED,
    TIMEOUT;

    public static final List<PipelineEventStatus> ERROR_STATUSES = List.of(FAILED, TIMEOUT);
}
