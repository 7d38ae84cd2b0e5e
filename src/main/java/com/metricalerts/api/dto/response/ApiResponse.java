package com.metricalerts.api.dto.response;

import java.time.Clock;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for read endpoints: {@code {success, data, timestamp}}, stamped with the
 * application clock.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.success = true;
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, Clock clock) {
        return new ApiResponse<>(data, clock.instant());
    }
}
