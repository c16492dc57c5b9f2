package com.questrail.beatbag.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the kick-sensor stack.
 */
public record SensorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
