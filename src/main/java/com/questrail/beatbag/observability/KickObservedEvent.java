package com.questrail.beatbag.observability;

import com.questrail.beatbag.detect.KickEvent;
import com.questrail.beatbag.detect.ThresholdConfig;

import java.time.Instant;

/**
 * Record representing a fired kick and the thresholds in effect at the time.
 */
public record KickObservedEvent(
    Instant timestamp,
    KickEvent kick,
    ThresholdConfig thresholds
) {
}
