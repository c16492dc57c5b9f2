package com.questrail.beatbag.protocol.wt901.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps and the
 * last-transition time of session snapshots.
 *
 * <p>Detection and sequencing never depend on this clock.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
