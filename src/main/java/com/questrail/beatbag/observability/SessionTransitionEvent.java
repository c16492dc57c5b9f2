package com.questrail.beatbag.observability;

import com.questrail.beatbag.protocol.wt901.internal.events.SessionEvent;
import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;
import com.questrail.beatbag.protocol.wt901.internal.state.SessionIntents;

import java.time.Instant;

/**
 * Record representing one processed event of the device session.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    DeviceSessionState oldState,
    DeviceSessionState newState,
    SessionEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    /**
     * Checks if the configuration phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }
}
