package com.questrail.beatbag.api;

import com.questrail.beatbag.detect.KickEvent;

/**
 * Receives kicks as the detector fires them.
 *
 * <p>Invoked synchronously on the thread that processes telemetry. Handlers
 * that play audio or touch a UI should hand the event off rather than block.</p>
 */
@FunctionalInterface
public interface KickListener
{
    void onKick(KickEvent event);
}
