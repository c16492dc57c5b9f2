package com.questrail.beatbag.observability;

/**
 * Main interface for receiving kick-sensor observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SensorObservabilitySink {
    /**
     * Called after the device session processed an event.
     * @param event the transition details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when the detector fires a kick.
     * @param event the kick details
     */
    void onKick(KickObservedEvent event);

    /**
     * Called when an error or anomaly occurs (configuration failure, a listener
     * throwing on the telemetry path).
     * @param event the error event
     */
    void onError(SensorErrorEvent event);
}
