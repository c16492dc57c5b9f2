package com.questrail.beatbag.observability;

/**
 * No-op implementation of SensorObservabilitySink.
 */
public final class NullObservabilitySink implements SensorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onKick(KickObservedEvent event) {}

    @Override
    public void onError(SensorErrorEvent event) {}
}
