package com.questrail.beatbag.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SensorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSensorObservabilitySink implements SensorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSensorObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Sensor session: {} -> {} on {}",
                event.oldState().phase(),
                event.newState().phase(),
                event.triggeringEvent().getClass().getSimpleName());
        }
        if (!event.resultingIntents().isEmpty()) {
            log.debug("Sensor session intents: {}", event.resultingIntents());
        }
    }

    @Override
    public void onKick(KickObservedEvent event) {
        log.debug("Kick: intensity={} magnitude={}g upper={}g",
            event.kick().intensity(),
            event.kick().magnitude(),
            event.thresholds().upperThreshold());
    }

    @Override
    public void onError(SensorErrorEvent event) {
        log.error("Sensor error: {}", event.message(), event.cause());
    }
}
