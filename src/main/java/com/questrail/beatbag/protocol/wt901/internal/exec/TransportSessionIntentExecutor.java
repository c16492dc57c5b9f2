package com.questrail.beatbag.protocol.wt901.internal.exec;

import com.questrail.beatbag.api.ConfigurationError;
import com.questrail.beatbag.api.SessionListener;
import com.questrail.beatbag.detect.KickDetector;
import com.questrail.beatbag.observability.NullObservabilitySink;
import com.questrail.beatbag.observability.SensorErrorEvent;
import com.questrail.beatbag.observability.SensorObservabilitySink;
import com.questrail.beatbag.protocol.wt901.internal.state.SessionIntents;
import com.questrail.beatbag.protocol.wt901.internal.time.WallClock;
import com.questrail.beatbag.protocol.wt901.model.Wt901Command;
import com.questrail.beatbag.transport.SensorTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * TransportSessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Production {@link SessionIntentExecutor}: realizes session intents against a
 * {@link SensorTransport}, the {@link KickDetector} and a {@link SessionListener}.
 *
 * <p>Exceptions thrown by the application's listener are reported to the
 * observability sink and do not interrupt the remaining intents.</p>
 */
public final class TransportSessionIntentExecutor implements SessionIntentExecutor
{
    private static final Logger log = LoggerFactory.getLogger(TransportSessionIntentExecutor.class);

    private final SensorTransport transport;
    private final KickDetector detector;
    private final SessionListener listener;
    private final SensorObservabilitySink observabilitySink;
    private final WallClock clock;

    public TransportSessionIntentExecutor(SensorTransport transport,
                                          KickDetector detector,
                                          SessionListener listener,
                                          SensorObservabilitySink observabilitySink,
                                          WallClock clock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.listener = Objects.requireNonNullElse(listener, new SessionListener() {});
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void execute(SessionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (SessionIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case RESET_DETECTOR -> detector.reset();
                case DISCOVER_SERVICES -> {
                    log.debug("Discovering services");
                    transport.discoverServices();
                }
                case WRITE_COMMAND -> {
                    UUID target = intents.targetCharacteristic().orElseThrow();
                    Wt901Command command = intents.command().orElseThrow();
                    log.debug("Writing {} to {}", command, target);
                    transport.writeCharacteristic(target, command.bytes());
                }
                case ENABLE_NOTIFICATIONS -> {
                    UUID target = intents.targetCharacteristic().orElseThrow();
                    log.debug("Enabling notifications on {}", target);
                    transport.enableNotifications(target);
                }
                case REPORT_STREAMING -> notifyListener("onStreaming", listener::onStreaming);
                case REPORT_FAILURE -> {
                    ConfigurationError error = intents.error().orElseThrow();
                    observabilitySink.onError(new SensorErrorEvent(clock.now(), error.describe(), causeOf(error)));
                    notifyListener("onConfigurationFailed", () -> listener.onConfigurationFailed(error));
                }
                case REPORT_DISCONNECTED -> notifyListener("onDisconnected", listener::onDisconnected);
            }
        }
    }

    private void notifyListener(String callback, Runnable call)
    {
        try {
            call.run();
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new SensorErrorEvent(
                    clock.now(),
                    "Session listener " + callback + " failed",
                    e));
        }
    }

    private static Throwable causeOf(ConfigurationError error)
    {
        if (error instanceof ConfigurationError.StepFailed failed) {
            return failed.cause();
        }
        return null;
    }
}
