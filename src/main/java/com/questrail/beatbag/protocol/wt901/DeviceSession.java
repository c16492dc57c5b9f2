package com.questrail.beatbag.protocol.wt901;

import com.questrail.beatbag.api.SampleListener;
import com.questrail.beatbag.detect.KickDetector;
import com.questrail.beatbag.observability.NullObservabilitySink;
import com.questrail.beatbag.observability.SensorErrorEvent;
import com.questrail.beatbag.observability.SensorObservabilitySink;
import com.questrail.beatbag.protocol.wt901.codec.Wt901FrameDecoder;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionAckEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionDiscoveryEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionLinkEvent;
import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;
import com.questrail.beatbag.protocol.wt901.internal.state.SensorCharacteristics;
import com.questrail.beatbag.protocol.wt901.internal.time.WallClock;
import com.questrail.beatbag.protocol.wt901.model.SensorSample;
import com.questrail.beatbag.transport.SensorTransport;
import com.questrail.beatbag.transport.SensorTransportException;
import com.questrail.beatbag.transport.SensorTransportListener;
import com.questrail.beatbag.transport.ServiceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * DeviceSession
 * =============================================================================
 * Transport adapter for one sensor: translates transport callbacks into
 * session events and, once streaming, routes telemetry into the detector.
 *
 * <h2>Inbound path (configuration)</h2>
 * <pre>
 *   SensorTransportListener callback
 *        → SessionEvent
 *            → SessionController (reducer → intents → executor)
 *                → SensorTransport operation
 * </pre>
 *
 * <h2>Inbound path (telemetry, STREAMING only)</h2>
 * <pre>
 *   onNotification(notify characteristic, payload)
 *        → Wt901FrameDecoder
 *            → SampleListener (optional)
 *            → KickDetector.process(compensatedMagnitude)
 * </pre>
 *
 * <p>Notifications received in any other phase, or on any other
 * characteristic, are dropped.</p>
 *
 * <h2>Threading</h2>
 * Callbacks must arrive serialized (see {@code SerializedTransportListener}).
 * {@link #connect()}, {@link #disconnect()} and {@link #restart()} must be
 * called on the same serialized context.
 */
public class DeviceSession implements SensorTransportListener
{
    private static final Logger log = LoggerFactory.getLogger(DeviceSession.class);

    private final SensorTransport transport;
    private final SessionController controller;
    private final Wt901FrameDecoder decoder;
    private final KickDetector detector;
    private final SensorObservabilitySink observabilitySink;
    private final WallClock clock;

    private volatile SampleListener sampleListener;

    public DeviceSession(SensorTransport transport,
                         SessionController controller,
                         Wt901FrameDecoder decoder,
                         KickDetector detector,
                         SensorObservabilitySink observabilitySink,
                         WallClock clock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers the optional diagnostics hook; {@code null} removes it.
     */
    public void setSampleListener(SampleListener sampleListener)
    {
        this.sampleListener = sampleListener;
    }

    public void connect()
    {
        log.info("Connecting to sensor");
        transport.connect();
    }

    /**
     * Disconnecting is always safe and is the only cancellation primitive.
     */
    public void disconnect()
    {
        log.info("Disconnecting from sensor");
        transport.disconnect();
    }

    /**
     * Re-runs the whole configuration sequence over the current link, e.g. after
     * a reported configuration failure.
     */
    public void restart()
    {
        log.info("Restarting sensor configuration");
        controller.submitAndDrain(new SessionLinkEvent.RestartRequested(clock.now()));
    }

    public DeviceSessionState state()
    {
        return controller.state();
    }

    public KickDetector detector()
    {
        return detector;
    }

    // -------------------------------------------------------------------------
    // SensorTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected()
    {
        controller.submitAndDrain(new SessionLinkEvent.Connected(clock.now()));
    }

    @Override
    public void onDisconnected(Throwable cause)
    {
        controller.submitAndDrain(new SessionLinkEvent.Disconnected(clock.now(), cause));
    }

    @Override
    public void onServicesDiscovered(ServiceSet services)
    {
        Objects.requireNonNull(services, "services");
        log.debug("Discovered services: {}", services);
        controller.submitAndDrain(new SessionDiscoveryEvent.ServicesDiscovered(clock.now(), services));
    }

    @Override
    public void onServiceDiscoveryFailed(SensorTransportException failure)
    {
        controller.submitAndDrain(new SessionDiscoveryEvent.DiscoveryFailed(clock.now(), failure));
    }

    @Override
    public void onCharacteristicWritten(UUID characteristic)
    {
        controller.submitAndDrain(new SessionAckEvent.CharacteristicWritten(clock.now(), characteristic));
    }

    @Override
    public void onCharacteristicWriteFailed(UUID characteristic, SensorTransportException failure)
    {
        controller.submitAndDrain(new SessionAckEvent.CharacteristicWriteFailed(clock.now(), characteristic, failure));
    }

    @Override
    public void onNotificationsEnabled(UUID characteristic)
    {
        controller.submitAndDrain(new SessionAckEvent.NotificationsEnabled(clock.now(), characteristic));
    }

    @Override
    public void onNotificationsEnableFailed(UUID characteristic, SensorTransportException failure)
    {
        controller.submitAndDrain(new SessionAckEvent.NotificationsEnableFailed(clock.now(), characteristic, failure));
    }

    @Override
    public void onNotification(UUID characteristic, byte[] payload)
    {
        Objects.requireNonNull(characteristic, "characteristic");
        Objects.requireNonNull(payload, "payload");

        DeviceSessionState current = controller.state();
        if (!current.isStreaming()) {
            log.debug("Dropping {}-byte notification in phase {}", payload.length, current.phase());
            return;
        }

        Optional<UUID> notify = current.characteristics().map(SensorCharacteristics::notifyCharacteristic);
        if (notify.isEmpty() || !notify.get().equals(characteristic)) {
            return;
        }

        decoder.decode(payload).forEach(this::dispatch);
    }

    private void dispatch(SensorSample sample)
    {
        SampleListener l = sampleListener;
        if (l != null) {
            try {
                l.onSample(sample);
            }
            catch (RuntimeException e) {
                observabilitySink.onError(new SensorErrorEvent(clock.now(), "Sample listener failed", e));
            }
        }

        try {
            detector.process(sample.compensatedMagnitude());
        }
        catch (RuntimeException e) {
            // The detector has already transitioned; only the kick handler failed.
            observabilitySink.onError(new SensorErrorEvent(clock.now(), "Kick listener failed", e));
        }
    }
}
