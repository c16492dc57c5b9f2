package com.questrail.beatbag.runtime;

import com.questrail.beatbag.api.KickListener;
import com.questrail.beatbag.api.SampleListener;
import com.questrail.beatbag.api.SessionListener;
import com.questrail.beatbag.audio.KickSoundTrigger;
import com.questrail.beatbag.audio.KickVolumeCurve;
import com.questrail.beatbag.config.BeatBagRuntimeConfig;
import com.questrail.beatbag.detect.DetectorState;
import com.questrail.beatbag.detect.KickDetector;
import com.questrail.beatbag.detect.KickEvent;
import com.questrail.beatbag.detect.ThresholdConfig;
import com.questrail.beatbag.observability.KickObservedEvent;
import com.questrail.beatbag.observability.NullObservabilitySink;
import com.questrail.beatbag.observability.SensorErrorEvent;
import com.questrail.beatbag.observability.SensorObservabilitySink;
import com.questrail.beatbag.protocol.wt901.DeviceSession;
import com.questrail.beatbag.protocol.wt901.SessionController;
import com.questrail.beatbag.protocol.wt901.codec.impl.DefaultWt901FrameDecoder;
import com.questrail.beatbag.protocol.wt901.internal.exec.SerializedTransportListener;
import com.questrail.beatbag.protocol.wt901.internal.exec.TransportSessionIntentExecutor;
import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;
import com.questrail.beatbag.protocol.wt901.internal.state.SessionStateReducer;
import com.questrail.beatbag.protocol.wt901.internal.time.SystemWallClock;
import com.questrail.beatbag.protocol.wt901.internal.time.WallClock;
import com.questrail.beatbag.transport.SensorTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * BeatBagRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the kick-sensor stack.
 *
 * <pre>
 *   SensorTransport
 *        → [SerializedTransportListener]
 *            → DeviceSession
 *                → SessionController (reducer / executor)
 *                → DefaultWt901FrameDecoder → KickDetector
 *                    → observability sink, kick listener, sound trigger
 * </pre>
 *
 * <p>The transport is supplied by the caller and stays owned by it: stopping
 * the runtime disconnects the link but does not release transport resources.</p>
 */
public final class BeatBagRuntime
{
    private static final Logger log = LoggerFactory.getLogger(BeatBagRuntime.class);

    private final DeviceSession session;
    private final KickDetector detector;
    private final SerializedTransportListener serializer;
    private final SensorObservabilitySink observabilitySink;
    private final WallClock clock;

    private volatile KickListener kickListener;
    private volatile KickSoundTrigger soundTrigger;

    private BeatBagRuntime(DeviceSession session,
                           KickDetector detector,
                           SerializedTransportListener serializer,
                           SensorObservabilitySink observabilitySink,
                           WallClock clock,
                           KickListener kickListener,
                           KickSoundTrigger soundTrigger)
    {
        this.session = session;
        this.detector = detector;
        this.serializer = serializer;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
        this.kickListener = kickListener;
        this.soundTrigger = soundTrigger;

        detector.setListener(this::dispatchKick);
    }

    public void start()
    {
        if (serializer != null) {
            serializer.start();
        }
        session.connect();
    }

    /**
     * Disconnects and stops the callback loop. Callbacks still pending at that
     * point are discarded, so the session is moved to {@code DISCONNECTED}
     * here rather than by the transport's own (possibly dropped) callback.
     */
    public void stop()
    {
        session.disconnect();
        if (serializer != null) {
            serializer.stop();
            // The loop has been joined; a duplicate is ignored by the reducer.
            session.onDisconnected(null);
        }
    }

    /**
     * Re-runs the configuration handshake over the current link.
     */
    public void restart()
    {
        if (serializer != null && !serializer.isLoopThread()) {
            serializer.post(session::restart);
        }
        else {
            session.restart();
        }
    }

    public ThresholdConfig setThresholds(double upper, double lower)
    {
        return detector.setThresholds(upper, lower);
    }

    public ThresholdConfig setUpperThreshold(double upper)
    {
        return detector.setUpperThreshold(upper);
    }

    public ThresholdConfig setLowerThreshold(double lower)
    {
        return detector.setLowerThreshold(lower);
    }

    public ThresholdConfig thresholds()
    {
        return detector.thresholds();
    }

    /**
     * Re-arms the detector. Posted to the callback loop when callbacks are
     * serialized, since the detector is single-threaded.
     */
    public void reset()
    {
        if (serializer != null && !serializer.isLoopThread()) {
            serializer.post(detector::reset);
        }
        else {
            detector.reset();
        }
    }

    public void onKick(KickListener listener)
    {
        this.kickListener = listener;
    }

    public void onSample(SampleListener listener)
    {
        session.setSampleListener(listener);
    }

    public void setSoundTrigger(KickSoundTrigger trigger)
    {
        this.soundTrigger = trigger;
    }

    public DeviceSessionState sessionState()
    {
        return session.state();
    }

    public DetectorState detectorState()
    {
        return detector.state();
    }

    private void dispatchKick(KickEvent event)
    {
        observabilitySink.onKick(new KickObservedEvent(clock.now(), event, detector.thresholds()));

        KickListener l = kickListener;
        if (l != null) {
            try {
                l.onKick(event);
            }
            catch (RuntimeException e) {
                observabilitySink.onError(new SensorErrorEvent(clock.now(), "Kick listener failed", e));
            }
        }

        KickSoundTrigger t = soundTrigger;
        if (t != null) {
            try {
                t.play(KickVolumeCurve.volumeFor(event.intensity()));
            }
            catch (RuntimeException e) {
                observabilitySink.onError(new SensorErrorEvent(clock.now(), "Kick sound failed", e));
            }
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private SensorTransport transport;
        private BeatBagRuntimeConfig config = BeatBagRuntimeConfig.defaults();
        private SensorObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private KickListener kickListener;
        private SampleListener sampleListener;
        private SessionListener sessionListener;
        private KickSoundTrigger soundTrigger;
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withTransport(SensorTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withConfig(BeatBagRuntimeConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(SensorObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withKickListener(KickListener listener)
        {
            this.kickListener = listener;
            return this;
        }

        public Builder withSampleListener(SampleListener listener)
        {
            this.sampleListener = listener;
            return this;
        }

        public Builder withSessionListener(SessionListener listener)
        {
            this.sessionListener = listener;
            return this;
        }

        public Builder withSoundTrigger(KickSoundTrigger trigger)
        {
            this.soundTrigger = trigger;
            return this;
        }

        public Builder withClock(WallClock clock)
        {
            this.clock = clock;
            return this;
        }

        public BeatBagRuntime build()
        {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            SensorObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Detection
            KickDetector detector = new KickDetector(config.thresholds());

            // 2. Session core
            TransportSessionIntentExecutor executor =
                    new TransportSessionIntentExecutor(transport, detector, sessionListener, sink, clock);
            SessionController controller = new SessionController(
                    DeviceSessionState.disconnected(clock.now()),
                    new SessionStateReducer(config.profile()),
                    executor,
                    sink,
                    clock);

            // 3. Transport adapter
            DeviceSession session = new DeviceSession(
                    transport, controller, new DefaultWt901FrameDecoder(), detector, sink, clock);
            session.setSampleListener(sampleListener);

            SerializedTransportListener serializer = null;
            if (config.serializeCallbacks()) {
                serializer = new SerializedTransportListener(session, sink);
                transport.setListener(serializer);
            }
            else {
                transport.setListener(session);
            }

            log.info("Kick-sensor runtime built: service={}, thresholds={}, serializedCallbacks={}",
                    config.profile().serviceId(), config.thresholds(), config.serializeCallbacks());

            return new BeatBagRuntime(session, detector, serializer, sink, clock, kickListener, soundTrigger);
        }
    }
}
