package com.questrail.beatbag.detect;

import com.questrail.beatbag.api.KickListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * KickDetector
 * -----------------------------------------------------------------------------
 * Deadband-hysteresis detector turning a compensated-magnitude signal into
 * discrete {@link KickEvent}s.
 *
 * <h2>Transition rules</h2>
 * Evaluated once per value {@code v}, in this order:
 * <ol>
 *   <li>{@code ARMED} and {@code v > upper}: emit a kick with intensity
 *       {@code min(v / upper, 2.0)} and become {@code DISARMED}</li>
 *   <li>{@code DISARMED} and {@code v < lower}: become {@code ARMED}, no event</li>
 *   <li>otherwise: nothing</li>
 * </ol>
 *
 * <p>The gap between the two edges absorbs the ringing that follows a single
 * impact, so one physical kick fires one event.</p>
 *
 * <h2>Threading</h2>
 * {@link #process(double)} and {@link #reset()} must be called from a single
 * thread (the telemetry path). Thresholds may be changed from any thread; each
 * {@code process} call reads one {@link ThresholdConfig} snapshot.
 */
public final class KickDetector
{
    private static final Logger log = LoggerFactory.getLogger(KickDetector.class);

    /** Upper bound of {@link KickEvent#intensity()}. */
    public static final double MAX_INTENSITY = 2.0;

    private final AtomicReference<ThresholdConfig> thresholds;

    // Written only by the telemetry thread; volatile so diagnostics may read it.
    private volatile DetectorState state = DetectorState.ARMED;

    private volatile KickListener listener;

    public KickDetector()
    {
        this(ThresholdConfig.defaults());
    }

    public KickDetector(ThresholdConfig initial)
    {
        this.thresholds = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    /**
     * Registers the handler that receives kicks. Replaces any previous handler;
     * {@code null} removes it.
     */
    public void setListener(KickListener listener)
    {
        this.listener = listener;
    }

    /**
     * Feeds one compensated-magnitude value through the detector.
     *
     * <p>Non-finite values are ignored: they cause no transition and no event.</p>
     *
     * @param magnitude compensated acceleration magnitude (g)
     */
    public void process(double magnitude)
    {
        if (!Double.isFinite(magnitude)) {
            log.debug("Ignoring non-finite magnitude {}", magnitude);
            return;
        }

        final ThresholdConfig config = thresholds.get();

        if (state == DetectorState.ARMED && magnitude > config.upperThreshold()) {
            final double intensity = Math.min(magnitude / config.upperThreshold(), MAX_INTENSITY);
            state = DetectorState.DISARMED;

            log.debug("Kick detected: intensity={}, magnitude={}", intensity, magnitude);

            final KickListener l = listener;
            if (l != null) {
                l.onKick(new KickEvent(intensity, magnitude));
            }
        }
        else if (state == DetectorState.DISARMED && magnitude < config.lowerThreshold()) {
            state = DetectorState.ARMED;
            log.debug("Re-armed at magnitude {}", magnitude);
        }
    }

    /**
     * Forces the detector back to {@code ARMED}, discarding any pending
     * disarm from signal seen before a reconnect.
     */
    public void reset()
    {
        state = DetectorState.ARMED;
        log.debug("Detector reset");
    }

    public DetectorState state()
    {
        return state;
    }

    public boolean isArmed()
    {
        return state == DetectorState.ARMED;
    }

    /**
     * Returns the snapshot the next {@link #process(double)} call will use.
     */
    public ThresholdConfig thresholds()
    {
        return thresholds.get();
    }

    /**
     * Replaces both thresholds in one atomic swap.
     */
    public ThresholdConfig setThresholds(ThresholdConfig config)
    {
        Objects.requireNonNull(config, "config");
        thresholds.set(config);
        logThresholds(config);
        return config;
    }

    public ThresholdConfig setThresholds(double upper, double lower)
    {
        return setThresholds(new ThresholdConfig(upper, lower));
    }

    /**
     * Sets the trigger edge, clamped to {@link ThresholdConfig#UPPER_FLOOR_G}.
     *
     * @return the snapshot now in effect
     */
    public ThresholdConfig setUpperThreshold(double upper)
    {
        ThresholdConfig updated = thresholds.updateAndGet(c -> c.withUpperThreshold(upper));
        logThresholds(updated);
        return updated;
    }

    /**
     * Sets the re-arm edge, clamped to {@link ThresholdConfig#LOWER_FLOOR_G}.
     *
     * @return the snapshot now in effect
     */
    public ThresholdConfig setLowerThreshold(double lower)
    {
        ThresholdConfig updated = thresholds.updateAndGet(c -> c.withLowerThreshold(lower));
        logThresholds(updated);
        return updated;
    }

    private static void logThresholds(ThresholdConfig config)
    {
        log.debug("Thresholds set: upper={}g, lower={}g",
                config.upperThreshold(), config.lowerThreshold());
        if (!config.hasDeadband()) {
            log.warn("Lower threshold {}g is not below upper threshold {}g; "
                            + "the detector may stay disarmed after a kick",
                    config.lowerThreshold(), config.upperThreshold());
        }
    }
}
