package com.questrail.beatbag.audio;

import com.questrail.beatbag.api.KickListener;
import com.questrail.beatbag.detect.KickDetector;
import com.questrail.beatbag.detect.KickEvent;

import java.util.Objects;

/**
 * Maps kick intensity to playback volume.
 *
 * <p>{@code volume = clamp(intensity / 2, MIN_VOLUME, MAX_VOLUME)}: a kick that
 * just crosses the trigger edge plays at half volume, a kick at twice the edge
 * or more at full volume, and nothing plays quieter than {@link #MIN_VOLUME}.</p>
 */
public final class KickVolumeCurve
{
    public static final float MIN_VOLUME = 0.3f;
    public static final float MAX_VOLUME = 1.0f;

    private KickVolumeCurve() {}

    public static float volumeFor(double intensity)
    {
        float volume = (float) (intensity / KickDetector.MAX_INTENSITY);
        return Math.max(MIN_VOLUME, Math.min(MAX_VOLUME, volume));
    }

    /**
     * Adapts a sound trigger into a kick listener applying this curve.
     */
    public static KickListener playing(KickSoundTrigger trigger)
    {
        Objects.requireNonNull(trigger, "trigger");
        return (KickEvent event) -> trigger.play(volumeFor(event.intensity()));
    }
}
