package com.questrail.beatbag.audio;

import com.questrail.beatbag.api.KickListener;
import com.questrail.beatbag.detect.KickEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class KickVolumeCurveTest
{
    @Test
    void volumeIsHalfTheIntensity()
    {
        assertEquals(0.5f, KickVolumeCurve.volumeFor(1.0), 1e-6f);
        assertEquals(0.75f, KickVolumeCurve.volumeFor(1.5), 1e-6f);
    }

    @Test
    void strongestKickPlaysAtFullVolume()
    {
        assertEquals(KickVolumeCurve.MAX_VOLUME, KickVolumeCurve.volumeFor(2.0));
        assertEquals(KickVolumeCurve.MAX_VOLUME, KickVolumeCurve.volumeFor(5.0));
    }

    @Test
    void weakKicksStayAudible()
    {
        assertEquals(KickVolumeCurve.MIN_VOLUME, KickVolumeCurve.volumeFor(0.2));
        assertEquals(KickVolumeCurve.MIN_VOLUME, KickVolumeCurve.volumeFor(0.0));
    }

    @Test
    void listenerAdapterPlaysMappedVolume()
    {
        List<Float> played = new ArrayList<>();
        KickListener listener = KickVolumeCurve.playing(played::add);

        listener.onKick(new KickEvent(1.2, 1.8));
        listener.onKick(new KickEvent(2.0, 9.0));

        assertEquals(2, played.size());
        assertEquals(0.6f, played.get(0), 1e-6f);
        assertEquals(1.0f, played.get(1), 1e-6f);
    }
}
