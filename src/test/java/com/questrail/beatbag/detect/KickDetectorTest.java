package com.questrail.beatbag.detect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KickDetectorTest
 * -----------------------------------------------------------------------------
 * Unit tests for the deadband-hysteresis detector.
 *
 * These tests feed compensated magnitudes directly; no decoding or session is
 * involved.
 */
final class KickDetectorTest
{
    private static final double EPS = 1e-9;

    private KickDetector detector;
    private List<KickEvent> kicks;

    @BeforeEach
    void setUp()
    {
        detector = new KickDetector();
        kicks = new ArrayList<>();
        detector.setListener(kicks::add);
    }

    private void feed(double... values)
    {
        for (double v : values) {
            detector.process(v);
        }
    }

    @Test
    void startsArmedWithDefaultThresholds()
    {
        assertEquals(DetectorState.ARMED, detector.state());
        assertEquals(ThresholdConfig.defaults(), detector.thresholds());
    }

    @Test
    void crossingUpperEdgeFiresOnceAndDisarms()
    {
        feed(0.0, 1.2, 3.0);

        assertEquals(1, kicks.size());
        assertEquals(2.0, kicks.get(0).intensity(), EPS);
        assertEquals(3.0, kicks.get(0).magnitude(), EPS);
        assertEquals(DetectorState.DISARMED, detector.state());
    }

    @Test
    void intensityIsRatioToUpperEdge()
    {
        feed(1.8);

        assertEquals(1.2, kicks.get(0).intensity(), EPS);
    }

    @Test
    void intensityIsCappedAtTwo()
    {
        feed(100.0);

        assertEquals(KickDetector.MAX_INTENSITY, kicks.get(0).intensity(), EPS);
    }

    @Test
    void valueEqualToUpperEdgeDoesNotFire()
    {
        feed(1.5);

        assertTrue(kicks.isEmpty());
        assertTrue(detector.isArmed());
    }

    @Test
    void ringingInsideDeadbandDoesNotRefire()
    {
        feed(2.0, 0.5, 1.9, 0.3, 2.5, 0.1);

        assertEquals(1, kicks.size());
        assertEquals(DetectorState.DISARMED, detector.state());
    }

    @Test
    void droppingBelowLowerEdgeReArmsWithoutEvent()
    {
        feed(2.0, 0.05);

        assertEquals(1, kicks.size());
        assertEquals(DetectorState.ARMED, detector.state());

        feed(2.0);
        assertEquals(2, kicks.size());
    }

    @Test
    void stateIsDisarmedWhenListenerRuns()
    {
        List<DetectorState> seen = new ArrayList<>();
        detector.setListener(e -> seen.add(detector.state()));

        feed(2.0);

        assertEquals(List.of(DetectorState.DISARMED), seen);
    }

    @Test
    void resetReArms()
    {
        feed(2.0);
        detector.reset();

        assertTrue(detector.isArmed());
        feed(2.0);
        assertEquals(2, kicks.size());
    }

    @Test
    void nonFiniteValuesAreIgnored()
    {
        feed(Double.NaN, Double.POSITIVE_INFINITY);
        assertTrue(kicks.isEmpty());
        assertTrue(detector.isArmed());

        feed(2.0, Double.NaN, Double.NEGATIVE_INFINITY);
        assertEquals(DetectorState.DISARMED, detector.state());
    }

    @Test
    void updatedThresholdsApplyToNextValue()
    {
        detector.setThresholds(0.5, 0.05);
        feed(0.6);

        assertEquals(1, kicks.size());
        assertEquals(1.2, kicks.get(0).intensity(), EPS);

        feed(0.07);
        assertEquals(DetectorState.DISARMED, detector.state());
        feed(0.04);
        assertEquals(DetectorState.ARMED, detector.state());
    }

    @Test
    void singleEdgeSettersClampToFloors()
    {
        ThresholdConfig upper = detector.setUpperThreshold(0.0);
        assertEquals(ThresholdConfig.UPPER_FLOOR_G, upper.upperThreshold());
        assertEquals(ThresholdConfig.DEFAULT_LOWER_G, upper.lowerThreshold());

        ThresholdConfig lower = detector.setLowerThreshold(-1.0);
        assertEquals(ThresholdConfig.LOWER_FLOOR_G, lower.lowerThreshold());
        assertEquals(ThresholdConfig.UPPER_FLOOR_G, lower.upperThreshold());

        assertEquals(lower, detector.thresholds());
    }

    @Test
    void detectorWithoutListenerStillTransitions()
    {
        detector.setListener(null);
        feed(2.0);

        assertEquals(DetectorState.DISARMED, detector.state());
    }
}
