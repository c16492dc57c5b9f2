package com.questrail.beatbag.detect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ThresholdConfigTest
{
    @Test
    void defaultsMatchFactoryTuning()
    {
        ThresholdConfig defaults = ThresholdConfig.defaults();

        assertEquals(1.5, defaults.upperThreshold());
        assertEquals(0.1, defaults.lowerThreshold());
        assertTrue(defaults.hasDeadband());
    }

    @Test
    void valuesBelowFloorsAreClamped()
    {
        ThresholdConfig config = new ThresholdConfig(0.01, 0.0);

        assertEquals(ThresholdConfig.UPPER_FLOOR_G, config.upperThreshold());
        assertEquals(ThresholdConfig.LOWER_FLOOR_G, config.lowerThreshold());
    }

    @Test
    void nanIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdConfig(Double.NaN, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdConfig(1.5, Double.NaN));
    }

    @Test
    void invertedEdgesAreKeptButHaveNoDeadband()
    {
        ThresholdConfig config = new ThresholdConfig(0.5, 0.8);

        assertEquals(0.5, config.upperThreshold());
        assertEquals(0.8, config.lowerThreshold());
        assertFalse(config.hasDeadband());
    }

    @Test
    void withersReplaceOneEdge()
    {
        ThresholdConfig config = ThresholdConfig.defaults().withUpperThreshold(2.5).withLowerThreshold(0.2);

        assertEquals(new ThresholdConfig(2.5, 0.2), config);
    }

    @Test
    void sliderProgressMapsToTenthsAndTwentieths()
    {
        ThresholdConfig config = ThresholdConfig.fromSliderProgress(15, 2);

        assertEquals(1.5, config.upperThreshold(), 1e-12);
        assertEquals(0.1, config.lowerThreshold(), 1e-12);
    }

    @Test
    void sliderAtZeroFallsBackToFloors()
    {
        ThresholdConfig config = ThresholdConfig.fromSliderProgress(0, 0);

        assertEquals(ThresholdConfig.UPPER_FLOOR_G, config.upperThreshold());
        assertEquals(ThresholdConfig.LOWER_FLOOR_G, config.lowerThreshold());
    }
}
