package com.questrail.beatbag.detect;

/**
 * ThresholdConfig
 * -----------------------------------------------------------------------------
 * Immutable pair of detector thresholds, in g.
 *
 * <p>Both values are floor-clamped on construction, so every instance satisfies
 * {@code upperThreshold >= UPPER_FLOOR_G} and
 * {@code lowerThreshold >= LOWER_FLOOR_G}. No ordering between the two is
 * enforced; see {@link #hasDeadband()}.</p>
 *
 * <p>{@link KickDetector} holds one snapshot at a time and swaps it atomically,
 * so a caller retuning from another thread never exposes half an update.</p>
 *
 * @param upperThreshold trigger edge (g)
 * @param lowerThreshold re-arm edge (g)
 */
public record ThresholdConfig(double upperThreshold, double lowerThreshold)
{
    public static final double DEFAULT_UPPER_G = 1.5;
    public static final double DEFAULT_LOWER_G = 0.1;

    public static final double UPPER_FLOOR_G = 0.1;
    public static final double LOWER_FLOOR_G = 0.01;

    private static final ThresholdConfig DEFAULTS =
            new ThresholdConfig(DEFAULT_UPPER_G, DEFAULT_LOWER_G);

    public ThresholdConfig {
        if (Double.isNaN(upperThreshold) || Double.isNaN(lowerThreshold)) {
            throw new IllegalArgumentException("thresholds must be numbers");
        }
        upperThreshold = Math.max(upperThreshold, UPPER_FLOOR_G);
        lowerThreshold = Math.max(lowerThreshold, LOWER_FLOOR_G);
    }

    public static ThresholdConfig defaults()
    {
        return DEFAULTS;
    }

    public ThresholdConfig withUpperThreshold(double upper)
    {
        return new ThresholdConfig(upper, lowerThreshold);
    }

    public ThresholdConfig withLowerThreshold(double lower)
    {
        return new ThresholdConfig(upperThreshold, lower);
    }

    /**
     * Returns true if the re-arm edge sits strictly below the trigger edge.
     *
     * <p>Without a deadband a detector that has fired can only re-arm on values
     * that are also below the trigger edge; if {@code lower > upper} it may
     * never re-arm while the signal hovers between them.</p>
     */
    public boolean hasDeadband()
    {
        return lowerThreshold < upperThreshold;
    }

    /**
     * Maps the two threshold slider positions of the control panel to a config.
     *
     * <p>The upper slider moves in steps of 0.1 g (0..40 gives 0..4 g); the lower
     * slider in steps of 0.05 g (0..20 gives 0..1 g). Floors still apply.</p>
     */
    public static ThresholdConfig fromSliderProgress(int upperProgress, int lowerProgress)
    {
        return new ThresholdConfig(upperProgress / 10.0, lowerProgress / 20.0);
    }
}
