package com.questrail.beatbag.detect;

/**
 * Hysteresis mode of a {@link KickDetector}.
 */
public enum DetectorState
{
    /** A value above the upper threshold will fire a kick. */
    ARMED,

    /** A kick has fired; waiting for the signal to fall below the lower threshold. */
    DISARMED
}
