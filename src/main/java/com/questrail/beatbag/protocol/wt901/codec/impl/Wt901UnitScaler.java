package com.questrail.beatbag.protocol.wt901.codec.impl;

/**
 * Wt901UnitScaler
 * -----------------------------------------------------------------------------
 * Pure conversions from raw signed 16-bit sensor readings to physical units.
 *
 * <ul>
 *   <li>acceleration: ±16 g full scale</li>
 *   <li>angular rate: ±2000 °/s full scale</li>
 *   <li>angle: ±180° full scale</li>
 * </ul>
 *
 * <p>Every {@code short} is in the domain; there are no error conditions.</p>
 */
public final class Wt901UnitScaler
{
    /** Full-scale acceleration, in g. */
    public static final double ACCEL_RANGE_G = 16.0;

    /** Full-scale angular rate, in degrees per second. */
    public static final double GYRO_RANGE_DPS = 2000.0;

    /** Full-scale angle, in degrees. */
    public static final double ANGLE_RANGE_DEG = 180.0;

    /** Magnitude of the signed 16-bit range. */
    public static final double RAW_FULL_SCALE = 32768.0;

    private Wt901UnitScaler() {}

    public static double accel(short raw)
    {
        return raw * ACCEL_RANGE_G / RAW_FULL_SCALE;
    }

    public static double angularRate(short raw)
    {
        return raw * GYRO_RANGE_DPS / RAW_FULL_SCALE;
    }

    public static double angle(short raw)
    {
        return raw * ANGLE_RANGE_DEG / RAW_FULL_SCALE;
    }
}
