package com.questrail.beatbag.protocol.wt901.model;

import java.util.Objects;

/**
 * SensorSample
 * -----------------------------------------------------------------------------
 * One decoded WT901 telemetry frame, in physical units.
 *
 * <p>A sample is produced once per valid 20-byte frame and carries no identity
 * beyond its position in the stream. Two derived values travel with the raw
 * axes:</p>
 * <ul>
 *   <li>{@code accelMagnitude}: norm of the acceleration vector (g)</li>
 *   <li>{@code compensatedMagnitude}: {@code max(0, accelMagnitude - baseline)},
 *       the signal the kick detector consumes</li>
 * </ul>
 *
 * @param accel                acceleration (g)
 * @param gyro                 angular rate (°/s)
 * @param orientation          roll / pitch / yaw (degrees)
 * @param accelMagnitude       Euclidean norm of {@code accel} (g)
 * @param compensatedMagnitude baseline-compensated magnitude, never negative (g)
 */
public record SensorSample(Vector3 accel,
                           Vector3 gyro,
                           Orientation orientation,
                           double accelMagnitude,
                           double compensatedMagnitude)
{
    public SensorSample {
        Objects.requireNonNull(accel, "accel");
        Objects.requireNonNull(gyro, "gyro");
        Objects.requireNonNull(orientation, "orientation");
        if (compensatedMagnitude < 0.0) {
            throw new IllegalArgumentException("compensatedMagnitude must not be negative");
        }
    }
}
