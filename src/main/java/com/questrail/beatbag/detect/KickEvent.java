package com.questrail.beatbag.detect;

/**
 * A single detected kick.
 *
 * <p>{@code intensity} is the ratio of the triggering magnitude to the upper
 * threshold, capped at {@link KickDetector#MAX_INTENSITY}. It is not a
 * calibrated physical unit. Events carry no timestamp; emission order is
 * occurrence order.</p>
 *
 * @param intensity dimensionless, in {@code (1.0, 2.0]} for a freshly fired kick
 * @param magnitude compensated magnitude that fired the kick (g)
 */
public record KickEvent(double intensity, double magnitude)
{
}
