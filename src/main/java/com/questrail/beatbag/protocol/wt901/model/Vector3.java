package com.questrail.beatbag.protocol.wt901.model;

/**
 * Three-axis reading in physical units (g for acceleration, degrees per second
 * for angular rate).
 */
public record Vector3(double x, double y, double z)
{
    /**
     * Returns the Euclidean norm {@code sqrt(x² + y² + z²)}.
     */
    public double magnitude()
    {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
