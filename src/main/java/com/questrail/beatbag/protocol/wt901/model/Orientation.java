package com.questrail.beatbag.protocol.wt901.model;

/**
 * Euler angles reported by the sensor's on-board fusion, in degrees.
 */
public record Orientation(double roll, double pitch, double yaw)
{
}
