package com.questrail.beatbag.api;

import com.questrail.beatbag.protocol.wt901.model.SensorSample;

/**
 * Optional diagnostics hook receiving every decoded sample, before detection.
 */
@FunctionalInterface
public interface SampleListener
{
    void onSample(SensorSample sample);
}
