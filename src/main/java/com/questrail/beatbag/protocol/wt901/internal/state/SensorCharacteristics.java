package com.questrail.beatbag.protocol.wt901.internal.state;

import java.util.Objects;
import java.util.UUID;

/**
 * Characteristics located during discovery, and the service that holds them.
 *
 * <p>{@code service} may differ from the profile's expected service when the
 * characteristics were found by probing.</p>
 */
public record SensorCharacteristics(UUID service, UUID writeCharacteristic, UUID notifyCharacteristic)
{
    public SensorCharacteristics {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(writeCharacteristic, "writeCharacteristic");
        Objects.requireNonNull(notifyCharacteristic, "notifyCharacteristic");
    }
}
