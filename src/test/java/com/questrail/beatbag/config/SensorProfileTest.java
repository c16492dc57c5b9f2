package com.questrail.beatbag.config;

import com.questrail.beatbag.detect.ThresholdConfig;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SensorProfileTest
{
    @Test
    void stockProfileUsesWt901Identifiers()
    {
        SensorProfile profile = SensorProfile.wt901();

        assertEquals(UUID.fromString("0000ffe0-0000-1000-8000-00805f9a34fb"), profile.serviceId());
        assertEquals(UUID.fromString("0000ffe9-0000-1000-8000-00805f9a34fb"), profile.writeCharacteristic());
        assertEquals(UUID.fromString("0000ffe4-0000-1000-8000-00805f9a34fb"), profile.notifyCharacteristic());
        assertEquals(profile, SensorProfile.builder().build());
    }

    @Test
    void deviceNameMatchIsCaseInsensitiveSubstring()
    {
        SensorProfile profile = SensorProfile.wt901();

        assertTrue(profile.matchesDeviceName("WT901BLE68"));
        assertTrue(profile.matchesDeviceName("my-wt901"));
        assertFalse(profile.matchesDeviceName("HC-08"));
        assertFalse(profile.matchesDeviceName(null));
    }

    @Test
    void builderOverridesSingleField()
    {
        UUID notify = UUID.fromString("0000fff4-0000-1000-8000-00805f9a34fb");

        SensorProfile profile = SensorProfile.builder().withNotifyCharacteristic(notify).build();

        assertEquals(notify, profile.notifyCharacteristic());
        assertEquals(SensorProfile.DEFAULT_SERVICE_ID, profile.serviceId());
    }

    @Test
    void builderRejectsMissingIdentifiers()
    {
        assertThrows(NullPointerException.class,
                () -> SensorProfile.builder().withServiceId(null).build());
    }

    @Test
    void runtimeDefaultsUseStockProfileAndThresholds()
    {
        BeatBagRuntimeConfig config = BeatBagRuntimeConfig.defaults();

        assertEquals(SensorProfile.wt901(), config.profile());
        assertEquals(ThresholdConfig.defaults(), config.thresholds());
        assertFalse(config.serializeCallbacks());
    }
}
