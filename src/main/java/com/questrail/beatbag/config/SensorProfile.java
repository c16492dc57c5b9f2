package com.questrail.beatbag.config;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifiers that describe how a WT901-family sensor exposes its telemetry.
 *
 * @param serviceId            service expected to group the two characteristics
 * @param writeCharacteristic  characteristic accepting configuration commands
 * @param notifyCharacteristic characteristic delivering telemetry notifications
 * @param deviceNameHint       substring identifying the device in scan results
 */
public record SensorProfile(
    UUID serviceId,
    UUID writeCharacteristic,
    UUID notifyCharacteristic,
    String deviceNameHint
) {
    public static final UUID DEFAULT_SERVICE_ID = UUID.fromString("0000ffe0-0000-1000-8000-00805f9a34fb");
    public static final UUID DEFAULT_WRITE_CHARACTERISTIC = UUID.fromString("0000ffe9-0000-1000-8000-00805f9a34fb");
    public static final UUID DEFAULT_NOTIFY_CHARACTERISTIC = UUID.fromString("0000ffe4-0000-1000-8000-00805f9a34fb");
    public static final String DEFAULT_DEVICE_NAME_HINT = "WT901";

    private static final SensorProfile WT901 = new SensorProfile(
        DEFAULT_SERVICE_ID,
        DEFAULT_WRITE_CHARACTERISTIC,
        DEFAULT_NOTIFY_CHARACTERISTIC,
        DEFAULT_DEVICE_NAME_HINT);

    public SensorProfile {
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(writeCharacteristic, "writeCharacteristic");
        Objects.requireNonNull(notifyCharacteristic, "notifyCharacteristic");
        Objects.requireNonNull(deviceNameHint, "deviceNameHint");
    }

    /**
     * Profile of the stock WT901 BLE firmware.
     */
    public static SensorProfile wt901() {
        return WT901;
    }

    /**
     * Returns true if an advertised device name looks like this sensor.
     * Unnamed devices never match.
     */
    public boolean matchesDeviceName(String deviceName) {
        if (deviceName == null) {
            return false;
        }
        return deviceName.toLowerCase(Locale.ROOT)
            .contains(deviceNameHint.toLowerCase(Locale.ROOT));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID serviceId = DEFAULT_SERVICE_ID;
        private UUID writeCharacteristic = DEFAULT_WRITE_CHARACTERISTIC;
        private UUID notifyCharacteristic = DEFAULT_NOTIFY_CHARACTERISTIC;
        private String deviceNameHint = DEFAULT_DEVICE_NAME_HINT;

        public Builder withServiceId(UUID serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder withWriteCharacteristic(UUID writeCharacteristic) {
            this.writeCharacteristic = writeCharacteristic;
            return this;
        }

        public Builder withNotifyCharacteristic(UUID notifyCharacteristic) {
            this.notifyCharacteristic = notifyCharacteristic;
            return this;
        }

        public Builder withDeviceNameHint(String deviceNameHint) {
            this.deviceNameHint = deviceNameHint;
            return this;
        }

        public SensorProfile build() {
            return new SensorProfile(serviceId, writeCharacteristic, notifyCharacteristic, deviceNameHint);
        }
    }
}
