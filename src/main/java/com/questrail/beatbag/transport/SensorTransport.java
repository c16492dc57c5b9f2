package com.questrail.beatbag.transport;

import java.util.UUID;

/**
 * SensorTransport
 * -----------------------------------------------------------------------------
 * Port for the byte-oriented link to a sensor (BLE GATT or an equivalent).
 *
 * <p>Every operation is non-blocking. Its outcome is reported later, exactly
 * once, on the registered {@link SensorTransportListener}. Higher layers are
 * responsible for:</p>
 * <ul>
 *   <li>sequencing operations (one outstanding operation at a time)</li>
 *   <li>decoding notification payloads</li>
 *   <li>deciding how long to wait before giving up on a device</li>
 * </ul>
 *
 * <p>Implementations may be backed by a platform BLE stack, Netty, or a test
 * harness.</p>
 */
public interface SensorTransport
{
    /**
     * Register the listener that receives outcomes and notifications.
     *
     * <p>This must be called before {@link #connect()}.</p>
     */
    void setListener(SensorTransportListener listener);

    /**
     * Establish the link. Reports {@link SensorTransportListener#onConnected()}
     * on success or {@link SensorTransportListener#onDisconnected(Throwable)}
     * on failure.
     */
    void connect();

    /**
     * Tear down the link. Always safe; reports
     * {@link SensorTransportListener#onDisconnected(Throwable)} at most once per
     * transition.
     */
    void disconnect();

    /**
     * Enumerate services and their characteristics.
     */
    void discoverServices();

    /**
     * Write {@code value} to {@code characteristic}; completion is acknowledged
     * through the listener.
     */
    void writeCharacteristic(UUID characteristic, byte[] value);

    /**
     * Enable notification delivery on {@code characteristic}; completion is
     * acknowledged through the listener.
     */
    void enableNotifications(UUID characteristic);
}
