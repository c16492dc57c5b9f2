package com.questrail.beatbag.transport;

import java.util.UUID;

/**
 * SensorTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link SensorTransport}.
 *
 * <p>Implementations of the transport must deliver callbacks in a
 * <em>serialized</em> manner. A transport that dispatches on a thread pool must
 * be wrapped (see {@code SerializedTransportListener}) before its callbacks reach
 * the device session: reordering notifications corrupts detection.</p>
 */
public interface SensorTransportListener
{
    /** The link is up; discovery may start. */
    void onConnected();

    /**
     * The link is down.
     *
     * @param cause diagnostic cause; may be {@code null} for an orderly disconnect
     */
    void onDisconnected(Throwable cause);

    void onServicesDiscovered(ServiceSet services);

    void onServiceDiscoveryFailed(SensorTransportException failure);

    void onCharacteristicWritten(UUID characteristic);

    void onCharacteristicWriteFailed(UUID characteristic, SensorTransportException failure);

    void onNotificationsEnabled(UUID characteristic);

    void onNotificationsEnableFailed(UUID characteristic, SensorTransportException failure);

    /**
     * A notification payload arrived.
     *
     * <p>The payload is delivered as received; it may hold several frames or a
     * partial one. Listeners must not retain the array beyond the call.</p>
     */
    void onNotification(UUID characteristic, byte[] payload);
}
