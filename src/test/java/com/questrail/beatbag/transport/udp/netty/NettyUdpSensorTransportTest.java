package com.questrail.beatbag.transport.udp.netty;

import com.questrail.beatbag.config.SensorProfile;
import com.questrail.beatbag.protocol.wt901.model.Wt901Command;
import com.questrail.beatbag.transport.SensorTransportException;
import com.questrail.beatbag.transport.SensorTransportListener;
import com.questrail.beatbag.transport.ServiceSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpSensorTransportTest
 * -----------------------------------------------------------------------------
 * Loopback tests: a plain {@link DatagramSocket} plays the sensor.
 */
final class NettyUdpSensorTransportTest
{
    private static final SensorProfile PROFILE = SensorProfile.wt901();
    private static final UUID WRITE = PROFILE.writeCharacteristic();
    private static final UUID NOTIFY = PROFILE.notifyCharacteristic();

    /** Callback as observed by the test. */
    record Callback(String name, UUID characteristic, Object detail) {}

    private final BlockingQueue<Callback> callbacks = new LinkedBlockingQueue<>();

    private DatagramSocket device;
    private NettyUdpSensorTransport transport;

    private final SensorTransportListener recorder = new SensorTransportListener() {
        @Override public void onConnected() { callbacks.add(new Callback("connected", null, null)); }
        @Override public void onDisconnected(Throwable cause) { callbacks.add(new Callback("disconnected", null, cause)); }
        @Override public void onServicesDiscovered(ServiceSet services) { callbacks.add(new Callback("discovered", null, services)); }
        @Override public void onServiceDiscoveryFailed(SensorTransportException failure) { callbacks.add(new Callback("discoveryFailed", null, failure)); }
        @Override public void onCharacteristicWritten(UUID c) { callbacks.add(new Callback("written", c, null)); }
        @Override public void onCharacteristicWriteFailed(UUID c, SensorTransportException f) { callbacks.add(new Callback("writeFailed", c, f)); }
        @Override public void onNotificationsEnabled(UUID c) { callbacks.add(new Callback("enabled", c, null)); }
        @Override public void onNotificationsEnableFailed(UUID c, SensorTransportException f) { callbacks.add(new Callback("enableFailed", c, f)); }
        @Override public void onNotification(UUID c, byte[] payload) { callbacks.add(new Callback("notification", c, payload)); }
    };

    @BeforeEach
    void setUp() throws Exception
    {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        device = new DatagramSocket(new InetSocketAddress(loopback, 0));
        device.setSoTimeout(5000);

        transport = new NettyUdpSensorTransport(
                new InetSocketAddress(loopback, 0),
                (InetSocketAddress) device.getLocalSocketAddress(),
                PROFILE);
        transport.setListener(recorder);
    }

    @AfterEach
    void tearDown()
    {
        transport.close();
        device.close();
    }

    private Callback next() throws InterruptedException
    {
        Callback c = callbacks.poll(5, TimeUnit.SECONDS);
        assertNotNull(c, "timed out waiting for a transport callback");
        return c;
    }

    private void connect() throws InterruptedException
    {
        transport.connect();
        assertEquals("connected", next().name());
    }

    private void sendFrom(DatagramSocket socket, byte[] payload) throws Exception
    {
        InetSocketAddress local = transport.localAddress().orElseThrow();
        socket.send(new DatagramPacket(payload, payload.length, local));
    }

    @Test
    void connectBindsEphemeralPort() throws Exception
    {
        assertTrue(transport.localAddress().isEmpty());

        connect();

        assertTrue(transport.localAddress().orElseThrow().getPort() > 0);
    }

    @Test
    void discoveryReportsProfileService() throws Exception
    {
        connect();

        transport.discoverServices();

        Callback c = next();
        assertEquals("discovered", c.name());
        ServiceSet services = (ServiceSet) c.detail();
        assertTrue(services.hasCharacteristic(PROFILE.serviceId(), WRITE));
        assertTrue(services.hasCharacteristic(PROFILE.serviceId(), NOTIFY));
    }

    @Test
    void discoveryBeforeConnectFails() throws Exception
    {
        transport.discoverServices();

        assertEquals("discoveryFailed", next().name());
    }

    @Test
    void writeSendsCommandDatagramAndAcknowledges() throws Exception
    {
        connect();

        transport.writeCharacteristic(WRITE, Wt901Command.UNLOCK.bytes());

        Callback c = next();
        assertEquals("written", c.name());
        assertEquals(WRITE, c.characteristic());

        DatagramPacket received = new DatagramPacket(new byte[64], 64);
        device.receive(received);
        assertArrayEquals(Wt901Command.UNLOCK.bytes(),
                Arrays.copyOf(received.getData(), received.getLength()));
    }

    @Test
    void writeToOtherCharacteristicFails() throws Exception
    {
        connect();

        transport.writeCharacteristic(NOTIFY, new byte[] { 1 });

        Callback c = next();
        assertEquals("writeFailed", c.name());
        assertInstanceOf(SensorTransportException.class, c.detail());
    }

    @Test
    void enablingNotificationsOnWriteCharacteristicFails() throws Exception
    {
        connect();

        transport.enableNotifications(WRITE);

        assertEquals("enableFailed", next().name());
    }

    @Test
    void deviceDatagramsBecomeNotificationsOnceEnabled() throws Exception
    {
        connect();
        transport.enableNotifications(NOTIFY);
        assertEquals("enabled", next().name());

        try (DatagramSocket stranger = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))) {
            sendFrom(stranger, new byte[] { 9, 9, 9 });
        }
        byte[] frame = { 0x55, 0x61, 1, 2, 3 };
        sendFrom(device, frame);

        Callback c = next();
        assertEquals("notification", c.name());
        assertEquals(NOTIFY, c.characteristic());
        assertArrayEquals(frame, (byte[]) c.detail());
    }

    @Test
    void disconnectReportsLinkDown() throws Exception
    {
        connect();

        transport.disconnect();

        Callback c = next();
        assertEquals("disconnected", c.name());
        assertNull(c.detail());
        assertTrue(transport.localAddress().isEmpty());
    }

    @Test
    void reconnectAfterDisconnect() throws Exception
    {
        connect();
        transport.disconnect();
        assertEquals("disconnected", next().name());

        connect();
        assertTrue(transport.localAddress().isPresent());
    }
}
