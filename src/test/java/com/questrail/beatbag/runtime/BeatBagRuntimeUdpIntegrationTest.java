package com.questrail.beatbag.runtime;

import com.questrail.beatbag.api.SessionListener;
import com.questrail.beatbag.config.BeatBagRuntimeConfig;
import com.questrail.beatbag.config.SensorProfile;
import com.questrail.beatbag.observability.RecordingObservabilitySink;
import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;
import com.questrail.beatbag.transport.udp.netty.NettyUdpSensorTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BeatBagRuntimeUdpIntegrationTest
 * -----------------------------------------------------------------------------
 * Runs the composition root over the Netty UDP transport with serialized
 * callbacks, with a plain {@link DatagramSocket} on loopback as the sensor.
 */
final class BeatBagRuntimeUdpIntegrationTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final CountDownLatch streaming = new CountDownLatch(1);
    private final AtomicInteger disconnects = new AtomicInteger();

    private DatagramSocket device;
    private NettyUdpSensorTransport transport;
    private BeatBagRuntime runtime;

    @BeforeEach
    void setUp() throws Exception
    {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        device = new DatagramSocket(new InetSocketAddress(loopback, 0));

        transport = new NettyUdpSensorTransport(
                new InetSocketAddress(loopback, 0),
                (InetSocketAddress) device.getLocalSocketAddress(),
                SensorProfile.wt901());

        runtime = BeatBagRuntime.builder()
                .withTransport(transport)
                .withConfig(BeatBagRuntimeConfig.builder().withSerializedCallbacks(true).build())
                .withObservabilitySink(sink)
                .withSessionListener(new SessionListener() {
                    @Override public void onStreaming() { streaming.countDown(); }
                    @Override public void onDisconnected() { disconnects.incrementAndGet(); }
                })
                .build();
    }

    @AfterEach
    void tearDown()
    {
        transport.close();
        device.close();
    }

    @Test
    void stopLeavesSessionDisconnectedAndReportsOnce() throws Exception
    {
        runtime.start();
        assertTrue(streaming.await(5, TimeUnit.SECONDS));
        assertTrue(runtime.sessionState().isStreaming());

        runtime.stop();

        assertEquals(DeviceSessionState.Phase.DISCONNECTED, runtime.sessionState().phase());
        assertEquals(1, disconnects.get());

        // The transport's own link-down callback arrives after the loop stopped.
        Thread.sleep(200);
        assertEquals(DeviceSessionState.Phase.DISCONNECTED, runtime.sessionState().phase());
        assertEquals(1, disconnects.get());
    }

    @Test
    void stopBeforeStreamingStillEndsDisconnected() throws Exception
    {
        runtime.start();
        runtime.stop();

        assertEquals(DeviceSessionState.Phase.DISCONNECTED, runtime.sessionState().phase());
        assertTrue(disconnects.get() <= 1);
    }
}
