package com.questrail.beatbag.transport.udp.netty;

import com.questrail.beatbag.config.SensorProfile;
import com.questrail.beatbag.transport.SensorTransport;
import com.questrail.beatbag.transport.SensorTransportException;
import com.questrail.beatbag.transport.SensorTransportListener;
import com.questrail.beatbag.transport.ServiceSet;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpSensorTransport
 * =============================================================================
 * Netty-backed {@link SensorTransport} for a WT901 reachable over UDP (the WiFi
 * variant of the sensor, or a BLE-to-UDP bridge relaying the same frames).
 *
 * <h2>Mapping onto the characteristic model</h2>
 * <ul>
 *   <li>Discovery reports one virtual service, the profile's service, holding
 *       the profile's write and notify characteristics.</li>
 *   <li>A write to the write characteristic is one datagram to the device; it
 *       is acknowledged when Netty completes the write.</li>
 *   <li>Enabling notifications on the notify characteristic opens the inbound
 *       gate; from then on each datagram from the device is one notification.</li>
 * </ul>
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * telemetry frames, retry operations, or enforce timeouts.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; reference-counted buffers are released internally.
 *
 * <h2>Threading</h2>
 * Every listener callback runs on the single event loop thread, so callbacks
 * are serialized and never re-enter the caller of a transport operation.
 *
 * <h2>Lifecycle</h2>
 * {@link #connect()} binds the local socket; {@link #disconnect()} closes it and
 * may be followed by another {@code connect()}; {@link #close()} releases the
 * event loop for good.
 */
public final class NettyUdpSensorTransport implements SensorTransport, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpSensorTransport.class);

    private final InetSocketAddress bindAddress;
    private final InetSocketAddress deviceAddress;
    private final SensorProfile profile;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean linkUp = new AtomicBoolean(false);

    private volatile SensorTransportListener listener;
    private volatile Channel channel;
    private volatile boolean notificationsEnabled;

    /**
     * @param bindAddress   local address to bind (port 0 for ephemeral)
     * @param deviceAddress address the sensor sends from and listens on
     * @param profile       identifiers reported by discovery
     */
    public NettyUdpSensorTransport(InetSocketAddress bindAddress,
                                   InetSocketAddress deviceAddress,
                                   SensorProfile profile)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.deviceAddress = Objects.requireNonNull(deviceAddress, "deviceAddress");
        this.profile = Objects.requireNonNull(profile, "profile");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(SensorTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        SensorTransportListener l = requireListener();

        notificationsEnabled = false;
        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                linkUp.set(true);
                log.info("UDP sensor link bound to {} for device {}", channel.localAddress(), deviceAddress);
                l.onConnected();
            }
            else {
                l.onDisconnected(future.cause());
            }
        });
    }

    @Override
    public void disconnect()
    {
        Channel ch = channel;
        channel = null;
        notificationsEnabled = false;
        if (ch != null) {
            // channelInactive reports the transition.
            ch.close();
        }
    }

    /**
     * Closes the link and shuts down the event loop.
     */
    @Override
    public void close()
    {
        disconnect();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    /**
     * Returns the bound local address while the link is up.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    @Override
    public void discoverServices()
    {
        SensorTransportListener l = requireListener();
        group.execute(() -> {
            if (channel == null) {
                l.onServiceDiscoveryFailed(new SensorTransportException("UDP link is not connected"));
                return;
            }
            l.onServicesDiscovered(ServiceSet.builder()
                    .addService(profile.serviceId(), profile.writeCharacteristic(), profile.notifyCharacteristic())
                    .build());
        });
    }

    @Override
    public void writeCharacteristic(UUID characteristic, byte[] value)
    {
        Objects.requireNonNull(characteristic, "characteristic");
        Objects.requireNonNull(value, "value");
        SensorTransportListener l = requireListener();

        Channel ch = channel;
        if (ch == null) {
            group.execute(() -> l.onCharacteristicWriteFailed(characteristic,
                    new SensorTransportException("UDP link is not connected")));
            return;
        }
        if (!profile.writeCharacteristic().equals(characteristic)) {
            group.execute(() -> l.onCharacteristicWriteFailed(characteristic,
                    new SensorTransportException("Characteristic " + characteristic + " is not writable")));
            return;
        }

        ByteBuf buf = Unpooled.copiedBuffer(value);
        ch.writeAndFlush(new DatagramPacket(buf, deviceAddress)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                l.onCharacteristicWritten(characteristic);
            }
            else {
                l.onCharacteristicWriteFailed(characteristic,
                        new SensorTransportException("Datagram write failed", future.cause()));
            }
        });
    }

    @Override
    public void enableNotifications(UUID characteristic)
    {
        Objects.requireNonNull(characteristic, "characteristic");
        SensorTransportListener l = requireListener();

        group.execute(() -> {
            if (channel == null) {
                l.onNotificationsEnableFailed(characteristic, new SensorTransportException("UDP link is not connected"));
                return;
            }
            if (!profile.notifyCharacteristic().equals(characteristic)) {
                l.onNotificationsEnableFailed(characteristic,
                        new SensorTransportException("Characteristic " + characteristic + " does not notify"));
                return;
            }
            notificationsEnabled = true;
            l.onNotificationsEnabled(characteristic);
        });
    }

    private SensorTransportListener requireListener()
    {
        SensorTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("SensorTransportListener must be set before use");
        }
        return l;
    }

    private void reportDown(Throwable cause)
    {
        SensorTransportListener l = listener;
        if (l != null && linkUp.compareAndSet(true, false)) {
            l.onDisconnected(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives datagrams from the device and forwards them as notifications
     * on the profile's notify characteristic.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            SensorTransportListener l = listener;
            if (l == null || !notificationsEnabled) {
                return;
            }

            SocketAddress sender = packet.sender();
            if (!deviceAddress.equals(sender)) {
                log.debug("Ignoring datagram from unexpected sender {}", sender);
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onNotification(profile.notifyCharacteristic(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportDown(cause);
            ctx.close();
        }
    }
}
