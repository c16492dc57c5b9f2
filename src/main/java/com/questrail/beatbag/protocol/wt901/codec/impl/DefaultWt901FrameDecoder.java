package com.questrail.beatbag.protocol.wt901.codec.impl;

import com.questrail.beatbag.protocol.wt901.codec.Wt901FrameDecoder;
import com.questrail.beatbag.protocol.wt901.model.Orientation;
import com.questrail.beatbag.protocol.wt901.model.SensorSample;
import com.questrail.beatbag.protocol.wt901.model.Vector3;

import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * DefaultWt901FrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link Wt901FrameDecoder}.
 *
 * <p>For each scan position, in order:</p>
 * <ol>
 *   <li>Stop if fewer than {@value Wt901Framing#FRAME_LENGTH} bytes remain</li>
 *   <li>On a header mismatch, advance by exactly one byte</li>
 *   <li>On a header match, read the nine fields, scale them through
 *       {@link Wt901UnitScaler}, derive the magnitudes, and advance by a full
 *       frame</li>
 * </ol>
 *
 * <p>The one-byte advance recovers alignment after a dropped or inserted byte
 * without skipping a frame that starts inside the rejected window.</p>
 */
public final class DefaultWt901FrameDecoder implements Wt901FrameDecoder
{
    /**
     * Baseline subtracted from the acceleration magnitude before detection, in g.
     * Covers gravity plus the resting bias of the mounted sensor.
     */
    public static final double BASELINE_OFFSET_G = 2.09;

    @Override
    public Stream<SensorSample> decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        // Transports may recycle their notification buffers once the callback
        // returns; the stream is lazy, so it must own its bytes.
        final byte[] bytes = payload.clone();
        return StreamSupport.stream(new FrameScanner(bytes), false);
    }

    /**
     * Decodes the frame whose header starts at {@code offset}.
     */
    static SensorSample decodeFrame(byte[] buffer, int offset)
    {
        final Vector3 accel = new Vector3(
                Wt901UnitScaler.accel(Wt901Framing.readField(buffer, offset, Wt901Framing.AX)),
                Wt901UnitScaler.accel(Wt901Framing.readField(buffer, offset, Wt901Framing.AY)),
                Wt901UnitScaler.accel(Wt901Framing.readField(buffer, offset, Wt901Framing.AZ)));

        final Vector3 gyro = new Vector3(
                Wt901UnitScaler.angularRate(Wt901Framing.readField(buffer, offset, Wt901Framing.WX)),
                Wt901UnitScaler.angularRate(Wt901Framing.readField(buffer, offset, Wt901Framing.WY)),
                Wt901UnitScaler.angularRate(Wt901Framing.readField(buffer, offset, Wt901Framing.WZ)));

        final Orientation orientation = new Orientation(
                Wt901UnitScaler.angle(Wt901Framing.readField(buffer, offset, Wt901Framing.ROLL)),
                Wt901UnitScaler.angle(Wt901Framing.readField(buffer, offset, Wt901Framing.PITCH)),
                Wt901UnitScaler.angle(Wt901Framing.readField(buffer, offset, Wt901Framing.YAW)));

        final double magnitude = accel.magnitude();
        final double compensated = Math.max(0.0, magnitude - BASELINE_OFFSET_G);

        return new SensorSample(accel, gyro, orientation, magnitude, compensated);
    }

    /**
     * Single-pass scanner over one payload. Not restartable.
     */
    private static final class FrameScanner extends Spliterators.AbstractSpliterator<SensorSample>
    {
        private final byte[] buffer;
        private int offset;

        FrameScanner(byte[] buffer)
        {
            super(buffer.length / Wt901Framing.FRAME_LENGTH,
                    Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE);
            this.buffer = buffer;
        }

        @Override
        public boolean tryAdvance(Consumer<? super SensorSample> action)
        {
            while (Wt901Framing.hasCompleteFrameAt(buffer, offset)) {
                if (!Wt901Framing.isHeaderAt(buffer, offset)) {
                    offset++;
                    continue;
                }

                final SensorSample sample = decodeFrame(buffer, offset);
                offset += Wt901Framing.FRAME_LENGTH;
                action.accept(sample);
                return true;
            }
            return false;
        }
    }
}
