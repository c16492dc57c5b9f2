package com.questrail.beatbag.protocol.wt901.codec.impl;

import com.questrail.beatbag.protocol.wt901.model.SensorSample;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.questrail.beatbag.protocol.wt901.codec.impl.Wt901TestFrames.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultWt901FrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultWt901FrameDecoder}.
 *
 * <p>These tests exercise the byte-level scan: header search, one-byte
 * resynchronization, field extraction, unit scaling and baseline
 * compensation.</p>
 */
final class DefaultWt901FrameDecoderTest
{
    private static final double EPS = 1e-9;

    private final DefaultWt901FrameDecoder decoder = new DefaultWt901FrameDecoder();

    @Test
    void decodesConsecutiveFramesInOrder()
    {
        byte[] payload = concat(accelFrame(0, 0, 2048), accelFrame(2048, 0, 0));

        List<SensorSample> samples = decoder.decodeAll(payload);

        assertEquals(2, samples.size());
        assertEquals(1.0, samples.get(0).accel().z(), EPS);
        assertEquals(1.0, samples.get(1).accel().x(), EPS);
    }

    @Test
    void skipsLeadingGarbageOneByteAtATime()
    {
        byte[] payload = concat(new byte[] { 0x00, 0x13, 0x55 }, accelFrame(0, 0, 2048));

        List<SensorSample> samples = decoder.decodeAll(payload);

        assertEquals(1, samples.size());
        assertEquals(1.0, samples.get(0).accelMagnitude(), EPS);
    }

    @Test
    void findsFrameStartingInsideRejectedWindow()
    {
        // A lone 0x55 directly before the real header must not hide it.
        byte[] payload = concat(new byte[] { 0x55 }, accelFrame(0, 2048, 0));

        assertEquals(1, decoder.decodeAll(payload).size());
    }

    @Test
    void bufferShorterThanFrameYieldsNothing()
    {
        byte[] frame = accelFrame(0, 0, 2048);
        byte[] truncated = Arrays.copyOf(frame, frame.length - 1);

        assertTrue(decoder.decodeAll(truncated).isEmpty());
        assertTrue(decoder.decodeAll(new byte[0]).isEmpty());
    }

    @Test
    void trailingPartialFrameIsDropped()
    {
        byte[] second = accelFrame(2048, 0, 0);
        byte[] payload = concat(accelFrame(0, 0, 2048), Arrays.copyOf(second, 10));

        assertEquals(1, decoder.decodeAll(payload).size());
    }

    @Test
    void restingSensorCompensatesToZero()
    {
        // az = 200 counts: 200 * 16 / 32768 g, far below the baseline.
        SensorSample sample = decoder.decodeAll(accelFrame(0, 0, 200)).get(0);

        assertEquals(0.09765625, sample.accel().z(), EPS);
        assertEquals(0.09765625, sample.accelMagnitude(), EPS);
        assertEquals(0.0, sample.compensatedMagnitude());
    }

    @Test
    void impactAboveBaselineIsCompensated()
    {
        SensorSample sample = decoder.decodeAll(verticalFrame(4.0)).get(0);

        assertEquals(4.0, sample.accelMagnitude(), EPS);
        assertEquals(4.0 - DefaultWt901FrameDecoder.BASELINE_OFFSET_G, sample.compensatedMagnitude(), EPS);
    }

    @Test
    void magnitudeCombinesAllAxesIncludingNegativeReadings()
    {
        // (-3, 4, 0) g -> |a| = 5 g
        SensorSample sample = decoder.decodeAll(accelFrame(-3 * 2048, 4 * 2048, 0)).get(0);

        assertEquals(-3.0, sample.accel().x(), EPS);
        assertEquals(4.0, sample.accel().y(), EPS);
        assertEquals(5.0, sample.accelMagnitude(), EPS);
    }

    @Test
    void decodesGyroAndOrientationFields()
    {
        SensorSample sample = decoder.decodeAll(
                frame(0, 0, 0, 16384, -16384, 0, 16384, -16384, 8192)).get(0);

        assertEquals(1000.0, sample.gyro().x(), EPS);
        assertEquals(-1000.0, sample.gyro().y(), EPS);
        assertEquals(0.0, sample.gyro().z(), EPS);
        assertEquals(90.0, sample.orientation().roll(), EPS);
        assertEquals(-90.0, sample.orientation().pitch(), EPS);
        assertEquals(45.0, sample.orientation().yaw(), EPS);
    }

    @Test
    void streamOwnsItsBytes()
    {
        byte[] payload = accelFrame(0, 0, 2048);

        Stream<SensorSample> samples = decoder.decode(payload);
        Arrays.fill(payload, (byte) 0);

        assertEquals(1, samples.count());
    }

    @Test
    void rejectsNullPayload()
    {
        assertThrows(NullPointerException.class, () -> decoder.decode(null));
    }

    @Test
    void randomNoiseDecodesQuicklyAndNeverGoesNegative()
    {
        Random random = new Random(901L);
        byte[] noise = new byte[200_000];
        random.nextBytes(noise);

        List<SensorSample> samples = assertTimeoutPreemptively(
                Duration.ofSeconds(5),
                () -> decoder.decode(noise).collect(Collectors.toList()));

        assertTrue(samples.stream().allMatch(s -> s.compensatedMagnitude() >= 0.0));
        assertTrue(samples.size() <= noise.length / Wt901Framing.FRAME_LENGTH);
    }
}
