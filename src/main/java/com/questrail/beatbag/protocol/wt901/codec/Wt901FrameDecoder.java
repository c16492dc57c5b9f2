package com.questrail.beatbag.protocol.wt901.codec;

import com.questrail.beatbag.protocol.wt901.model.SensorSample;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wt901FrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for WT901 telemetry notifications.
 *
 * <p>This interface defines the inbound boundary between raw notification
 * payloads and structured {@link SensorSample}s.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Locating frame headers anywhere in the payload</li>
 *   <li>Extracting and scaling the nine telemetry fields</li>
 *   <li>Deriving the acceleration magnitude and its compensated form</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Detecting kicks</li>
 *   <li>Buffering partial frames across payloads</li>
 *   <li>Reporting malformed input (there is none; see below)</li>
 * </ul>
 *
 * <p>Once a header matches, any 18 payload bytes are a valid set of signed
 * 16-bit values. Misaligned bytes are skipped one at a time until the next
 * header; bytes that do not yet form a complete frame produce nothing.</p>
 */
public interface Wt901FrameDecoder
{
    /**
     * Decode every complete frame in a single notification payload.
     *
     * <p>The payload may hold zero, one or several frames, possibly preceded or
     * separated by stray bytes. The returned stream is lazy, finite and may be
     * consumed only once.</p>
     *
     * @param payload raw bytes delivered by the transport
     * @return samples in the order their frames appear in {@code payload}
     */
    Stream<SensorSample> decode(byte[] payload);

    /**
     * Eagerly decode a payload into a list.
     */
    default List<SensorSample> decodeAll(byte[] payload)
    {
        return decode(payload).collect(Collectors.toList());
    }
}
