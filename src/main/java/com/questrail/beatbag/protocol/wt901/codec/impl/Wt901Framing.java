package com.questrail.beatbag.protocol.wt901.codec.impl;

/**
 * Wt901Framing
 * -----------------------------------------------------------------------------
 * Frame layout constants and low-level byte access for WT901 telemetry.
 *
 * <p>A frame is exactly {@value #FRAME_LENGTH} bytes: the two-byte header
 * {@code 0x55 0x61} followed by {@value #FIELD_COUNT} signed little-endian
 * 16-bit fields.</p>
 *
 * <p>This class locates headers and reads raw fields. It does
 * <strong>not</strong> scale values.</p>
 */
final class Wt901Framing
{
    /** First header byte. */
    static final int HEADER_0 = 0x55;

    /** Second header byte; identifies the combined accel/gyro/angle frame. */
    static final int HEADER_1 = 0x61;

    static final int HEADER_LENGTH = 2;

    static final int FIELD_COUNT = 9;

    static final int FRAME_LENGTH = HEADER_LENGTH + FIELD_COUNT * 2;

    // Field indices, in wire order.
    static final int AX = 0;
    static final int AY = 1;
    static final int AZ = 2;
    static final int WX = 3;
    static final int WY = 4;
    static final int WZ = 5;
    static final int ROLL = 6;
    static final int PITCH = 7;
    static final int YAW = 8;

    private Wt901Framing() {}

    /**
     * Returns true if a complete frame could start at {@code offset}.
     */
    static boolean hasCompleteFrameAt(byte[] buffer, int offset)
    {
        return offset >= 0 && buffer.length - offset >= FRAME_LENGTH;
    }

    /**
     * Returns true if the header bytes appear at {@code offset}.
     *
     * <p>The caller must have checked {@link #hasCompleteFrameAt(byte[], int)}.</p>
     */
    static boolean isHeaderAt(byte[] buffer, int offset)
    {
        return (buffer[offset] & 0xFF) == HEADER_0
                && (buffer[offset + 1] & 0xFF) == HEADER_1;
    }

    /**
     * Reads field {@code index} of the frame starting at {@code frameOffset} as a
     * signed little-endian 16-bit value.
     */
    static short readField(byte[] buffer, int frameOffset, int index)
    {
        final int at = frameOffset + HEADER_LENGTH + index * 2;
        return (short) ((buffer[at] & 0xFF) | (buffer[at + 1] << 8));
    }
}
