/**
 * WT901 Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for WT901 telemetry.
 * The wire format is fixed:</p>
 *
 * <pre>
 *   offset  0..1   header  0x55 0x61
 *   offset  2..19  9 x int16 little-endian:
 *                  ax ay az  wx wy wz  roll pitch yaw
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] notification payload
 *        → Wt901FrameDecoder      (header scan, field extraction, scaling)
 *            → SensorSample        (physical units, compensated magnitude)
 *                → KickDetector
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never carries state across payloads.</li>
 *   <li>The codec has no error channel; resynchronization is byte-wise.</li>
 *   <li>Kick semantics live exclusively in {@code com.questrail.beatbag.detect}.</li>
 * </ul>
 */
package com.questrail.beatbag.protocol.wt901.codec;
