/**
 * WT901 Codec: Implementation
 * =============================================================================
 *
 * <pre>
 *   byte[] payload
 *        → Wt901Framing.isHeaderAt / readField
 *        → Wt901UnitScaler
 *        → SensorSample
 * </pre>
 *
 * <p>This codec layer is strictly transport-agnostic and semantics-free.</p>
 */
package com.questrail.beatbag.protocol.wt901.codec.impl;
