/**
 * Sensor Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete link implementation (a platform BLE stack, the Netty UDP
 * bridge, a simulator, or a test double) and the device session.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Raw payloads as {@code byte[]}</li>
 *   <li>Characteristic identifiers as {@link java.util.UUID}</li>
 *   <li>Completion acknowledgments and link up/down notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform link I/O only</li>
 *   <li>Not decode telemetry frames</li>
 *   <li>Not retry operations on their own</li>
 *   <li>Not enforce discovery timeouts</li>
 * </ul>
 */
package com.questrail.beatbag.transport;
