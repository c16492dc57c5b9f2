package com.questrail.beatbag.protocol.wt901.internal.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * DeviceSessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a device session's configuration progress.
 *
 * <h2>Role in the architecture</h2>
 * This class represents the state consumed and produced by the
 * {@link SessionStateReducer}. It is deliberately:
 * <ul>
 *   <li>Pure data (no behavior)</li>
 *   <li>Immutable</li>
 *   <li>Explicit about which characteristics the session is talking to</li>
 * </ul>
 *
 * <h2>Phase ordering</h2>
 * <pre>
 *   DISCONNECTED → DISCOVERING → UNLOCKING → SETTING_RATE → SAVING_CONFIG
 *                → ENABLING_NOTIFICATIONS → STREAMING
 * </pre>
 * Phases advance strictly forward, one step per acknowledgment. Any failure or
 * disconnect returns to {@code DISCONNECTED}.
 *
 * <h2>Stale acknowledgments</h2>
 * A restart abandons the operation in flight, but its acknowledgment may still
 * arrive. The state carries the characteristics of those abandoned operations
 * so that their acknowledgments are consumed instead of advancing the new
 * sequence.
 */
public final class DeviceSessionState
{
    /**
     * Configuration phase. Each configuring phase names the operation it has
     * initiated and is awaiting an acknowledgment for.
     */
    public enum Phase {
        DISCONNECTED,
        DISCOVERING,
        UNLOCKING,
        SETTING_RATE,
        SAVING_CONFIG,
        ENABLING_NOTIFICATIONS,
        STREAMING;

        /**
         * Returns true for the phases that await a write or descriptor acknowledgment.
         */
        public boolean awaitsWriteAcknowledgment() {
            return this == UNLOCKING
                    || this == SETTING_RATE
                    || this == SAVING_CONFIG
                    || this == ENABLING_NOTIFICATIONS;
        }
    }

    private final Phase phase;
    private final SensorCharacteristics characteristics;
    private final Instant lastTransition;
    private final List<UUID> staleAcknowledgments;

    private DeviceSessionState(Phase phase,
                               SensorCharacteristics characteristics,
                               Instant lastTransition,
                               List<UUID> staleAcknowledgments) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.characteristics = characteristics;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
        this.staleAcknowledgments = List.copyOf(staleAcknowledgments);
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Characteristics located by discovery; empty before discovery succeeds and
     * after the session returns to {@code DISCONNECTED}.
     */
    public Optional<SensorCharacteristics> characteristics() {
        return Optional.ofNullable(characteristics);
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    /**
     * Characteristics of abandoned operations whose acknowledgments are still
     * outstanding, oldest first.
     */
    public List<UUID> staleAcknowledgments() {
        return staleAcknowledgments;
    }

    public boolean isStreaming() {
        return phase == Phase.STREAMING;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    public static DeviceSessionState disconnected(Instant now) {
        return new DeviceSessionState(Phase.DISCONNECTED, null, now, List.of());
    }

    /**
     * Returns a state in {@code DISCOVERING} with no located characteristics.
     */
    public static DeviceSessionState discovering(Instant now) {
        return discovering(now, List.of());
    }

    /**
     * Returns a state in {@code DISCOVERING} that still expects acknowledgments
     * on {@code staleAcknowledgments} from operations abandoned earlier.
     */
    public static DeviceSessionState discovering(Instant now, List<UUID> staleAcknowledgments) {
        return new DeviceSessionState(Phase.DISCOVERING, null, now, staleAcknowledgments);
    }

    /**
     * Returns a new state advanced to {@code phase}, keeping the located characteristics.
     */
    public DeviceSessionState withPhase(Phase newPhase, Instant now) {
        return new DeviceSessionState(newPhase, this.characteristics, now, this.staleAcknowledgments);
    }

    public DeviceSessionState withCharacteristics(SensorCharacteristics located, Instant now) {
        return new DeviceSessionState(this.phase, Objects.requireNonNull(located, "located"), now,
                this.staleAcknowledgments);
    }

    /**
     * Returns this state with the oldest stale acknowledgment on
     * {@code characteristic} removed. The phase and transition time are kept.
     */
    public DeviceSessionState consumeStaleAcknowledgment(UUID characteristic) {
        List<UUID> remaining = new ArrayList<>(staleAcknowledgments);
        if (!remaining.remove(characteristic)) {
            return this;
        }
        return new DeviceSessionState(phase, characteristics, lastTransition, remaining);
    }

    public static DeviceSessionState of(Phase phase, SensorCharacteristics characteristics, Instant now) {
        return new DeviceSessionState(phase, characteristics, now, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceSessionState other)) return false;
        return phase == other.phase
                && Objects.equals(characteristics, other.characteristics)
                && lastTransition.equals(other.lastTransition)
                && staleAcknowledgments.equals(other.staleAcknowledgments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, characteristics, lastTransition, staleAcknowledgments);
    }

    @Override
    public String toString() {
        return "DeviceSessionState{phase=" + phase
                + ", characteristics=" + characteristics
                + ", lastTransition=" + lastTransition
                + ", staleAcknowledgments=" + staleAcknowledgments + '}';
    }
}
