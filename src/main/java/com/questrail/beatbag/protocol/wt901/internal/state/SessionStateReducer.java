package com.questrail.beatbag.protocol.wt901.internal.state;

import com.questrail.beatbag.api.ConfigurationError;
import com.questrail.beatbag.config.SensorProfile;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionAckEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionDiscoveryEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionLinkEvent;
import com.questrail.beatbag.protocol.wt901.model.Wt901Command;
import com.questrail.beatbag.transport.ServiceSet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * SessionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for the device session.
 *
 * <p>Given a prior {@link DeviceSessionState} and a single {@link SessionEvent},
 * the reducer computes the new state and the {@link SessionIntents} the caller
 * should carry out. It never touches the transport itself.</p>
 *
 * <h2>Handshake</h2>
 * <pre>
 *   Connected              → DISCOVERING             / discover services
 *   ServicesDiscovered     → UNLOCKING               / write UNLOCK
 *   CharacteristicWritten  → SETTING_RATE            / write SET_RATE_100HZ
 *   CharacteristicWritten  → SAVING_CONFIG           / write SAVE_CONFIG
 *   CharacteristicWritten  → ENABLING_NOTIFICATIONS  / enable notifications
 *   NotificationsEnabled   → STREAMING               / reset detector, report
 * </pre>
 *
 * <p>Failures while configuring return to {@code DISCONNECTED} and report a
 * {@link ConfigurationError}. Steps are never retried individually; the caller
 * restarts the whole sequence.</p>
 *
 * <p>A restart while a configuration step is in flight records that step's
 * characteristic as owing a stale acknowledgment. The next acknowledgment on
 * that characteristic is consumed without advancing the new sequence.</p>
 */
public final class SessionStateReducer
{
    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated session state
     * @param intents  actions to be executed by the caller
     */
    public record Result(DeviceSessionState newState,
                         SessionIntents intents) {}

    private final SensorProfile profile;

    public SessionStateReducer(SensorProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    /**
     * Applies a single event to the current session state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intentions
     */
    public Result apply(DeviceSessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof SessionLinkEvent.Connected e) {
            return new Result(DeviceSessionState.discovering(e.timestamp()), SessionIntents.discoverServices());
        }
        if (event instanceof SessionLinkEvent.RestartRequested e) {
            return onRestartRequested(state, e);
        }
        if (event instanceof SessionLinkEvent.Disconnected e) {
            return onDisconnected(state, e);
        }
        if (event instanceof SessionDiscoveryEvent.ServicesDiscovered e) {
            return onServicesDiscovered(state, e);
        }
        if (event instanceof SessionDiscoveryEvent.DiscoveryFailed e) {
            return onDiscoveryFailed(state, e);
        }
        if (event instanceof SessionAckEvent.Acknowledgment e) {
            return onAcknowledgment(state, e);
        }

        // Unknown events are ignored.
        return new Result(state, SessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onRestartRequested(DeviceSessionState state, SessionLinkEvent.RestartRequested e) {
        // Any half-finished sequence is abandoned; located characteristics are
        // re-discovered from scratch.
        List<UUID> stale = new ArrayList<>(state.staleAcknowledgments());
        inFlightCharacteristic(state).ifPresent(stale::add);
        return new Result(DeviceSessionState.discovering(e.timestamp(), stale), SessionIntents.discoverServices());
    }

    private static Optional<UUID> inFlightCharacteristic(DeviceSessionState state) {
        if (!state.phase().awaitsWriteAcknowledgment()) {
            return Optional.empty();
        }
        return state.characteristics().map(chars -> state.phase() == DeviceSessionState.Phase.ENABLING_NOTIFICATIONS
                ? chars.notifyCharacteristic()
                : chars.writeCharacteristic());
    }

    private Result onDisconnected(DeviceSessionState state, SessionLinkEvent.Disconnected e) {
        if (state.phase() == DeviceSessionState.Phase.DISCONNECTED) {
            return new Result(state, SessionIntents.none());
        }
        return new Result(DeviceSessionState.disconnected(e.timestamp()), SessionIntents.reportDisconnected());
    }

    private Result onServicesDiscovered(DeviceSessionState state, SessionDiscoveryEvent.ServicesDiscovered e) {
        if (state.phase() != DeviceSessionState.Phase.DISCOVERING) {
            return new Result(state, SessionIntents.none());
        }

        final Instant now = e.timestamp();
        final Optional<SensorCharacteristics> located = locate(e.services());

        if (located.isEmpty()) {
            ConfigurationError error = new ConfigurationError.CharacteristicsNotFound(e.services().serviceIds());
            return new Result(DeviceSessionState.disconnected(now), SessionIntents.reportFailure(error));
        }

        DeviceSessionState unlocking = state
                .withCharacteristics(located.get(), now)
                .withPhase(DeviceSessionState.Phase.UNLOCKING, now);

        return new Result(unlocking, SessionIntents.writeCommand(located.get().writeCharacteristic(), Wt901Command.UNLOCK));
    }

    private Result onDiscoveryFailed(DeviceSessionState state, SessionDiscoveryEvent.DiscoveryFailed e) {
        if (state.phase() != DeviceSessionState.Phase.DISCOVERING) {
            return new Result(state, SessionIntents.none());
        }
        ConfigurationError error = new ConfigurationError.StepFailed(DeviceSessionState.Phase.DISCOVERING, e.failure());
        return new Result(DeviceSessionState.disconnected(e.timestamp()), SessionIntents.reportFailure(error));
    }

    private Result onAcknowledgment(DeviceSessionState state, SessionAckEvent.Acknowledgment e) {
        if (state.staleAcknowledgments().contains(e.characteristic())) {
            return new Result(state.consumeStaleAcknowledgment(e.characteristic()), SessionIntents.none());
        }

        final DeviceSessionState.Phase phase = state.phase();
        if (!phase.awaitsWriteAcknowledgment() || state.characteristics().isEmpty()) {
            return new Result(state, SessionIntents.none());
        }

        final SensorCharacteristics chars = state.characteristics().get();
        final boolean descriptorPhase = phase == DeviceSessionState.Phase.ENABLING_NOTIFICATIONS;
        final boolean descriptorAck = e instanceof SessionAckEvent.NotificationsEnabled
                || e instanceof SessionAckEvent.NotificationsEnableFailed;

        // A write acknowledgment during ENABLING_NOTIFICATIONS (or the reverse)
        // belongs to some other operation.
        if (descriptorPhase != descriptorAck) {
            return new Result(state, SessionIntents.none());
        }

        final UUID expected = descriptorPhase ? chars.notifyCharacteristic() : chars.writeCharacteristic();
        if (!expected.equals(e.characteristic())) {
            return new Result(state, SessionIntents.none());
        }

        final Instant now = e.timestamp();

        if (!e.succeeded()) {
            ConfigurationError error = new ConfigurationError.StepFailed(phase, e.failure());
            return new Result(DeviceSessionState.disconnected(now), SessionIntents.reportFailure(error));
        }

        return switch (phase) {
            case UNLOCKING -> new Result(
                    state.withPhase(DeviceSessionState.Phase.SETTING_RATE, now),
                    SessionIntents.writeCommand(chars.writeCharacteristic(), Wt901Command.SET_RATE_100HZ));
            case SETTING_RATE -> new Result(
                    state.withPhase(DeviceSessionState.Phase.SAVING_CONFIG, now),
                    SessionIntents.writeCommand(chars.writeCharacteristic(), Wt901Command.SAVE_CONFIG));
            case SAVING_CONFIG -> new Result(
                    state.withPhase(DeviceSessionState.Phase.ENABLING_NOTIFICATIONS, now),
                    SessionIntents.enableNotifications(chars.notifyCharacteristic()));
            case ENABLING_NOTIFICATIONS -> new Result(
                    state.withPhase(DeviceSessionState.Phase.STREAMING, now),
                    SessionIntents.beginStreaming());
            default -> new Result(state, SessionIntents.none());
        };
    }

    // ---------------------------------------------------------------------
    // Characteristic lookup
    // ---------------------------------------------------------------------

    /**
     * Finds the write and notify characteristics: first in the profile's
     * service, then by probing every advertised service in order for one that
     * holds both.
     */
    Optional<SensorCharacteristics> locate(ServiceSet services) {
        if (holdsBoth(services, profile.serviceId())) {
            return Optional.of(characteristicsIn(profile.serviceId()));
        }

        for (UUID service : services.serviceIds()) {
            if (holdsBoth(services, service)) {
                return Optional.of(characteristicsIn(service));
            }
        }
        return Optional.empty();
    }

    private boolean holdsBoth(ServiceSet services, UUID service) {
        return services.hasCharacteristic(service, profile.writeCharacteristic())
                && services.hasCharacteristic(service, profile.notifyCharacteristic());
    }

    private SensorCharacteristics characteristicsIn(UUID service) {
        return new SensorCharacteristics(service, profile.writeCharacteristic(), profile.notifyCharacteristic());
    }
}
