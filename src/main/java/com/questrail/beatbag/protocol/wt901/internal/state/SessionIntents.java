package com.questrail.beatbag.protocol.wt901.internal.state;

import com.questrail.beatbag.api.ConfigurationError;
import com.questrail.beatbag.protocol.wt901.model.Wt901Command;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable collection of <em>session execution intentions</em> emitted by the
 * {@link SessionStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code SessionIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic state transition logic</li>
 *   <li>impure transport calls and listener notifications</li>
 * </ul>
 *
 * The reducer determines <b>what should happen next</b>; the executor
 * determines <b>how</b> it is carried out. Kinds are executed in declaration
 * order.
 */
public final class SessionIntents
{
    /**
     * Enumerates the kinds of actions the session may need to perform.
     */
    public enum Kind {
        /** Force the kick detector back to armed. */
        RESET_DETECTOR,

        /** Ask the transport to enumerate services. */
        DISCOVER_SERVICES,

        /** Write a configuration command to the target characteristic. */
        WRITE_COMMAND,

        /** Enable notifications on the target characteristic. */
        ENABLE_NOTIFICATIONS,

        /** Tell the application that telemetry is flowing. */
        REPORT_STREAMING,

        /** Tell the application that configuration failed. */
        REPORT_FAILURE,

        /** Tell the application that the link went down. */
        REPORT_DISCONNECTED
    }

    private static final SessionIntents NONE = new SessionIntents(EnumSet.noneOf(Kind.class), null, null, null);

    private final Set<Kind> kinds;
    private final UUID targetCharacteristic;
    private final Wt901Command command;
    private final ConfigurationError error;

    private SessionIntents(Set<Kind> kinds,
                           UUID targetCharacteristic,
                           Wt901Command command,
                           ConfigurationError error) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.targetCharacteristic = targetCharacteristic;
        this.command = command;
        this.error = error;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * Characteristic targeted by {@link Kind#WRITE_COMMAND} or
     * {@link Kind#ENABLE_NOTIFICATIONS}.
     */
    public Optional<UUID> targetCharacteristic() {
        return Optional.ofNullable(targetCharacteristic);
    }

    /** Command carried by {@link Kind#WRITE_COMMAND}. */
    public Optional<Wt901Command> command() {
        return Optional.ofNullable(command);
    }

    /** Error carried by {@link Kind#REPORT_FAILURE}. */
    public Optional<ConfigurationError> error() {
        return Optional.ofNullable(error);
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static SessionIntents none() {
        return NONE;
    }

    public static SessionIntents discoverServices() {
        return builder().add(Kind.DISCOVER_SERVICES).build();
    }

    public static SessionIntents writeCommand(UUID characteristic, Wt901Command command) {
        return builder()
                .add(Kind.WRITE_COMMAND)
                .targetCharacteristic(characteristic)
                .command(command)
                .build();
    }

    public static SessionIntents enableNotifications(UUID characteristic) {
        return builder()
                .add(Kind.ENABLE_NOTIFICATIONS)
                .targetCharacteristic(characteristic)
                .build();
    }

    /**
     * Entering {@code STREAMING}: re-arm the detector, then announce.
     */
    public static SessionIntents beginStreaming() {
        return builder()
                .add(Kind.RESET_DETECTOR)
                .add(Kind.REPORT_STREAMING)
                .build();
    }

    public static SessionIntents reportFailure(ConfigurationError error) {
        return builder()
                .add(Kind.REPORT_FAILURE)
                .error(error)
                .build();
    }

    public static SessionIntents reportDisconnected() {
        return builder().add(Kind.REPORT_DISCONNECTED).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private UUID targetCharacteristic;
        private Wt901Command command;
        private ConfigurationError error;

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder targetCharacteristic(UUID characteristic) {
            this.targetCharacteristic = Objects.requireNonNull(characteristic, "characteristic");
            return this;
        }

        public Builder command(Wt901Command command) {
            this.command = Objects.requireNonNull(command, "command");
            return this;
        }

        public Builder error(ConfigurationError error) {
            this.error = Objects.requireNonNull(error, "error");
            return this;
        }

        public SessionIntents build() {
            if (kinds.contains(Kind.WRITE_COMMAND) && (command == null || targetCharacteristic == null)) {
                throw new IllegalStateException("WRITE_COMMAND requires a command and a target characteristic");
            }
            if (kinds.contains(Kind.ENABLE_NOTIFICATIONS) && targetCharacteristic == null) {
                throw new IllegalStateException("ENABLE_NOTIFICATIONS requires a target characteristic");
            }
            if (kinds.contains(Kind.REPORT_FAILURE) && error == null) {
                throw new IllegalStateException("REPORT_FAILURE requires an error");
            }
            return new SessionIntents(kinds, targetCharacteristic, command, error);
        }
    }

    @Override
    public String toString() {
        return "SessionIntents{kinds=" + kinds
                + (command != null ? ", command=" + command : "")
                + (targetCharacteristic != null ? ", target=" + targetCharacteristic : "")
                + (error != null ? ", error=" + error.describe() : "")
                + '}';
    }
}
