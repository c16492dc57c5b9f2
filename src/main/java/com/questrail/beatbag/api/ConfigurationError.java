package com.questrail.beatbag.api;

import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * ConfigurationError
 * -----------------------------------------------------------------------------
 * Reason a device session could not reach streaming.
 *
 * <p>The two variants let a caller tell "the device answered but does not look
 * like a WT901" apart from "the device stopped cooperating mid-handshake".</p>
 */
public sealed interface ConfigurationError
        permits ConfigurationError.CharacteristicsNotFound, ConfigurationError.StepFailed
{
    /** Human-readable description for logs and notifications. */
    String describe();

    /**
     * Discovery succeeded but no advertised service exposes both the write and
     * notify characteristics.
     *
     * @param advertisedServices service identifiers the device did advertise
     */
    record CharacteristicsNotFound(List<UUID> advertisedServices) implements ConfigurationError
    {
        public CharacteristicsNotFound {
            advertisedServices = List.copyOf(advertisedServices);
        }

        @Override
        public String describe()
        {
            return "Sensor characteristics not found among " + advertisedServices.size()
                    + " advertised service(s)";
        }
    }

    /**
     * The transport reported a failure for the operation a phase initiated.
     *
     * @param phase phase whose operation failed
     * @param cause transport detail; may be {@code null}
     */
    record StepFailed(DeviceSessionState.Phase phase, Throwable cause) implements ConfigurationError
    {
        public StepFailed {
            Objects.requireNonNull(phase, "phase");
        }

        public Optional<Throwable> optionalCause()
        {
            return Optional.ofNullable(cause);
        }

        @Override
        public String describe()
        {
            return "Configuration step " + phase + " failed"
                    + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "");
        }
    }
}
