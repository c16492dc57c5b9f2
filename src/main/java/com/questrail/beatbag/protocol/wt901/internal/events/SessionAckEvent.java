package com.questrail.beatbag.protocol.wt901.internal.events;

import com.questrail.beatbag.transport.SensorTransportException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * SessionAckEvent
 * -----------------------------------------------------------------------------
 * Completion acknowledgments for the write and descriptor operations the
 * session initiates while configuring the sensor.
 *
 * <p>Each acknowledgment names the characteristic it refers to, so that stale
 * or foreign completions can be told apart from the one the current phase is
 * waiting for.</p>
 */
public sealed interface SessionAckEvent extends SessionEvent
        permits SessionAckEvent.Acknowledgment
{
    /** Characteristic the acknowledgment refers to. */
    UUID characteristic();

    /** True if the transport reported success. */
    boolean succeeded();

    final class CharacteristicWritten extends Acknowledgment {
        public CharacteristicWritten(Instant timestamp, UUID characteristic) {
            super(timestamp, characteristic, null);
        }
    }

    final class CharacteristicWriteFailed extends Acknowledgment {
        public CharacteristicWriteFailed(Instant timestamp, UUID characteristic, SensorTransportException failure) {
            super(timestamp, characteristic, failure);
        }
    }

    final class NotificationsEnabled extends Acknowledgment {
        public NotificationsEnabled(Instant timestamp, UUID characteristic) {
            super(timestamp, characteristic, null);
        }
    }

    final class NotificationsEnableFailed extends Acknowledgment {
        public NotificationsEnableFailed(Instant timestamp, UUID characteristic, SensorTransportException failure) {
            super(timestamp, characteristic, failure);
        }
    }

    /**
     * Shared state of all acknowledgments.
     */
    abstract sealed class Acknowledgment extends SessionEvent.Base implements SessionAckEvent
            permits CharacteristicWritten, CharacteristicWriteFailed, NotificationsEnabled, NotificationsEnableFailed {
        private final UUID characteristic;
        private final SensorTransportException failure;

        Acknowledgment(Instant timestamp, UUID characteristic, SensorTransportException failure) {
            super(timestamp);
            this.characteristic = Objects.requireNonNull(characteristic, "characteristic");
            this.failure = failure;
        }

        @Override
        public UUID characteristic() {
            return characteristic;
        }

        /** Transport detail of a failed acknowledgment; {@code null} on success. */
        public SensorTransportException failure() {
            return failure;
        }

        @Override
        public boolean succeeded() {
            return this instanceof CharacteristicWritten || this instanceof NotificationsEnabled;
        }
    }
}
