package com.questrail.beatbag.protocol.wt901.internal.events;

import com.questrail.beatbag.transport.SensorTransportException;
import com.questrail.beatbag.transport.ServiceSet;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of service discovery.
 */
public sealed interface SessionDiscoveryEvent extends SessionEvent
        permits SessionDiscoveryEvent.ServicesDiscovered, SessionDiscoveryEvent.DiscoveryFailed
{
    final class ServicesDiscovered extends SessionEvent.Base implements SessionDiscoveryEvent {
        private final ServiceSet services;

        public ServicesDiscovered(Instant timestamp, ServiceSet services) {
            super(timestamp);
            this.services = Objects.requireNonNull(services, "services");
        }

        public ServiceSet services() {
            return services;
        }
    }

    final class DiscoveryFailed extends SessionEvent.Base implements SessionDiscoveryEvent {
        private final SensorTransportException failure;

        public DiscoveryFailed(Instant timestamp, SensorTransportException failure) {
            super(timestamp);
            this.failure = failure;
        }

        /** Transport detail; may be {@code null}. */
        public SensorTransportException failure() {
            return failure;
        }
    }
}
