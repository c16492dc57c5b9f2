package com.questrail.beatbag.protocol.wt901.internal.events;

import java.time.Instant;
import java.util.Optional;

/**
 * Events reporting the availability of the transport link, plus the caller's
 * request to re-run the handshake over a link that is still up.
 */
public sealed interface SessionLinkEvent extends SessionEvent
        permits SessionLinkEvent.Connected, SessionLinkEvent.Disconnected, SessionLinkEvent.RestartRequested
{
    /** Link became available. */
    final class Connected extends SessionEvent.Base implements SessionLinkEvent {
        public Connected(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Link became unavailable. */
    final class Disconnected extends SessionEvent.Base implements SessionLinkEvent {
        private final Throwable cause;

        public Disconnected(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Optional<Throwable> cause() {
            return Optional.ofNullable(cause);
        }
    }

    /** Caller asked to start the configuration sequence again. */
    final class RestartRequested extends SessionEvent.Base implements SessionLinkEvent {
        public RestartRequested(Instant timestamp) {
            super(timestamp);
        }
    }
}
