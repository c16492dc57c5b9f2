package com.questrail.beatbag.protocol.wt901.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for all events processed by the device session state
 * machine.
 *
 * <p>Every change to session state occurs strictly in response to a
 * {@code SessionEvent}, processed one at a time. Transport callbacks are
 * translated into events at the session boundary; telemetry notifications are
 * not events (they are decoded directly once streaming).</p>
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events must be immutable</li>
 *   <li>Events must carry only the information needed to advance state</li>
 * </ul>
 */
public interface SessionEvent
{
    /**
     * Time at which the event occurred or was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SessionEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + timestamp;
        }
    }
}
