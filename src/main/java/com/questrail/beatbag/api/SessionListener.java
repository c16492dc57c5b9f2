package com.questrail.beatbag.api;

/**
 * SessionListener
 * -----------------------------------------------------------------------------
 * Lifecycle callbacks of a device session.
 *
 * <p>Each condition is reported once per occurrence. All methods have empty
 * defaults so callers override only what they display.</p>
 */
public interface SessionListener
{
    /** The configuration handshake completed; telemetry is flowing. */
    default void onStreaming() {}

    /** The transport link went down (from any phase other than disconnected). */
    default void onDisconnected() {}

    /**
     * Configuration could not complete on this connection attempt. The session
     * is back in its disconnected phase; the caller may restart it.
     */
    default void onConfigurationFailed(ConfigurationError error) {}
}
