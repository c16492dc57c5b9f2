package com.questrail.beatbag.protocol.wt901.internal.exec;

import com.questrail.beatbag.protocol.wt901.internal.state.SessionIntents;

/**
 * SessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure session state machine and the impure
 * world of transport calls and application callbacks.
 *
 * <p>It is the ONLY layer allowed to:</p>
 * <ul>
 *   <li>Initiate discovery, writes and descriptor writes on the transport</li>
 *   <li>Reset the kick detector</li>
 *   <li>Notify the application of session outcomes</li>
 * </ul>
 *
 * <p>Execution must be <b>non-blocking</b>. Outcomes of transport operations
 * come back to the state machine as session events, never as return values.</p>
 */
public interface SessionIntentExecutor
{
    /**
     * Execute the supplied intentions, in {@link SessionIntents.Kind} order.
     *
     * @param intents immutable set of actions to perform
     */
    void execute(SessionIntents intents);
}
