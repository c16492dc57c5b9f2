package com.questrail.beatbag.protocol.wt901;

import com.questrail.beatbag.observability.NullObservabilitySink;
import com.questrail.beatbag.observability.SensorObservabilitySink;
import com.questrail.beatbag.observability.SessionTransitionEvent;
import com.questrail.beatbag.protocol.wt901.internal.events.SessionEvent;
import com.questrail.beatbag.protocol.wt901.internal.exec.SessionIntentExecutor;
import com.questrail.beatbag.protocol.wt901.internal.state.DeviceSessionState;
import com.questrail.beatbag.protocol.wt901.internal.state.SessionStateReducer;
import com.questrail.beatbag.protocol.wt901.internal.time.WallClock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionController
 * -----------------------------------------------------------------------------
 * Owner of the device session's event loop.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The composition point for reducer, executor and session state</li>
 *   <li>A single-threaded, actor-style coordinator</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It is <strong>not</strong> a transport adapter</li>
 *   <li>It is <strong>not</strong> responsible for decoding telemetry</li>
 *   <li>It is <strong>not</strong> allowed to invent session behavior</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new state → intents → executor
 * </pre>
 * <p>Transports may acknowledge an operation synchronously, from inside the
 * executor. Such re-entrant submissions are queued and processed by the outer
 * {@link #drain()} once the current step has completed, so the state seen by
 * every event is the state produced by the event before it.</p>
 */
public class SessionController
{
    private final SessionStateReducer reducer;
    private final SessionIntentExecutor executor;
    private final SensorObservabilitySink observabilitySink;
    private final WallClock clock;

    private final Deque<SessionEvent> queue = new ArrayDeque<>();
    private boolean draining;

    // Volatile so diagnostics on other threads see the latest snapshot.
    private volatile DeviceSessionState state;

    public SessionController(DeviceSessionState initialState,
                             SessionStateReducer reducer,
                             SessionIntentExecutor executor,
                             SensorObservabilitySink observabilitySink,
                             WallClock clock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Enqueue an event for later processing.
     */
    public void submit(SessionEvent event)
    {
        Objects.requireNonNull(event, "event");
        queue.addLast(event);
    }

    /**
     * Process exactly one queued event, if present.
     *
     * @return {@code true} if an event was processed; {@code false} if the queue was empty.
     */
    public boolean step()
    {
        SessionEvent event = queue.pollFirst();
        if (event == null) {
            return false;
        }

        DeviceSessionState oldState = state;
        SessionStateReducer.Result result = reducer.apply(oldState, event);
        this.state = result.newState();

        observabilitySink.onSessionTransition(new SessionTransitionEvent(
                clock.now(),
                oldState,
                result.newState(),
                event,
                result.intents()));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
        return true;
    }

    /**
     * Drain the queue until no events remain. A nested call made while draining
     * returns immediately; the outer call picks up what was queued.
     */
    public void drain()
    {
        if (draining) {
            return;
        }
        draining = true;
        try {
            while (step()) {
                // Intentionally empty.
            }
        }
        finally {
            draining = false;
        }
    }

    /**
     * Convenience for the common submit-then-drain sequence.
     */
    public void submitAndDrain(SessionEvent event)
    {
        submit(event);
        drain();
    }

    /**
     * Exposes the current immutable session state snapshot.
     */
    public DeviceSessionState state()
    {
        return state;
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    public Optional<SessionEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peekFirst());
    }
}
