package com.questrail.beatbag.protocol.wt901.internal.exec;

import com.questrail.beatbag.observability.NullObservabilitySink;
import com.questrail.beatbag.observability.SensorErrorEvent;
import com.questrail.beatbag.observability.SensorObservabilitySink;
import com.questrail.beatbag.protocol.wt901.internal.time.SystemWallClock;
import com.questrail.beatbag.transport.SensorTransportException;
import com.questrail.beatbag.transport.SensorTransportListener;
import com.questrail.beatbag.transport.ServiceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SerializedTransportListener
 * =============================================================================
 * Single-consumer event loop in front of a {@link SensorTransportListener}.
 *
 * <h2>Purpose</h2>
 * Some hosts deliver transport callbacks on a thread pool. The device session
 * and the kick detector mutate ordered state and must see callbacks one at a
 * time, in arrival order. This wrapper enqueues every callback and replays it
 * on one dedicated thread.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Any thread may invoke the listener methods; they only enqueue</li>
 *   <li>The delegate is invoked only from the loop thread</li>
 *   <li>Notification payloads are copied on enqueue, since transports may
 *       recycle their buffers</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   serializer.start()   → starts loop thread
 *   transport callbacks  → enqueued, replayed in order
 *   serializer.stop()    → stops loop, discards pending callbacks
 * </pre>
 */
public final class SerializedTransportListener implements SensorTransportListener
{
    private static final Logger log = LoggerFactory.getLogger(SerializedTransportListener.class);

    private final SensorTransportListener delegate;
    private final SensorObservabilitySink observabilitySink;

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread loopThread;

    public SerializedTransportListener(SensorTransportListener delegate,
                                       SensorObservabilitySink observabilitySink)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the loop thread. Idempotent.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "beatbag-transport-callbacks");
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    /**
     * Stops the loop thread and waits for it to terminate.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = loopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(5000);
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            queue.clear();
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    /**
     * Runs {@code task} on the loop thread, after every callback already queued.
     * Used for caller-initiated session actions that must not race callbacks.
     */
    public void post(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        enqueue("post", task);
    }

    /**
     * Returns true if the caller is running on the loop thread.
     */
    public boolean isLoopThread()
    {
        return Thread.currentThread() == loopThread;
    }

    // -------------------------------------------------------------------------
    // SensorTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected()
    {
        enqueue("onConnected", delegate::onConnected);
    }

    @Override
    public void onDisconnected(Throwable cause)
    {
        enqueue("onDisconnected", () -> delegate.onDisconnected(cause));
    }

    @Override
    public void onServicesDiscovered(ServiceSet services)
    {
        enqueue("onServicesDiscovered", () -> delegate.onServicesDiscovered(services));
    }

    @Override
    public void onServiceDiscoveryFailed(SensorTransportException failure)
    {
        enqueue("onServiceDiscoveryFailed", () -> delegate.onServiceDiscoveryFailed(failure));
    }

    @Override
    public void onCharacteristicWritten(UUID characteristic)
    {
        enqueue("onCharacteristicWritten", () -> delegate.onCharacteristicWritten(characteristic));
    }

    @Override
    public void onCharacteristicWriteFailed(UUID characteristic, SensorTransportException failure)
    {
        enqueue("onCharacteristicWriteFailed", () -> delegate.onCharacteristicWriteFailed(characteristic, failure));
    }

    @Override
    public void onNotificationsEnabled(UUID characteristic)
    {
        enqueue("onNotificationsEnabled", () -> delegate.onNotificationsEnabled(characteristic));
    }

    @Override
    public void onNotificationsEnableFailed(UUID characteristic, SensorTransportException failure)
    {
        enqueue("onNotificationsEnableFailed", () -> delegate.onNotificationsEnableFailed(characteristic, failure));
    }

    @Override
    public void onNotification(UUID characteristic, byte[] payload)
    {
        final byte[] copy = payload.clone();
        enqueue("onNotification", () -> delegate.onNotification(characteristic, copy));
    }

    // -------------------------------------------------------------------------
    // Loop
    // -------------------------------------------------------------------------

    private void enqueue(String callback, Runnable task)
    {
        if (!running.get()) {
            log.warn("Dropping {}: callback loop is not running", callback);
            return;
        }
        queue.offer(task);
    }

    private void runLoop()
    {
        while (running.get()) {
            try {
                Runnable task = queue.take();
                if (running.get()) {
                    task.run();
                }
            }
            catch (InterruptedException e) {
                // Expected during shutdown
                if (!running.get()) {
                    return;
                }
                log.warn("Callback loop interrupted while running; continuing");
            }
            catch (RuntimeException e) {
                observabilitySink.onError(new SensorErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Transport callback processing error",
                        e));
            }
            catch (Error e) {
                // The loop dies with the thread; later callbacks are dropped, not queued.
                running.set(false);
                queue.clear();
                log.error("Callback loop terminated by fatal error", e);
                observabilitySink.onError(new SensorErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Transport callback loop terminated",
                        e));
                throw e;
            }
        }
    }
}
