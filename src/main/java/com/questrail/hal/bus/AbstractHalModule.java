package com.questrail.hal.bus;

import com.questrail.hal.observability.HalErrorEvent;
import com.questrail.hal.observability.HalObservabilitySink;
import com.questrail.hal.observability.MessageDispatchEvent;
import com.questrail.hal.observability.NullObservabilitySink;

import io.netty.util.concurrent.Future;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractHalModule
 * =============================================================================
 * Base class for every module attached to a {@link HalMessageBus}.
 *
 * <h2>Mailbox</h2>
 * The bus hands each message to every module on its single dispatch thread.
 * Each module puts it in its own mailbox and processes the mailbox in order,
 * one message at a time. While the module has a scoped task in flight its
 * mailbox is held back: the next message is processed only after the task
 * finishes. Other modules are unaffected and keep draining their own
 * mailboxes.
 *
 * <h2>Subclass contract</h2>
 * <ul>
 *   <li>{@link #processMessage(HalMessage)} runs on the dispatch thread and must
 *       not block. Blocking device work goes through
 *       {@link #runWorkerTask(HalMessage, Runnable, Runnable)}.</li>
 *   <li>Message types the module understands are registered in
 *       {@link #onAttach(MessageRegistry)}.</li>
 *   <li>Resources are released in {@link #onCleanUp()}, which runs on the
 *       module's worker after any outstanding task.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * A runtime exception thrown by {@code processMessage} or by a scoped task is
 * recorded against the message (see {@link MessageOutcome#failures()}) and
 * reported to the observability sink. It never stops the bus or the module.
 */
public abstract class AbstractHalModule implements HalModule
{
    private final String moduleName;

    // Dispatch thread only.
    private final Deque<HalMessage> mailbox = new ArrayDeque<>();
    private HalMessage current;
    private HalMessage inFlight;
    private boolean draining;

    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);

    private volatile HalMessageBus bus;
    private volatile ScopedTaskRunner taskRunner;

    protected AbstractHalModule(String moduleName) {
        Objects.requireNonNull(moduleName, "moduleName");
        if (moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName must not be blank");
        }
        this.moduleName = moduleName;
    }

    @Override
    public final String moduleName() {
        return moduleName;
    }

    /**
     * Decides how to handle one message.
     *
     * @return {@link Dispatch#SCOPED_TASK} if a worker task was started,
     *         {@link Dispatch#SYNCHRONOUS} if the message was fully handled here,
     *         {@link Dispatch#IGNORED} if it was not for this module
     */
    protected abstract Dispatch processMessage(HalMessage message);

    /**
     * Called once when the module is attached to a bus. Register message types
     * here.
     */
    protected void onAttach(MessageRegistry registry) {
    }

    /**
     * Releases module resources. Runs on the worker thread.
     */
    protected void onCleanUp() {
    }

    /**
     * Starts a scoped task for the message currently being processed.
     */
    protected final void runWorkerTask(HalMessage message, Runnable work) {
        runWorkerTask(message, work, null);
    }

    /**
     * Starts a scoped task for the message currently being processed. The
     * message stays open, and this module's mailbox is held, until the task has
     * finished.
     *
     * @param then optional continuation run on the worker after {@code work}
     *             succeeds; responses it appends follow the task's side effects
     * @throws IllegalStateException if called outside {@link #processMessage}
     *                               for that message, or if a task is already
     *                               in flight
     */
    protected final void runWorkerTask(HalMessage message, Runnable work, Runnable then) {
        Objects.requireNonNull(message, "message");
        if (message != current) {
            throw new IllegalStateException(moduleName + " may only start a task for the message it is processing");
        }

        Future<Void> task = runner().run(message, work, then);
        inFlight = message;

        task.addListener(done -> {
            try {
                bus.dispatcher().execute(() -> onTaskFinished(message, done));
            } catch (RejectedExecutionException e) {
                // Dispatcher already stopped; settle the message here.
                if (!done.isSuccess()) {
                    fail(message, done.cause());
                }
                message.release();
            }
        });
    }

    /**
     * Sends a new message on the bus this module is attached to.
     */
    protected final Future<MessageOutcome> sendMessage(HalMessage message) {
        return attachedBus().send(message);
    }

    protected final HalObservabilitySink observabilitySink() {
        HalMessageBus b = bus;
        return b == null ? NullObservabilitySink.INSTANCE : b.sink();
    }

    public final boolean isAttached() {
        return bus != null;
    }

    /**
     * True while a scoped task started by this module has not finished.
     */
    public final boolean isBusy() {
        ScopedTaskRunner r = taskRunner;
        return r != null && r.isBusy();
    }

    /**
     * Runs {@link #onCleanUp()} on the worker after any outstanding task and
     * stops the worker. Only the first call has any effect.
     */
    @Override
    public final void cleanUp() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        ScopedTaskRunner r = taskRunner;
        if (r == null) {
            onCleanUp();
            return;
        }
        r.shutdown(this::onCleanUp);
    }

    // ---------------------------------------------------------------------
    // Bus side
    // ---------------------------------------------------------------------

    final void attach(HalMessageBus bus, ScopedTaskRunner runner) {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(runner, "runner");
        if (this.bus != null) {
            throw new IllegalStateException(moduleName + " is already attached to a bus");
        }
        onAttach(bus.registry());
        this.taskRunner = runner;
        this.bus = bus;
    }

    /**
     * Accepts a message from the bus. Dispatch thread only.
     */
    final void deliver(HalMessage message) {
        message.hold();
        mailbox.addLast(message);
        drain();
    }

    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            while (inFlight == null && !mailbox.isEmpty()) {
                dispatchOne(mailbox.pollFirst());
            }
        } finally {
            draining = false;
        }
    }

    private void dispatchOne(HalMessage message) {
        current = message;
        try {
            Dispatch dispatch = processMessage(message);
            observabilitySink().onMessageDispatched(new MessageDispatchEvent(
                    Instant.now(), moduleName, message.type(), message.source(), dispatch));
        } catch (RuntimeException e) {
            fail(message, e);
        } finally {
            current = null;
        }

        if (inFlight != message) {
            message.release();
        }
    }

    private void onTaskFinished(HalMessage message, Future<?> done) {
        if (!done.isSuccess()) {
            fail(message, done.cause());
        }
        inFlight = null;
        message.release();
        drain();
    }

    private void fail(HalMessage message, Throwable cause) {
        message.recordFailure(moduleName, cause);
        String text = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        observabilitySink().onError(new HalErrorEvent(
                Instant.now(), moduleName, message.type(), text, cause));
    }

    private ScopedTaskRunner runner() {
        ScopedTaskRunner r = taskRunner;
        if (r == null) {
            throw new IllegalStateException(moduleName + " is not attached to a bus");
        }
        return r;
    }

    private HalMessageBus attachedBus() {
        HalMessageBus b = bus;
        if (b == null) {
            throw new IllegalStateException(moduleName + " is not attached to a bus");
        }
        return b;
    }
}
