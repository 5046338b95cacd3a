package com.questrail.hal.bus;

import com.questrail.hal.config.HalTimingPolicy;
import com.questrail.hal.observability.HalErrorEvent;
import com.questrail.hal.observability.HalObservabilitySink;
import com.questrail.hal.observability.NullObservabilitySink;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HalMessageBus
 * =============================================================================
 * Single-process message bus connecting the modules of a HAL application.
 *
 * <h2>Threading Model</h2>
 * All dispatch happens on one executor thread. A message sent from any thread
 * is validated immediately, then queued for that thread, which hands it to
 * every registered module in registration order. This ensures:
 * <ul>
 *   <li>Every module sees messages in the order they were sent</li>
 *   <li>No module ever processes two messages concurrently</li>
 *   <li>A module's blocking work (see {@link ScopedTaskRunner}) never delays
 *       the other modules</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   bus.register(module)     → attaches module, creates its worker
 *   bus.send(message)        → validates, queues for dispatch, returns outcome
 *   bus.shutdown(timeout)    → cleans up every module, stops dispatch
 * </pre>
 */
public final class HalMessageBus
{
    private final MessageRegistry registry;
    private final EventExecutor dispatcher;
    private final HalTimingPolicy timingPolicy;
    private final HalObservabilitySink observabilitySink;

    private final List<AbstractHalModule> modules = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public HalMessageBus(MessageRegistry registry,
                         EventExecutor dispatcher,
                         HalTimingPolicy timingPolicy,
                         HalObservabilitySink observabilitySink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Creates a bus with a fresh registry and its own daemon dispatch thread.
     */
    public static HalMessageBus create(HalTimingPolicy timingPolicy, HalObservabilitySink observabilitySink) {
        return new HalMessageBus(
                new MessageRegistry(),
                new DefaultEventExecutor(new DefaultThreadFactory("hal-bus", true)),
                timingPolicy,
                observabilitySink);
    }

    /**
     * Attaches a module. Modules receive messages in the order they were
     * registered.
     *
     * @throws IllegalStateException if a module of the same name is registered
     *                               or the bus has been shut down
     */
    public synchronized void register(AbstractHalModule module) {
        Objects.requireNonNull(module, "module");
        if (shutdown.get()) {
            throw new IllegalStateException("Bus has been shut down");
        }
        for (AbstractHalModule existing : modules) {
            if (existing.moduleName().equals(module.moduleName())) {
                throw new IllegalStateException("Module '" + module.moduleName() + "' is already registered");
            }
        }

        EventExecutor worker = new DefaultEventExecutor(
                new DefaultThreadFactory(module.moduleName() + "-worker", true));
        ScopedTaskRunner runner = new ScopedTaskRunner(
                module.moduleName(), worker, dispatcher, timingPolicy, observabilitySink);
        try {
            module.attach(this, runner);
        } catch (RuntimeException e) {
            worker.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw e;
        }
        modules.add(module);
    }

    /**
     * Sends a message to every registered module.
     *
     * @return the message's outcome, completed when every module has handled it
     *         and every scoped task it started has finished
     * @throws ProtocolViolationException if the message does not match its
     *                                    registered definition
     * @throws IllegalStateException      if the message was already sent or the
     *                                    bus has been shut down
     */
    public Future<MessageOutcome> send(HalMessage message) {
        Objects.requireNonNull(message, "message");
        if (shutdown.get()) {
            throw new IllegalStateException("Bus has been shut down");
        }

        MessageDefinition definition = registry.validate(message);
        Promise<MessageOutcome> outcome = dispatcher.newPromise();
        message.bind(definition, outcome);

        try {
            dispatcher.execute(() -> fanOut(message));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Bus has been shut down", e);
        }
        return outcome;
    }

    public List<HalModule> modules() {
        return List.copyOf(modules);
    }

    public MessageRegistry registry() {
        return registry;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public void shutdown() {
        shutdown(timingPolicy.shutdownTimeout());
    }

    /**
     * Cleans up every module in registration order, then stops the dispatch
     * thread. A module whose clean-up fails is reported and skipped. Only the
     * first call has any effect.
     */
    public void shutdown(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        for (AbstractHalModule module : modules) {
            try {
                module.cleanUp();
            } catch (RuntimeException e) {
                observabilitySink.onError(new HalErrorEvent(
                        Instant.now(), module.moduleName(), null, "clean-up failed", e));
            }
        }

        long timeoutMillis = timeout.toMillis();
        try {
            dispatcher.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS)
                    .await(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    EventExecutor dispatcher() {
        return dispatcher;
    }

    HalObservabilitySink sink() {
        return observabilitySink;
    }

    private void fanOut(HalMessage message) {
        try {
            for (AbstractHalModule module : modules) {
                module.deliver(message);
            }
        } finally {
            message.release();
        }
    }
}
