package com.questrail.hal.bus;

import com.questrail.hal.config.HalTimingPolicy;
import com.questrail.hal.observability.HalObservabilitySink;
import com.questrail.hal.observability.ScopedTaskEvent;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ScopedTaskRunner
 * =============================================================================
 * Runs one module's blocking device work off the bus dispatch thread.
 *
 * <h2>Role in the architecture</h2>
 * A handler that would block the bus (anything touching hardware) hands the
 * work to its module's runner instead. The runner executes it on a worker
 * thread owned by that module alone, so a slow camera never delays the
 * dispatch of messages to other modules.
 *
 * <h2>Single-flight rule</h2>
 * At most one task per runner is outstanding. Starting a second one before the
 * first completes is a programming error and throws
 * {@link IllegalStateException}. {@link AbstractHalModule} holds back the
 * module's next message until the running task finishes, so well-behaved
 * modules never trip this.
 *
 * <h2>Ordering</h2>
 * For a message M the sender observes:
 * <pre>
 *   responses appended before run()  →  work side effects  →  responses appended by "then"
 * </pre>
 * {@code then} runs on the worker right after {@code work} succeeds and before
 * the returned future completes. It is skipped if {@code work} fails.
 *
 * <h2>Cancellation</h2>
 * None. Once started a task runs to completion. If the timing policy enables
 * it, a watchdog on the dispatch executor reports tasks that run longer than
 * the slow-task threshold.
 */
public final class ScopedTaskRunner {

    private final String moduleName;
    private final EventExecutor worker;
    private final EventExecutor watchdog;
    private final HalTimingPolicy timingPolicy;
    private final HalObservabilitySink observabilitySink;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    /**
     * @param moduleName        owning module, used in diagnostics
     * @param worker            single-threaded executor owned by this runner
     * @param watchdog          executor used only to time slow tasks
     * @param timingPolicy      slow-task and shutdown timing
     * @param observabilitySink receives task lifecycle events
     */
    public ScopedTaskRunner(String moduleName,
                            EventExecutor worker,
                            EventExecutor watchdog,
                            HalTimingPolicy timingPolicy,
                            HalObservabilitySink observabilitySink)
    {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public Future<Void> run(HalMessage message, Runnable work) {
        return run(message, work, null);
    }

    /**
     * Runs {@code work}, then {@code then} (if non-null), on the worker.
     *
     * @return a future that completes after both have run, or fails with the
     *         first exception thrown
     * @throws IllegalStateException if a task is already in flight or the
     *                               worker has been shut down
     */
    public Future<Void> run(HalMessage message, Runnable work, Runnable then) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(work, "work");

        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException(moduleName + " already has a scoped task in flight");
        }

        long submittedNanos = System.nanoTime();
        Promise<Void> promise = worker.newPromise();
        ScheduledFuture<?> slowCheck = armSlowCheck(message, promise, submittedNanos);

        try {
            worker.execute(() -> execute(message, work, then, promise, slowCheck, submittedNanos));
        } catch (RejectedExecutionException e) {
            if (slowCheck != null) {
                slowCheck.cancel(false);
            }
            inFlight.set(false);
            throw new IllegalStateException(moduleName + " worker has been shut down", e);
        }
        return promise;
    }

    /**
     * Returns true while a task is outstanding.
     */
    public boolean isBusy() {
        return inFlight.get();
    }

    public void shutdown(Runnable finalWork) {
        shutdown(finalWork, timingPolicy.shutdownTimeout());
    }

    /**
     * Runs {@code finalWork} on the worker after any outstanding task, waits for
     * it, and stops the worker. Later calls do nothing.
     *
     * @throws IllegalStateException if the final work does not finish within
     *                               {@code timeout}
     */
    public void shutdown(Runnable finalWork, Duration timeout) {
        Objects.requireNonNull(finalWork, "finalWork");
        Objects.requireNonNull(timeout, "timeout");
        if (worker.isShuttingDown()) {
            return;
        }

        long timeoutMillis = timeout.toMillis();
        try {
            Future<?> done = worker.submit(finalWork);
            if (!done.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException(moduleName + " clean-up did not finish within "
                        + timeoutMillis + " ms");
            }
            if (!done.isSuccess()) {
                Throwable cause = done.cause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException(moduleName + " clean-up failed", cause);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            worker.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS)
                    .awaitUninterruptibly(timeoutMillis, TimeUnit.MILLISECONDS);
        }
    }

    private void execute(HalMessage message, Runnable work, Runnable then,
                         Promise<Void> promise, ScheduledFuture<?> slowCheck, long submittedNanos)
    {
        report(message, ScopedTaskEvent.Kind.STARTED, Duration.ZERO, null);

        Throwable failure = null;
        try {
            work.run();
            if (then != null) {
                then.run();
            }
        } catch (Throwable t) {
            failure = t;
        }

        if (slowCheck != null) {
            slowCheck.cancel(false);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - submittedNanos);

        // Settled before the future completes.
        inFlight.set(false);
        if (failure == null) {
            report(message, ScopedTaskEvent.Kind.COMPLETED, elapsed, null);
            promise.setSuccess(null);
        } else {
            report(message, ScopedTaskEvent.Kind.FAILED, elapsed, failure);
            promise.setFailure(failure);
        }
    }

    private ScheduledFuture<?> armSlowCheck(HalMessage message, Promise<Void> promise, long submittedNanos) {
        if (!timingPolicy.slowTaskCheckEnabled() || watchdog.isShuttingDown()) {
            return null;
        }

        long thresholdNanos = timingPolicy.slowTaskThreshold().toNanos();
        try {
            return watchdog.schedule(() -> {
                if (!promise.isDone()) {
                    report(message, ScopedTaskEvent.Kind.SLOW,
                            Duration.ofNanos(System.nanoTime() - submittedNanos), null);
                }
            }, thresholdNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // Bus is stopping; the check is observational only.
            return null;
        }
    }

    private void report(HalMessage message, ScopedTaskEvent.Kind kind, Duration elapsed, Throwable cause) {
        observabilitySink.onScopedTask(new ScopedTaskEvent(
                Instant.now(), moduleName, message.type(), kind, elapsed, cause));
    }
}
