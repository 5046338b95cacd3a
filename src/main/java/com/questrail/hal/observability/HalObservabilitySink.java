package com.questrail.hal.observability;

/**
 * Main interface for receiving bus and camera observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the bus dispatch thread or on module worker threads
 * and must not block.</p>
 */
public interface HalObservabilitySink {
    /**
     * Called after a module has decided how to handle a message.
     */
    void onMessageDispatched(MessageDispatchEvent event);

    /**
     * Called when a camera controller's film length state changes.
     */
    void onFilmLengthTransition(FilmLengthTransitionEvent event);

    /**
     * Called as scoped tasks start, finish, fail or run long.
     */
    void onScopedTask(ScopedTaskEvent event);

    /**
     * Called when a module fails to handle a message.
     */
    void onError(HalErrorEvent event);
}
