package com.questrail.hal.observability;

/**
 * No-op implementation of HalObservabilitySink.
 */
public final class NullObservabilitySink implements HalObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageDispatched(MessageDispatchEvent event) {}

    @Override
    public void onFilmLengthTransition(FilmLengthTransitionEvent event) {}

    @Override
    public void onScopedTask(ScopedTaskEvent event) {}

    @Override
    public void onError(HalErrorEvent event) {}
}
