package com.questrail.hal.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HalObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHalObservabilitySink implements HalObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHalObservabilitySink.class);

    @Override
    public void onMessageDispatched(MessageDispatchEvent event) {
        log.debug("{}: '{}' from {} -> {}",
            event.module(),
            event.messageType(),
            event.messageSource(),
            event.dispatch());
    }

    @Override
    public void onFilmLengthTransition(FilmLengthTransitionEvent event) {
        if (event.discardedUndelivered()) {
            log.warn("{}: fixed film length {} discarded on '{}' before any film timing notice",
                event.camera(),
                event.oldState(),
                event.triggeringMessageType());
            return;
        }
        log.info("{}: Film length {} -> {}",
            event.camera(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onScopedTask(ScopedTaskEvent event) {
        switch (event.kind()) {
            case SLOW -> log.warn("{}: task for '{}' still running after {} ms",
                event.module(), event.messageType(), event.elapsed().toMillis());
            case FAILED -> log.debug("{}: task for '{}' failed after {} ms",
                event.module(), event.messageType(), event.elapsed().toMillis(), event.cause());
            default -> log.debug("{}: task for '{}' {}",
                event.module(), event.messageType(), event.kind());
        }
    }

    @Override
    public void onError(HalErrorEvent event) {
        log.error("{}: '{}' failed: {}", event.module(), event.messageType(), event.message(), event.cause());
    }
}
