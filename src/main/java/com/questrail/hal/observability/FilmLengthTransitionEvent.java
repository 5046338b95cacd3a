package com.questrail.hal.observability;

import com.questrail.hal.camera.FilmLengthState;

import java.time.Instant;

/**
 * Record representing a change of a camera controller's film length state.
 */
public record FilmLengthTransitionEvent(
    Instant timestamp,
    String camera,
    FilmLengthState oldState,
    FilmLengthState newState,
    String triggeringMessageType
) {
    /**
     * True when a fixed film length was dropped before it was ever pushed to
     * the driver, i.e. a film ended without this camera receiving a film
     * timing notice naming it as the time base.
     */
    public boolean discardedUndelivered() {
        return oldState instanceof FilmLengthState.PendingFixedLength
                && newState instanceof FilmLengthState.Idle;
    }
}
