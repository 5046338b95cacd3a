package com.questrail.hal.api;

import java.util.Objects;

/**
 * Settings for one film (acquisition), as sent with a "start film" message.
 *
 * @param basename    file basename the film is saved under
 * @param fixedLength {@code true} for a film of a predetermined frame count,
 *                    {@code false} for a film stopped externally
 * @param filmLength  number of frames of a fixed-length film; ignored otherwise
 */
public record FilmSettings(String basename, boolean fixedLength, int filmLength)
{
    public FilmSettings {
        Objects.requireNonNull(basename, "basename");
        if (fixedLength && filmLength < 0) {
            throw new IllegalArgumentException("filmLength must be >= 0 for a fixed-length film");
        }
    }

    public static FilmSettings fixedLength(String basename, int frames) {
        return new FilmSettings(basename, true, frames);
    }

    public static FilmSettings runTillAbort(String basename) {
        return new FilmSettings(basename, false, 0);
    }

    public boolean isFixedLength() {
        return fixedLength;
    }

    public int getFilmLength() {
        return filmLength;
    }
}
