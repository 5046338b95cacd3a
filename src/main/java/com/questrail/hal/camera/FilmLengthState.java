package com.questrail.hal.camera;

import java.util.OptionalInt;

/**
 * Film length state of one camera controller.
 *
 * <pre>
 *   Idle ──start film (fixed n)──▶ PendingFixedLength(n) ──film timing (own time base)──▶ Delivered(n)
 *     ▲                                   │                                                   │
 *     └─────────────── stop film / start film (not fixed) ◀──────────────────────────────────┘
 * </pre>
 *
 * The film length is pushed to the driver at most once per film, on the
 * transition to {@link Delivered}.
 */
public sealed interface FilmLengthState
        permits FilmLengthState.Idle, FilmLengthState.PendingFixedLength, FilmLengthState.Delivered
{
    /**
     * The fixed length of the current film, if one was declared.
     */
    OptionalInt filmLength();

    static FilmLengthState idle() {
        return Idle.INSTANCE;
    }

    /** No fixed-length film in progress. */
    enum Idle implements FilmLengthState {
        INSTANCE;

        @Override
        public OptionalInt filmLength() {
            return OptionalInt.empty();
        }

        @Override
        public String toString() {
            return "Idle";
        }
    }

    /** A fixed-length film started; the length has not reached the driver yet. */
    record PendingFixedLength(int frames) implements FilmLengthState {
        public PendingFixedLength {
            if (frames < 0) {
                throw new IllegalArgumentException("frames must be >= 0");
            }
        }

        @Override
        public OptionalInt filmLength() {
            return OptionalInt.of(frames);
        }
    }

    /** The length was handed to the driver for the current film. */
    record Delivered(int frames) implements FilmLengthState {
        public Delivered {
            if (frames < 0) {
                throw new IllegalArgumentException("frames must be >= 0");
            }
        }

        @Override
        public OptionalInt filmLength() {
            return OptionalInt.of(frames);
        }
    }
}
