package com.questrail.hal.camera;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.FilmSettings;
import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.bus.MessagePayload;

import java.util.Objects;
import java.util.Optional;

/**
 * Payloads of the messages a camera controller understands.
 *
 * <p>One record per {@link CameraMessageType}. Payloads that name a single
 * camera implement {@link Addressed}; every other camera ignores them.</p>
 */
public final class CameraMessages
{
    private CameraMessages() {}

    /**
     * Payload of a message meant for one camera only.
     */
    public interface Addressed extends MessagePayload {
        String camera();
    }

    /** First configuration pass; cameras answer by broadcasting their initial parameters. */
    public record ConfigureInitial() implements MessagePayload {}

    /**
     * Sent by the timing module when a film starts, naming the feed whose time
     * base drives it.
     */
    public record FilmTiming(CameraFunctionality functionality) implements MessagePayload {
        public FilmTiming {
            Objects.requireNonNull(functionality, "functionality");
        }
    }

    /**
     * Request for a camera's functionality handle.
     *
     * @param extraData optional free-form tag the requester uses to correlate
     *                  the reply; may be {@code null}
     */
    public record GetFunctionality(String camera, String extraData) implements Addressed {
        public GetFunctionality {
            Objects.requireNonNull(camera, "camera");
        }

        public GetFunctionality(String camera) {
            this(camera, null);
        }

        public Optional<String> extra() {
            return Optional.ofNullable(extraData);
        }
    }

    /**
     * New settings for the whole application. Each camera applies the sub-tree
     * keyed by its own name.
     */
    public record NewParameters(ParameterSet parameters) implements MessagePayload {
        public NewParameters {
            Objects.requireNonNull(parameters, "parameters");
        }
    }

    public record ShutterClicked(String camera) implements Addressed {
        public ShutterClicked {
            Objects.requireNonNull(camera, "camera");
        }
    }

    public record StartCamera(String camera) implements Addressed {
        public StartCamera {
            Objects.requireNonNull(camera, "camera");
        }
    }

    public record StartFilm(FilmSettings filmSettings) implements MessagePayload {
        public StartFilm {
            Objects.requireNonNull(filmSettings, "filmSettings");
        }
    }

    public record StopCamera(String camera) implements Addressed {
        public StopCamera {
            Objects.requireNonNull(camera, "camera");
        }
    }

    /** Goes to every camera at once when a film ends. */
    public record StopFilm() implements MessagePayload {}

    /** Broadcast by a camera in answer to {@link ConfigureInitial}. */
    public record InitialParameters(ParameterSet parameters) implements MessagePayload {
        public InitialParameters {
            Objects.requireNonNull(parameters, "parameters");
        }
    }
}
