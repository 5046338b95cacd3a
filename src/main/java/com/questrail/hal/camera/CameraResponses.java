package com.questrail.hal.camera;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.bus.ResponsePayload;

import java.util.Objects;

/**
 * Response payloads appended by camera controllers.
 */
public final class CameraResponses
{
    private CameraResponses() {}

    public record FunctionalityResponse(CameraFunctionality functionality) implements ResponsePayload {
        public FunctionalityResponse {
            Objects.requireNonNull(functionality, "functionality");
        }
    }

    /**
     * Snapshot of a camera's parameters taken before new ones were applied.
     */
    public record OldParametersResponse(ParameterSet parameters) implements ResponsePayload {
        public OldParametersResponse {
            Objects.requireNonNull(parameters, "parameters");
        }
    }

    /**
     * A camera's parameters as read back after new ones were applied.
     */
    public record NewParametersResponse(ParameterSet parameters) implements ResponsePayload {
        public NewParametersResponse {
            Objects.requireNonNull(parameters, "parameters");
        }
    }

    /**
     * A camera's parameters at the end of a film, saved with the film.
     */
    public record StopFilmResponse(ParameterSet parameters) implements ResponsePayload {
        public StopFilmResponse {
            Objects.requireNonNull(parameters, "parameters");
        }
    }
}
