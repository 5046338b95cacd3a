package com.questrail.hal.camera;

import com.questrail.hal.bus.HalMessage;
import com.questrail.hal.bus.MessageDefinition;
import com.questrail.hal.bus.MessagePayload;
import com.questrail.hal.bus.MessageRegistry;
import com.questrail.hal.bus.ResponsePayload;
import com.questrail.hal.camera.CameraMessages.ConfigureInitial;
import com.questrail.hal.camera.CameraMessages.FilmTiming;
import com.questrail.hal.camera.CameraMessages.GetFunctionality;
import com.questrail.hal.camera.CameraMessages.InitialParameters;
import com.questrail.hal.camera.CameraMessages.NewParameters;
import com.questrail.hal.camera.CameraMessages.ShutterClicked;
import com.questrail.hal.camera.CameraMessages.StartCamera;
import com.questrail.hal.camera.CameraMessages.StartFilm;
import com.questrail.hal.camera.CameraMessages.StopCamera;
import com.questrail.hal.camera.CameraMessages.StopFilm;
import com.questrail.hal.camera.CameraResponses.FunctionalityResponse;
import com.questrail.hal.camera.CameraResponses.NewParametersResponse;
import com.questrail.hal.camera.CameraResponses.OldParametersResponse;
import com.questrail.hal.camera.CameraResponses.StopFilmResponse;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CameraMessageType
 * -----------------------------------------------------------------------------
 * The closed set of message kinds a camera controller understands.
 *
 * <p>Each kind fixes the bus type name, the payload class and the response
 * classes handlers may append. The bus registry itself stays open: other
 * modules register their own types next to these, and a type name with no
 * matching kind here is simply not a camera message.</p>
 */
public enum CameraMessageType
{
    CONFIGURE_INITIAL("configure1", ConfigureInitial.class, Set.of()),
    FILM_TIMING("film timing", FilmTiming.class, Set.of()),
    GET_FUNCTIONALITY("get camera functionality", GetFunctionality.class, Set.of(FunctionalityResponse.class)),
    NEW_PARAMETERS("new parameters", NewParameters.class,
            Set.of(OldParametersResponse.class, NewParametersResponse.class)),
    SHUTTER_CLICKED("shutter clicked", ShutterClicked.class, Set.of()),
    START_CAMERA("start camera", StartCamera.class, Set.of()),
    START_FILM("start film", StartFilm.class, Set.of()),
    STOP_CAMERA("stop camera", StopCamera.class, Set.of()),
    STOP_FILM("stop film", StopFilm.class, Set.of(StopFilmResponse.class)),
    INITIAL_PARAMETERS("initial parameters", InitialParameters.class, Set.of());

    private final String typeName;
    private final Class<? extends MessagePayload> payloadType;
    private final Set<Class<? extends ResponsePayload>> responseTypes;

    CameraMessageType(String typeName,
                      Class<? extends MessagePayload> payloadType,
                      Set<Class<? extends ResponsePayload>> responseTypes)
    {
        this.typeName = typeName;
        this.payloadType = payloadType;
        this.responseTypes = responseTypes;
    }

    public String typeName() {
        return typeName;
    }

    public Class<? extends MessagePayload> payloadType() {
        return payloadType;
    }

    public MessageDefinition definition() {
        return new MessageDefinition(typeName, payloadType, responseTypes);
    }

    /**
     * Creates an unsent message of this kind.
     *
     * @throws IllegalArgumentException if the payload does not belong to this kind
     */
    public HalMessage newMessage(String source, MessagePayload payload) {
        Objects.requireNonNull(payload, "payload");
        if (!payloadType.isInstance(payload)) {
            throw new IllegalArgumentException(typeName + " expects " + payloadType.getSimpleName()
                    + ", got " + payload.getClass().getSimpleName());
        }
        return new HalMessage(source, typeName, payload);
    }

    public static Optional<CameraMessageType> fromTypeName(String typeName) {
        for (CameraMessageType kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Registers every camera message type. Every camera calls this, so
     * identical re-registration is tolerated.
     */
    public static void registerAll(MessageRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        for (CameraMessageType kind : values()) {
            registry.register(kind.definition(), false);
        }
    }
}
