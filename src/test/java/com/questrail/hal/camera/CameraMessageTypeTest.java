package com.questrail.hal.camera;

import com.questrail.hal.bus.MessageDefinition;
import com.questrail.hal.bus.MessageRegistry;
import com.questrail.hal.camera.CameraMessages.GetFunctionality;
import com.questrail.hal.camera.CameraMessages.StopFilm;
import com.questrail.hal.camera.CameraResponses.FunctionalityResponse;
import com.questrail.hal.camera.CameraResponses.OldParametersResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CameraMessageTypeTest {

    @Test
    void typeNamesMapBothWays() {
        for (CameraMessageType kind : CameraMessageType.values()) {
            assertEquals(kind, CameraMessageType.fromTypeName(kind.typeName()).orElseThrow());
        }
        assertEquals(CameraMessageType.GET_FUNCTIONALITY,
                CameraMessageType.fromTypeName("get camera functionality").orElseThrow());
        assertTrue(CameraMessageType.fromTypeName("lock jump").isEmpty());
    }

    @Test
    void registerAllToleratesEveryCameraRegistering() {
        MessageRegistry registry = new MessageRegistry();
        CameraMessageType.registerAll(registry);
        CameraMessageType.registerAll(registry);

        assertEquals(CameraMessageType.values().length, registry.registeredTypes().size());
    }

    @Test
    void definitionsDeclareResponses() {
        MessageDefinition get = CameraMessageType.GET_FUNCTIONALITY.definition();
        assertEquals(GetFunctionality.class, get.payloadType());
        assertTrue(get.responseTypes().contains(FunctionalityResponse.class));

        assertTrue(CameraMessageType.NEW_PARAMETERS.definition().responseTypes()
                .contains(OldParametersResponse.class));
        assertTrue(CameraMessageType.START_CAMERA.definition().responseTypes().isEmpty());
    }

    @Test
    void newMessageRejectsPayloadOfAnotherKind() {
        assertThrows(IllegalArgumentException.class,
                () -> CameraMessageType.START_FILM.newMessage("film", new StopFilm()));
        assertEquals("stop film",
                CameraMessageType.STOP_FILM.newMessage("film", new StopFilm()).type());
    }

    @Test
    void functionalityRequestExtraDataIsOptional() {
        assertTrue(new GetFunctionality("cam1").extra().isEmpty());
        assertEquals("display1", new GetFunctionality("cam1", "display1").extra().orElseThrow());
    }
}
