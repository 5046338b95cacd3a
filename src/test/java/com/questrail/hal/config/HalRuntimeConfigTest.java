package com.questrail.hal.config;

import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.camera.sim.SimulatedCameraDriver;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HalRuntimeConfigTest {

    @Test
    void cameraDefaultsToSimulatedDriverAndEmptyParameters() {
        CameraConfig camera = CameraConfig.builder("cam1").build();

        assertFalse(camera.master());
        assertEquals(new ParameterSet("cam1"), camera.parameters());
        assertInstanceOf(SimulatedCameraDriver.class,
                camera.driverFactory().create("cam1", camera.parameters(), false));
    }

    @Test
    void builderKeepsCameraOrderAndDefaultPolicy() {
        HalRuntimeConfig config = HalRuntimeConfig.builder()
                .addCamera(CameraConfig.builder("cam2").build())
                .addCamera(CameraConfig.builder("cam1").withMaster(true).build())
                .build();

        assertEquals("cam2", config.cameras().get(0).cameraName());
        assertTrue(config.cameras().get(1).master());
        assertEquals(HalTimingPolicy.defaults(), config.timingPolicy());
    }

    @Test
    void requiresAtLeastOneCamera() {
        assertThrows(IllegalArgumentException.class, () -> HalRuntimeConfig.builder().build());
    }

    @Test
    void rejectsDuplicateCameraNames() {
        HalRuntimeConfig.Builder builder = HalRuntimeConfig.builder()
                .addCamera(CameraConfig.builder("cam1").build())
                .addCamera(CameraConfig.builder("cam1").build());

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsBlankCameraNameAndNullPolicy() {
        assertThrows(IllegalArgumentException.class, () -> CameraConfig.builder(" ").build());
        assertThrows(NullPointerException.class, () -> HalRuntimeConfig.builder()
                .addCamera(CameraConfig.builder("cam1").build())
                .withTimingPolicy(null)
                .build());
    }
}
