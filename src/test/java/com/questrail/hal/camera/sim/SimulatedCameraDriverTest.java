package com.questrail.hal.camera.sim;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.DeviceDriver;
import com.questrail.hal.api.DeviceException;
import com.questrail.hal.api.ParameterSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SimulatedCameraDriverTest
 * -----------------------------------------------------------------------------
 * Rules the simulated camera enforces in place of real hardware.
 */
class SimulatedCameraDriverTest {

    private static SimulatedCameraDriver driver() {
        return new SimulatedCameraDriver("cam1", null, true);
    }

    @Test
    void configuredParametersOverrideDefaults() {
        ParameterSet configured = new ParameterSet("cam1").set("x_pixels", 1024).set("gain", 2);
        SimulatedCameraDriver d = new SimulatedCameraDriver("cam1", configured, false);

        ParameterSet p = d.getParameters();
        assertEquals(1024, p.getValue("x_pixels"));
        assertEquals(512, p.getValue("y_pixels"));
        assertEquals(2, p.getValue("gain"));
        assertEquals(0.1, p.getValue("exposure_time"));
    }

    @Test
    void functionalityReflectsParameters() {
        SimulatedCameraDriver d = driver();
        CameraFunctionality f = d.getCameraFunctionality();

        assertEquals("cam1", f.cameraName());
        assertEquals("cam1", f.timeBase());
        assertTrue(f.master());
        assertEquals(4096, f.maximum());
        assertEquals(512, f.xPixels());
        assertEquals(10.0, f.frameRate(), 1e-9);
    }

    @Test
    void rejectsNonPositiveExposure() {
        SimulatedCameraDriver d = driver();
        assertThrows(DeviceException.class,
                () -> d.newParameters(new ParameterSet("cam1").set("exposure_time", 0.0)));
        assertThrows(DeviceException.class,
                () -> new SimulatedCameraDriver("cam1", new ParameterSet("cam1").set("exposure_time", -1), false));
        assertEquals(0.1, d.getParameters().getValue("exposure_time"));
    }

    @Test
    void rejectsParameterChangesWhileRunning() {
        SimulatedCameraDriver d = driver();
        d.startCamera();
        assertTrue(d.isRunning());

        assertThrows(DeviceException.class,
                () -> d.newParameters(new ParameterSet("cam1").set("exposure_time", 0.2)));

        d.stopCamera();
        d.newParameters(new ParameterSet("cam1").set("exposure_time", 0.2));
        assertEquals(0.2, d.getParameters().getValue("exposure_time"));
    }

    @Test
    void tracksShutterAndFilmLength() {
        SimulatedCameraDriver d = driver();
        d.toggleShutter();
        assertTrue(d.isShutterOpen());
        d.toggleShutter();
        assertFalse(d.isShutterOpen());

        d.setFilmLength(250);
        assertEquals(250, d.filmLength().orElseThrow());
        d.stopFilm();
        assertTrue(d.filmLength().isEmpty());
    }

    @Test
    void everyCallFailsAfterCleanUp() {
        SimulatedCameraDriver d = driver();
        d.cleanUp();

        assertTrue(d.isClosed());
        assertThrows(DeviceException.class, d::getParameters);
        assertThrows(DeviceException.class, d::startCamera);
        assertThrows(DeviceException.class, d::cleanUp);
    }

    @Test
    void factoryBuildsSimulatedDriver() {
        DeviceDriver d = SimulatedCameraDriver.factory().create("cam2", new ParameterSet("cam2"), false);
        assertInstanceOf(SimulatedCameraDriver.class, d);
        assertFalse(d.getCameraFunctionality().master());
    }
}
