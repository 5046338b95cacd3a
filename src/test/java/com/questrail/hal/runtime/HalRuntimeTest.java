package com.questrail.hal.runtime;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.DeviceException;
import com.questrail.hal.api.FilmSettings;
import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.bus.AbstractHalModule;
import com.questrail.hal.bus.Dispatch;
import com.questrail.hal.bus.HalMessage;
import com.questrail.hal.bus.MessageOutcome;
import com.questrail.hal.camera.CameraMessageType;
import com.questrail.hal.camera.CameraMessages.FilmTiming;
import com.questrail.hal.camera.CameraMessages.GetFunctionality;
import com.questrail.hal.camera.CameraMessages.StartFilm;
import com.questrail.hal.camera.CameraMessages.StopFilm;
import com.questrail.hal.camera.CameraResponses.FunctionalityResponse;
import com.questrail.hal.camera.CameraResponses.StopFilmResponse;
import com.questrail.hal.camera.sim.SimulatedCameraDriver;
import com.questrail.hal.config.CameraConfig;
import com.questrail.hal.config.HalRuntimeConfig;
import com.questrail.hal.observability.Slf4jHalObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HalRuntimeTest
 * -----------------------------------------------------------------------------
 * Full stack with simulated cameras: composition, start-up broadcast, a
 * fixed-length film and shutdown.
 */
class HalRuntimeTest {

    private final Map<String, SimulatedCameraDriver> drivers = new ConcurrentHashMap<>();
    private HalRuntime runtime;

    @BeforeEach
    void setUp() {
        HalRuntimeConfig config = HalRuntimeConfig.builder()
                .addCamera(CameraConfig.builder("cam1")
                        .withMaster(true)
                        .withParameters(new ParameterSet("cam1").set("exposure_time", 0.05))
                        .withDriverFactory(this::simulatedDriver)
                        .build())
                .addCamera(CameraConfig.builder("cam2")
                        .withDriverFactory(this::simulatedDriver)
                        .build())
                .build();

        runtime = HalRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jHalObservabilitySink())
                .build();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    private SimulatedCameraDriver simulatedDriver(String camera, ParameterSet parameters, boolean master) {
        SimulatedCameraDriver driver = new SimulatedCameraDriver(camera, parameters, master);
        drivers.put(camera, driver);
        return driver;
    }

    // Simulator state is read only after the messages changing it have completed.
    private SimulatedCameraDriver simulated(String camera) {
        return drivers.get(camera);
    }

    private CameraFunctionality functionalityOf(String camera) throws Exception {
        MessageOutcome outcome = runtime.send(CameraMessageType.GET_FUNCTIONALITY.newMessage("display",
                new GetFunctionality(camera, null))).get(5, TimeUnit.SECONDS);
        List<FunctionalityResponse> responses = outcome.message().responses(FunctionalityResponse.class);
        assertEquals(1, responses.size());
        return responses.get(0).functionality();
    }

    @Test
    void buildsOneControllerPerCameraInOrder() {
        assertEquals(List.of("cam1", "cam2"), runtime.cameraNames());
        assertEquals("cam1", runtime.controller("cam1").moduleName());
        assertTrue(runtime.registry().isRegistered("get camera functionality"));
        assertThrows(IllegalArgumentException.class, () -> runtime.controller("cam3"));
    }

    @Test
    void configuredParametersReachTheDriver() throws Exception {
        assertEquals(0.05, simulated("cam1").getParameters().getValue("exposure_time"));
        assertTrue(functionalityOf("cam1").master());
        assertFalse(functionalityOf("cam2").master());
    }

    @Test
    void startBroadcastsConfigureAndCamerasAnnounceTheirParameters() throws Exception {
        Listener listener = new Listener(2);
        runtime.register(listener);

        MessageOutcome configure = runtime.start().get(5, TimeUnit.SECONDS);

        assertTrue(configure.isSuccess());
        assertEquals(HalRuntime.SOURCE, configure.message().source());
        assertTrue(listener.latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("cam1", "cam2"), listener.sources);
        assertThrows(IllegalStateException.class, () -> runtime.start());
    }

    @Test
    void fixedLengthFilmReachesTheTimeBaseDriver() throws Exception {
        runtime.start().get(5, TimeUnit.SECONDS);

        runtime.send(CameraMessageType.START_FILM.newMessage("film",
                new StartFilm(FilmSettings.fixedLength("movie", 20)))).get(5, TimeUnit.SECONDS);
        CameraFunctionality timing = functionalityOf("cam1");
        runtime.send(CameraMessageType.FILM_TIMING.newMessage("timing",
                new FilmTiming(timing))).get(5, TimeUnit.SECONDS);

        assertEquals(20, simulated("cam1").filmLength().orElseThrow());
        assertTrue(simulated("cam2").filmLength().isEmpty());

        MessageOutcome stop = runtime.send(CameraMessageType.STOP_FILM.newMessage("film",
                new StopFilm())).get(5, TimeUnit.SECONDS);

        assertTrue(stop.isSuccess());
        assertEquals(2, stop.message().responses(StopFilmResponse.class).size());
        assertTrue(simulated("cam1").filmLength().isEmpty());
        assertTrue(runtime.controller("cam1").filmLength().isEmpty());
    }

    @Test
    void stopCleansUpEveryDriverAndIsIdempotent() {
        runtime.stop();
        runtime.stop();

        assertTrue(runtime.isStopped());
        assertTrue(simulated("cam1").isClosed());
        assertTrue(simulated("cam2").isClosed());
        assertThrows(IllegalStateException.class, () -> runtime.send(
                CameraMessageType.STOP_FILM.newMessage("film", new StopFilm())));
    }

    @Test
    void driverFactoryFailureAbortsBuild() {
        HalRuntimeConfig config = HalRuntimeConfig.builder()
                .addCamera(CameraConfig.builder("cam1")
                        .withDriverFactory((name, parameters, master) -> {
                            throw new DeviceException("no camera on port");
                        })
                        .build())
                .build();

        assertThrows(DeviceException.class, () -> HalRuntime.builder().withConfig(config).build());
    }

    /**
     * Collects "initial parameters" broadcasts.
     */
    private static final class Listener extends AbstractHalModule {
        final List<String> sources = new CopyOnWriteArrayList<>();
        final CountDownLatch latch;

        Listener(int expected) {
            super("settings");
            this.latch = new CountDownLatch(expected);
        }

        @Override
        protected Dispatch processMessage(HalMessage message) {
            if (!message.isType(CameraMessageType.INITIAL_PARAMETERS.typeName())) {
                return Dispatch.IGNORED;
            }
            sources.add(message.source());
            latch.countDown();
            return Dispatch.SYNCHRONOUS;
        }
    }
}
