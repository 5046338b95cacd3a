package com.questrail.hal.runtime;

import com.questrail.hal.api.DeviceDriver;
import com.questrail.hal.bus.AbstractHalModule;
import com.questrail.hal.bus.HalMessage;
import com.questrail.hal.bus.HalMessageBus;
import com.questrail.hal.bus.MessageOutcome;
import com.questrail.hal.bus.MessageRegistry;
import com.questrail.hal.camera.CameraController;
import com.questrail.hal.camera.CameraMessageType;
import com.questrail.hal.camera.CameraMessages.ConfigureInitial;
import com.questrail.hal.config.CameraConfig;
import com.questrail.hal.config.HalRuntimeConfig;
import com.questrail.hal.observability.HalObservabilitySink;
import com.questrail.hal.observability.NullObservabilitySink;

import io.netty.util.concurrent.Future;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HalRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for the camera side of a HAL
 * application.
 *
 * <p>Builds the bus and one {@link CameraController} per configured camera, in
 * configuration order, each with the driver its {@link CameraConfig} factory
 * produces. Other modules (film, timing, display...) are attached with
 * {@link #register(AbstractHalModule)} before {@link #start()}.</p>
 *
 * <pre>
 *   runtime = HalRuntime.builder().withConfig(config).build();
 *   runtime.register(filmModule);
 *   runtime.start();     → broadcasts "configure1"
 *   ...
 *   runtime.stop();      → driver clean-up on every camera, bus stopped
 * </pre>
 */
public final class HalRuntime {
    public static final String SOURCE = "hal";

    private final HalMessageBus bus;
    private final Map<String, CameraController> controllers;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private HalRuntime(HalMessageBus bus, Map<String, CameraController> controllers) {
        this.bus = bus;
        this.controllers = controllers;
    }

    /**
     * Broadcasts {@code configure1} so every camera announces its initial
     * parameters.
     *
     * @return outcome of the configure message
     * @throws IllegalStateException if already started or stopped
     */
    public Future<MessageOutcome> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }
        return send(CameraMessageType.CONFIGURE_INITIAL.newMessage(SOURCE, new ConfigureInitial()));
    }

    /**
     * Cleans up every module and stops the bus. Safe to call more than once.
     */
    public void stop() {
        started.set(true);
        bus.shutdown();
    }

    public Future<MessageOutcome> send(HalMessage message) {
        return bus.send(message);
    }

    public void register(AbstractHalModule module) {
        bus.register(module);
    }

    /**
     * @throws IllegalArgumentException if no camera has that name
     */
    public CameraController controller(String cameraName) {
        CameraController controller = controllers.get(cameraName);
        if (controller == null) {
            throw new IllegalArgumentException("Unknown camera: " + cameraName);
        }
        return controller;
    }

    public List<String> cameraNames() {
        return List.copyOf(controllers.keySet());
    }

    public MessageRegistry registry() {
        return bus.registry();
    }

    public boolean isStopped() {
        return bus.isShutdown();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HalRuntimeConfig config;
        private HalObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(HalRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(HalObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public HalRuntime build() {
            Objects.requireNonNull(config, "config");

            // 1. Bus with its own dispatch thread
            HalMessageBus bus = HalMessageBus.create(config.timingPolicy(), observabilitySink);

            // 2. One controller per camera, drivers resolved up front
            Map<String, CameraController> controllers = new LinkedHashMap<>();
            try {
                for (CameraConfig camera : config.cameras()) {
                    DeviceDriver driver = camera.driverFactory()
                            .create(camera.cameraName(), camera.parameters().copy(), camera.master());
                    CameraController controller = new CameraController(
                            camera.cameraName(),
                            Objects.requireNonNull(driver, "driver for " + camera.cameraName()));
                    bus.register(controller);
                    controllers.put(camera.cameraName(), controller);
                }
            } catch (RuntimeException e) {
                bus.shutdown();
                throw e;
            }

            return new HalRuntime(bus, controllers);
        }
    }
}
