package com.questrail.hal.config;

import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.camera.DeviceDriverFactory;
import com.questrail.hal.camera.sim.SimulatedCameraDriver;

import java.util.Objects;

/**
 * Configuration of one camera: its module name, whether it is the master, the
 * driver settings and the factory that builds its driver.
 */
public record CameraConfig(
    String cameraName,
    boolean master,
    ParameterSet parameters,
    DeviceDriverFactory driverFactory
) {
    public CameraConfig {
        Objects.requireNonNull(cameraName, "cameraName");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(driverFactory, "driverFactory");
        if (cameraName.isBlank()) {
            throw new IllegalArgumentException("cameraName must not be blank");
        }
    }

    public static Builder builder(String cameraName) {
        return new Builder(cameraName);
    }

    public static final class Builder {
        private final String cameraName;
        private boolean master;
        private ParameterSet parameters;
        private DeviceDriverFactory driverFactory = SimulatedCameraDriver.factory();

        private Builder(String cameraName) {
            this.cameraName = cameraName;
        }

        public Builder withMaster(boolean master) {
            this.master = master;
            return this;
        }

        public Builder withParameters(ParameterSet parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder withDriverFactory(DeviceDriverFactory driverFactory) {
            this.driverFactory = driverFactory;
            return this;
        }

        public CameraConfig build() {
            ParameterSet p = parameters != null ? parameters : new ParameterSet(cameraName);
            return new CameraConfig(cameraName, master, p, driverFactory);
        }
    }
}
