package com.questrail.hal.camera;

import com.questrail.hal.api.DeviceDriver;
import com.questrail.hal.api.ParameterSet;

/**
 * Creates the driver for one camera. Chosen by configuration; the controller
 * only ever sees the resulting driver.
 */
@FunctionalInterface
public interface DeviceDriverFactory
{
    /**
     * @param cameraName the camera's module name
     * @param parameters driver configuration for this camera
     * @param master     whether this camera provides the master clock
     */
    DeviceDriver create(String cameraName, ParameterSet parameters, boolean master);
}
