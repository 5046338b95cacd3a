package com.questrail.hal.camera.sim;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.DeviceDriver;
import com.questrail.hal.api.DeviceException;
import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.camera.DeviceDriverFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * SimulatedCameraDriver
 * -----------------------------------------------------------------------------
 * A camera with no hardware behind it.
 *
 * <p>Used when no real driver is configured and by tests that need a driver
 * with believable rules. It keeps a parameter set, tracks whether the camera
 * is running, the shutter position and the configured film length, and
 * enforces the constraints a real camera would:</p>
 * <ul>
 *   <li>the exposure time must be positive</li>
 *   <li>parameters cannot change while the camera is running</li>
 *   <li>nothing works after {@link #cleanUp()}</li>
 * </ul>
 */
public final class SimulatedCameraDriver implements DeviceDriver
{
    public static final String EXPOSURE_TIME = "exposure_time";
    public static final String X_PIXELS = "x_pixels";
    public static final String Y_PIXELS = "y_pixels";
    public static final String MAX_INTENSITY = "max_intensity";
    public static final String EXTENSION = "extension";

    private final String cameraName;
    private final boolean master;
    private final ParameterSet parameters;

    private volatile boolean running;
    private volatile boolean shutterOpen;
    private volatile int filmLength = -1;
    private volatile boolean closed;

    /**
     * @param configured settings that override the defaults; may be {@code null}
     */
    public SimulatedCameraDriver(String cameraName, ParameterSet configured, boolean master) {
        this.cameraName = Objects.requireNonNull(cameraName, "cameraName");
        this.master = master;
        this.parameters = defaults(cameraName);
        if (configured != null) {
            checkExposure(configured);
            for (String key : configured.keys()) {
                parameters.set(key, copyValue(configured.getValue(key)));
            }
        }
    }

    public static DeviceDriverFactory factory() {
        return SimulatedCameraDriver::new;
    }

    @Override
    public ParameterSet getParameters() {
        ensureOpen();
        return parameters;
    }

    @Override
    public void newParameters(ParameterSet changes) {
        Objects.requireNonNull(changes, "changes");
        ensureOpen();
        if (running) {
            throw new DeviceException(cameraName + ": cannot change parameters while the camera is running");
        }
        checkExposure(changes);
        for (String key : changes.keys()) {
            parameters.set(key, copyValue(changes.getValue(key)));
        }
    }

    @Override
    public CameraFunctionality getCameraFunctionality() {
        ensureOpen();
        double exposure = parameters.getValue(EXPOSURE_TIME, Number.class).doubleValue();
        return CameraFunctionality.builder(cameraName)
                .withMaster(master)
                .withMaximum(parameters.getValue(MAX_INTENSITY, Number.class).intValue())
                .withChipSize(parameters.getValue(X_PIXELS, Number.class).intValue(),
                        parameters.getValue(Y_PIXELS, Number.class).intValue())
                .withFrameRate(1.0 / exposure)
                .withShutter(true)
                .withTemperature(false)
                .build();
    }

    @Override
    public void setFilmLength(int frames) {
        ensureOpen();
        if (frames < 0) {
            throw new DeviceException(cameraName + ": film length must be >= 0, got " + frames);
        }
        filmLength = frames;
    }

    @Override
    public void startCamera() {
        ensureOpen();
        running = true;
    }

    @Override
    public void stopCamera() {
        ensureOpen();
        running = false;
    }

    @Override
    public void stopFilm() {
        ensureOpen();
        filmLength = -1;
    }

    @Override
    public void toggleShutter() {
        ensureOpen();
        shutterOpen = !shutterOpen;
    }

    @Override
    public void cleanUp() {
        ensureOpen();
        running = false;
        closed = true;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isShutterOpen() {
        return shutterOpen;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Film length last configured for the current film.
     */
    public OptionalInt filmLength() {
        int n = filmLength;
        return n < 0 ? OptionalInt.empty() : OptionalInt.of(n);
    }

    private void ensureOpen() {
        if (closed) {
            throw new DeviceException(cameraName + ": driver has been cleaned up");
        }
    }

    private void checkExposure(ParameterSet changes) {
        if (!changes.has(EXPOSURE_TIME)) {
            return;
        }
        Object value = changes.getValue(EXPOSURE_TIME);
        if (!(value instanceof Number n) || n.doubleValue() <= 0) {
            throw new DeviceException(cameraName + ": exposure_time must be a positive number, got " + value);
        }
    }

    private static Object copyValue(Object value) {
        return value instanceof ParameterSet child ? child.copy() : value;
    }

    private static ParameterSet defaults(String cameraName) {
        return new ParameterSet(cameraName)
                .set(EXPOSURE_TIME, 0.1)
                .set(X_PIXELS, 512)
                .set(Y_PIXELS, 512)
                .set(MAX_INTENSITY, 4096)
                .set(EXTENSION, "");
    }
}
