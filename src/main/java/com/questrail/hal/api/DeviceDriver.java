package com.questrail.hal.api;

/**
 * DeviceDriver
 * -----------------------------------------------------------------------------
 * Boundary between a camera controller and the hardware (or simulation) that
 * actually runs the camera.
 *
 * <h2>Role in the architecture</h2>
 * A {@code DeviceDriver} turns abstract commands ("start", "stop", "apply these
 * parameters") into device I/O. It knows nothing about the message bus.
 * <p>
 * Exactly one controller owns each driver instance. No other component may call
 * into it; everything else reaches the device through bus messages handled by
 * that controller.
 *
 * <h2>Blocking and failure</h2>
 * Every method may block for a non-trivial time and may fail with a
 * {@link DeviceException}. Callers must not assume any call is cheap.
 *
 * <h2>Threading</h2>
 * Implementations need not be thread-safe. The owning controller guarantees
 * that calls never overlap, although successive calls may arrive on different
 * threads.
 */
public interface DeviceDriver
{
    /**
     * Returns the driver's live parameter set.
     * <p>
     * The returned object may be the driver's own instance; callers that need a
     * stable snapshot must {@link ParameterSet#copy()} it.
     */
    ParameterSet getParameters();

    /**
     * Applies a new parameter sub-tree (the part of the settings addressed to
     * this camera).
     *
     * @param parameters parameters for this camera only
     */
    void newParameters(ParameterSet parameters);

    /**
     * Returns the capability handle describing this camera.
     */
    CameraFunctionality getCameraFunctionality();

    /**
     * Configures the device for a fixed-length film of {@code frames} frames.
     */
    void setFilmLength(int frames);

    void startCamera();

    void stopCamera();

    /**
     * Called once per film when the film ends, on every camera at once.
     */
    void stopFilm();

    void toggleShutter();

    /**
     * Releases the device. No other method will be called afterwards.
     */
    void cleanUp();
}
