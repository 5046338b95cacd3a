package com.questrail.hal.camera;

import com.questrail.hal.api.CameraFunctionality;
import com.questrail.hal.api.DeviceDriver;
import com.questrail.hal.api.FilmSettings;
import com.questrail.hal.api.ParameterSet;
import com.questrail.hal.bus.AbstractHalModule;
import com.questrail.hal.bus.Dispatch;
import com.questrail.hal.bus.HalMessage;
import com.questrail.hal.bus.HalMessageResponse;
import com.questrail.hal.bus.MessageRegistry;
import com.questrail.hal.camera.CameraMessages.Addressed;
import com.questrail.hal.camera.CameraMessages.FilmTiming;
import com.questrail.hal.camera.CameraMessages.GetFunctionality;
import com.questrail.hal.camera.CameraMessages.InitialParameters;
import com.questrail.hal.camera.CameraMessages.NewParameters;
import com.questrail.hal.camera.CameraMessages.StartFilm;
import com.questrail.hal.camera.CameraResponses.FunctionalityResponse;
import com.questrail.hal.camera.CameraResponses.NewParametersResponse;
import com.questrail.hal.camera.CameraResponses.OldParametersResponse;
import com.questrail.hal.camera.CameraResponses.StopFilmResponse;
import com.questrail.hal.observability.FilmLengthTransitionEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * CameraController
 * =============================================================================
 * Bus-facing controller for a single camera.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Operate the camera through its {@link DeviceDriver} in response to bus
 *       messages</li>
 *   <li>Hand out the camera's {@link CameraFunctionality} on request</li>
 *   <li>Remember the length of a fixed-length film until the time base camera
 *       is told about it</li>
 * </ul>
 *
 * <h2>Identity</h2>
 * The controller's module name is the camera's name. Messages addressed to a
 * different camera are ignored without touching the driver.
 *
 * <h2>Driver ownership</h2>
 * The driver is owned exclusively by this controller. It is called either on
 * the dispatch thread (cheap queries, and the stop-film path, which must
 * complete before the film is closed) or inside a scoped task on the module's
 * worker. The mailbox guarantees the two never overlap.
 *
 * <h2>State</h2>
 * {@link FilmLengthState} is the only state carried from one message to the
 * next. It is written on the dispatch thread only.
 */
public final class CameraController extends AbstractHalModule
{
    private final DeviceDriver driver;

    private volatile FilmLengthState filmLengthState = FilmLengthState.idle();

    public CameraController(String cameraName, DeviceDriver driver) {
        super(cameraName);
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    public FilmLengthState filmLengthState() {
        return filmLengthState;
    }

    /**
     * Fixed length of the current film, present only between a fixed-length
     * start film and the next stop film.
     */
    public OptionalInt filmLength() {
        return filmLengthState.filmLength();
    }

    @Override
    protected void onAttach(MessageRegistry registry) {
        CameraMessageType.registerAll(registry);
    }

    @Override
    protected void onCleanUp() {
        driver.cleanUp();
    }

    @Override
    protected Dispatch processMessage(HalMessage message) {
        Optional<CameraMessageType> kind = CameraMessageType.fromTypeName(message.type());
        if (kind.isEmpty()) {
            return Dispatch.IGNORED;
        }

        return switch (kind.get()) {
            case CONFIGURE_INITIAL -> onConfigureInitial();
            case FILM_TIMING -> onFilmTiming(message);
            case GET_FUNCTIONALITY -> onGetFunctionality(message);
            case NEW_PARAMETERS -> onNewParameters(message);
            case SHUTTER_CLICKED -> ifAddressed(message, driver::toggleShutter);
            case START_CAMERA -> ifAddressed(message, driver::startCamera);
            case START_FILM -> onStartFilm(message);
            case STOP_CAMERA -> ifAddressed(message, driver::stopCamera);
            case STOP_FILM -> onStopFilm(message);
            case INITIAL_PARAMETERS -> Dispatch.IGNORED;
        };
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    private Dispatch onConfigureInitial() {
        InitialParameters payload = new InitialParameters(driver.getParameters().copy());
        sendMessage(CameraMessageType.INITIAL_PARAMETERS.newMessage(moduleName(), payload));
        return Dispatch.SYNCHRONOUS;
    }

    private Dispatch onFilmTiming(HalMessage message) {
        CameraFunctionality functionality = message.data(FilmTiming.class).functionality();
        if (!functionality.timeBase().equals(moduleName())) {
            return Dispatch.IGNORED;
        }
        if (!(filmLengthState instanceof FilmLengthState.PendingFixedLength pending)) {
            return Dispatch.IGNORED;
        }

        int frames = pending.frames();
        runWorkerTask(message, () -> driver.setFilmLength(frames));
        transition(new FilmLengthState.Delivered(frames), message);
        return Dispatch.SCOPED_TASK;
    }

    private Dispatch onGetFunctionality(HalMessage message) {
        if (!isAddressedToMe(message.data(GetFunctionality.class))) {
            return Dispatch.IGNORED;
        }
        message.addResponse(new HalMessageResponse(moduleName(),
                new FunctionalityResponse(driver.getCameraFunctionality())));
        return Dispatch.SYNCHRONOUS;
    }

    private Dispatch onNewParameters(HalMessage message) {
        // Fails with UnknownParameterException before anything is appended.
        ParameterSet mine = message.data(NewParameters.class).parameters().get(moduleName()).copy();

        message.addResponse(new HalMessageResponse(moduleName(),
                new OldParametersResponse(driver.getParameters().copy())));

        runWorkerTask(message,
                () -> driver.newParameters(mine),
                () -> message.addResponse(new HalMessageResponse(moduleName(),
                        new NewParametersResponse(driver.getParameters().copy()))));
        return Dispatch.SCOPED_TASK;
    }

    private Dispatch onStartFilm(HalMessage message) {
        FilmSettings settings = message.data(StartFilm.class).filmSettings();
        if (settings.isFixedLength()) {
            transition(new FilmLengthState.PendingFixedLength(settings.getFilmLength()), message);
        } else {
            transition(FilmLengthState.idle(), message);
        }
        return Dispatch.SYNCHRONOUS;
    }

    private Dispatch onStopFilm(HalMessage message) {
        transition(FilmLengthState.idle(), message);
        driver.stopFilm();
        message.addResponse(new HalMessageResponse(moduleName(),
                new StopFilmResponse(driver.getParameters().copy())));
        return Dispatch.SYNCHRONOUS;
    }

    private Dispatch ifAddressed(HalMessage message, Runnable work) {
        if (!isAddressedToMe(message.data(Addressed.class))) {
            return Dispatch.IGNORED;
        }
        runWorkerTask(message, work);
        return Dispatch.SCOPED_TASK;
    }

    private boolean isAddressedToMe(Addressed payload) {
        return moduleName().equals(payload.camera());
    }

    private void transition(FilmLengthState next, HalMessage trigger) {
        FilmLengthState previous = filmLengthState;
        filmLengthState = next;
        if (!previous.equals(next)) {
            observabilitySink().onFilmLengthTransition(new FilmLengthTransitionEvent(
                    Instant.now(), moduleName(), previous, next, trigger.type()));
        }
    }
}
