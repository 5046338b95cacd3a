package com.questrail.hal.api;

/**
 * Indicates that a {@link DeviceDriver} could not complete an operation.
 *
 * This typically reflects:
 * <ul>
 *   <li>An I/O fault talking to the camera</li>
 *   <li>An operation that is illegal in the device's current state</li>
 *   <li>A hardware timeout</li>
 * </ul>
 *
 * Controllers do not retry on this exception. It is recorded against the
 * message that triggered the operation and reported to the sender.
 */
public class DeviceException extends RuntimeException
{
    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
