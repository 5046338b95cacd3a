package com.questrail.hal.bus;

/**
 * Indicates a message or response that does not match its registered shape.
 *
 * This typically reflects:
 * <ul>
 *   <li>A message type nobody registered</li>
 *   <li>A payload of the wrong class for the message type</li>
 *   <li>A response payload the message type does not declare</li>
 * </ul>
 *
 * It is thrown to the offending caller at send (or append) time, before any
 * module sees the message.
 */
public final class ProtocolViolationException extends RuntimeException
{
    public ProtocolViolationException(String message) {
        super(message);
    }
}
