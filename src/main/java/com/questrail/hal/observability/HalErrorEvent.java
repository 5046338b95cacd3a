package com.questrail.hal.observability;

import java.time.Instant;

/**
 * Record representing a failure while a module handled a message.
 *
 * @param module      module that failed
 * @param messageType type of the message being handled
 */
public record HalErrorEvent(
    Instant timestamp,
    String module,
    String messageType,
    String message,
    Throwable cause
) {
}
