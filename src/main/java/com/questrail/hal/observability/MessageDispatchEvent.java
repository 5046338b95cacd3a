package com.questrail.hal.observability;

import com.questrail.hal.bus.Dispatch;

import java.time.Instant;

/**
 * Record of one module's decision about one message.
 */
public record MessageDispatchEvent(
    Instant timestamp,
    String module,
    String messageType,
    String messageSource,
    Dispatch dispatch
) {
}
