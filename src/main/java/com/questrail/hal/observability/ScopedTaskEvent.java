package com.questrail.hal.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a lifecycle step of a scoped (worker) task.
 *
 * @param elapsed time since the task was submitted; {@link Duration#ZERO} for
 *                {@link Kind#STARTED}
 * @param cause   failure cause for {@link Kind#FAILED}, otherwise {@code null}
 */
public record ScopedTaskEvent(
    Instant timestamp,
    String module,
    String messageType,
    Kind kind,
    Duration elapsed,
    Throwable cause
) {
    public enum Kind {
        STARTED,
        COMPLETED,
        FAILED,
        /** Still running after the configured slow-task threshold. */
        SLOW
    }
}
