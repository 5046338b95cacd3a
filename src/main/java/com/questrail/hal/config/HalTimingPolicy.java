package com.questrail.hal.config;

import java.time.Duration;
import java.util.Objects;

/**
 * HalTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the bus and its scoped task runners.
 *
 * <p>This is <em>operational only</em>. Nothing here changes what a
 * controller does with a message; it only bounds how long the runtime waits
 * and when it complains.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>slowTaskThreshold</b>: A scoped task still running after this long
 *       is reported as slow. Reporting only: tasks are never cancelled or
 *       preempted. {@link Duration#ZERO} disables the check.</li>
 *   <li><b>shutdownTimeout</b>: Maximum time to wait for a module's final
 *       clean-up work and for each executor to terminate on stop.</li>
 * </ul>
 */
public record HalTimingPolicy(
        Duration slowTaskThreshold,
        Duration shutdownTimeout
) {
    /**
     * Canonical constructor with validation.
     */
    public HalTimingPolicy {
        Objects.requireNonNull(slowTaskThreshold, "slowTaskThreshold");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (slowTaskThreshold.isNegative()) {
            throw new IllegalArgumentException("slowTaskThreshold must be non-negative");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    public boolean slowTaskCheckEnabled() {
        return !slowTaskThreshold.isZero();
    }

    /**
     * Creates a policy with typical defaults.
     *
     * <ul>
     *   <li>slowTaskThreshold: 2s</li>
     *   <li>shutdownTimeout: 5s</li>
     * </ul>
     */
    public static HalTimingPolicy defaults() {
        return new HalTimingPolicy(
                Duration.ofSeconds(2),
                Duration.ofSeconds(5)
        );
    }
}
