package com.questrail.hal.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HalTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates timing policy configuration and defaults.
 */
class HalTimingPolicyTest {

    @Test
    void defaultsAreTwoAndFiveSeconds() {
        HalTimingPolicy policy = HalTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(2), policy.slowTaskThreshold());
        assertEquals(Duration.ofSeconds(5), policy.shutdownTimeout());
        assertTrue(policy.slowTaskCheckEnabled());
    }

    @Test
    void zeroThresholdDisablesSlowTaskCheck() {
        assertFalse(new HalTimingPolicy(Duration.ZERO, Duration.ZERO).slowTaskCheckEnabled());
    }

    @Test
    void rejectsNullDurations() {
        assertThrows(NullPointerException.class, () -> new HalTimingPolicy(null, Duration.ZERO));
        assertThrows(NullPointerException.class, () -> new HalTimingPolicy(Duration.ZERO, null));
    }

    @Test
    void rejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> new HalTimingPolicy(Duration.ofMillis(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new HalTimingPolicy(Duration.ZERO, Duration.ofMillis(-1)));
    }
}
