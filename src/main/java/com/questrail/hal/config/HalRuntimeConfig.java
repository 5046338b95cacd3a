package com.questrail.hal.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the HAL runtime.
 *
 * @param cameras cameras in the order their controllers are attached to the bus
 */
public record HalRuntimeConfig(
    List<CameraConfig> cameras,
    HalTimingPolicy timingPolicy
) {
    public HalRuntimeConfig {
        Objects.requireNonNull(cameras, "cameras");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        cameras = List.copyOf(cameras);
        if (cameras.isEmpty()) {
            throw new IllegalArgumentException("At least one camera required");
        }
        Set<String> names = new HashSet<>();
        for (CameraConfig camera : cameras) {
            if (!names.add(camera.cameraName())) {
                throw new IllegalArgumentException("Duplicate camera name: " + camera.cameraName());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<CameraConfig> cameras = new ArrayList<>();
        private HalTimingPolicy timingPolicy = HalTimingPolicy.defaults();

        public Builder addCamera(CameraConfig camera) {
            cameras.add(Objects.requireNonNull(camera, "camera"));
            return this;
        }

        public Builder withTimingPolicy(HalTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public HalRuntimeConfig build() {
            return new HalRuntimeConfig(cameras, timingPolicy);
        }
    }
}
