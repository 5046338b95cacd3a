package com.questrail.hal.api;

import java.util.Objects;

/**
 * CameraFunctionality
 * -----------------------------------------------------------------------------
 * Immutable capability handle describing one usable camera or feed.
 *
 * <h2>Purpose</h2>
 * Display, timing and film modules need to know <em>about</em> a camera (its
 * name, its chip size, which clock drives it) without being able to
 * <em>control</em> it. This handle carries exactly that information and no
 * reference to the controller or the driver.
 *
 * <h2>Time base</h2>
 * {@code timeBase} names the module whose clock or trigger governs this feed.
 * For a master camera this is normally the camera itself; a timing module may
 * hand out derived functionalities via {@link #withTimeBase(String)}.
 */
public record CameraFunctionality(
        String cameraName,
        String timeBase,
        boolean master,
        int maximum,
        int xPixels,
        int yPixels,
        double frameRate,
        boolean hasShutter,
        boolean hasTemperature
) {
    public CameraFunctionality {
        requireNonBlank(cameraName, "cameraName");
        requireNonBlank(timeBase, "timeBase");
        if (maximum < 0 || xPixels < 0 || yPixels < 0) {
            throw new IllegalArgumentException("maximum and chip dimensions must be >= 0");
        }
        if (frameRate < 0) {
            throw new IllegalArgumentException("frameRate must be >= 0");
        }
    }

    /**
     * Returns a copy of this functionality governed by a different time base.
     */
    public CameraFunctionality withTimeBase(String newTimeBase) {
        return new CameraFunctionality(cameraName, newTimeBase, master, maximum,
                xPixels, yPixels, frameRate, hasShutter, hasTemperature);
    }

    public static Builder builder(String cameraName) {
        return new Builder(cameraName);
    }

    private static void requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    public static final class Builder {
        private final String cameraName;
        private String timeBase;
        private boolean master;
        private int maximum;
        private int xPixels;
        private int yPixels;
        private double frameRate;
        private boolean hasShutter;
        private boolean hasTemperature;

        private Builder(String cameraName) {
            this.cameraName = cameraName;
            this.timeBase = cameraName;
        }

        public Builder withTimeBase(String timeBase) {
            this.timeBase = timeBase;
            return this;
        }

        public Builder withMaster(boolean master) {
            this.master = master;
            return this;
        }

        public Builder withMaximum(int maximum) {
            this.maximum = maximum;
            return this;
        }

        public Builder withChipSize(int xPixels, int yPixels) {
            this.xPixels = xPixels;
            this.yPixels = yPixels;
            return this;
        }

        public Builder withFrameRate(double frameRate) {
            this.frameRate = frameRate;
            return this;
        }

        public Builder withShutter(boolean hasShutter) {
            this.hasShutter = hasShutter;
            return this;
        }

        public Builder withTemperature(boolean hasTemperature) {
            this.hasTemperature = hasTemperature;
            return this;
        }

        public CameraFunctionality build() {
            return new CameraFunctionality(cameraName, timeBase, master, maximum,
                    xPixels, yPixels, frameRate, hasShutter, hasTemperature);
        }
    }
}
