package com.mediaprobe.core;

import com.mediaprobe.Constants;
import lombok.Value;

import java.util.Optional;

/**
 * Frame size in pixels. Both sides are always in {@code (0, MAX_DIMENSION]}.
 */
@Value
public class Dimensions {
    /** Analog goggle DVR recordings. */
    public static final Dimensions SKYZONE_DVR = new Dimensions(640, 480);

    int width;
    int height;

    private Dimensions(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public static Dimensions of(int width, int height) {
        if (!isPlausible(width, height)) {
            throw new IllegalArgumentException("Dimensions out of range: " + width + "x" + height);
        }
        return new Dimensions(width, height);
    }

    /**
     * Empty when either side is outside {@code (0, MAX_DIMENSION]}, which is how corrupted or
     * zeroed (audio track) geometry fields are filtered out.
     */
    public static Optional<Dimensions> ifPlausible(int width, int height) {
        return isPlausible(width, height) ? Optional.of(new Dimensions(width, height)) : Optional.empty();
    }

    public static boolean isPlausible(int width, int height) {
        return width > 0 && height > 0 && width <= Constants.MAX_DIMENSION && height <= Constants.MAX_DIMENSION;
    }

    public boolean is(int width, int height) {
        return this.width == width && this.height == height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
