package com.mediaprobe.core;

import com.mediaprobe.Constants;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Window caps used by {@link MediaProbe}.
 * <p>
 * {@link #fromSystemProperties()} reads overrides from
 * {@code mediaprobe.window.dimension.bytes}, {@code mediaprobe.window.marker.bytes} and
 * {@code mediaprobe.window.avi.bytes}.
 */
@Slf4j
@Value
public class ProbeSettings {
    public static final String DIMENSION_WINDOW_PROPERTY = "mediaprobe.window.dimension.bytes";
    public static final String MARKER_WINDOW_PROPERTY = "mediaprobe.window.marker.bytes";
    public static final String AVI_WINDOW_PROPERTY = "mediaprobe.window.avi.bytes";

    int dimensionWindowBytes;
    int markerWindowBytes;
    int aviHeaderWindowBytes;

    public ProbeSettings(int dimensionWindowBytes, int markerWindowBytes, int aviHeaderWindowBytes) {
        requirePositive("dimensionWindowBytes", dimensionWindowBytes);
        requirePositive("markerWindowBytes", markerWindowBytes);
        requirePositive("aviHeaderWindowBytes", aviHeaderWindowBytes);
        this.dimensionWindowBytes = dimensionWindowBytes;
        this.markerWindowBytes = markerWindowBytes;
        this.aviHeaderWindowBytes = aviHeaderWindowBytes;
    }

    public static ProbeSettings defaults() {
        return new ProbeSettings(Constants.DIMENSION_WINDOW_BYTES, Constants.MARKER_WINDOW_BYTES,
                Constants.AVI_HEADER_WINDOW_BYTES);
    }

    public static ProbeSettings fromSystemProperties() {
        return new ProbeSettings(
                intProperty(DIMENSION_WINDOW_PROPERTY, Constants.DIMENSION_WINDOW_BYTES),
                intProperty(MARKER_WINDOW_PROPERTY, Constants.MARKER_WINDOW_BYTES),
                intProperty(AVI_WINDOW_PROPERTY, Constants.AVI_HEADER_WINDOW_BYTES));
    }

    private static int intProperty(String name, int defaultValue) {
        var raw = System.getProperty(name);
        if (raw == null)
            return defaultValue;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0)
                return value;
            log.warn("Ignoring non-positive value {} for {}, using {}", value, name, defaultValue);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value '{}' for {}, using {}", raw, name, defaultValue);
        }
        return defaultValue;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0)
            throw new IllegalArgumentException(name + " must be positive: " + value);
    }
}
