package com.mediaprobe.marker;

import lombok.Getter;

/**
 * Vendor fingerprint found in a file's metadata.
 */
public enum MarkerResult {
    FLIP_VENDOR("DJI Flip"),
    O4_PRO_VENDOR("DJI O4 Pro"),
    UNKNOWN("Unknown");

    @Getter
    private final String displayName;

    MarkerResult(String displayName) {
        this.displayName = displayName;
    }
}
