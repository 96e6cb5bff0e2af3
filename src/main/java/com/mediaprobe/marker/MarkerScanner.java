package com.mediaprobe.marker;

import com.mediaprobe.core.ContainerType;
import com.mediaprobe.error.ProbeException;
import com.mediaprobe.scan.BoundedFileScanner;
import com.mediaprobe.scan.ScanWindow;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds vendor marker literals in the head and tail of a video file.
 * <p>
 * Matching runs in two tiers. The raw tier searches the window bytes directly, ignoring ASCII
 * case. Only if no window matches there, each window is decoded as UTF-8 with NUL characters
 * removed and searched for shorter fragments of each marker. Within a tier, markers are tried
 * in {@link VendorMarker} order.
 */
@Slf4j
public class MarkerScanner {

    private final int windowBytes;

    public MarkerScanner(int windowBytes) {
        if (windowBytes <= 0)
            throw new IllegalArgumentException("windowBytes must be positive: " + windowBytes);
        this.windowBytes = windowBytes;
    }

    /**
     * Never throws for unreadable or malformed files; they come back as {@link MarkerResult#UNKNOWN}.
     */
    public MarkerResult classify(Path path) {
        try {
            return scan(path);
        } catch (ProbeException e) {
            log.debug("No marker for {}: {}", path, e);
            return MarkerResult.UNKNOWN;
        }
    }

    public MarkerResult scan(Path path) throws ProbeException {
        var windows = BoundedFileScanner.readHeadAndTail(path, windowBytes);
        var bytes = new ArrayList<byte[]>(windows.size());
        for (ScanWindow window : windows)
            bytes.add(window.getBytes());
        var result = scanBytes(bytes);
        log.debug("{} -> {}", path, result);
        return result;
    }

    /**
     * Classifies only {@code .mp4}, {@code .mov} and {@code .m4v} files and returns the vendor
     * with a strict majority of hits. Ties, including no hits at all, are {@link MarkerResult#UNKNOWN}.
     */
    public MarkerResult classifyMany(Iterable<Path> paths) {
        var hits = new Object2IntOpenHashMap<MarkerResult>();
        for (var path : paths) {
            if (ContainerType.detect(path).orElse(null) != ContainerType.ISO_BMFF) {
                log.trace("Skipping {}: not an ISO-BMFF container", path);
                continue;
            }
            var result = classify(path);
            if (result != MarkerResult.UNKNOWN)
                hits.addTo(result, 1);
        }

        int flip = hits.getInt(MarkerResult.FLIP_VENDOR);
        int o4Pro = hits.getInt(MarkerResult.O4_PRO_VENDOR);
        if (flip > o4Pro)
            return MarkerResult.FLIP_VENDOR;
        if (o4Pro > flip)
            return MarkerResult.O4_PRO_VENDOR;
        return MarkerResult.UNKNOWN;
    }

    public static MarkerResult scanBytes(byte[]... windows) {
        return scanBytes(List.of(windows));
    }

    public static MarkerResult scanBytes(List<byte[]> windows) {
        for (var marker : VendorMarker.values()) {
            for (var window : windows) {
                if (marker.foundIn(window))
                    return marker.getResult();
            }
        }

        var texts = new ArrayList<String>(windows.size());
        for (var window : windows)
            texts.add(new String(window, StandardCharsets.UTF_8).replace("\0", "").toLowerCase(Locale.ROOT));
        for (var marker : VendorMarker.values()) {
            for (var text : texts) {
                if (marker.foundInLowerCaseText(text))
                    return marker.getResult();
            }
        }
        return MarkerResult.UNKNOWN;
    }
}
