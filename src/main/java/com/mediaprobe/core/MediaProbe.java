package com.mediaprobe.core;

import com.mediaprobe.error.ErrorType;
import com.mediaprobe.error.ProbeException;
import com.mediaprobe.isobmff.TrackGeometryExtractor;
import com.mediaprobe.marker.MarkerResult;
import com.mediaprobe.marker.MarkerScanner;
import com.mediaprobe.riff.BitmapHeaderExtractor;
import com.mediaprobe.riff.RiffChunkWalker;
import com.mediaprobe.scan.BoundedFileScanner;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for inspecting video files.
 * <p>
 * Every public operation is total: unreadable, truncated, corrupt or foreign files produce an
 * empty result instead of an exception, so one bad file never aborts a batch. The
 * {@code probe*} variants report why nothing was found through {@link ProbeException}.
 * <p>
 * Instances hold only their settings and can be shared between threads.
 */
@Slf4j
public class MediaProbe {

    @Getter
    private final ProbeSettings settings;
    private final MarkerScanner markerScanner;

    public MediaProbe() {
        this(ProbeSettings.defaults());
    }

    public MediaProbe(ProbeSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.markerScanner = new MarkerScanner(settings.getMarkerWindowBytes());
    }

    public static MediaProbe fromSystemProperties() {
        return new MediaProbe(ProbeSettings.fromSystemProperties());
    }

    // ========== DIMENSIONS ==========

    /**
     * Frame size of the first video track, if the file is a MOV/MP4/M4V or AVI that records one.
     */
    public Optional<Dimensions> dimensions(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        try {
            return Optional.of(probeDimensions(path));
        } catch (ProbeException e) {
            log.debug("No dimensions for {}: {}", path, e);
            return Optional.empty();
        }
    }

    public Dimensions probeDimensions(Path path) throws ProbeException {
        var type = ContainerType.fromPath(path);
        switch (type) {
            case ISO_BMFF:
                return BoundedFileScanner.searchTailThenHead(path, settings.getDimensionWindowBytes(),
                                window -> TrackGeometryExtractor.firstTrackDimensions(window.getBytes()))
                        .orElseThrow(() -> new ProbeException(ErrorType.NOT_FOUND,
                                "No track with usable geometry in " + path));
            case RIFF_AVI:
                return probeAvi(path);
            default:
                throw new ProbeException(ErrorType.UNSUPPORTED_EXTENSION, "Unhandled container " + type);
        }
    }

    private Dimensions probeAvi(Path path) throws ProbeException {
        // hdrl sits right after the file header, so the head window is enough
        var head = BoundedFileScanner.readHead(path, settings.getAviHeaderWindowBytes()).getBytes();
        if (head.length < RiffChunkWalker.FILE_HEADER_BYTES)
            throw new ProbeException(ErrorType.TRUNCATED, "Only " + head.length + " bytes in " + path);
        if (!RiffChunkWalker.isAvi(head))
            throw new ProbeException(ErrorType.MALFORMED, "Missing RIFF/AVI signature in " + path);
        return BitmapHeaderExtractor.firstStreamDimensions(head)
                .orElseThrow(() -> new ProbeException(ErrorType.NOT_FOUND,
                        "No usable hdrl/strl/strf bitmap header in " + path));
    }

    public boolean isExactly(Path path, int width, int height) {
        return dimensions(path).map(d -> d.is(width, height)).orElse(false);
    }

    /**
     * True for 640x480 recordings, the size analog goggle DVRs write.
     */
    public boolean isSkyZoneRecording(Path path) {
        return isExactly(path, Dimensions.SKYZONE_DVR.getWidth(), Dimensions.SKYZONE_DVR.getHeight());
    }

    // ========== MARKERS ==========

    public MarkerResult classify(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        return markerScanner.classify(path);
    }

    public MarkerResult probeMarker(Path path) throws ProbeException {
        return markerScanner.scan(path);
    }

    public MarkerResult classifyMany(Iterable<Path> paths) {
        Objects.requireNonNull(paths, "paths cannot be null");
        return markerScanner.classifyMany(paths);
    }
}
