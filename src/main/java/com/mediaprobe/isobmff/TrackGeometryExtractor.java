package com.mediaprobe.isobmff;

import com.mediaprobe.core.Dimensions;
import com.mediaprobe.util.ByteRange;
import lombok.experimental.UtilityClass;

import java.util.Optional;

import static com.mediaprobe.Constants.TKHD_MIN_PAYLOAD_BYTES;
import static com.mediaprobe.Constants.TKHD_V0_WIDTH_OFFSET;
import static com.mediaprobe.Constants.TKHD_V1_WIDTH_OFFSET;
import static com.mediaprobe.util.ByteReads.readU32BE;

/**
 * Reads the frame size of the first track whose {@code tkhd} carries usable geometry.
 * <p>
 * Descent is {@code moov -> trak -> tkhd}. Audio tracks usually record a zero width and
 * height, so every {@code trak} is tried in order until one passes the sanity bound. If a
 * {@code moov} candidate yields nothing, the next one in the buffer is tried.
 */
@UtilityClass
public final class TrackGeometryExtractor {

    public static Optional<Dimensions> firstTrackDimensions(byte[] buffer) {
        // a tail window rarely starts on a box boundary, so look for moov headers everywhere
        for (var moov : AtomTreeWalker.findAnywhere(buffer, ByteRange.of(buffer), AtomTreeWalker.MOOV)) {
            var dimensions = firstTrackDimensions(buffer, moov);
            if (dimensions.isPresent())
                return dimensions;
        }
        return Optional.empty();
    }

    /**
     * Tries each {@code trak} directly inside {@code moov}, in order.
     */
    public static Optional<Dimensions> firstTrackDimensions(byte[] buffer, ByteRange moov) {
        var remaining = moov;
        while (!remaining.isEmpty()) {
            var trak = AtomTreeWalker.findChild(buffer, remaining, AtomTreeWalker.TRAK);
            if (trak.isEmpty())
                break;

            var dimensions = AtomTreeWalker.findChild(buffer, trak.get(), AtomTreeWalker.TKHD)
                    .flatMap(tkhd -> trackHeaderDimensions(buffer, tkhd));
            if (dimensions.isPresent())
                return dimensions;
            remaining = remaining.from(trak.get().getEnd());
        }
        return Optional.empty();
    }

    /**
     * Width and height from a {@code tkhd} payload. Version 1 headers carry 64-bit times, which
     * moves the geometry fields 8 bytes further in. Both fields are Q16.16; the fraction is
     * dropped.
     */
    public static Optional<Dimensions> trackHeaderDimensions(byte[] buffer, ByteRange tkhd) {
        if (tkhd.length() < TKHD_MIN_PAYLOAD_BYTES)
            return Optional.empty();

        int version = buffer[tkhd.getStart()] & 0xFF;
        int widthOffset = version == 0 ? TKHD_V0_WIDTH_OFFSET : TKHD_V1_WIDTH_OFFSET;
        if (widthOffset + 8 > tkhd.length())
            return Optional.empty();

        long width = readU32BE(buffer, tkhd.getStart() + widthOffset);
        long height = readU32BE(buffer, tkhd.getStart() + widthOffset + 4);
        return Dimensions.ifPlausible((int) (width >>> 16), (int) (height >>> 16));
    }
}
