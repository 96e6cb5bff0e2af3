package com.mediaprobe.riff;

import com.mediaprobe.core.Dimensions;
import com.mediaprobe.util.ByteRange;
import lombok.experimental.UtilityClass;

import java.util.Optional;

import static com.mediaprobe.Constants.BITMAP_HEADER_MIN_BYTES;
import static com.mediaprobe.util.ByteReads.readI32LE;

/**
 * Frame size of an AVI file, read from the {@code BITMAPINFOHEADER} in the first stream's
 * {@code strf} chunk ({@code LIST hdrl -> LIST strl -> strf}).
 */
@UtilityClass
public final class BitmapHeaderExtractor {

    /**
     * Expects a buffer that starts with the AVI file header; see {@link RiffChunkWalker#isAvi}.
     */
    public static Optional<Dimensions> firstStreamDimensions(byte[] buffer) {
        if (!RiffChunkWalker.isAvi(buffer))
            return Optional.empty();
        return RiffChunkWalker.findList(buffer, RiffChunkWalker.body(buffer), RiffChunkWalker.HDRL)
                .flatMap(hdrl -> RiffChunkWalker.findList(buffer, hdrl, RiffChunkWalker.STRL))
                .flatMap(strl -> RiffChunkWalker.findChunk(buffer, strl, RiffChunkWalker.STRF))
                .flatMap(strf -> extract(buffer, strf));
    }

    /**
     * {@code biWidth} at +4 and {@code biHeight} at +8, both signed little-endian. A negative
     * height marks a top-down bitmap and only its magnitude is kept.
     */
    public static Optional<Dimensions> extract(byte[] buffer, ByteRange strf) {
        if (strf.length() < BITMAP_HEADER_MIN_BYTES)
            return Optional.empty();

        int width = readI32LE(buffer, strf.getStart() + 4);
        int height = readI32LE(buffer, strf.getStart() + 8);
        if (height < 0)
            height = -height; // MIN_VALUE stays negative and is rejected below
        return Dimensions.ifPlausible(width, height);
    }
}
