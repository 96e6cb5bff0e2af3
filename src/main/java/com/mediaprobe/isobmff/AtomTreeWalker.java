package com.mediaprobe.isobmff;

import com.mediaprobe.util.ByteRange;
import com.mediaprobe.util.FourCC;
import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static com.mediaprobe.Constants.BOX_HEADER_BYTES;
import static com.mediaprobe.Constants.EXTENDED_BOX_HEADER_BYTES;
import static com.mediaprobe.util.ByteReads.readU32BE;
import static com.mediaprobe.util.ByteReads.readU64BE;

/**
 * Single-level scan over big-endian, length-prefixed ISO-BMFF boxes.
 * <p>
 * Each call looks at the siblings inside one range only. Descending into a box means calling
 * again with the payload range returned by the previous call. The scan stops, without
 * throwing, at the first header that is truncated, declares a size below the header length,
 * or runs past the end of the range. A size of 0 ("to end of file") counts as malformed.
 */
@Slf4j
@UtilityClass
public final class AtomTreeWalker {

    public static final FourCC MOOV = FourCC.of("moov");
    public static final FourCC TRAK = FourCC.of("trak");
    public static final FourCC TKHD = FourCC.of("tkhd");

    /**
     * Payload range of the first sibling in {@code range} tagged {@code target}.
     */
    public static Optional<ByteRange> findChild(byte[] buffer, ByteRange range, FourCC target) {
        return scan(buffer, range, box -> box.getTag().equals(target)).map(Box::getPayload);
    }

    /**
     * Payload ranges of every well-formed box tagged {@code target} whose header starts anywhere
     * in {@code range}, at any nesting depth, in file order. Used where the range does not start
     * on a box boundary, such as a window cut from the end of a file.
     */
    public static List<ByteRange> findAnywhere(byte[] buffer, ByteRange range, FourCC target) {
        var found = new ArrayList<ByteRange>();
        int end = Math.min(range.getEnd(), buffer.length);
        for (int tagAt = range.getStart() + 4; tagAt + 4 <= end; tagAt++) {
            if (!target.matchesAt(buffer, tagAt))
                continue;
            // the header at tagAt - 4 is first in this range, so any match is that header
            findChild(buffer, ByteRange.of(tagAt - 4, end), target).ifPresent(found::add);
        }
        return found;
    }

    /**
     * Every well-formed sibling in {@code range}, in file order, up to the first malformed one.
     */
    public static List<Box> children(byte[] buffer, ByteRange range) {
        var boxes = new ArrayList<Box>();
        scan(buffer, range, box -> {
            boxes.add(box);
            return false;
        });
        return boxes;
    }

    private static Optional<Box> scan(byte[] buffer, ByteRange range, Predicate<Box> stopAt) {
        long end = Math.min(range.getEnd(), buffer.length);
        long i = range.getStart();

        while (i + BOX_HEADER_BYTES <= end) {
            int at = (int) i;
            long size = readU32BE(buffer, at);
            long payloadStart;
            long boxEnd;

            if (size == 1) {
                if (i + EXTENDED_BOX_HEADER_BYTES > end) {
                    log.trace("Extended header at {} truncated by range end {}", i, end);
                    return Optional.empty();
                }
                long extendedSize = readU64BE(buffer, at + BOX_HEADER_BYTES);
                if (extendedSize < EXTENDED_BOX_HEADER_BYTES || extendedSize > Integer.MAX_VALUE) {
                    log.trace("Unusable extended size {} at {}", Long.toUnsignedString(extendedSize), i);
                    return Optional.empty();
                }
                payloadStart = i + EXTENDED_BOX_HEADER_BYTES;
                boxEnd = i + extendedSize;
            } else if (size < BOX_HEADER_BYTES) {
                log.trace("Declared size {} below header length at {}", size, i);
                return Optional.empty();
            } else {
                payloadStart = i + BOX_HEADER_BYTES;
                boxEnd = i + size;
            }

            if (boxEnd > end) {
                log.trace("Box at {} ends at {}, past range end {}", i, boxEnd, end);
                return Optional.empty();
            }

            var box = new Box(at, FourCC.read(buffer, at + 4), ByteRange.of((int) payloadStart, (int) boxEnd));
            if (stopAt.test(box))
                return Optional.of(box);
            i = boxEnd;
        }
        return Optional.empty();
    }
}
