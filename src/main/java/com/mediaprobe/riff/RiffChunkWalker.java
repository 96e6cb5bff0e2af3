package com.mediaprobe.riff;

import com.mediaprobe.util.ByteRange;
import com.mediaprobe.util.FourCC;
import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static com.mediaprobe.Constants.CHUNK_HEADER_BYTES;
import static com.mediaprobe.Constants.LIST_TYPE_BYTES;
import static com.mediaprobe.util.ByteReads.readU32LE;

/**
 * Single-level scan over little-endian RIFF chunks and lists.
 * <p>
 * Chunks are 2-byte aligned: an odd declared size is followed by one pad byte that the size
 * does not include. Like {@link com.mediaprobe.isobmff.AtomTreeWalker}, a call only looks at
 * one level, and a chunk that overruns the range ends the scan without an error.
 */
@Slf4j
@UtilityClass
public final class RiffChunkWalker {

    public static final FourCC RIFF = FourCC.of("RIFF");
    public static final FourCC LIST = FourCC.of("LIST");
    public static final FourCC AVI = FourCC.of("AVI ");
    public static final FourCC HDRL = FourCC.of("hdrl");
    public static final FourCC STRL = FourCC.of("strl");
    public static final FourCC STRF = FourCC.of("strf");

    /** Size of the {@code RIFF <size> AVI } file header. */
    public static final int FILE_HEADER_BYTES = 12;

    /**
     * With a {@code listType}, matches the first {@code LIST} of that type and returns the range
     * after the type field. Without one, matches the first plain chunk tagged {@code fourCC}.
     * Lists never match in chunk mode, and plain chunks never match in list mode.
     */
    public static Optional<ByteRange> findChild(byte[] buffer, ByteRange range, FourCC fourCC, FourCC listType) {
        Predicate<Chunk> wanted = listType != null
                ? chunk -> chunk.isListOf(listType)
                : chunk -> !chunk.isList() && chunk.getFourCC().equals(fourCC);
        return scan(buffer, range, wanted).map(Chunk::getPayload);
    }

    public static Optional<ByteRange> findList(byte[] buffer, ByteRange range, FourCC listType) {
        return findChild(buffer, range, LIST, listType);
    }

    public static Optional<ByteRange> findChunk(byte[] buffer, ByteRange range, FourCC fourCC) {
        return findChild(buffer, range, fourCC, null);
    }

    public static List<Chunk> children(byte[] buffer, ByteRange range) {
        var chunks = new ArrayList<Chunk>();
        scan(buffer, range, chunk -> {
            chunks.add(chunk);
            return false;
        });
        return chunks;
    }

    /**
     * {@code RIFF} at bytes 0-3 and {@code AVI } at bytes 8-11.
     */
    public static boolean isAvi(byte[] buffer) {
        return buffer.length >= FILE_HEADER_BYTES && RIFF.matchesAt(buffer, 0) && AVI.matchesAt(buffer, 8);
    }

    /**
     * Range holding the top-level chunks of an AVI file, i.e. everything after its file header.
     */
    public static ByteRange body(byte[] buffer) {
        return ByteRange.of(Math.min(FILE_HEADER_BYTES, buffer.length), buffer.length);
    }

    private static Optional<Chunk> scan(byte[] buffer, ByteRange range, Predicate<Chunk> stopAt) {
        long end = Math.min(range.getEnd(), buffer.length);
        long i = range.getStart();

        while (i + CHUNK_HEADER_BYTES <= end) {
            int at = (int) i;
            var tag = FourCC.read(buffer, at);
            long size = readU32LE(buffer, at + 4);
            long payloadStart = i + CHUNK_HEADER_BYTES;
            long chunkEnd = payloadStart + size;
            if (chunkEnd > end) {
                log.trace("Chunk {} at {} declares {} bytes, past range end {}", tag, i, size, end);
                return Optional.empty();
            }

            boolean isList = LIST.equals(tag);
            FourCC listType = null;
            long contentStart = payloadStart;
            if (isList && size >= LIST_TYPE_BYTES) {
                listType = FourCC.read(buffer, (int) payloadStart);
                contentStart = payloadStart + LIST_TYPE_BYTES;
            }

            var chunk = new Chunk(at, tag, isList, listType, ByteRange.of((int) contentStart, (int) chunkEnd));
            if (stopAt.test(chunk))
                return Optional.of(chunk);

            i = chunkEnd;
            if ((i & 1) != 0)
                i++;
        }
        return Optional.empty();
    }
}
