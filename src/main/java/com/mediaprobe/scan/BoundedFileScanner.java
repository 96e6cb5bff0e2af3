package com.mediaprobe.scan;

import com.mediaprobe.error.ErrorType;
import com.mediaprobe.error.ProbeException;
import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads at most {@code cap} bytes per window from a file.
 * <p>
 * Files no longer than the cap come back as a single window. Longer files are read as a
 * tail window (last {@code cap} bytes) and/or a head window (first {@code cap} bytes),
 * depending on the caller. Windows are never merged, even when they overlap.
 * <p>
 * The {@code load*} methods are total: I/O failures come back as an empty list. The
 * {@code read*} and {@code search*} methods report them as {@link ErrorType#IO_ERROR}.
 */
@Slf4j
@UtilityClass
public final class BoundedFileScanner {

    /**
     * Tail window first, then head window. Both are read eagerly; use
     * {@link #searchTailThenHead} to read the head only when the tail yields nothing.
     */
    public static List<ScanWindow> loadWindows(Path path, int cap) {
        try {
            return readTailThenHead(path, cap);
        } catch (ProbeException e) {
            log.debug("Skipping {}: {}", path, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Head window, then the tail window when the file is longer than the head.
     */
    public static List<ScanWindow> loadMarkerWindows(Path path, int cap) {
        try {
            return readHeadAndTail(path, cap);
        } catch (ProbeException e) {
            log.debug("Skipping {}: {}", path, e.getMessage());
            return Collections.emptyList();
        }
    }

    public static List<ScanWindow> readTailThenHead(Path path, int cap) throws ProbeException {
        checkCap(cap);
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size <= cap)
                return List.of(read(channel, 0, (int) size));
            return List.of(read(channel, size - cap, cap), read(channel, 0, cap));
        } catch (IOException e) {
            throw ioError(path, e);
        }
    }

    public static List<ScanWindow> readHeadAndTail(Path path, int cap) throws ProbeException {
        checkCap(cap);
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return readHeadAndTail(channel, channel.size(), cap);
        } catch (IOException e) {
            throw ioError(path, e);
        }
    }

    /**
     * The tail is keyed off the reported {@code size}, not the bytes the head actually
     * returned, which may be fewer when the file shrinks or reports more than it holds.
     */
    static List<ScanWindow> readHeadAndTail(FileChannel channel, long size, int cap) throws IOException {
        var windows = new ArrayList<ScanWindow>(2);
        windows.add(read(channel, 0, (int) Math.min(size, cap)));
        if (size > cap)
            windows.add(read(channel, Math.max(0, size - cap), cap));
        return windows;
    }

    /**
     * First {@code min(size, cap)} bytes of the file.
     */
    public static ScanWindow readHead(Path path, int cap) throws ProbeException {
        checkCap(cap);
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return read(channel, 0, (int) Math.min(channel.size(), cap));
        } catch (IOException e) {
            throw ioError(path, e);
        }
    }

    /**
     * Applies {@code search} to the tail window and, only if that finds nothing and the file
     * is longer than {@code cap}, to the head window. The head is not read unless needed.
     */
    public static <T> Optional<T> searchTailThenHead(Path path, int cap, Function<ScanWindow, Optional<T>> search)
            throws ProbeException {
        checkCap(cap);
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size <= cap)
                return search.apply(read(channel, 0, (int) size));

            var found = search.apply(read(channel, size - cap, cap));
            if (found.isPresent())
                return found;
            log.trace("Nothing in the last {} bytes of {}, trying the head", cap, path);
            return search.apply(read(channel, 0, cap));
        } catch (IOException e) {
            throw ioError(path, e);
        }
    }

    private static ScanWindow read(FileChannel channel, long offset, int length) throws IOException {
        var bytes = new byte[length];
        var target = ByteBuffer.wrap(bytes);
        long position = offset;
        while (target.hasRemaining()) {
            int n = channel.read(target, position);
            if (n < 0)
                break; // file shrank since size() was taken
            position += n;
        }
        int filled = target.position();
        return new ScanWindow(filled == length ? bytes : Arrays.copyOf(bytes, filled), offset);
    }

    private static void checkCap(int cap) {
        if (cap <= 0)
            throw new IllegalArgumentException("Window cap must be positive: " + cap);
    }

    private static ProbeException ioError(Path path, Exception cause) {
        return new ProbeException(ErrorType.IO_ERROR, "Failed to read " + path + ": " + cause.getMessage(), cause);
    }
}
