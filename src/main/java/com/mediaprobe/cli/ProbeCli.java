package com.mediaprobe.cli;

import com.mediaprobe.core.ContainerType;
import com.mediaprobe.core.MediaProbe;
import com.mediaprobe.error.ProbeException;
import com.mediaprobe.isobmff.AtomTreeWalker;
import com.mediaprobe.isobmff.Box;
import com.mediaprobe.marker.MarkerResult;
import com.mediaprobe.riff.Chunk;
import com.mediaprobe.riff.RiffChunkWalker;
import com.mediaprobe.scan.BoundedFileScanner;
import com.mediaprobe.util.ByteRange;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints what {@link MediaProbe} sees in one or more files.
 * <pre>
 * ProbeCli [--boxes] &lt;file&gt;...
 * </pre>
 * {@code --boxes} also lists the top-level boxes (ISO-BMFF) or chunks (AVI) in the head window.
 */
public final class ProbeCli {
    static final int EXIT_OK = 0;
    static final int EXIT_MISSING_FILE = 1;
    static final int EXIT_USAGE = 2;

    private final MediaProbe probe;
    private final PrintStream out;

    ProbeCli(MediaProbe probe, PrintStream out) {
        this.probe = probe;
        this.out = out;
    }

    public static void main(String[] args) {
        int status = new ProbeCli(MediaProbe.fromSystemProperties(), System.out).run(args);
        if (status != EXIT_OK)
            System.exit(status);
    }

    int run(String[] args) {
        boolean boxes = false;
        List<Path> paths = new ArrayList<>();
        for (String arg : args) {
            if ("--boxes".equals(arg)) {
                boxes = true;
            } else if (arg.startsWith("--")) {
                out.println("Unknown option: " + arg);
                return usage();
            } else {
                paths.add(Path.of(arg));
            }
        }
        if (paths.isEmpty())
            return usage();

        int status = EXIT_OK;
        for (Path path : paths) {
            if (!Files.isRegularFile(path)) {
                out.println("File not found: " + path);
                status = EXIT_MISSING_FILE;
                continue;
            }
            describe(path, boxes);
        }
        return status;
    }

    private void describe(Path path, boolean boxes) {
        out.println("File: " + path);
        out.println("Container: " + ContainerType.detect(path).map(Enum::name).orElse("unsupported"));

        try {
            out.println("Dimensions: " + probe.probeDimensions(path));
        } catch (ProbeException e) {
            out.println("Dimensions: none (" + e.getErrorType() + ": " + e.getMessage() + ")");
        }

        MarkerResult marker;
        try {
            marker = probe.probeMarker(path);
        } catch (ProbeException e) {
            out.println("Marker: read failed (" + e.getMessage() + ")");
            marker = MarkerResult.UNKNOWN;
        }
        out.println("Detected: " + marker.getDisplayName() + " (" + marker + ")");
        if (marker == MarkerResult.UNKNOWN)
            out.println("No pb_file:dvtm_* marker found. Try searching the file for 'dvtm_' or 'pb_file'.");

        if (boxes)
            printStructure(path);
        out.println();
    }

    private void printStructure(Path path) {
        byte[] head;
        try {
            head = BoundedFileScanner.readHead(path, probe.getSettings().getDimensionWindowBytes()).getBytes();
        } catch (ProbeException e) {
            out.println("Structure: unreadable (" + e.getMessage() + ")");
            return;
        }

        if (RiffChunkWalker.isAvi(head)) {
            out.println("Chunks:");
            for (Chunk chunk : RiffChunkWalker.children(head, RiffChunkWalker.body(head))) {
                var label = chunk.getListType().map(type -> chunk.getFourCC() + " " + type)
                        .orElse(chunk.getFourCC().toString());
                out.println("  " + label + " @" + chunk.getOffset() + " payload " + chunk.getPayload());
            }
            return;
        }

        out.println("Boxes:");
        for (Box box : AtomTreeWalker.children(head, ByteRange.of(head)))
            out.println("  " + box.getTag() + " @" + box.getOffset() + " size " + box.size());
    }

    private int usage() {
        out.println("Usage: ProbeCli [--boxes] <file>...");
        return EXIT_USAGE;
    }
}
