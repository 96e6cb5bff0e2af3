package com.mediaprobe.marker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MarkerScanner")
class MarkerScannerTest {

    private static final int TEN_MIB = 10 * 1024 * 1024;

    @TempDir
    Path tempDir;

    private MarkerScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new MarkerScanner(TEN_MIB);
    }

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static byte[] randomWith(int length, long seed, int at, String marker) {
        var bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        var markerBytes = ascii(marker);
        System.arraycopy(markerBytes, 0, bytes, at, markerBytes.length);
        return bytes;
    }

    private Path write(String name, byte[] content) throws IOException {
        return Files.write(tempDir.resolve(name), content);
    }

    private Path flipClip(String name) throws IOException {
        return write(name, ascii("....udta....pb_file:dvtm_flip.proto...."));
    }

    private Path o4ProClip(String name) throws IOException {
        return write(name, ascii("....udta....pb_file:dvtm_O4P.proto...."));
    }

    @Nested
    @DisplayName("Raw byte tier")
    class RawByteTier {

        @Test
        @DisplayName("should find the O4 Pro marker in any letter case inside 10 MiB of noise")
        void shouldFindMarkerInNoise() throws IOException {
            var path = write("noise.mp4", randomWith(TEN_MIB, 42L, 7_340_033, "PB_FILE:DVTM_o4p.PROTO"));

            assertThat(scanner.classify(path)).isEqualTo(MarkerResult.O4_PRO_VENDOR);
        }

        @Test
        @DisplayName("should find a marker that only the tail window covers")
        void shouldFindMarkerInTailOfLargeFile() throws IOException {
            var small = new MarkerScanner(1024);
            var path = write("long.mov", randomWith(10_000, 7L, 9_900, "pb_file:dvtm_flip.proto"));

            assertThat(small.classify(path)).isEqualTo(MarkerResult.FLIP_VENDOR);
        }

        @Test
        @DisplayName("should not see a marker between the head and tail windows")
        void shouldNotSeeMarkerBetweenWindows() throws IOException {
            var small = new MarkerScanner(1024);
            var path = write("middle.mov", randomWith(10_000, 7L, 5_000, "pb_file:dvtm_flip.proto"));

            assertThat(small.classify(path)).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        @DisplayName("should check O4 Pro before Flip")
        void shouldPreferO4ProWhenBothPresent() {
            var window = ascii("pb_file:dvtm_flip.proto / pb_file:dvtm_O4P.proto");

            assertThat(MarkerScanner.scanBytes(window)).isEqualTo(MarkerResult.O4_PRO_VENDOR);
        }

        @Test
        @DisplayName("should check every window before moving to the next vendor")
        void shouldSearchAllWindowsPerVendor() {
            var head = ascii("pb_file:dvtm_flip.proto");
            var tail = ascii("pb_file:dvtm_o4p.proto");

            assertThat(MarkerScanner.scanBytes(head, tail)).isEqualTo(MarkerResult.O4_PRO_VENDOR);
        }

        @Test
        @DisplayName("should not fold non-ASCII bytes into letters")
        void shouldIgnoreHighBytes() {
            var window = ascii("pb_file:dvtm_flip.proto");
            window[13] = (byte) ('f' | 0x80);

            assertThat(VendorMarker.FLIP.foundIn(window)).isFalse();
        }
    }

    @Nested
    @DisplayName("Text fallback tier")
    class TextFallbackTier {

        @Test
        @DisplayName("should recover fragments split by NUL bytes")
        void shouldStripNullBytes() {
            var window = ascii("pb_file:dvtm_fl\0ip\0.proto");

            assertThat(VendorMarker.FLIP.foundIn(window)).isFalse();
            assertThat(MarkerScanner.scanBytes(window)).isEqualTo(MarkerResult.FLIP_VENDOR);
        }

        @Test
        @DisplayName("should match either fragment of a vendor")
        void shouldMatchShortFragments() {
            assertThat(MarkerScanner.scanBytes(ascii("xx\u0001O4P.proto"))).isEqualTo(MarkerResult.O4_PRO_VENDOR);
            assertThat(MarkerScanner.scanBytes(ascii("DVTM_FLIP"))).isEqualTo(MarkerResult.FLIP_VENDOR);
        }

        @Test
        @DisplayName("should prefer any raw match over a text match")
        void shouldPreferRawTier() {
            var head = ascii("dvtm_O4P");
            var tail = ascii("pb_file:dvtm_flip.proto");

            assertThat(MarkerScanner.scanBytes(head, tail)).isEqualTo(MarkerResult.FLIP_VENDOR);
        }
    }

    @Nested
    @DisplayName("Unreadable or empty input")
    class EdgeCases {

        @Test
        void shouldReturnUnknownForEmptyAndTinyFiles() throws IOException {
            assertThat(scanner.classify(write("empty.mp4", new byte[0]))).isEqualTo(MarkerResult.UNKNOWN);
            assertThat(scanner.classify(write("tiny.mp4", new byte[]{0, 0, 0, 8}))).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        void shouldReturnUnknownForMissingFile() {
            assertThat(scanner.classify(tempDir.resolve("gone.mp4"))).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        void shouldReturnUnknownWithoutMarker() {
            assertThat(MarkerScanner.scanBytes(ascii("pb_file:dvtm_wm170.proto"))).isEqualTo(MarkerResult.UNKNOWN);
            assertThat(MarkerScanner.scanBytes(List.of())).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        void shouldRejectNonPositiveWindow() {
            assertThatThrownBy(() -> new MarkerScanner(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Majority vote")
    class MajorityVote {

        @Test
        void shouldReturnStrictMajority() throws IOException {
            var paths = List.of(flipClip("a.mp4"), flipClip("b.MOV"), o4ProClip("c.m4v"));

            assertThat(scanner.classifyMany(paths)).isEqualTo(MarkerResult.FLIP_VENDOR);
        }

        @Test
        void shouldReturnUnknownOnTie() throws IOException {
            var paths = List.of(flipClip("a.mp4"), o4ProClip("b.mp4"));

            assertThat(scanner.classifyMany(paths)).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        void shouldReturnUnknownWithoutHits() throws IOException {
            assertThat(scanner.classifyMany(List.of())).isEqualTo(MarkerResult.UNKNOWN);
            assertThat(scanner.classifyMany(List.of(write("plain.mp4", new byte[64])))).isEqualTo(MarkerResult.UNKNOWN);
        }

        @Test
        void shouldIgnoreUnknownFilesInCount() throws IOException {
            var paths = List.of(o4ProClip("a.mp4"), write("b.mp4", new byte[16]), write("c.mp4", new byte[16]));

            assertThat(scanner.classifyMany(paths)).isEqualTo(MarkerResult.O4_PRO_VENDOR);
        }

        @Test
        void shouldOnlyCountVideoContainers() throws IOException {
            var paths = List.of(o4ProClip("a.mp4"), flipClip("b.srt"), flipClip("c.avi"), flipClip("d.jpg"),
                    tempDir.resolve("missing.mp4"));

            assertThat(scanner.classifyMany(paths)).isEqualTo(MarkerResult.O4_PRO_VENDOR);
        }
    }
}
