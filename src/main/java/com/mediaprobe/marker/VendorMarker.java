package com.mediaprobe.marker;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Protobuf descriptor names the vendor firmware writes into its metadata boxes.
 * Declaration order is the order markers are checked in.
 */
public enum VendorMarker {
    O4_PRO(MarkerResult.O4_PRO_VENDOR, "pb_file:dvtm_O4P.proto", "dvtm_O4P", "O4P.proto"),
    FLIP(MarkerResult.FLIP_VENDOR, "pb_file:dvtm_flip.proto", "dvtm_flip", "flip.proto");

    @Getter
    private final MarkerResult result;

    private final byte[] lowerCaseLiteral;

    /** Shorter pieces looked for in the decoded-text fallback, lower-cased. */
    private final List<String> lowerCaseFragments;

    VendorMarker(MarkerResult result, String literal, String... fragments) {
        this.result = result;
        this.lowerCaseLiteral = literal.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        this.lowerCaseFragments = Arrays.stream(fragments)
                .map(fragment -> fragment.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * ASCII case-insensitive search for the full literal in {@code buffer}. Bytes at or above
     * 0x80 never match.
     */
    public boolean foundIn(byte[] buffer) {
        return indexOfIgnoreCase(buffer, lowerCaseLiteral) >= 0;
    }

    /**
     * Looks for any fragment in text that has already been lower-cased.
     */
    public boolean foundInLowerCaseText(String lowerCaseText) {
        for (var fragment : lowerCaseFragments) {
            if (lowerCaseText.contains(fragment))
                return true;
        }
        return false;
    }

    static int indexOfIgnoreCase(byte[] buffer, byte[] lowerCasePattern) {
        int last = buffer.length - lowerCasePattern.length;
        byte first = lowerCasePattern[0];
        outer:
        for (int i = 0; i <= last; i++) {
            if (toLowerAscii(buffer[i]) != first)
                continue;
            for (int j = 1; j < lowerCasePattern.length; j++) {
                if (toLowerAscii(buffer[i + j]) != lowerCasePattern[j])
                    continue outer;
            }
            return i;
        }
        return -1;
    }

    private static byte toLowerAscii(byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + ('a' - 'A')) : b;
    }
}
