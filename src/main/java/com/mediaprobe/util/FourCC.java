package com.mediaprobe.util;

import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;

/**
 * Four-byte ASCII type code naming a box or chunk, e.g. {@code moov} or {@code LIST}.
 * Comparison is exact and case-sensitive.
 */
@EqualsAndHashCode
public final class FourCC {
    private final int code;

    private FourCC(int code) {
        this.code = code;
    }

    public static FourCC of(String text) {
        if (text == null || text.length() != 4) {
            throw new IllegalArgumentException("FourCC must be exactly 4 characters: " + text);
        }
        int packed = 0;
        for (int i = 0; i < 4; i++) {
            char c = text.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("FourCC must be ASCII: " + text);
            }
            packed = (packed << 8) | c;
        }
        return new FourCC(packed);
    }

    /**
     * Reads the four bytes at {@code offset}. The caller guarantees they are in bounds.
     */
    public static FourCC read(byte[] buffer, int offset) {
        return new FourCC((int) ByteReads.readU32BE(buffer, offset));
    }

    public boolean matchesAt(byte[] buffer, int offset) {
        return offset >= 0 && offset + 4 <= buffer.length && (int) ByteReads.readU32BE(buffer, offset) == code;
    }

    @Override
    public String toString() {
        byte[] bytes = {(byte) (code >>> 24), (byte) (code >>> 16), (byte) (code >>> 8), (byte) code};
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }
}
