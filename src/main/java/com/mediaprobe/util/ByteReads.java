package com.mediaprobe.util;

/**
 * Fixed-width integer reads straight off a byte array. No bounds checks beyond what the
 * JVM does: callers validate the range first.
 */
public final class ByteReads {

    private ByteReads() {}

    public static long readU32BE(byte[] b, int i) {
        return ((long) (b[i] & 0xFF) << 24)
                | ((b[i + 1] & 0xFF) << 16)
                | ((b[i + 2] & 0xFF) << 8)
                | (b[i + 3] & 0xFF);
    }

    /**
     * Big-endian 64-bit read. Values with the top bit set come back negative.
     */
    public static long readU64BE(byte[] b, int i) {
        return (readU32BE(b, i) << 32) | readU32BE(b, i + 4);
    }

    public static long readU32LE(byte[] b, int i) {
        return (b[i] & 0xFF)
                | ((b[i + 1] & 0xFF) << 8)
                | ((b[i + 2] & 0xFF) << 16)
                | ((long) (b[i + 3] & 0xFF) << 24);
    }

    public static int readI32LE(byte[] b, int i) {
        return (int) readU32LE(b, i);
    }
}
