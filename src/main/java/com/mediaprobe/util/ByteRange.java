package com.mediaprobe.util;

import lombok.Value;

/**
 * Half-open {@code [start, end)} span of byte offsets into a buffer.
 */
@Value
public class ByteRange {
    int start;
    int end;

    private ByteRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static ByteRange of(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: [" + start + ", " + end + ")");
        }
        return new ByteRange(start, end);
    }

    /**
     * Range covering the whole of {@code buffer}.
     */
    public static ByteRange of(byte[] buffer) {
        return new ByteRange(0, buffer.length);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Same end, starting at {@code newStart}. Used to resume a sibling scan after a match.
     */
    public ByteRange from(int newStart) {
        return of(newStart, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
