package com.mediaprobe.scan;

import com.mediaprobe.util.ByteRange;
import lombok.Value;

/**
 * A contiguous slice of a file loaded into memory. {@code bytes} is exactly {@code length} long.
 */
@Value
public class ScanWindow {
    byte[] bytes;
    long fileOffsetBase;
    int length;

    public ScanWindow(byte[] bytes, long fileOffsetBase) {
        this.bytes = bytes;
        this.fileOffsetBase = fileOffsetBase;
        this.length = bytes.length;
    }

    public ByteRange range() {
        return ByteRange.of(bytes);
    }

    /**
     * True when this window starts at offset zero and ends at {@code fileSize}.
     */
    public boolean coversWholeFile(long fileSize) {
        return fileOffsetBase == 0 && length == fileSize;
    }
}
