package com.mediaprobe;

public final class Constants {
    public static final int BOX_HEADER_BYTES = 8;
    public static final int EXTENDED_BOX_HEADER_BYTES = 16;
    public static final int CHUNK_HEADER_BYTES = 8;
    public static final int LIST_TYPE_BYTES = 4;

    public static final int TKHD_MIN_PAYLOAD_BYTES = 88;
    public static final int TKHD_V0_WIDTH_OFFSET = 76;
    public static final int TKHD_V1_WIDTH_OFFSET = 84;
    public static final int BITMAP_HEADER_MIN_BYTES = 12;

    public static final int MAX_DIMENSION = 8192;

    public static final int DIMENSION_WINDOW_BYTES = 2 * 1024 * 1024;
    public static final int MARKER_WINDOW_BYTES = 10 * 1024 * 1024;
    public static final int AVI_HEADER_WINDOW_BYTES = 64 * 1024;

    private Constants() {}
}
