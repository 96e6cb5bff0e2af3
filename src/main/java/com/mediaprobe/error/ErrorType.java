package com.mediaprobe.error;

/**
 * Reasons a probe can come back without a result.
 */
public enum ErrorType {
    TRUNCATED,
    MALFORMED,
    UNSUPPORTED_EXTENSION,
    NOT_FOUND,
    IO_ERROR
}
