package com.mediaprobe.error;

import lombok.Getter;

/**
 * Raised inside a probe to carry why it produced nothing. Never escapes the public
 * {@link com.mediaprobe.core.MediaProbe} operations.
 */
@Getter
public class ProbeException extends Exception {
    private final ErrorType errorType;

    public ProbeException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ProbeException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("ProbeException{type=%s, message='%s'}", errorType, getMessage());
    }
}
