package com.mediaprobe.core;

import com.mediaprobe.error.ErrorType;
import com.mediaprobe.error.ProbeException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Container families recognised by file extension.
 */
public enum ContainerType {
    ISO_BMFF(".mov", ".mp4", ".m4v"),
    RIFF_AVI(".avi");

    private final List<String> extensions;

    ContainerType(String... extensions) {
        this.extensions = List.of(extensions);
    }

    public static Optional<ContainerType> detect(Path path) {
        var fileName = path.getFileName();
        if (fileName == null)
            return Optional.empty();
        var name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0)
            return Optional.empty();
        var extension = name.substring(dot);
        for (var type : values()) {
            if (type.extensions.contains(extension))
                return Optional.of(type);
        }
        return Optional.empty();
    }

    public static ContainerType fromPath(Path path) throws ProbeException {
        return detect(path).orElseThrow(() ->
                new ProbeException(ErrorType.UNSUPPORTED_EXTENSION, "Not a recognised video container: " + path));
    }
}
