package com.mediaprobe.core;

import com.mediaprobe.error.ErrorType;
import com.mediaprobe.error.ProbeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ContainerTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"a.mp4", "A.MP4", "clip.mov", "DJI_0001.MOV", "x.m4v", "/card/DCIM/100MEDIA/y.Mp4"})
    void shouldDetectIsoBmff(String name) {
        assertThat(ContainerType.detect(Path.of(name))).contains(ContainerType.ISO_BMFF);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.avi", "DVR0001.AVI"})
    void shouldDetectAvi(String name) {
        assertThat(ContainerType.detect(Path.of(name))).contains(ContainerType.RIFF_AVI);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.mkv", "a.srt", "a.lrv", "mp4", "archive.mp4.gz", "noext"})
    void shouldIgnoreOtherFiles(String name) {
        assertThat(ContainerType.detect(Path.of(name))).isEmpty();
    }

    @Test
    void shouldThrowUnsupportedExtension() {
        assertThatThrownBy(() -> ContainerType.fromPath(Path.of("photo.jpg")))
                .isInstanceOf(ProbeException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.UNSUPPORTED_EXTENSION);
    }

    @Test
    void shouldHandleRootPath() {
        assertThat(ContainerType.detect(Path.of("/"))).isEmpty();
    }
}
