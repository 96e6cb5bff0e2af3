package com.mediaprobe.riff;

import com.mediaprobe.util.ByteRange;
import com.mediaprobe.util.FourCC;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;

/**
 * One RIFF chunk or {@code LIST}. For lists the payload starts after the list type.
 */
@Value
public class Chunk {
    int offset;
    FourCC fourCC;
    boolean list;

    @Getter(AccessLevel.NONE)
    FourCC listType;

    ByteRange payload;

    public Optional<FourCC> getListType() {
        return Optional.ofNullable(listType);
    }

    /**
     * True when this is a {@code LIST} of the given type.
     */
    public boolean isListOf(FourCC type) {
        return list && type.equals(listType);
    }
}
