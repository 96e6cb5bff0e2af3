package com.mediaprobe.isobmff;

import com.mediaprobe.util.ByteRange;
import com.mediaprobe.util.FourCC;
import lombok.Value;

/**
 * One ISO-BMFF box as seen by {@link AtomTreeWalker}.
 */
@Value
public class Box {
    /** Offset of the size field. */
    int offset;
    FourCC tag;
    /** Everything after the (possibly extended) header, up to the declared end. */
    ByteRange payload;

    public int size() {
        return payload.getEnd() - offset;
    }
}
