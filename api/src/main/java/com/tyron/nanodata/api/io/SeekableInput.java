package com.tyron.nanodata.api.io;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;

/**
 * A byte stream whose read position can be queried and moved.
 * <p>
 * This is the only randomly addressable ground truth the text layer has: positions
 * are always byte offsets into the (possibly decompressed) content.
 */
public abstract class SeekableInput extends InputStream {

    /**
     * @return The byte offset of the next byte {@link #read()} will return.
     */
    public abstract long position() throws IOException;

    /**
     * Moves the read position to an absolute byte offset.
     * Seeking past the end is allowed; subsequent reads return end of stream.
     */
    public abstract void seek(long position) throws IOException;

    /**
     * @return The total number of bytes in this stream.
     */
    public abstract long size() throws IOException;

    /**
     * @return A human readable name for diagnostics, or null if the stream is anonymous.
     */
    @Nullable
    public String getName() {
        return null;
    }

    /**
     * @return true once {@link #close()} has been called.
     */
    public abstract boolean isClosed();
}
