package com.tyron.nanodata.api.io;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A decoding reader over a {@link SeekableInput} that still supports {@link #seek} and {@link #tell}.
 * <p>
 * Positions are byte offsets in the underlying stream. Sizes passed to {@link #read(int)} and
 * {@link #readline(int)} are byte counts; character counts (as used by {@link #charSeekForward(int)})
 * are Unicode code points.
 */
public interface SeekableTextReader extends Closeable, Iterable<String> {

    int SEEK_SET = 0;
    int SEEK_CUR = 1;
    int SEEK_END = 2;

    /**
     * Reads and decodes the rest of the stream.
     */
    String read() throws IOException;

    /**
     * Reads up to {@code size} bytes and decodes them. Any characters buffered by
     * {@link #readline()} are returned first.
     */
    String read(int size) throws IOException;

    /**
     * @return The next line including its terminator, or an empty string at end of stream.
     */
    String readline() throws IOException;

    /**
     * Reads a line, but performs a single physical read of {@code size} bytes; the result
     * may be an incomplete line if no terminator was found in that window.
     */
    String readline(int size) throws IOException;

    List<String> readlines(boolean keepEnds) throws IOException;

    /**
     * Skips the next line without returning it.
     */
    void discardLine() throws IOException;

    default void seek(long offset) throws IOException {
        seek(offset, SEEK_SET);
    }

    /**
     * Moves to a byte offset. Only {@link #SEEK_SET} and {@link #SEEK_END} are supported;
     * all buffered text is discarded.
     *
     * @throws UnsupportedOperationException for {@link #SEEK_CUR}
     */
    void seek(long offset, int whence) throws IOException;

    /**
     * Moves forward by exactly {@code offset} decoded characters.
     */
    void charSeekForward(int offset) throws IOException;

    /**
     * @return The byte offset of the next character that a read would return.
     */
    long tell() throws IOException;

    /**
     * @return The canonical name of the charset in use, after byte order mark detection.
     */
    String getEncoding();

    boolean isClosed();
}
