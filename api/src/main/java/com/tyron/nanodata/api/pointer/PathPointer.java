package com.tyron.nanodata.api.pointer;

import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.io.SeekableTextReader;

import java.io.IOException;

/**
 * Identifies a readable resource (a file, a compressed file or an archive entry)
 * without opening it.
 * <p>
 * Path components in {@link #join(String)} are always separated by '/'.
 */
public interface PathPointer {

    /**
     * Opens the resource as a seekable byte stream. Compressed resources are decompressed.
     */
    SeekableInput open() throws IOException;

    /**
     * Opens the resource and decodes it with the given encoding.
     */
    SeekableTextReader open(String encoding) throws IOException;

    /**
     * @return The size in bytes of the stored resource.
     */
    long fileSize() throws IOException;

    /**
     * @return A new pointer for {@code child} below this one. This pointer is never modified.
     */
    PathPointer join(String child) throws IOException;

    /**
     * @return A string form of the location, e.g. {@code /data/corpora/x.txt} or
     * {@code /data/corpora/x.zip/x/y.txt}.
     */
    String getPath();
}
