package com.tyron.nanodata.core.pointer;

import com.tyron.nanodata.api.io.SeekableTextReader;
import com.tyron.nanodata.api.pointer.PathPointer;
import com.tyron.nanodata.core.text.SeekableUnicodeStreamReader;

import java.io.IOException;

/**
 * Base class for pointers: decoding is always layered on top of {@link #open()}.
 */
abstract class AbstractPathPointer implements PathPointer {

    @Override
    public SeekableTextReader open(String encoding) throws IOException {
        return new SeekableUnicodeStreamReader(open(), encoding);
    }

    @Override
    public String toString() {
        return getPath();
    }
}
