package com.tyron.nanodata.core.pointer;

import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.pointer.PathNotFoundException;
import com.tyron.nanodata.core.io.GzipSeekableInput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pointer to a gzip compressed file; {@link #open()} yields the decompressed bytes.
 * {@link #fileSize()} still reports the compressed size on disk.
 */
public class GzipFileSystemPathPointer extends FileSystemPathPointer {

    public GzipFileSystemPathPointer(Path path) throws PathNotFoundException {
        super(path);
    }

    @Override
    public SeekableInput open() throws IOException {
        return new GzipSeekableInput(path.toString(), () -> Files.newInputStream(path));
    }
}
