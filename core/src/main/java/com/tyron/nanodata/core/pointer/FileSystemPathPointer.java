package com.tyron.nanodata.core.pointer;

import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.pointer.PathNotFoundException;
import com.tyron.nanodata.api.pointer.PathPointer;
import com.tyron.nanodata.core.io.FileSeekableInput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pointer to a file or directory on the local filesystem.
 */
public class FileSystemPathPointer extends AbstractPathPointer {

    protected final Path path;

    /**
     * @throws PathNotFoundException if {@code path} does not exist
     */
    public FileSystemPathPointer(Path path) throws PathNotFoundException {
        this.path = path.toAbsolutePath().normalize();
        if (!Files.exists(this.path)) {
            throw new PathNotFoundException(this.path.toString());
        }
    }

    public Path getFile() {
        return path;
    }

    @Override
    public SeekableInput open() throws IOException {
        return new FileSeekableInput(path);
    }

    @Override
    public long fileSize() throws IOException {
        return Files.size(path);
    }

    @Override
    public PathPointer join(String child) throws PathNotFoundException {
        return new FileSystemPathPointer(path.resolve(child));
    }

    @Override
    public String getPath() {
        return path.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileSystemPathPointer that = (FileSystemPathPointer) o;
        return path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }
}
