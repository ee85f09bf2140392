package com.tyron.nanodata.api.pointer;

import java.io.IOException;

/**
 * Thrown when a file cannot be opened as an archive.
 */
public class ArchiveConstructException extends IOException {

    public ArchiveConstructException(String archive, Throwable cause) {
        super("Failed to open archive: " + archive, cause);
    }
}
