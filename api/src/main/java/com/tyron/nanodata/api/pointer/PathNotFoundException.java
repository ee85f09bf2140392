package com.tyron.nanodata.api.pointer;

import java.io.FileNotFoundException;

/**
 * Thrown when a filesystem pointer is created for a path that does not exist.
 */
public class PathNotFoundException extends FileNotFoundException {

    private final String path;

    public PathNotFoundException(String path) {
        super("No such file or directory: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
