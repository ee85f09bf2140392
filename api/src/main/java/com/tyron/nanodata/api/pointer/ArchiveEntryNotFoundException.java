package com.tyron.nanodata.api.pointer;

import java.io.FileNotFoundException;

/**
 * Thrown when an archive does not contain a requested entry.
 */
public class ArchiveEntryNotFoundException extends FileNotFoundException {

    private final String archive;
    private final String entry;

    public ArchiveEntryNotFoundException(String archive, String entry) {
        super("Zipfile '" + archive + "' does not contain '" + entry + "'");
        this.archive = archive;
        this.entry = entry;
    }

    public String getArchive() {
        return archive;
    }

    public String getEntry() {
        return entry;
    }
}
