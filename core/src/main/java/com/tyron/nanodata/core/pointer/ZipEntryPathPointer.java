package com.tyron.nanodata.core.pointer;

import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.pointer.ArchiveEntryNotFoundException;
import com.tyron.nanodata.api.pointer.PathPointer;
import com.tyron.nanodata.core.archive.OpenOnDemandArchive;
import com.tyron.nanodata.core.io.ByteArraySeekableInput;
import com.tyron.nanodata.core.io.GzipSeekableInput;
import com.tyron.nanodata.core.resolve.ResourceNames;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Pointer to an entry inside a zip archive.
 * <p>
 * Several pointers may share one {@link OpenOnDemandArchive}. An empty entry denotes the archive root.
 */
public final class ZipEntryPathPointer extends AbstractPathPointer {

    private final OpenOnDemandArchive archive;
    private final String entry; // "" for root, "p/" for directory, "p/a.txt" for file

    private ZipEntryPathPointer(OpenOnDemandArchive archive, String entry) {
        this.archive = archive;
        this.entry = entry;
    }

    /**
     * @throws ArchiveEntryNotFoundException if the archive does not contain {@code entry}. Directory
     *                                       entries (ending in '/') need not be listed explicitly
     *                                       as long as some entry lies below them.
     */
    public static ZipEntryPathPointer of(OpenOnDemandArchive archive, String entry) throws ArchiveEntryNotFoundException {
        Objects.requireNonNull(archive, "archive");
        String normalized = normalizeEntry(entry);

        if (!normalized.isEmpty() && !archive.contains(normalized)) {
            // The entry already ends with '/', so a prefix match never hits a mere file name prefix.
            boolean impliedDirectory = normalized.endsWith("/") && archive.hasEntryWithPrefix(normalized);
            if (!impliedDirectory) {
                throw new ArchiveEntryNotFoundException(archive.getPath().toString(), normalized);
            }
        }
        return new ZipEntryPathPointer(archive, normalized);
    }

    /**
     * Opens {@code zipFile} and points at {@code entry} inside it.
     */
    public static ZipEntryPathPointer of(Path zipFile, String entry) throws IOException {
        return of(new OpenOnDemandArchive(zipFile), entry);
    }

    // Skips validation; used by join().
    private static ZipEntryPathPointer unchecked(OpenOnDemandArchive archive, String entry) {
        return new ZipEntryPathPointer(archive, entry);
    }

    private static String normalizeEntry(String entry) {
        if (entry == null || entry.isEmpty()) {
            return "";
        }
        String normalized = ResourceNames.normalize(entry, true);
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.equals("./")) {
            return "";
        }
        return normalized;
    }

    public OpenOnDemandArchive getArchive() {
        return archive;
    }

    public String getEntry() {
        return entry;
    }

    /**
     * Reads the whole entry into memory; entries ending in {@code .gz} are decompressed.
     */
    @Override
    public SeekableInput open() throws IOException {
        byte[] data = archive.read(entry);
        if (entry.endsWith(".gz")) {
            return new GzipSeekableInput(getPath(), () -> new ByteArrayInputStream(data));
        }
        return new ByteArraySeekableInput(data, getPath());
    }

    @Override
    public long fileSize() throws IOException {
        return archive.getSize(entry);
    }

    /**
     * Zip directories are not always listed, so the child is not validated.
     */
    @Override
    public PathPointer join(String child) {
        String joined;
        if (entry.isEmpty() || entry.endsWith("/")) {
            joined = entry + child;
        } else {
            joined = entry + "/" + child;
        }
        return unchecked(archive, joined);
    }

    @Override
    public String getPath() {
        String base = archive.getPath().toString().replace('\\', '/');
        return entry.isEmpty() ? base : base + "/" + entry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ZipEntryPathPointer that = (ZipEntryPathPointer) o;
        return archive.getPath().equals(that.archive.getPath()) && entry.equals(that.entry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(archive.getPath(), entry);
    }
}
