package com.tyron.nanodata.core.archive;

import com.tyron.nanodata.api.pointer.ArchiveConstructException;
import com.tyron.nanodata.api.pointer.ArchiveEntryNotFoundException;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Read-only zip archive that keeps no file descriptor open between reads.
 * <p>
 * The central directory is indexed once at construction; every {@link #read(String)} reopens the
 * archive, reads one entry and closes it again before returning. Resolution probes many entries
 * across many archives, so holding one descriptor per archive would exhaust OS limits.
 * <p>
 * Not internally synchronized.
 */
public final class OpenOnDemandArchive {

    private static final Logger LOG = Logger.getLogger(OpenOnDemandArchive.class.getName());

    private final Path path;

    // entry name -> uncompressed size, in central directory order
    private final Map<String, Long> entries;

    // the most recently opened handle, kept only so tests can check that it was closed
    @Nullable
    private ZipFile lastOpened;
    private int openCount;

    /**
     * @throws ArchiveConstructException if {@code path} is not a readable zip archive
     */
    public OpenOnDemandArchive(Path path) throws ArchiveConstructException {
        this.path = path.toAbsolutePath().normalize();

        Map<String, Long> index = new LinkedHashMap<>();
        try (ZipFile zip = openZip()) {
            zip.stream().forEach(entry -> index.put(entry.getName(), entry.getSize()));
        } catch (IOException e) {
            throw new ArchiveConstructException(this.path.toString(), e);
        }
        this.entries = Collections.unmodifiableMap(index);

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Indexed archive " + this.path + " (" + entries.size() + " entries)");
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the complete contents of one entry.
     *
     * @throws ArchiveEntryNotFoundException if the archive has no such entry
     */
    public byte[] read(String entry) throws IOException {
        try (ZipFile zip = openZip()) {
            ZipEntry ze = zip.getEntry(entry);
            if (ze == null || ze.isDirectory()) {
                throw new ArchiveEntryNotFoundException(path.toString(), entry);
            }
            try (InputStream in = zip.getInputStream(ze)) {
                return in.readAllBytes();
            }
        }
    }

    /**
     * @return true if the central directory lists {@code entry} exactly.
     */
    public boolean contains(String entry) {
        return entries.containsKey(entry);
    }

    /**
     * @return true if any listed entry name starts with {@code prefix}.
     */
    public boolean hasEntryWithPrefix(String prefix) {
        for (String name : entries.keySet()) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The uncompressed size of {@code entry}, from the central directory.
     */
    public long getSize(String entry) throws ArchiveEntryNotFoundException {
        Long size = entries.get(entry);
        if (size == null) {
            throw new ArchiveEntryNotFoundException(path.toString(), entry);
        }
        return size < 0 ? 0 : size;
    }

    public Set<String> getEntryNames() {
        return entries.keySet();
    }

    /**
     * @return true if the last {@link ZipFile} this archive opened has not been closed.
     * Always false between calls.
     */
    @TestOnly
    public boolean isOpen() {
        if (lastOpened == null) {
            return false;
        }
        try {
            lastOpened.size();
            return true;
        } catch (IllegalStateException closed) {
            return false;
        }
    }

    /**
     * @return How many times the underlying file has been opened, including indexing.
     */
    @TestOnly
    public int getOpenCount() {
        return openCount;
    }

    private ZipFile openZip() throws IOException {
        ZipFile zip = new ZipFile(path.toFile());
        openCount++;
        lastOpened = zip;
        return zip;
    }

    @Override
    public String toString() {
        return "OpenOnDemandArchive(" + path + ")";
    }
}
