package com.tyron.nanodata.core.resolve;

import com.tyron.nanodata.api.pointer.PathPointer;
import com.tyron.nanodata.api.resource.ResourceNotFoundException;
import com.tyron.nanodata.core.archive.OpenOnDemandArchive;
import com.tyron.nanodata.core.config.DataPathConfiguration;
import com.tyron.nanodata.core.pointer.FileSystemPathPointer;
import com.tyron.nanodata.core.pointer.GzipFileSystemPathPointer;
import com.tyron.nanodata.core.pointer.ZipEntryPathPointer;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves resource names against an ordered list of roots.
 * <p>
 * Roots are directories, zip files, or "" (the name is absolute). Earlier roots win. If nothing
 * matches and the name has no archive segment, each segment {@code p} is in turn replaced by
 * {@code p.zip/p}, left to right, so that {@code corpora/chat80/cities.pl} is also found as
 * {@code corpora/chat80.zip/chat80/cities.pl}. Directories inside archives must be requested
 * with a trailing '/'.
 */
public final class ResourceResolver {

    private static final Logger LOG = Logger.getLogger(ResourceResolver.class.getName());

    private final DataPathConfiguration configuration;

    public ResourceResolver(DataPathConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Searches the configured roots.
     */
    public PathPointer find(String resourceName) throws ResourceNotFoundException {
        return find(resourceName, configuration.getRoots());
    }

    /**
     * @throws ResourceNotFoundException if no root yields a match, carrying the searched roots
     */
    public PathPointer find(String resourceName, List<String> roots) throws ResourceNotFoundException {
        String name = ResourceNames.normalize(resourceName, true);

        PathPointer found = findInRoots(name, roots);
        if (found != null) {
            return found;
        }

        if (ResourceNames.splitArchive(name).isEmpty()) {
            String[] pieces = name.split("/");
            for (int i = 0; i < pieces.length; i++) {
                if (pieces[i].isEmpty()) {
                    continue;
                }
                String candidate = withArchiveAt(pieces, i, name.endsWith("/"));
                found = findInRoots(candidate, roots);
                if (found != null) {
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Resolved " + name + " through zip fallback " + candidate);
                    }
                    return found;
                }
            }
        }

        throw new ResourceNotFoundException(name, roots, ResourceNames.packageName(name));
    }

    /**
     * {@code [corpora, x, y.txt]} at 1 becomes {@code corpora/x.zip/x/y.txt}.
     */
    static String withArchiveAt(String[] pieces, int index, boolean directory) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pieces.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            if (i == index) {
                sb.append(pieces[i]).append(ResourceNames.ARCHIVE_EXTENSIONS.get(0)).append('/');
            }
            sb.append(pieces[i]);
        }
        if (directory) {
            sb.append('/');
        }
        return sb.toString();
    }

    @Nullable
    private PathPointer findInRoots(String name, List<String> roots) {
        Optional<ResourceNames.ArchiveReference> archiveRef = ResourceNames.splitArchive(name);

        for (String root : roots) {
            if (!root.isEmpty() && isArchiveFile(root)) {
                PathPointer pointer = probeArchive(Paths.get(root), name);
                if (pointer != null) {
                    return pointer;
                }
            } else if (root.isEmpty() || Files.isDirectory(Paths.get(root))) {
                if (archiveRef.isEmpty()) {
                    Path candidate = onDisk(root, name);
                    if (Files.exists(candidate)) {
                        PathPointer pointer = fileSystemPointer(candidate);
                        if (pointer != null) {
                            return pointer;
                        }
                    }
                } else {
                    Path archive = onDisk(root, archiveRef.get().archivePart());
                    if (Files.exists(archive)) {
                        PathPointer pointer = probeArchive(archive, archiveRef.get().entryPart());
                        if (pointer != null) {
                            return pointer;
                        }
                    }
                }
            }
        }
        return null;
    }

    /**
     * @return A pointer to {@code entry} in {@code archive}, or null if either is missing or invalid.
     */
    @Nullable
    private static PathPointer probeArchive(Path archive, String entry) {
        try {
            return ZipEntryPathPointer.of(new OpenOnDemandArchive(archive), entry);
        } catch (IOException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Skipping " + archive + ": " + e.getMessage());
            }
            return null;
        }
    }

    @Nullable
    private static PathPointer fileSystemPointer(Path candidate) {
        try {
            if (ResourceNames.isCompressedName(candidate.toString())) {
                return new GzipFileSystemPathPointer(candidate);
            }
            return new FileSystemPathPointer(candidate);
        } catch (IOException e) {
            // Deleted between the existence check and construction.
            LOG.log(Level.FINE, "Resource vanished: " + candidate, e);
            return null;
        }
    }

    private static boolean isArchiveFile(String root) {
        return ResourceNames.isArchiveName(root) && Files.isRegularFile(Paths.get(root));
    }

    private static Path onDisk(String root, String name) {
        return root.isEmpty() ? Paths.get(name) : Paths.get(root).resolve(name);
    }
}
