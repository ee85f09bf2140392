package com.tyron.nanodata.core.resolve;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for posix style resource names such as {@code corpora/brown/} or
 * {@code corpora/chat80.zip/chat80/cities.pl}.
 */
public final class ResourceNames {

    public static final List<String> ARCHIVE_EXTENSIONS = List.of(".zip");

    public static final String COMPRESSED_EXTENSION = ".gz";

    /**
     * A resource name split at its first archive segment.
     *
     * @param archivePart the name up to and including the archive file, e.g. {@code corpora/x.zip}
     * @param entryPart   the remainder inside the archive, possibly empty
     */
    public record ArchiveReference(String archivePart, String entryPart) {
    }

    private ResourceNames() {
    }

    public static String normalize(String name, boolean allowRelative) {
        return normalize(name, allowRelative, null);
    }

    /**
     * Normalizes a resource name to posix form.
     * <p>
     * Names ending in '/', '\' or '.' denote directories and keep (or gain) a trailing '/'.
     * With {@code allowRelative} the name is only cleaned up ({@code a/./b/../c} becomes {@code a/c});
     * otherwise it is made absolute against {@code relativeTo} (default: the working directory).
     */
    public static String normalize(String name, boolean allowRelative, @Nullable String relativeTo) {
        boolean isDirectory = !name.isEmpty() && "/\\.".indexOf(name.charAt(name.length() - 1)) >= 0;

        String result = name.replace('\\', '/').replaceFirst("^/+", "/");
        if (allowRelative) {
            result = normpath(result);
        } else {
            Path base = relativeTo == null ? Paths.get("") : Paths.get(relativeTo);
            result = base.toAbsolutePath().resolve(result).normalize().toString().replace('\\', '/');
            if (!result.startsWith("/")) {
                // Windows drive letters: C:/dir becomes /C:/dir
                result = "/" + result;
            }
        }

        if (isDirectory && !result.endsWith("/")) {
            result += "/";
        }
        return result;
    }

    /**
     * Lexically collapses '.', '..' and repeated separators. An empty result becomes ".".
     */
    static String normpath(String path) {
        if (path.isEmpty()) {
            return ".";
        }
        boolean absolute = path.startsWith("/");
        Deque<String> parts = new ArrayDeque<>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (!parts.isEmpty() && !parts.peekLast().equals("..")) {
                    parts.removeLast();
                } else if (!absolute) {
                    parts.addLast(part);
                }
                continue;
            }
            parts.addLast(part);
        }
        String joined = String.join("/", parts);
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    /**
     * Splits {@code name} at the first path segment that names an archive.
     */
    public static Optional<ArchiveReference> splitArchive(String name) {
        int start = 0;
        while (start <= name.length()) {
            int slash = name.indexOf('/', start);
            int end = slash < 0 ? name.length() : slash;
            if (isArchiveName(name.substring(start, end))) {
                String entry = slash < 0 ? "" : name.substring(slash + 1);
                return Optional.of(new ArchiveReference(name.substring(0, end), entry));
            }
            if (slash < 0) {
                break;
            }
            start = slash + 1;
        }
        return Optional.empty();
    }

    public static boolean isArchiveName(String fileName) {
        for (String extension : ARCHIVE_EXTENSIONS) {
            if (fileName.length() > extension.length() && fileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isCompressedName(String fileName) {
        return fileName.endsWith(COMPRESSED_EXTENSION);
    }

    /**
     * Guesses the data package a resource belongs to: its second path segment without any
     * archive extension ({@code tokenizers/punkt/english.ser} belongs to {@code punkt}).
     *
     * @return The package name, or an empty string for single segment names.
     */
    public static String packageName(String name) {
        String[] pieces = name.split("/");
        if (pieces.length < 2) {
            return "";
        }
        String candidate = pieces[1];
        for (String extension : ARCHIVE_EXTENSIONS) {
            if (candidate.endsWith(extension)) {
                return candidate.substring(0, candidate.length() - extension.length());
            }
        }
        return candidate;
    }
}
