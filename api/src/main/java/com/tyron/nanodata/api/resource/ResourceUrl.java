package com.tyron.nanodata.api.resource;

import java.util.Locale;
import java.util.Objects;

/**
 * A normalized resource URL.
 * <p>
 * {@code path} is always posix style; directory names end in '/'.
 * For {@link Protocol#FILE} it is absolute, for {@link Protocol#NLTK} it is relative to the
 * data search roots, and for anything else it is the remainder after {@code scheme://}.
 */
public record ResourceUrl(Protocol protocol, String scheme, String path) {

    public enum Protocol {
        /** An absolute path on the local filesystem. */
        FILE,
        /** A path searched for in the configured data roots. */
        NLTK,
        HTTP,
        OTHER;

        public static Protocol fromScheme(String scheme) {
            switch (scheme.toLowerCase(Locale.ROOT)) {
                case "file":
                    return FILE;
                case "nltk":
                    return NLTK;
                case "http":
                case "https":
                    return HTTP;
                default:
                    return OTHER;
            }
        }
    }

    public ResourceUrl {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(path, "path");
    }

    public static ResourceUrl file(String absolutePath) {
        return new ResourceUrl(Protocol.FILE, "file", absolutePath);
    }

    public static ResourceUrl data(String relativePath) {
        return new ResourceUrl(Protocol.NLTK, "nltk", relativePath);
    }

    /**
     * @return true if bytes for this URL are obtained from the local disk (directly or via the roots).
     */
    public boolean isLocal() {
        return protocol == Protocol.FILE || protocol == Protocol.NLTK;
    }

    @Override
    public String toString() {
        switch (protocol) {
            case FILE:
                return "file://" + path;
            case NLTK:
                return "nltk:" + path;
            default:
                return scheme + "://" + path;
        }
    }
}
