package com.tyron.nanodata.core.load;

import com.tyron.nanodata.api.resource.ResourceFormat;
import com.tyron.nanodata.api.resource.ResourceUrl;
import com.tyron.nanodata.core.resolve.ResourceNames;

import java.nio.file.Paths;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsing and normalization of {@code <protocol>:<path>} resource URLs.
 */
public final class ResourceUrls {

    // Single letters are drive names (C:/dir), not schemes.
    private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]+");

    private ResourceUrls() {
    }

    /**
     * Splits {@code url} at its first ':' without normalizing the path beyond its slashes:
     * {@code file:///home/x} gives {@code (file, /home/x)}, {@code http://host/x} gives
     * {@code (http, host/x)} and {@code nltk:a/b} is kept as is.
     *
     * @return {@code [scheme, path]}, or empty if the url has no scheme
     */
    public static Optional<String[]> split(String url) {
        int colon = url.indexOf(':');
        if (colon < 0 || !SCHEME.matcher(url.substring(0, colon)).matches()) {
            return Optional.empty();
        }
        String scheme = url.substring(0, colon);
        String path = url.substring(colon + 1);
        switch (ResourceUrl.Protocol.fromScheme(scheme)) {
            case NLTK:
                break;
            case FILE:
                if (path.startsWith("/")) {
                    path = "/" + path.replaceFirst("^/+", "");
                }
                break;
            default:
                path = path.replaceFirst("^/{0,2}", "");
                break;
        }
        return Optional.of(new String[]{scheme, path});
    }

    /**
     * Normalizes a resource URL. Names without a scheme are data names ({@code nltk:}); absolute
     * data names and {@code file:} paths become absolute {@code file:} URLs.
     */
    public static ResourceUrl normalize(String url) {
        Optional<String[]> parts = split(url);
        String scheme = parts.map(p -> p[0]).orElse("nltk");
        String name = parts.map(p -> p[1]).orElse(url);

        ResourceUrl.Protocol protocol = ResourceUrl.Protocol.fromScheme(scheme);
        switch (protocol) {
            case NLTK:
                if (Paths.get(name).isAbsolute() || name.startsWith("/")) {
                    return ResourceUrl.file(ResourceNames.normalize(name, false));
                }
                return ResourceUrl.data(ResourceNames.normalize(name, true));
            case FILE:
                return ResourceUrl.file(ResourceNames.normalize(name, false));
            default:
                return new ResourceUrl(protocol, scheme, name);
        }
    }

    /**
     * Infers a format from the last extension of the url's file name, looking past a
     * trailing {@code .gz}.
     */
    public static Optional<ResourceFormat> inferFormat(ResourceUrl url) {
        String path = url.path();
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String[] parts = fileName.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        String extension = parts[parts.length - 1];
        if (extension.equals(ResourceNames.COMPRESSED_EXTENSION.substring(1))) {
            if (parts.length < 3) {
                return Optional.empty();
            }
            extension = parts[parts.length - 2];
        }
        return ResourceFormat.forExtension(extension);
    }

    /**
     * @return The last path segment of {@code url}, used when a copy needs a file name.
     */
    public static String fileName(ResourceUrl url) {
        String path = url.path();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
