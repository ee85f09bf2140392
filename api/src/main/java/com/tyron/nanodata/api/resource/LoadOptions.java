package com.tyron.nanodata.api.resource;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options for {@link ResourceLoader#load(String, LoadOptions)}.
 *
 * @param format    a {@link ResourceFormat} id, or {@link #AUTO} to infer it from the file extension
 * @param cache     whether to consult and populate the resource cache
 * @param encoding  the encoding of text formats; null means UTF-8 with an ISO-8859-1 fallback
 * @param verbose   log loads at INFO instead of FINE
 * @param arguments passed through to the format's {@link ResourceParser}
 */
public record LoadOptions(String format,
                          boolean cache,
                          @Nullable String encoding,
                          boolean verbose,
                          Map<String, Object> arguments) {

    public static final String AUTO = "auto";

    public LoadOptions {
        Objects.requireNonNull(format, "format");
        arguments = Map.copyOf(arguments);
    }

    public static LoadOptions defaults() {
        return new LoadOptions(AUTO, true, null, false, Map.of());
    }

    public LoadOptions withFormat(String format) {
        return new LoadOptions(format, cache, encoding, verbose, arguments);
    }

    public LoadOptions withFormat(ResourceFormat format) {
        return withFormat(format.getId());
    }

    public LoadOptions withCache(boolean cache) {
        return new LoadOptions(format, cache, encoding, verbose, arguments);
    }

    public LoadOptions withEncoding(@Nullable String encoding) {
        return new LoadOptions(format, cache, encoding, verbose, arguments);
    }

    public LoadOptions withVerbose(boolean verbose) {
        return new LoadOptions(format, cache, encoding, verbose, arguments);
    }

    public LoadOptions withArgument(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(arguments);
        copy.put(key, value);
        return new LoadOptions(format, cache, encoding, verbose, copy);
    }
}
