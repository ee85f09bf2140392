package com.tyron.nanodata.api.resource;

import java.io.IOException;
import java.util.Objects;

/**
 * A resource that is loaded on first access and then kept.
 */
public final class LazyResource<T> {

    private interface State {
    }

    private record Unloaded() implements State {
    }

    private record Loaded(Object value) implements State {
    }

    private final ResourceLoader loader;
    private final String url;
    private final LoadOptions options;
    private final Class<T> type;

    private State state = new Unloaded();

    public LazyResource(ResourceLoader loader, String url, Class<T> type) {
        this(loader, url, LoadOptions.defaults(), type);
    }

    public LazyResource(ResourceLoader loader, String url, LoadOptions options, Class<T> type) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.url = Objects.requireNonNull(url, "url");
        this.options = Objects.requireNonNull(options, "options");
        this.type = Objects.requireNonNull(type, "type");
    }

    public synchronized T get() throws IOException {
        if (state instanceof Loaded loaded) {
            return type.cast(loaded.value());
        }
        T value = loader.load(url, options, type);
        state = new Loaded(value);
        return value;
    }

    public synchronized boolean isLoaded() {
        return state instanceof Loaded;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public synchronized String toString() {
        if (state instanceof Loaded loaded) {
            return String.valueOf(loaded.value());
        }
        return "LazyResource(" + url + ")";
    }
}
