package com.tyron.nanodata.core.load;

import com.tyron.nanodata.api.resource.ResourceFormat;
import com.tyron.nanodata.api.resource.ResourceUrl;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loaded resources keyed by normalized URL and format. Entries are never evicted;
 * {@link #clear()} drops everything.
 */
public final class ResourceCache {

    public record Key(ResourceUrl url, ResourceFormat format) {

        public Key {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(format, "format");
        }
    }

    private final Map<Key, Object> values = new ConcurrentHashMap<>();

    public Optional<Object> get(Key key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Stores {@code value} unless it cannot be cached.
     *
     * @return false if the value was skipped
     */
    public boolean put(Key key, Object value) {
        if (!isCacheable(value)) {
            return false;
        }
        values.put(key, value);
        return true;
    }

    /**
     * Null values and open handles are never cached: a handle closed by one caller would be
     * handed to the next.
     */
    public static boolean isCacheable(Object value) {
        return value != null && !(value instanceof AutoCloseable);
    }

    public boolean contains(Key key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }
}
