package com.tyron.nanodata.core.load;

import com.tyron.nanodata.api.resource.ResourceUrl;
import com.tyron.nanodata.api.resource.UrlOpener;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Opens remote resources through {@link java.net.URL}.
 */
public final class DefaultUrlOpener implements UrlOpener {

    @Override
    public InputStream open(ResourceUrl url) throws IOException {
        try {
            return URI.create(url.toString()).toURL().openStream();
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed resource url: " + url, e);
        }
    }
}
