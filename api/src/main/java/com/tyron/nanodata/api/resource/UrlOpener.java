package com.tyron.nanodata.api.resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens resources that are not on the local disk (http and other URL schemes).
 */
@FunctionalInterface
public interface UrlOpener {

    InputStream open(ResourceUrl url) throws IOException;
}
