package com.tyron.nanodata.core.load;

import com.tyron.nanodata.core.io.BufferedGzipOutputStream;
import com.tyron.nanodata.core.resolve.ResourceNames;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes {@code ser} resources that {@link DefaultResourceLoader} can read back.
 */
public final class ResourceSerializer {

    private static final Logger LOG = Logger.getLogger(ResourceSerializer.class.getName());

    private ResourceSerializer() {
    }

    /**
     * Serializes {@code value} to {@code target}, gzip compressed if the file name ends in {@code .gz}.
     * An existing file is replaced.
     */
    public static void write(Path target, Serializable value) throws IOException {
        Objects.requireNonNull(value, "value");
        boolean compressed = ResourceNames.isCompressedName(target.getFileName().toString());

        OutputStream file = Files.newOutputStream(target);
        try (OutputStream out = compressed ? new BufferedGzipOutputStream(file) : new BufferedOutputStream(file);
             ObjectOutputStream objects = new ObjectOutputStream(out)) {
            objects.writeObject(value);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Wrote " + value.getClass().getName() + " to " + target + (compressed ? " (gzip)" : ""));
        }
    }
}
