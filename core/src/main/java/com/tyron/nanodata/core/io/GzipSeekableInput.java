package com.tyron.nanodata.core.io;

import com.tyron.nanodata.api.io.SeekableInput;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * Decompressing {@link SeekableInput}. Positions refer to the decompressed content.
 * <p>
 * Forward seeks skip through the data; backward seeks reopen the compressed source and skip
 * from the beginning. The decompressed size is computed on first request by a separate pass.
 */
public final class GzipSeekableInput extends SeekableInput {

    /**
     * Supplies a fresh stream over the compressed bytes.
     */
    @FunctionalInterface
    public interface Source {
        InputStream open() throws IOException;
    }

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private final String name;
    private final Source source;

    private InputStream in;
    private long position;
    private long size = -1;
    private boolean closed;

    public GzipSeekableInput(String name, Source source) throws IOException {
        this.name = name;
        this.source = Objects.requireNonNull(source, "source");
        this.in = openDecompressed();
    }

    private InputStream openDecompressed() throws IOException {
        InputStream raw = source.open();
        try {
            return new GZIPInputStream(raw, DEFAULT_BUFFER_SIZE);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        int b = in.read();
        if (b >= 0) {
            position++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        int n = in.read(b, off, len);
        if (n > 0) {
            position += n;
        }
        return n;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long target) throws IOException {
        ensureOpen();
        if (target < 0) {
            throw new IOException("Negative seek position: " + target);
        }
        if (target < position) {
            in.close();
            in = openDecompressed();
            position = 0;
        }
        byte[] scratch = new byte[8192];
        while (position < target) {
            int n = in.read(scratch, 0, (int) Math.min(scratch.length, target - position));
            if (n < 0) {
                break;
            }
            position += n;
        }
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        if (size < 0) {
            long total = 0;
            byte[] scratch = new byte[8192];
            try (InputStream counting = openDecompressed()) {
                int n;
                while ((n = counting.read(scratch)) >= 0) {
                    total += n;
                }
            }
            size = total;
        }
        return size;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            in.close();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
