package com.tyron.nanodata.core.io;

import com.tyron.nanodata.api.io.SeekableInput;

import java.io.IOException;
import java.util.Objects;

/**
 * In-memory {@link SeekableInput}, used for archive entries and downloaded resources.
 */
public final class ByteArraySeekableInput extends SeekableInput {

    private final byte[] data;
    private final String name;
    private long position;
    private boolean closed;

    public ByteArraySeekableInput(byte[] data) {
        this(data, null);
    }

    public ByteArraySeekableInput(byte[] data, String name) {
        this.data = Objects.requireNonNull(data, "data");
        this.name = name;
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        if (position >= data.length) {
            return -1;
        }
        return data[(int) position++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (position >= data.length) {
            return -1;
        }
        int n = (int) Math.min(len, data.length - position);
        System.arraycopy(data, (int) position, b, off, n);
        position += n;
        return n;
    }

    @Override
    public int available() {
        return (int) Math.max(0, data.length - position);
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long position) throws IOException {
        ensureOpen();
        if (position < 0) {
            throw new IOException("Negative seek position: " + position);
        }
        this.position = position;
    }

    @Override
    public long size() {
        return data.length;
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
    public void close() {
        closed = true;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
