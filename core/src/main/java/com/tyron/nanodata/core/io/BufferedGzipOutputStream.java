package com.tyron.nanodata.core.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.zip.Deflater;
import java.util.zip.GZIPOutputStream;

/**
 * A gzip output stream that batches small writes into a large buffer before compressing them.
 * <p>
 * Serializing a large object graph produces many tiny writes; collecting them first makes writing
 * large compressed payloads considerably faster at the cost of up to {@code bufferSize} bytes of memory.
 */
public class BufferedGzipOutputStream extends OutputStream {

    public static final int MB = 1 << 20;
    public static final int DEFAULT_BUFFER_SIZE = 2 * MB;

    private final GZIPOutputStream gzip;
    private final int bufferSize;
    private ByteArrayOutputStream buffer;
    private boolean closed;

    public BufferedGzipOutputStream(OutputStream out) throws IOException {
        this(out, DEFAULT_BUFFER_SIZE, Deflater.BEST_COMPRESSION);
    }

    public BufferedGzipOutputStream(OutputStream out, int bufferSize) throws IOException {
        this(out, bufferSize, Deflater.BEST_COMPRESSION);
    }

    /**
     * @param compressionLevel 1 (fastest) to 9 (smallest output)
     */
    public BufferedGzipOutputStream(OutputStream out, int bufferSize, int compressionLevel) throws IOException {
        Objects.requireNonNull(out, "out");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.buffer = new ByteArrayOutputStream(Math.min(bufferSize, 64 * 1024));
        this.gzip = new LeveledGzipOutputStream(out, compressionLevel);
    }

    /**
     * {@link GZIPOutputStream} only exposes its deflater to subclasses.
     */
    private static final class LeveledGzipOutputStream extends GZIPOutputStream {

        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out, 8192, true);
            def.setLevel(level);
        }
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        if (buffer.size() + 1 > bufferSize) {
            writeBuffer();
        }
        buffer.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(off, len, b.length);
        if (buffer.size() + len <= bufferSize) {
            buffer.write(b, off, len);
            return;
        }
        writeBuffer();
        if (len > bufferSize) {
            gzip.write(b, off, len);
        } else {
            buffer.write(b, off, len);
        }
    }

    /**
     * @return The number of bytes waiting to be compressed.
     */
    public int getBufferedLength() {
        return buffer.size();
    }

    /**
     * Compresses everything buffered so far and sync-flushes the compressor.
     */
    @Override
    public void flush() throws IOException {
        ensureOpen();
        writeBuffer();
        gzip.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writeBuffer();
        } finally {
            gzip.close();
        }
    }

    private void writeBuffer() throws IOException {
        if (buffer.size() > 0) {
            buffer.writeTo(gzip);
            buffer = new ByteArrayOutputStream(Math.min(bufferSize, 64 * 1024));
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
