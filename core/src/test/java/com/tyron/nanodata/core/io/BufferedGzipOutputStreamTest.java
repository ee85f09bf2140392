package com.tyron.nanodata.core.io;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;

public class BufferedGzipOutputStreamTest {

    @Test
    public void smallWritesStayBufferedUntilFlush() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        BufferedGzipOutputStream out = new BufferedGzipOutputStream(sink, 1024);
        int headerOnly = sink.size();

        for (int i = 0; i < 100; i++) {
            out.write('a');
        }
        Assertions.assertEquals(100, out.getBufferedLength());
        Assertions.assertEquals(headerOnly, sink.size());

        out.flush();
        Assertions.assertEquals(0, out.getBufferedLength());
        Assertions.assertTrue(sink.size() > headerOnly);
        out.close();

        Assertions.assertEquals("a".repeat(100), gunzip(sink.toByteArray()));
    }

    @Test
    public void bufferSpillsWhenFull() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        StringBuilder expected = new StringBuilder();
        try (BufferedGzipOutputStream out = new BufferedGzipOutputStream(sink, 16)) {
            for (int i = 0; i < 10; i++) {
                String chunk = "chunk-" + i + ";";
                expected.append(chunk);
                out.write(chunk.getBytes(StandardCharsets.UTF_8));
                Assertions.assertTrue(out.getBufferedLength() <= 16);
            }
            // larger than the buffer: written straight through
            String big = "B".repeat(100);
            expected.append(big);
            out.write(big.getBytes(StandardCharsets.UTF_8));
            Assertions.assertEquals(0, out.getBufferedLength());
        }
        Assertions.assertEquals(expected.toString(), gunzip(sink.toByteArray()));
    }

    @Test
    public void closeIsIdempotentAndFinal() throws Exception {
        BufferedGzipOutputStream out = new BufferedGzipOutputStream(new ByteArrayOutputStream());
        out.write(1);
        out.close();
        out.close();
        Assertions.assertThrows(IOException.class, () -> out.write(2));
    }

    @Test
    public void compressionLevelIsApplied() throws Exception {
        Random random = new Random(7);
        String[] words = {"the", "grammar", "corpus", "tokenizer", "of", "punkt", "a", "tree", "bank"};
        StringBuilder text = new StringBuilder();
        while (text.length() < 200_000) {
            text.append(words[random.nextInt(words.length)]).append(random.nextInt(100)).append(' ');
        }
        byte[] data = text.toString().getBytes(StandardCharsets.UTF_8);

        byte[] fastest = compress(data, Deflater.BEST_SPEED);
        byte[] smallest = compress(data, Deflater.BEST_COMPRESSION);

        Assertions.assertTrue(smallest.length < fastest.length, smallest.length + " vs " + fastest.length);
        Assertions.assertEquals(text.toString(), gunzip(fastest));
        Assertions.assertEquals(text.toString(), gunzip(smallest));
    }

    @Test
    public void rejectsInvalidCompressionLevel() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BufferedGzipOutputStream(new ByteArrayOutputStream(), 1024, 42));
    }

    @Test
    public void rejectsInvalidBufferSize() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BufferedGzipOutputStream(new ByteArrayOutputStream(), 0));
    }

    private static byte[] compress(byte[] data, int level) throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (BufferedGzipOutputStream out = new BufferedGzipOutputStream(sink, BufferedGzipOutputStream.DEFAULT_BUFFER_SIZE, level)) {
            out.write(data);
        }
        return sink.toByteArray();
    }

    private static String gunzip(byte[] compressed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
