package com.tyron.nanodata.testFramework;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds zip and gzip fixtures in memory.
 */
public final class TestArchives {

    private TestArchives() {
    }

    /**
     * @param pathAndContent alternating entry names and contents; a content is a
     *                       {@code String} (written as UTF-8) or a {@code byte[]}.
     *                       Names ending in '/' become directory entries and take no content.
     */
    public static byte[] makeZip(Object... pathAndContent) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zout = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
            int i = 0;
            while (i < pathAndContent.length) {
                String path = (String) pathAndContent[i++];
                zout.putNextEntry(new ZipEntry(path));
                if (!path.endsWith("/")) {
                    zout.write(toBytes(pathAndContent[i++]));
                }
                zout.closeEntry();
            }
        }
        return out.toByteArray();
    }

    public static Path writeZip(Path target, Object... pathAndContent) throws IOException {
        Files.createDirectories(target.getParent());
        return Files.write(target, makeZip(pathAndContent));
    }

    public static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (OutputStream gz = new GZIPOutputStream(out)) {
            gz.write(content);
        }
        return out.toByteArray();
    }

    public static byte[] gzip(String content) throws IOException {
        return gzip(content.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] toBytes(Object content) {
        if (content instanceof byte[] bytes) {
            return bytes;
        }
        if (content instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException("Unsupported content type: " + content);
    }
}
