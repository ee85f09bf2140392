package com.tyron.nanodata.core.text;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps loose encoding names ("utf8", "UTF-16", "latin-1") to charsets and knows which
 * byte order marks each Unicode encoding may start with.
 */
public final class EncodingNames {

    /**
     * A byte order mark, and the charset it narrows a generic encoding to (null if it does not).
     */
    public record Bom(byte[] bytes, @Nullable Charset narrowed) {

        public boolean isPrefixOf(byte[] data, int length) {
            if (length < bytes.length) {
                return false;
            }
            for (int i = 0; i < bytes.length; i++) {
                if (data[i] != bytes[i]) {
                    return false;
                }
            }
            return true;
        }
    }

    private static final Charset UTF_32LE = Charset.forName("UTF-32LE");
    private static final Charset UTF_32BE = Charset.forName("UTF-32BE");

    private static final byte[] BOM_UTF8 = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] BOM_UTF16_LE = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] BOM_UTF16_BE = {(byte) 0xFE, (byte) 0xFF};
    private static final byte[] BOM_UTF32_LE = {(byte) 0xFF, (byte) 0xFE, 0, 0};
    private static final byte[] BOM_UTF32_BE = {0, 0, (byte) 0xFE, (byte) 0xFF};

    private static final Map<String, List<Bom>> BOM_TABLE = Map.of(
            "utf8", List.of(new Bom(BOM_UTF8, null)),
            "utf16", List.of(new Bom(BOM_UTF16_LE, StandardCharsets.UTF_16LE), new Bom(BOM_UTF16_BE, StandardCharsets.UTF_16BE)),
            "utf16le", List.of(new Bom(BOM_UTF16_LE, null)),
            "utf16be", List.of(new Bom(BOM_UTF16_BE, null)),
            "utf32", List.of(new Bom(BOM_UTF32_LE, UTF_32LE), new Bom(BOM_UTF32_BE, UTF_32BE)),
            "utf32le", List.of(new Bom(BOM_UTF32_LE, null)),
            "utf32be", List.of(new Bom(BOM_UTF32_BE, null))
    );

    private EncodingNames() {
    }

    /**
     * @return {@code encoding} lower-cased with spaces, dashes and underscores removed.
     */
    static String key(String encoding) {
        return encoding.toLowerCase(Locale.ROOT).replaceAll("[ _-]", "");
    }

    /**
     * Resolves an encoding name.
     * <p>
     * Generic UTF-16/UTF-32 names resolve to their big-endian forms, which is what applies when
     * there is no byte order mark; decoders are created per chunk and must not consume marks themselves.
     *
     * @throws java.nio.charset.UnsupportedCharsetException if the name is unknown
     */
    public static Charset forName(String encoding) {
        switch (key(encoding)) {
            case "utf8":
            case "utf8sig":
                return StandardCharsets.UTF_8;
            case "utf16":
            case "utf16be":
                return StandardCharsets.UTF_16BE;
            case "utf16le":
                return StandardCharsets.UTF_16LE;
            case "utf32":
            case "utf32be":
                return UTF_32BE;
            case "utf32le":
                return UTF_32LE;
            case "latin1":
            case "l1":
            case "iso88591":
            case "iso8859":
            case "cp819":
                return StandardCharsets.ISO_8859_1;
            case "ascii":
            case "usascii":
                return StandardCharsets.US_ASCII;
            default:
                return Charset.forName(encoding);
        }
    }

    /**
     * @return The byte order marks {@code encoding} may start with, in the order they are checked.
     */
    public static List<Bom> bomsFor(String encoding) {
        String key = key(encoding);
        if (key.equals("utf8sig")) {
            key = "utf8";
        }
        return BOM_TABLE.getOrDefault(key, List.of());
    }
}
