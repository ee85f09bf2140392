package com.tyron.nanodata.core.text;

import com.tyron.nanodata.api.io.DecodeErrorMode;
import com.tyron.nanodata.api.io.SeekableTextReader;
import com.tyron.nanodata.core.io.ByteArraySeekableInput;
import com.tyron.nanodata.core.io.GzipSeekableInput;
import com.tyron.nanodata.testFramework.TestArchives;
import com.tyron.nanodata.testFramework.TestLogging;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class SeekableUnicodeStreamReaderTest {

    private static final String LATIN1_TEXT = "Ça a été très bien.\n"
            + "Déjà vu, naïve façade, señor, smörgåsbord.\r\n"
            + "x".repeat(71) + "\r\n"
            + "Une ligne assez longue pour dépasser plusieurs tampons de lecture: "
            + "àâäéèêëîïôöùûüÿç ".repeat(12) + "\n"
            + "\n"
            + "fin sans retour";

    private static final String UTF8_TEXT = "Ελληνικά και 日本語のテキスト.\n"
            + "emoji 😀 and 🎉 straddle buffers\r\n"
            + "é".repeat(50) + "\n"
            + "漢字".repeat(40) + "\r"
            + "mixed \u2028separators\u0085here\n"
            + "ascii line\n"
            + "last 🚀 line";

    @BeforeAll
    public static void setUpLogging() {
        TestLogging.configureOnce();
    }

    private static SeekableUnicodeStreamReader reader(String text, Charset charset, String encoding) throws IOException {
        return reader(text.getBytes(charset), encoding);
    }

    private static SeekableUnicodeStreamReader reader(byte[] bytes, String encoding) throws IOException {
        return new SeekableUnicodeStreamReader(new ByteArraySeekableInput(bytes, "test"), encoding);
    }

    @Test
    public void readReturnsWholeText() throws Exception {
        try (SeekableTextReader r = reader(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals(UTF8_TEXT, r.read());
            Assertions.assertEquals("", r.read());
        }
    }

    @Test
    public void readlineReturnsLinesWithTerminators() throws Exception {
        String text = "a\r\nb\rc\u2028d\n\ne";
        try (SeekableTextReader r = reader(text, StandardCharsets.UTF_8, "utf8")) {
            Assertions.assertEquals("a\r\n", r.readline());
            Assertions.assertEquals("b\r", r.readline());
            Assertions.assertEquals("c\u2028", r.readline());
            Assertions.assertEquals("d\n", r.readline());
            Assertions.assertEquals("\n", r.readline());
            Assertions.assertEquals("e", r.readline());
            Assertions.assertEquals("", r.readline());
        }
    }

    @Test
    public void carriageReturnAtChunkEndJoinsFollowingNewline() throws Exception {
        // the first physical read is 72 bytes and ends right after the '\r'
        String text = "x".repeat(71) + "\r\n" + "y\n";
        try (SeekableTextReader r = reader(text, StandardCharsets.US_ASCII, "ascii")) {
            Assertions.assertEquals("x".repeat(71) + "\r\n", r.readline());
            Assertions.assertEquals("y\n", r.readline());
        }
    }

    @Test
    public void longLinesGrowTheReadAhead() throws Exception {
        String longLine = "0123456789".repeat(2000) + "\n";
        try (SeekableTextReader r = reader(longLine + "tail", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals(longLine, r.readline());
            Assertions.assertEquals("tail", r.readline());
        }
    }

    @Test
    public void readlineWithSizeDoesASingleRead() throws Exception {
        try (SeekableTextReader r = reader("abcdefghij\nk\n", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals("abcd", r.readline(4));
            Assertions.assertEquals("efghij\n", r.readline());
        }
    }

    @Test
    public void readReturnsBufferedLinesFirst() throws Exception {
        try (SeekableTextReader r = reader("one\ntwo\nthree\n", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals("one\n", r.readline());
            Assertions.assertEquals("two\nthree\n", r.read(2));
        }
    }

    @Test
    public void discardLineSkipsOneLine() throws Exception {
        try (SeekableTextReader r = reader("one\ntwo\nthree\n", StandardCharsets.UTF_8, "utf-8")) {
            r.discardLine();
            Assertions.assertEquals("two\n", r.readline());
            r.discardLine();
            Assertions.assertEquals("", r.readline());
        }
    }

    @Test
    public void readlinesAndIterationSplitLikeWholeText() throws Exception {
        try (SeekableTextReader r = reader(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals(LineSplitter.splitLines(UTF8_TEXT, false), r.readlines(false));
        }
        List<String> lines = new ArrayList<>();
        try (SeekableTextReader r = reader(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8")) {
            for (String line : r) {
                lines.add(line);
            }
        }
        Assertions.assertEquals(LineSplitter.splitLines(UTF8_TEXT, true), lines);
    }

    @Test
    public void mixedReadsConcatenateToTextLatin1() throws Exception {
        assertMixedReadsConcatenate(LATIN1_TEXT, StandardCharsets.ISO_8859_1, "latin-1");
    }

    @Test
    public void mixedReadsConcatenateToTextUtf8() throws Exception {
        assertMixedReadsConcatenate(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8");
    }

    @Test
    public void mixedReadsConcatenateToTextUtf16() throws Exception {
        assertMixedReadsConcatenate(LATIN1_TEXT, StandardCharsets.UTF_16LE, "utf-16-le");
    }

    @Test
    public void mixedReadsConcatenateToTextWithReplacedBytes() throws Exception {
        byte[] bytes = invalidUtf8Lines();
        String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        assertMixedReadsConcatenate(bytes, text, "utf-8", DecodeErrorMode.REPLACE);
    }

    private static void assertMixedReadsConcatenate(String text, Charset charset, String encoding) throws IOException {
        assertMixedReadsConcatenate(text.getBytes(charset), text, encoding, DecodeErrorMode.STRICT);
    }

    /**
     * Random mixes of read(n), readline() and readline(n); seek(tell()) followed by read() must
     * give exactly the text not yet returned.
     */
    private static void assertMixedReadsConcatenate(byte[] bytes, String text, String encoding,
                                                    DecodeErrorMode errors) throws IOException {
        for (long seed = 0; seed < 20; seed++) {
            Random random = new Random(seed);
            StringBuilder out = new StringBuilder();
            try (SeekableUnicodeStreamReader r = new SeekableUnicodeStreamReader(new ByteArraySeekableInput(bytes, "test"), encoding, errors)) {
                r.setDebug(errors != DecodeErrorMode.STRICT);
                for (int step = 0; step < 10_000 && out.length() < text.length(); step++) {
                    switch (random.nextInt(3)) {
                        case 0:
                            out.append(r.read(1 + random.nextInt(20)));
                            break;
                        case 1:
                            out.append(r.readline());
                            break;
                        default:
                            out.append(r.readline(1 + random.nextInt(20)));
                            break;
                    }

                    // checking discards the reader's buffers, so only do it on some steps
                    if (random.nextInt(4) == 0) {
                        long pos = r.tell();
                        String rest = r.read();
                        Assertions.assertEquals(text.substring(out.length()), rest,
                                "seed " + seed + " step " + step + " tell " + pos);
                        r.seek(pos);
                    }
                }
                Assertions.assertEquals(text, out.toString(), "seed " + seed);
                Assertions.assertEquals("", r.read());
            }
        }
    }

    /**
     * UTF-8 lines with a stray 0xFF at varying offsets, including line starts, line ends and
     * inside a two byte character.
     */
    private static byte[] invalidUtf8Lines() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < 40; i++) {
            byte[] line = ("line " + i + " caf\u00e9 " + "x".repeat(i % 7) + "\n").getBytes(StandardCharsets.UTF_8);
            int bad = (i * 5) % line.length;
            out.write(line, 0, bad);
            out.write(0xFF);
            out.write(line, bad, line.length - bad);
        }
        return out.toByteArray();
    }

    @Test
    public void replacedBytesCountAsOneCharacter() throws Exception {
        byte[] line = {'a', 'b', (byte) 0xFF, 'c', '\n'};
        byte[] bytes = concat(concat(line, line), line);
        String text = "ab\uFFFDc\n".repeat(3);

        try (SeekableUnicodeStreamReader r = new SeekableUnicodeStreamReader(new ByteArraySeekableInput(bytes, "test"), "utf-8", DecodeErrorMode.REPLACE)) {
            r.setDebug(true);
            for (int n = 0; n <= text.length(); n++) {
                r.seek(0);
                r.charSeekForward(n);
                Assertions.assertEquals(text.substring(n), r.read(), "n = " + n);
            }

            r.seek(0);
            Assertions.assertEquals("ab\uFFFDc\n", r.readline());
            Assertions.assertEquals(5, r.tell());
            r.charSeekForward(3);
            Assertions.assertEquals(8, r.tell());
            Assertions.assertEquals("c\nab\uFFFDc\n", r.read());
        }
    }

    @Test
    public void utf8CharactersSpanningReadBoundaries() throws Exception {
        // every read(1) ends inside a multi-byte character
        String text = "日本語😀é";
        StringBuilder out = new StringBuilder();
        try (SeekableTextReader r = reader(text, StandardCharsets.UTF_8, "utf-8")) {
            String chunk;
            while (!(chunk = r.read(1)).isEmpty()) {
                out.append(chunk);
            }
        }
        Assertions.assertEquals(text, out.toString());
    }

    @Test
    public void tellSeekRoundTripAfterEachLine() throws Exception {
        try (SeekableUnicodeStreamReader r = reader(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8")) {
            r.setDebug(true);
            List<Long> positions = new ArrayList<>();
            List<String> lines = new ArrayList<>();
            String line;
            do {
                positions.add(r.tell());
                line = r.readline();
                lines.add(line);
            } while (!line.isEmpty());

            for (int i = lines.size() - 1; i >= 0; i--) {
                r.seek(positions.get(i));
                Assertions.assertEquals(lines.get(i), r.readline());
            }
        }
    }

    @Test
    public void tellReportsByteOffsets() throws Exception {
        String text = "é\nab\n";
        try (SeekableTextReader r = reader(text, StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals(0, r.tell());
            r.readline();
            Assertions.assertEquals(3, r.tell());
            r.readline();
            Assertions.assertEquals(6, r.tell());
        }
    }

    @Test
    public void charSeekForwardFromStart() throws Exception {
        assertCharSeekForward(UTF8_TEXT, StandardCharsets.UTF_8, "utf-8");
        assertCharSeekForward(LATIN1_TEXT, StandardCharsets.ISO_8859_1, "iso-8859-1");
    }

    private static void assertCharSeekForward(String text, Charset charset, String encoding) throws IOException {
        int length = text.codePointCount(0, text.length());
        try (SeekableTextReader r = reader(text, charset, encoding)) {
            for (int n = 0; n <= length; n++) {
                r.seek(0);
                r.charSeekForward(n);
                String expected = text.substring(text.offsetByCodePoints(0, n));
                Assertions.assertEquals(expected, r.read(), "n = " + n);
            }
        }
    }

    @Test
    public void charSeekForwardFromBufferedPosition() throws Exception {
        try (SeekableTextReader r = reader("first line\nαβγδ rest\n", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertEquals("first line\n", r.readline());
            r.charSeekForward(3);
            Assertions.assertEquals("δ rest\n", r.read());
        }
    }

    @Test
    public void charSeekForwardPastEndStopsAtEnd() throws Exception {
        try (SeekableTextReader r = reader("αβ", StandardCharsets.UTF_8, "utf-8")) {
            r.charSeekForward(10);
            Assertions.assertEquals("", r.read());
            Assertions.assertEquals(4, r.tell());
        }
    }

    @Test
    public void negativeCharSeekIsRejected() throws Exception {
        try (SeekableTextReader r = reader("abc", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> r.charSeekForward(-1));
        }
    }

    @Test
    public void relativeSeekIsUnsupported() throws Exception {
        try (SeekableTextReader r = reader("abc", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertThrows(UnsupportedOperationException.class, () -> r.seek(1, SeekableTextReader.SEEK_CUR));
            Assertions.assertThrows(IllegalArgumentException.class, () -> r.seek(1, 7));
        }
    }

    @Test
    public void seekFromEnd() throws Exception {
        try (SeekableTextReader r = reader("hello world\n", StandardCharsets.UTF_8, "utf-8")) {
            r.readline();
            r.seek(-6, SeekableTextReader.SEEK_END);
            Assertions.assertEquals("world\n", r.read());
        }
    }

    @Test
    public void utf8ByteOrderMarkIsSkipped() throws Exception {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] bytes = concat(bom, "héllo\nworld\n".getBytes(StandardCharsets.UTF_8));
        try (SeekableTextReader r = reader(bytes, "utf-8")) {
            Assertions.assertEquals("héllo\n", r.readline());
            long afterFirst = r.tell();
            Assertions.assertEquals(10, afterFirst);
            r.seek(0);
            Assertions.assertEquals("héllo\nworld\n", r.read());
            r.seek(0);
            r.charSeekForward(1);
            Assertions.assertEquals("éllo\n", r.readline());
        }
    }

    @Test
    public void utf16ByteOrderMarkNarrowsEncoding() throws Exception {
        byte[] little = concat(new byte[]{(byte) 0xFF, (byte) 0xFE}, "ab\ncd".getBytes(StandardCharsets.UTF_16LE));
        try (SeekableTextReader r = reader(little, "UTF-16")) {
            Assertions.assertEquals("UTF-16LE", r.getEncoding());
            Assertions.assertEquals("ab\n", r.readline());
            Assertions.assertEquals("cd", r.readline());
        }

        byte[] big = concat(new byte[]{(byte) 0xFE, (byte) 0xFF}, "ab\ncd".getBytes(StandardCharsets.UTF_16BE));
        try (SeekableTextReader r = reader(big, "utf16")) {
            Assertions.assertEquals("UTF-16BE", r.getEncoding());
            Assertions.assertEquals("ab\ncd", r.read());
        }
    }

    @Test
    public void utf16WithoutByteOrderMarkIsBigEndian() throws Exception {
        try (SeekableTextReader r = reader("ab", StandardCharsets.UTF_16BE, "utf-16")) {
            Assertions.assertEquals("UTF-16BE", r.getEncoding());
            Assertions.assertEquals("ab", r.read());
        }
    }

    @Test
    public void malformedInputIsReportedInStrictMode() throws Exception {
        byte[] bytes = {'a', 'b', (byte) 0xFF, 'c', 'd', '\n'};
        try (SeekableTextReader r = reader(bytes, "utf-8")) {
            Assertions.assertThrows(CharacterCodingException.class, r::read);
        }
    }

    @Test
    public void malformedInputIsReplacedOrIgnored() throws Exception {
        byte[] bytes = {'a', 'b', (byte) 0xFF, 'c', 'd', '\n'};
        try (SeekableTextReader r = new SeekableUnicodeStreamReader(new ByteArraySeekableInput(bytes), "utf-8", DecodeErrorMode.REPLACE)) {
            Assertions.assertEquals("ab\uFFFDcd\n", r.read());
        }
        try (SeekableTextReader r = new SeekableUnicodeStreamReader(new ByteArraySeekableInput(bytes), "utf-8", DecodeErrorMode.IGNORE)) {
            Assertions.assertEquals("abcd\n", r.read());
        }
    }

    @Test
    public void worksOverDecompressedStreams() throws Exception {
        byte[] compressed = TestArchives.gzip(UTF8_TEXT);
        GzipSeekableInput input = new GzipSeekableInput("test.gz", () -> new ByteArrayInputStream(compressed));
        try (SeekableTextReader r = new SeekableUnicodeStreamReader(input, "utf-8")) {
            String first = r.readline();
            long pos = r.tell();
            String rest = r.read();
            Assertions.assertEquals(UTF8_TEXT, first + rest);
            r.seek(pos);
            Assertions.assertEquals(rest, r.read());
        }
    }

    @Test
    public void encodingAliases() throws Exception {
        try (SeekableTextReader r = reader("x", StandardCharsets.ISO_8859_1, "Latin-1")) {
            Assertions.assertEquals("ISO-8859-1", r.getEncoding());
        }
        try (SeekableTextReader r = reader("x", StandardCharsets.UTF_8, "UTF_8")) {
            Assertions.assertEquals("UTF-8", r.getEncoding());
        }
    }

    @Test
    public void debugDefaultsToSystemProperty() throws Exception {
        System.setProperty(SeekableUnicodeStreamReader.DEBUG_PROPERTY, "true");
        try (SeekableUnicodeStreamReader r = reader("x", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertTrue(r.isDebug());
        } finally {
            System.clearProperty(SeekableUnicodeStreamReader.DEBUG_PROPERTY);
        }
        try (SeekableUnicodeStreamReader r = reader("x", StandardCharsets.UTF_8, "utf-8")) {
            Assertions.assertFalse(r.isDebug());
        }
    }

    @Test
    public void closeClosesTheStream() throws Exception {
        SeekableTextReader r = reader("x", StandardCharsets.UTF_8, "utf-8");
        Assertions.assertFalse(r.isClosed());
        r.close();
        Assertions.assertTrue(r.isClosed());
    }

    private static byte[] concat(byte[] a, byte[] b) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(a);
        out.writeBytes(b);
        return out.toByteArray();
    }
}
