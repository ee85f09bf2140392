package com.tyron.nanodata.core.text;

import com.tyron.nanodata.api.io.DecodeErrorMode;
import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.io.SeekableTextReader;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes a {@link SeekableInput} incrementally while keeping {@link #tell()} and {@link #seek}
 * meaningful as byte offsets.
 * <p>
 * Two buffers sit between the stream and the caller: bytes that do not yet form a complete
 * character, and lines that {@link #readline()} decoded ahead of the one it returned. To answer
 * {@code tell()} while lines are buffered, the reader remembers the byte offset where the last
 * read-ahead chunk started and how many characters of that chunk have been handed out since;
 * the position is recovered by seeking to the checkpoint and skipping that many characters.
 * <p>
 * Not thread safe.
 */
public class SeekableUnicodeStreamReader implements SeekableTextReader {

    private static final Logger LOG = Logger.getLogger(SeekableUnicodeStreamReader.class.getName());

    static final int INITIAL_READLINE_SIZE = 72;
    static final int MAX_READLINE_SIZE = 8000;
    private static final int DEBUG_PROBE_BYTES = 50;

    /**
     * System property that turns on {@link #setDebug position verification} for new readers.
     */
    public static final String DEBUG_PROPERTY = "nanodata.reader.debug";
    private static final int BOM_PROBE_BYTES = 4;
    private static final byte[] EMPTY = new byte[0];

    private record Decoded(String chars, int consumed) {
    }

    private final SeekableInput stream;
    private final DecodeErrorMode errors;
    private final int bomLength;
    private Charset charset;
    private boolean debug;

    // bytes read from the stream that did not yet decode to a character
    private byte[] byteBuffer = EMPTY;

    // decoded lines not yet returned; null when empty. The last one may be incomplete.
    @Nullable
    private List<String> lineBuffer;

    private long rewindCheckpoint;
    private long rewindCharCount;

    public SeekableUnicodeStreamReader(SeekableInput stream, String encoding) throws IOException {
        this(stream, encoding, DecodeErrorMode.STRICT);
    }

    /**
     * @throws java.nio.charset.UnsupportedCharsetException if {@code encoding} is unknown
     */
    public SeekableUnicodeStreamReader(SeekableInput stream, String encoding, DecodeErrorMode errors)
            throws IOException {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.errors = Objects.requireNonNull(errors, "errors");
        this.charset = EncodingNames.forName(encoding);
        this.debug = Boolean.getBoolean(DEBUG_PROPERTY);

        stream.seek(0);
        this.bomLength = detectBom(encoding);
        this.rewindCheckpoint = stream.position();
    }

    private int detectBom(String encoding) throws IOException {
        List<EncodingNames.Bom> boms = EncodingNames.bomsFor(encoding);
        if (boms.isEmpty()) {
            return 0;
        }
        byte[] prefix = stream.readNBytes(BOM_PROBE_BYTES);
        stream.seek(0);
        for (EncodingNames.Bom bom : boms) {
            if (bom.isPrefixOf(prefix, prefix.length)) {
                if (bom.narrowed() != null) {
                    charset = bom.narrowed();
                }
                if (LOG.isLoggable(Level.FINER)) {
                    LOG.finer("Byte order mark in " + stream.getName() + ", decoding as " + charset.name());
                }
                return bom.bytes().length;
            }
        }
        return 0;
    }

    /**
     * Enables verification of every buffered {@link #tell()} by re-decoding at the computed offset.
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @TestOnly
    boolean isDebug() {
        return debug;
    }

    @Override
    public String read() throws IOException {
        return read(-1);
    }

    /**
     * @param size bytes to read; negative reads to the end of the stream
     */
    @Override
    public String read(int size) throws IOException {
        String chars = readChars(size);
        if (lineBuffer != null) {
            chars = String.join("", lineBuffer) + chars;
            lineBuffer = null;
        }
        return chars;
    }

    @Override
    public String readline() throws IOException {
        return readline(-1);
    }

    @Override
    public String readline(int size) throws IOException {
        if (lineBuffer != null && lineBuffer.size() > 1) {
            return popBufferedLine();
        }

        int readSize = size > 0 ? size : INITIAL_READLINE_SIZE;
        StringBuilder chars = new StringBuilder();
        if (lineBuffer != null) {
            chars.append(lineBuffer.remove(0));
            lineBuffer = null;
        }

        while (true) {
            skipBom();
            long startPos = stream.position() - byteBuffer.length;
            String newChars = readChars(readSize);

            // a "\r" at the end of the chunk may be the first half of "\r\n"
            if (!newChars.isEmpty() && newChars.endsWith("\r")) {
                newChars += readChars(1);
            }
            chars.append(newChars);

            List<String> lines = LineSplitter.splitLines(chars.toString(), true);
            if (lines.size() > 1) {
                String line = lines.get(0);
                lineBuffer = new ArrayList<>(lines.subList(1, lines.size()));
                rewindCheckpoint = startPos;
                rewindCharCount = charCount(newChars) - (charCount(chars) - charCount(line));
                return line;
            }
            if (lines.size() == 1 && LineSplitter.endsWithLineBreak(lines.get(0))) {
                return lines.get(0);
            }
            if (newChars.isEmpty() || size >= 0) {
                return chars.toString();
            }
            if (readSize < MAX_READLINE_SIZE) {
                readSize *= 2;
            }
        }
    }

    private String popBufferedLine() {
        String line = lineBuffer.remove(0);
        rewindCharCount += charCount(line);
        return line;
    }

    @Override
    public List<String> readlines(boolean keepEnds) throws IOException {
        return LineSplitter.splitLines(read(), keepEnds);
    }

    @Override
    public void discardLine() throws IOException {
        if (lineBuffer != null && lineBuffer.size() > 1) {
            popBufferedLine();
        } else {
            readline();
        }
    }

    @Override
    public Iterator<String> iterator() {
        return new Iterator<>() {
            private String next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = readline();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
                return !next.isEmpty();
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String line = next;
                next = null;
                return line;
            }
        };
    }

    @Override
    public void seek(long offset, int whence) throws IOException {
        long target;
        switch (whence) {
            case SEEK_SET:
                target = offset;
                break;
            case SEEK_END:
                target = stream.size() + offset;
                break;
            case SEEK_CUR:
                throw new UnsupportedOperationException(
                        "Relative seek is not supported by " + getClass().getSimpleName()
                                + "; use charSeekForward() to move by characters");
            default:
                throw new IllegalArgumentException("Invalid whence: " + whence);
        }
        if (target < 0) {
            throw new IllegalArgumentException("Negative seek position " + target);
        }
        stream.seek(target);
        resetBuffers();
    }

    private void resetBuffers() throws IOException {
        lineBuffer = null;
        byteBuffer = EMPTY;
        rewindCharCount = 0;
        rewindCheckpoint = stream.position();
    }

    @Override
    public void charSeekForward(int offset) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offsets are not supported");
        }
        seek(tell());
        skipBom();
        seekForwardChars(offset, offset);
    }

    /**
     * Advances the stream by {@code offset} characters, starting with a guess of
     * {@code estimatedBytes} bytes. Stops at the last complete character if the stream ends first.
     */
    private void seekForwardChars(long offset, long estimatedBytes) throws IOException {
        long estimate = estimatedBytes;
        byte[] bytes = EMPTY;
        while (true) {
            int wanted = (int) Math.max(0, estimate - bytes.length);
            byte[] newBytes = stream.readNBytes(wanted);
            bytes = concat(bytes, newBytes);

            Decoded decoded = incrementalDecode(bytes, bytes.length);
            long count = charCount(decoded.chars());
            if (count >= offset) {
                int consumed = count == offset ? decoded.consumed() : bytesForChars(bytes, offset);
                stream.seek(stream.position() - bytes.length + consumed);
                return;
            }
            if (wanted > 0 && newBytes.length < wanted) {
                stream.seek(stream.position() - bytes.length + decoded.consumed());
                return;
            }
            estimate += offset - count;
        }
    }

    @Override
    public long tell() throws IOException {
        if (lineBuffer == null) {
            return stream.position() - byteBuffer.length;
        }

        long origPos = stream.position();
        try {
            long bytesRead = (origPos - byteBuffer.length) - rewindCheckpoint;
            long bufferedChars = 0;
            for (String line : lineBuffer) {
                bufferedChars += charCount(line);
            }
            long total = rewindCharCount + bufferedChars;
            long estimate = total == 0 ? 0 : bytesRead * rewindCharCount / total;

            stream.seek(rewindCheckpoint);
            seekForwardChars(rewindCharCount, estimate);
            long filePos = stream.position();

            if (debug) {
                verifyPosition(filePos);
            }
            return filePos;
        } finally {
            stream.seek(origPos);
        }
    }

    private void verifyPosition(long filePos) throws IOException {
        stream.seek(filePos);
        byte[] probe = stream.readNBytes(DEBUG_PROBE_BYTES);
        String fromStream = incrementalDecode(probe, probe.length).chars();
        String buffered = String.join("", lineBuffer);
        if (!fromStream.startsWith(buffered) && !buffered.startsWith(fromStream)) {
            throw new IllegalStateException("tell() computed " + filePos + " but the text there ("
                    + fromStream + ") does not match the buffered text (" + buffered + ")");
        }
    }

    /**
     * Reads {@code size} bytes (all remaining if negative) and decodes as much as possible.
     * If the bytes only form part of a character, reads further until one is complete.
     */
    private String readChars(int size) throws IOException {
        if (size == 0) {
            return "";
        }
        skipBom();

        byte[] newBytes = size < 0 ? stream.readAllBytes() : stream.readNBytes(size);
        byte[] bytes = concat(byteBuffer, newBytes);
        Decoded decoded = incrementalDecode(bytes, bytes.length);

        if (size > 0 && newBytes.length > 0) {
            while (decoded.chars().isEmpty()) {
                int next = stream.read();
                if (next < 0) {
                    break;
                }
                bytes = concat(bytes, new byte[]{(byte) next});
                decoded = incrementalDecode(bytes, bytes.length);
            }
        }

        byteBuffer = Arrays.copyOfRange(bytes, decoded.consumed(), bytes.length);
        return decoded.chars();
    }

    private void skipBom() throws IOException {
        if (bomLength > 0 && stream.position() == 0) {
            stream.seek(bomLength);
        }
    }

    /**
     * Decodes the first {@code length} bytes, leaving a trailing incomplete sequence undecoded.
     *
     * @throws CharacterCodingException in strict mode, for invalid bytes
     */
    private Decoded incrementalDecode(byte[] bytes, int length) throws CharacterCodingException {
        CharsetDecoder decoder = newDecoder(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, length);
        CharBuffer out = CharBuffer.allocate(length + 1);
        while (true) {
            CoderResult result = decoder.decode(in, out, false);
            if (result.isOverflow()) {
                out = grow(out);
                continue;
            }
            if (result.isUnderflow()) {
                // a sequence cut off at the end comes back as underflow and stays in the input
                break;
            }
            // malformed even if more bytes followed, including a bad byte at the very end
            if (errors == DecodeErrorMode.STRICT) {
                result.throwException();
            }
            return lenientDecode(bytes, length);
        }
        out.flip();
        return new Decoded(out.toString(), in.position());
    }

    private Decoded lenientDecode(byte[] bytes, int length) {
        CharsetDecoder decoder = newDecoder(errorAction());
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, length);
        CharBuffer out = CharBuffer.allocate(length + 1);
        while (decoder.decode(in, out, false).isOverflow()) {
            out = grow(out);
        }
        out.flip();
        return new Decoded(out.toString(), in.position());
    }

    /**
     * @return The length of the shortest prefix of {@code bytes} that decodes to {@code chars}
     * characters. The output buffer is sized so the decoder stops right after the last one.
     */
    private int bytesForChars(byte[] bytes, long chars) throws CharacterCodingException {
        CharsetDecoder decoder = newDecoder(errorAction());
        ByteBuffer in = ByteBuffer.wrap(bytes);
        long remaining = chars;
        while (remaining > 0) {
            CharBuffer out = CharBuffer.allocate((int) Math.min(remaining, MAX_READLINE_SIZE));
            CoderResult result = decoder.decode(in, out, false);
            if (result.isError()) {
                result.throwException();
            }
            if (out.position() == 0 && result.isOverflow()) {
                // a surrogate pair does not fit in one slot
                out = CharBuffer.allocate(2);
                result = decoder.decode(in, out, false);
                if (result.isError()) {
                    result.throwException();
                }
            }
            if (out.position() == 0) {
                break;
            }
            out.flip();
            remaining -= charCount(out);
        }
        return in.position();
    }

    private CodingErrorAction errorAction() {
        switch (errors) {
            case IGNORE:
                return CodingErrorAction.IGNORE;
            case REPLACE:
                return CodingErrorAction.REPLACE;
            default:
                return CodingErrorAction.REPORT;
        }
    }

    private CharsetDecoder newDecoder(CodingErrorAction action) {
        return charset.newDecoder()
                .onMalformedInput(action)
                .onUnmappableCharacter(action);
    }

    private static CharBuffer grow(CharBuffer out) {
        CharBuffer bigger = CharBuffer.allocate(out.capacity() * 2 + 16);
        out.flip();
        bigger.put(out);
        return bigger;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        if (a.length == 0) {
            return b;
        }
        if (b.length == 0) {
            return a;
        }
        byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static long charCount(CharSequence s) {
        return Character.codePointCount(s, 0, s.length());
    }

    @TestOnly
    int getBufferedLineCount() {
        return lineBuffer == null ? 0 : lineBuffer.size();
    }

    @Override
    public String getEncoding() {
        return charset.name();
    }

    @Nullable
    public String getName() {
        return stream.getName();
    }

    @Override
    public boolean isClosed() {
        return stream.isClosed();
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }

    @Override
    public String toString() {
        return "SeekableUnicodeStreamReader(" + stream.getName() + ", " + charset.name() + ")";
    }
}
