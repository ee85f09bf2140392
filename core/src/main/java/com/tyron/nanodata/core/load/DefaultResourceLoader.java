package com.tyron.nanodata.core.load;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.io.SeekableTextReader;
import com.tyron.nanodata.api.pointer.PathPointer;
import com.tyron.nanodata.api.resource.LoadOptions;
import com.tyron.nanodata.api.resource.ParseContext;
import com.tyron.nanodata.api.resource.ResourceFormat;
import com.tyron.nanodata.api.resource.ResourceLoader;
import com.tyron.nanodata.api.resource.ResourceParser;
import com.tyron.nanodata.api.resource.ResourceUrl;
import com.tyron.nanodata.api.resource.UnknownFormatException;
import com.tyron.nanodata.api.resource.UrlOpener;
import com.tyron.nanodata.core.config.DataPathConfiguration;
import com.tyron.nanodata.core.io.ByteArraySeekableInput;
import com.tyron.nanodata.core.resolve.ResourceResolver;
import com.tyron.nanodata.core.text.EncodingNames;
import com.tyron.nanodata.core.text.LineSplitter;
import com.tyron.nanodata.core.text.SeekableUnicodeStreamReader;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads resources by URL and decodes them by format.
 * <p>
 * {@code nltk:} URLs are searched for in the configured roots (and then as plain paths),
 * {@code file:} URLs are read directly, and any other scheme is fetched through the
 * {@link UrlOpener}. Grammar and logic formats are handed to parsers registered with
 * {@link #registerParser}.
 */
public class DefaultResourceLoader implements ResourceLoader {

    private static final Logger LOG = Logger.getLogger(DefaultResourceLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int COPY_BLOCK_SIZE = 64 * 1024;
    public static final String DEFAULT_GRAMMAR_ESCAPE = "##";

    private final DataPathConfiguration configuration;
    private final ResourceResolver resolver;
    private final ResourceCache cache;
    private final UrlOpener urlOpener;
    private final Map<ResourceFormat, ResourceParser> parsers = new ConcurrentHashMap<>();

    public DefaultResourceLoader(DataPathConfiguration configuration, ResourceCache cache) {
        this(configuration, cache, new DefaultUrlOpener());
    }

    public DefaultResourceLoader(DataPathConfiguration configuration, ResourceCache cache, UrlOpener urlOpener) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.urlOpener = Objects.requireNonNull(urlOpener, "urlOpener");
        this.resolver = new ResourceResolver(configuration);
    }

    /**
     * Registers the parser for a grammar or logic format, replacing any previous one.
     *
     * @throws IllegalArgumentException if {@code format} is decoded without a parser
     */
    public void registerParser(ResourceFormat format, ResourceParser parser) {
        if (!format.isText() || format == ResourceFormat.TEXT) {
            throw new IllegalArgumentException("Format " + format.getId() + " does not take a parser");
        }
        parsers.put(format, Objects.requireNonNull(parser, "parser"));
    }

    @Override
    public Object load(String url, LoadOptions options) throws IOException {
        ResourceUrl resourceUrl = ResourceUrls.normalize(url);
        ResourceFormat format = resolveFormat(resourceUrl, options.format());
        boolean useCache = options.cache() && configuration.isCacheEnabled();
        ResourceCache.Key key = new ResourceCache.Key(resourceUrl, format);

        if (useCache) {
            Optional<Object> cached = cache.get(key);
            if (cached.isPresent()) {
                if (LOG.isLoggable(Level.FINER)) {
                    LOG.finer("Using cached copy of " + resourceUrl);
                }
                return cached.get();
            }
        }

        Level level = options.verbose() ? Level.INFO : Level.FINE;
        if (LOG.isLoggable(level)) {
            LOG.log(level, "Loading " + resourceUrl + " as " + format.getId());
        }

        Object value;
        try (SeekableInput in = open(resourceUrl)) {
            value = decode(in, resourceUrl, format, options);
        }

        if (useCache && !cache.put(key, value) && LOG.isLoggable(Level.FINER)) {
            LOG.finer("Not caching " + resourceUrl);
        }
        return value;
    }

    private static ResourceFormat resolveFormat(ResourceUrl url, String format) {
        if (LoadOptions.AUTO.equals(format)) {
            return ResourceUrls.inferFormat(url).orElseThrow(() -> new UnknownFormatException(
                    "Could not determine format for " + url + " based on its file extension;"
                            + " use the format option to specify the format explicitly"));
        }
        return ResourceFormat.fromId(format)
                .orElseThrow(() -> new UnknownFormatException("Unknown format type: " + format));
    }

    private Object decode(SeekableInput in, ResourceUrl url, ResourceFormat format, LoadOptions options) throws IOException {
        switch (format) {
            case RAW:
                return in.readAllBytes();
            case SER:
                try (ObjectInputStream objects = new ObjectInputStream(in)) {
                    objects.setObjectInputFilter(configuration.createSerialFilter());
                    return objects.readObject();
                } catch (ClassNotFoundException e) {
                    throw new IOException("Cannot deserialize " + url + ": " + e.getMessage(), e);
                }
            case JSON:
                return JSON.readValue(in, Object.class);
            case YAML:
                return new Yaml().load(in);
            default:
                break;
        }

        DecodedText text = decodeText(in.readAllBytes(), url, options.encoding());
        if (format == ResourceFormat.TEXT) {
            return text.text();
        }

        ResourceParser parser = parsers.get(format);
        if (parser == null) {
            throw new UnknownFormatException("No parser registered for format " + format.getId());
        }
        return parser.parse(text.text(), new ParseContext(url, format, text.explicitEncoding(), options.arguments()));
    }

    private record DecodedText(String text, @Nullable Charset explicitEncoding) {
    }

    /**
     * Decodes with {@code encoding} if given (skipping its byte order mark), otherwise tries
     * UTF-8 and falls back to ISO-8859-1.
     */
    private static DecodedText decodeText(byte[] bytes, ResourceUrl url, @Nullable String encoding)
            throws CharacterCodingException {
        if (encoding != null) {
            Charset charset = EncodingNames.forName(encoding);
            int offset = 0;
            for (EncodingNames.Bom bom : EncodingNames.bomsFor(encoding)) {
                if (bom.isPrefixOf(bytes, bytes.length)) {
                    offset = bom.bytes().length;
                    if (bom.narrowed() != null) {
                        charset = bom.narrowed();
                    }
                    break;
                }
            }
            return new DecodedText(strictDecode(bytes, offset, charset), charset);
        }
        try {
            return new DecodedText(strictDecode(bytes, 0, StandardCharsets.UTF_8), null);
        } catch (CharacterCodingException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(url + " is not valid UTF-8, decoding as ISO-8859-1");
            }
            return new DecodedText(new String(bytes, StandardCharsets.ISO_8859_1), null);
        }
    }

    private static String strictDecode(byte[] bytes, int offset, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                .toString();
    }

    @Override
    public PathPointer find(String resourceName) throws IOException {
        return resolver.find(resourceName);
    }

    @Override
    public SeekableInput open(String url) throws IOException {
        return open(ResourceUrls.normalize(url));
    }

    /**
     * Opens the bytes behind a normalized URL.
     */
    protected SeekableInput open(ResourceUrl url) throws IOException {
        switch (url.protocol()) {
            case NLTK: {
                List<String> roots = new ArrayList<>(configuration.getRoots());
                roots.add("");
                return resolver.find(url.path(), roots).open();
            }
            case FILE:
                return resolver.find(url.path(), List.of("")).open();
            default:
                try (InputStream in = urlOpener.open(url)) {
                    return new ByteArraySeekableInput(in.readAllBytes(), url.toString());
                }
        }
    }

    @Override
    public SeekableTextReader openText(String url, String encoding) throws IOException {
        SeekableInput in = open(url);
        try {
            SeekableUnicodeStreamReader reader = new SeekableUnicodeStreamReader(in, encoding);
            reader.setDebug(configuration.isReaderDebug());
            return reader;
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    @Override
    public void retrieve(String url, Path target) throws IOException {
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toAbsolutePath().toString());
        }
        ResourceUrl resourceUrl = ResourceUrls.normalize(url);
        LOG.info("Retrieving " + resourceUrl + ", saving to " + target);

        try (SeekableInput in = open(resourceUrl);
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW)) {
            byte[] block = new byte[COPY_BLOCK_SIZE];
            int n;
            while ((n = in.read(block)) != -1) {
                out.write(block, 0, n);
            }
        }
    }

    /**
     * Copies a resource into {@code directory}, named after the last segment of its URL.
     *
     * @return The file written.
     */
    public Path retrieveInto(String url, Path directory) throws IOException {
        Path target = directory.resolve(ResourceUrls.fileName(ResourceUrls.normalize(url)));
        retrieve(url, target);
        return target;
    }

    @Override
    public List<String> readGrammarLines(String url, String escape) throws IOException {
        String text = load(url, LoadOptions.defaults().withFormat(ResourceFormat.TEXT).withCache(false), String.class);
        List<String> lines = new ArrayList<>();
        for (String line : LineSplitter.splitLines(text, false)) {
            if (line.isEmpty() || line.startsWith(escape)) {
                continue;
            }
            lines.add(line);
        }
        return lines;
    }

    public List<String> readGrammarLines(String url) throws IOException {
        return readGrammarLines(url, DEFAULT_GRAMMAR_ESCAPE);
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    public DataPathConfiguration getConfiguration() {
        return configuration;
    }
}
