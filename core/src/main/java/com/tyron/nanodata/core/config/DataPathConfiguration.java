package com.tyron.nanodata.core.config;

import com.tyron.nanodata.core.text.SeekableUnicodeStreamReader;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputFilter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The data root search list and loader switches.
 * <p>
 * Roots are searched in order; each is a directory, a zip file, or the empty string (meaning
 * "resolve absolute names directly"). {@link #fromEnvironment()} assembles them from:
 * <ol>
 *     <li>the {@value #PATH_PROPERTY} system property,</li>
 *     <li>the {@value #PATH_ENV} environment variable,</li>
 *     <li>{@code paths:} in {@code ~/.nanodata/nanodata.yaml},</li>
 *     <li>{@code ~/nanodata} and the usual system locations.</li>
 * </ol>
 * The YAML file may also set {@code cache: false}, {@code debug: true} and {@code serialFilter:}, an
 * {@link ObjectInputFilter} pattern for {@code ser} resources.
 */
public final class DataPathConfiguration {

    private static final Logger LOG = Logger.getLogger(DataPathConfiguration.class.getName());

    public static final String PATH_PROPERTY = "nanodata.path";
    public static final String PATH_ENV = "NANODATA_PATH";
    public static final String CONFIG_FILE_NAME = "nanodata.yaml";
    public static final String DEBUG_PROPERTY = SeekableUnicodeStreamReader.DEBUG_PROPERTY;

    /**
     * JDK classes only. Applications whose {@code ser} resources hold their own types add their
     * packages in front, e.g. {@code com.example.model.*;maxdepth=64;java.base/*;!*}.
     */
    public static final String DEFAULT_SERIAL_FILTER = "maxdepth=64;java.base/*;!*";

    private static final List<String> SYSTEM_ROOTS = List.of(
            "/usr/share/nanodata",
            "/usr/local/share/nanodata",
            "/usr/lib/nanodata",
            "/usr/local/lib/nanodata"
    );

    private final CopyOnWriteArrayList<String> roots;
    private volatile boolean cacheEnabled = true;
    private volatile boolean readerDebug;
    private volatile String serialFilter = DEFAULT_SERIAL_FILTER;

    private DataPathConfiguration(Collection<String> roots) {
        this.roots = new CopyOnWriteArrayList<>(roots);
        this.readerDebug = Boolean.getBoolean(DEBUG_PROPERTY);
    }

    /**
     * @return A configuration that searches exactly {@code roots}, with no defaults.
     */
    public static DataPathConfiguration of(String... roots) {
        return new DataPathConfiguration(List.of(roots));
    }

    public static DataPathConfiguration of(List<String> roots) {
        return new DataPathConfiguration(roots);
    }

    public static DataPathConfiguration fromEnvironment() {
        Path home = Paths.get(System.getProperty("user.home"));
        return fromSources(
                System.getProperty(PATH_PROPERTY),
                System.getenv(PATH_ENV),
                home.resolve(".nanodata").resolve(CONFIG_FILE_NAME),
                home
        );
    }

    /**
     * Builds a configuration from explicit sources; any of them may be null.
     */
    public static DataPathConfiguration fromSources(@Nullable String propertyValue,
                                                    @Nullable String envValue,
                                                    @Nullable Path configFile,
                                                    @Nullable Path home) {
        List<String> roots = new ArrayList<>();
        addPathList(roots, propertyValue);
        addPathList(roots, envValue);

        DataPathConfiguration configuration = new DataPathConfiguration(List.of());
        if (configFile != null && Files.isRegularFile(configFile)) {
            configuration.loadYaml(configFile, roots);
        }

        if (home != null) {
            addRoot(roots, home.resolve("nanodata").toString());
        }
        if (File.separatorChar == '/') {
            for (String root : SYSTEM_ROOTS) {
                addRoot(roots, root);
            }
        }

        configuration.roots.addAll(roots);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Data roots: " + roots);
        }
        return configuration;
    }

    private void loadYaml(Path configFile, List<String> roots) {
        try (InputStream in = Files.newInputStream(configFile)) {
            Object doc = new Yaml().load(in);
            if (!(doc instanceof Map<?, ?> map)) return;

            // paths: [dir, archive.zip, ...]
            Object paths = map.get("paths");
            if (paths instanceof List<?> list) {
                for (Object item : list) {
                    if (item != null) {
                        addRoot(roots, String.valueOf(item));
                    }
                }
            } else if (paths instanceof String s) {
                addPathList(roots, s);
            }

            Object cache = map.get("cache");
            if (cache != null) {
                cacheEnabled = Boolean.parseBoolean(String.valueOf(cache));
            }

            Object debug = map.get("debug");
            if (debug != null) {
                readerDebug = Boolean.parseBoolean(String.valueOf(debug));
            }

            Object filter = map.get("serialFilter");
            if (filter != null) {
                setSerialFilter(String.valueOf(filter));
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable configuration " + configFile, e);
        }
    }

    private static void addPathList(List<String> roots, @Nullable String value) {
        if (value == null || value.isBlank()) return;
        for (String item : value.split(File.pathSeparator)) {
            addRoot(roots, item.trim());
        }
    }

    private static void addRoot(List<String> roots, String root) {
        if (!root.isEmpty() && !roots.contains(root)) {
            roots.add(root);
        }
    }

    /**
     * @return The live, mutable search list. Changes affect subsequent lookups.
     */
    public List<String> getRoots() {
        return roots;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * @return Whether text readers verify {@code tell()} results by re-decoding.
     */
    public boolean isReaderDebug() {
        return readerDebug;
    }

    public void setReaderDebug(boolean readerDebug) {
        this.readerDebug = readerDebug;
    }

    public String getSerialFilter() {
        return serialFilter;
    }

    /**
     * @throws IllegalArgumentException if {@code pattern} is not a valid filter pattern
     */
    public void setSerialFilter(String pattern) {
        ObjectInputFilter.Config.createFilter(Objects.requireNonNull(pattern, "pattern"));
        this.serialFilter = pattern;
    }

    public ObjectInputFilter createSerialFilter() {
        return ObjectInputFilter.Config.createFilter(serialFilter);
    }
}
