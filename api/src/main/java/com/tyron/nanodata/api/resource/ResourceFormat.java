package com.tyron.nanodata.api.resource;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Formats understood by {@link ResourceLoader#load}.
 */
public enum ResourceFormat {

    RAW("raw", "The raw (byte array) contents of a file.", false),
    SER("ser", "A serialized Java object, stored with java.io object serialization.", false, "ser"),
    JSON("json", "A serialized object, stored as JSON.", false, "json"),
    YAML("yaml", "A serialized object, stored as YAML.", false, "yaml", "yml"),
    TEXT("text", "The unicode text contents of a file.", true, "txt", "text"),
    CFG("cfg", "A context free grammar.", true, "cfg"),
    PCFG("pcfg", "A probabilistic context free grammar.", true, "pcfg"),
    FCFG("fcfg", "A feature context free grammar.", true, "fcfg"),
    FOL("fol", "A list of first order logic expressions.", true, "fol"),
    LOGIC("logic", "A list of first order logic expressions, parsed by a caller supplied logic parser.", true, "logic"),
    VAL("val", "A semantic valuation.", true, "val");

    private final String id;
    private final String description;
    private final boolean text;
    private final List<String> extensions;

    ResourceFormat(String id, String description, boolean text, String... extensions) {
        this.id = id;
        this.description = description;
        this.text = text;
        this.extensions = List.of(extensions);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true if resources of this format are decoded to a string before parsing.
     */
    public boolean isText() {
        return text;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public static Optional<ResourceFormat> fromId(String id) {
        String key = id.toLowerCase(Locale.ROOT);
        for (ResourceFormat format : values()) {
            if (format.id.equals(key)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * @param extension A file extension without the dot.
     */
    public static Optional<ResourceFormat> forExtension(String extension) {
        for (ResourceFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
