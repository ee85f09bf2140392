package com.tyron.nanodata.api.resource;

import com.tyron.nanodata.api.io.SeekableInput;
import com.tyron.nanodata.api.io.SeekableTextReader;
import com.tyron.nanodata.api.pointer.PathPointer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds and loads data resources by URL.
 * <p>
 * Usage:
 * <pre>
 *     String text = loader.load("corpora/abc/rural.txt", LoadOptions.defaults(), String.class);
 * </pre>
 * URLs take the form {@code <protocol>:<path>}; a URL without a recognized protocol is treated
 * as {@code nltk:<path>}, i.e. searched for in the data roots.
 */
public interface ResourceLoader {

    default Object load(String url) throws IOException {
        return load(url, LoadOptions.defaults());
    }

    /**
     * Loads a resource, decoding it according to its format.
     *
     * @throws UnknownFormatException    if the format cannot be determined or has no parser
     * @throws ResourceNotFoundException if the resource cannot be found
     */
    Object load(String url, LoadOptions options) throws IOException;

    default <T> T load(String url, LoadOptions options, Class<T> type) throws IOException {
        return type.cast(load(url, options));
    }

    /**
     * Resolves a resource name against the configured data roots.
     */
    PathPointer find(String resourceName) throws IOException;

    /**
     * Opens the bytes of a resource without decoding them.
     */
    SeekableInput open(String url) throws IOException;

    /**
     * Opens a resource as seekable text.
     */
    SeekableTextReader openText(String url, String encoding) throws IOException;

    /**
     * Copies a resource to a local file.
     *
     * @throws java.nio.file.FileAlreadyExistsException if {@code target} exists
     */
    void retrieve(String url, Path target) throws IOException;

    /**
     * @return The lines of a grammar resource, without blank lines and lines starting with {@code escape}.
     */
    List<String> readGrammarLines(String url, String escape) throws IOException;

    /**
     * Removes every cached resource.
     */
    void clearCache();
}
