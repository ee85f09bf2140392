package com.tyron.nanodata.api.resource;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;
import java.util.Map;

/**
 * What a {@link ResourceParser} gets to know about the resource it parses.
 *
 * @param encoding  the explicitly requested encoding, or null if the text was decoded by fallback
 * @param arguments format specific options, e.g. an externally supplied logic parser
 */
public record ParseContext(ResourceUrl url,
                           ResourceFormat format,
                           @Nullable Charset encoding,
                           Map<String, Object> arguments) {
}
