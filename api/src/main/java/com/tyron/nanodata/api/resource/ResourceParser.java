package com.tyron.nanodata.api.resource;

import java.io.IOException;

/**
 * Turns decoded resource text into a value, e.g. a grammar or a list of logic expressions.
 * <p>
 * Parsers are supplied by the caller and registered per {@link ResourceFormat}; the loader treats
 * them as opaque functions.
 */
@FunctionalInterface
public interface ResourceParser {

    Object parse(String text, ParseContext context) throws IOException;
}
