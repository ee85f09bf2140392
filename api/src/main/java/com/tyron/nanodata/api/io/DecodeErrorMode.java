package com.tyron.nanodata.api.io;

/**
 * What a text reader does with byte sequences that are malformed for its encoding.
 */
public enum DecodeErrorMode {
    /** Fail with a {@link java.nio.charset.CharacterCodingException}. */
    STRICT,
    /** Drop the malformed bytes. */
    IGNORE,
    /** Substitute the encoding's replacement character. */
    REPLACE
}
