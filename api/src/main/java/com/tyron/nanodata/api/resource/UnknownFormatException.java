package com.tyron.nanodata.api.resource;

/**
 * Thrown when a resource format cannot be inferred, is not recognized, or has no parser.
 */
public class UnknownFormatException extends IllegalArgumentException {

    public UnknownFormatException(String message) {
        super(message);
    }
}
