package com.formwright.core.spec;

/**
 * A specification file could not be read or does not describe valid activities.
 */
public class SpecParseException extends RuntimeException {

    public SpecParseException(String message) {
        super(message);
    }

    public SpecParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
