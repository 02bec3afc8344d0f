package com.formwright.core.engine;

/**
 * The run was started without any activity specification. The only run-fatal condition.
 */
public class MissingSpecificationException extends RuntimeException {

    public MissingSpecificationException(String message) {
        super(message);
    }
}
