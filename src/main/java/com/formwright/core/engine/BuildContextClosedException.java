package com.formwright.core.engine;

/**
 * Thrown when a {@link BuildContext} is used after its activity finished.
 */
public class BuildContextClosedException extends RuntimeException {

    public BuildContextClosedException(String activityCode) {
        super("Build context for activity " + activityCode + " is closed");
    }
}
