package com.formwright.core.engine;

/**
 * Per-run overrides of configured behaviour.
 *
 * @param retryEnabled whether retry passes run after the main pass
 */
public record RunOptions(boolean retryEnabled) {
}
