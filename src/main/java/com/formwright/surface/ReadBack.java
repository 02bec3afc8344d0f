package com.formwright.surface;

import java.util.Optional;

/**
 * Reads a single property of a target, for the read-back half of prove / re-prove.
 */
@FunctionalInterface
public interface ReadBack {

    Optional<String> readValue(TargetRef target, String property);
}
