package com.formwright.core.verify;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * The re-prove half of a verification. Evaluated against fresh surface state on every
 * poll; an empty result means "not proven yet".
 *
 * @param <T> what the expectation yields once it holds (a new id, a read-back value)
 */
@FunctionalInterface
public interface Expectation<T> {

    Optional<T> check();

    static Expectation<Boolean> of(BooleanSupplier condition) {
        return () -> condition.getAsBoolean() ? Optional.of(Boolean.TRUE) : Optional.empty();
    }
}
