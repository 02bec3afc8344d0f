package com.formwright.core.binding;

import java.util.Optional;

/**
 * Result of proving the properties panel is bound to a field.
 *
 * @param writer   gated writer for the field, present only when bound
 * @param attempts click attempts spent
 */
public record BindResult(PropertyWriter writer, int attempts) {

    public boolean isBound() {
        return writer != null;
    }

    public Optional<PropertyWriter> boundWriter() {
        return Optional.ofNullable(writer);
    }
}
