package com.formwright.core.capability;

import java.util.List;

/**
 * Result of configuring one field.
 *
 * @param configured  whether every supported property was written and read back
 * @param reason      machine-readable reason when not configured
 * @param written     properties written and read back
 * @param unsupported requested properties the field type does not offer
 */
public record ConfigureResult(boolean configured, String reason, List<String> written, List<String> unsupported) {

    public ConfigureResult {
        written = List.copyOf(written);
        unsupported = List.copyOf(unsupported);
    }

    public static ConfigureResult ok(List<String> written, List<String> unsupported) {
        return new ConfigureResult(true, null, written, unsupported);
    }

    public static ConfigureResult failed(String reason, List<String> written, List<String> unsupported) {
        return new ConfigureResult(false, reason, written, unsupported);
    }
}
