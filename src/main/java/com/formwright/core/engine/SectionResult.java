package com.formwright.core.engine;

import com.formwright.core.registry.Section;

/**
 * Result of {@link SectionAssembler#ensureSection}.
 *
 * @param section the confirmed section, {@code null} when it could not be established
 * @param created whether this call created it
 * @param reason  machine-readable reason when it could not be established
 */
public record SectionResult(Section section, boolean created, String reason) {

    public boolean isReady() {
        return section != null;
    }
}
