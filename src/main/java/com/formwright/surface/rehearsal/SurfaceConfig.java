package com.formwright.surface.rehearsal;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.verify.PollingClock;
import com.formwright.surface.TemplateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the builder surface. Only the rehearsal surface ships in this module; a live
 * browser adapter registers its own {@code BuilderSurface} bean under another provider name.
 */
@Configuration
public class SurfaceConfig {

    private static final Logger log = LoggerFactory.getLogger(SurfaceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "formwright.surface.provider", havingValue = "rehearsal", matchIfMissing = true)
    public RehearsalSurface rehearsalSurface(FormwrightProperties properties, PollingClock clock) {
        var rehearsal = properties.getSurface().getRehearsal();
        var surface = new RehearsalSurface(rehearsal, clock);
        for (String entry : rehearsal.getExistingTemplates()) {
            seed(surface, entry);
        }
        log.info("Rehearsal surface ready (seed {}, {} existing template(s))",
                rehearsal.getSeed(), rehearsal.getExistingTemplates().size());
        return surface;
    }

    /**
     * Seeds one {@code CODE[:inactive][:locked]} entry.
     */
    static void seed(RehearsalSurface surface, String entry) {
        var parts = entry.trim().split(":");
        if (parts[0].isBlank()) {
            throw new IllegalArgumentException("Existing template entry has no code: '" + entry + "'");
        }
        var status = TemplateStatus.ACTIVE;
        boolean locked = false;
        for (int i = 1; i < parts.length; i++) {
            switch (parts[i].trim().toLowerCase(Locale.ROOT)) {
                case "inactive" -> status = TemplateStatus.INACTIVE;
                case "active" -> status = TemplateStatus.ACTIVE;
                case "locked" -> locked = true;
                default -> throw new IllegalArgumentException(
                        "Unknown flag '" + parts[i] + "' in existing template entry '" + entry + "'");
            }
        }
        surface.seedTemplate(parts[0].trim(), parts[0].trim(), status, locked);
    }
}
