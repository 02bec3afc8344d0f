package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.config.FormwrightProperties.LocatePolicy;
import com.formwright.surface.TemplateDirectory;
import com.formwright.surface.TemplateMatch;
import com.formwright.surface.TemplateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Looks an activity code up in the template listings, in the order the locate policy
 * gives, and stops at the first listing that has it.
 */
@Component
public class ActivityLocator {

    private static final Logger log = LoggerFactory.getLogger(ActivityLocator.class);

    private final TemplateDirectory directory;
    private final FormwrightProperties properties;

    public ActivityLocator(TemplateDirectory directory, FormwrightProperties properties) {
        this.directory = directory;
        this.properties = properties;
    }

    public Optional<TemplateMatch> locate(BuildContext ctx, String code) {
        LocatePolicy policy = properties.getBuild().getLocatePolicy();
        for (TemplateStatus status : order(policy)) {
            ctx.increment(BuildCounters.TEMPLATE_LOOKUPS);
            Optional<TemplateMatch> match = directory.find(code, status);
            if (match.isPresent()) {
                log.info("Found existing template {} in {} listing (locked={})",
                        match.get().templateId(), status, match.get().locked());
                return match;
            }
        }
        log.info("No existing template for {} ({})", code, policy);
        return Optional.empty();
    }

    static List<TemplateStatus> order(LocatePolicy policy) {
        return switch (policy) {
            case ACTIVE_THEN_INACTIVE -> List.of(TemplateStatus.ACTIVE, TemplateStatus.INACTIVE);
            case INACTIVE_THEN_ACTIVE -> List.of(TemplateStatus.INACTIVE, TemplateStatus.ACTIVE);
            case ACTIVE_ONLY -> List.of(TemplateStatus.ACTIVE);
        };
    }
}
