package com.formwright.surface;

import java.util.List;
import java.util.Optional;

/**
 * Searches the application's activity template listings.
 */
@FunctionalInterface
public interface TemplateDirectory {

    /**
     * Every template in the given listing carrying {@code activityCode}, in listing order.
     */
    List<TemplateMatch> findAll(String activityCode, TemplateStatus status);

    default Optional<TemplateMatch> find(String activityCode, TemplateStatus status) {
        return findAll(activityCode, status).stream().findFirst();
    }
}
