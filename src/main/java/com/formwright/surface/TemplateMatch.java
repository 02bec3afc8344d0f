package com.formwright.surface;

/**
 * An existing activity template found in the template directory.
 *
 * @param code       activity code
 * @param title      template title
 * @param templateId surface identifier of the template
 * @param status     listing the template was found in
 * @param locked     whether the template is assigned and can only change through a new revision
 */
public record TemplateMatch(
    String code,
    String title,
    String templateId,
    TemplateStatus status,
    boolean locked
) {}
