package com.formwright.core.model;

import java.io.Serializable;

/**
 * A field that was skipped, with enough context to retry it later.
 *
 * @param activityCode activity the field belongs to
 * @param kind         stage that failed
 * @param reason       machine-readable reason from {@link Reasons}
 * @param retryable    whether a retry pass may attempt it again
 * @param fieldKey     spec key of the field
 * @param typeKey      opaque field type
 * @param sectionTitle section the field belongs to
 * @param fieldIndex   position of the field across the whole activity, in spec order
 * @param fieldId      surface id when the field was confirmed before failing, otherwise {@code null}
 * @param attempts     add or bind attempts spent
 */
public record FailureRecord(
    String activityCode,
    FailureKind kind,
    String reason,
    boolean retryable,
    String fieldKey,
    String typeKey,
    String sectionTitle,
    int fieldIndex,
    String fieldId,
    int attempts
) implements Serializable {}
