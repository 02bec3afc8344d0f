package com.formwright.core.binding;

/**
 * Result of one gated property write.
 */
public enum WriteResult {
    /** Written and read back. */
    CONFIRMED,
    /** Not issued: the panel was not bound to the expected field. */
    REFUSED,
    /** Issued but never read back. */
    UNCONFIRMED
}
