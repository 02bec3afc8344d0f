package com.formwright.core.verify;

/**
 * One act / re-prove cycle inside a verification. Lives only as long as the outcome
 * that carries it.
 *
 * @param verification name of the verification, e.g. {@code add-field}
 * @param targetId     confirmed id, or {@code "pending"} when nothing was confirmed
 * @param result       how the cycle ended
 * @param number       1-based attempt number
 * @param polls        expectation checks spent in this cycle
 */
public record Attempt(String verification, String targetId, Result result, int number, int polls) {

    public static final String PENDING = "pending";

    public enum Result {
        CONFIRMED,
        PHANTOM,
        FAILED
    }
}
