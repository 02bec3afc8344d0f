package com.formwright.core.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks consecutive field failures within one pass. A success resets the streak.
 */
public class FailureStreak {

    private final int threshold;
    private final List<String> reasons = new ArrayList<>();

    /**
     * @param threshold consecutive failures that trip the streak; zero or less never trips
     */
    public FailureStreak(int threshold) {
        this.threshold = threshold;
    }

    public void recordFailure(String reason) {
        reasons.add(reason);
    }

    public void recordSuccess() {
        reasons.clear();
    }

    public int length() {
        return reasons.size();
    }

    public boolean isTripped() {
        return threshold > 0 && reasons.size() >= threshold;
    }

    /** Reasons of the current streak, oldest first. */
    public List<String> reasons() {
        return List.copyOf(reasons);
    }
}
