package com.formwright.core.phantom;

import com.formwright.core.model.Reasons;
import com.formwright.surface.Snapshot;

import java.util.Optional;

/**
 * Result of one hard resynchronization.
 *
 * @param succeeded whether the registry was rebuilt from a verified observation
 * @param observed  the observation the registry was rebuilt from
 * @param reason    machine-readable reason when it did not succeed
 */
public record ResyncResult(boolean succeeded, Snapshot observed, String reason) {

    static ResyncResult rebuilt(Snapshot observed) {
        return new ResyncResult(true, observed, null);
    }

    static ResyncResult budgetExhausted() {
        return new ResyncResult(false, null, Reasons.HARD_RESYNC_BUDGET_EXHAUSTED);
    }

    static ResyncResult failed() {
        return new ResyncResult(false, null, Reasons.HARD_RESYNC_FAILED);
    }

    public Optional<Snapshot> snapshot() {
        return Optional.ofNullable(observed);
    }
}
