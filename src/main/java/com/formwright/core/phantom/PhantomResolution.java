package com.formwright.core.phantom;

import com.formwright.core.registry.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * How a phantom add ended.
 *
 * @param state     {@link PhantomState#RECOVERED} or {@link PhantomState#UNRECOVERABLE}
 * @param field     the registered field when recovered
 * @param reason    machine-readable reason when unrecoverable
 * @param retryable whether adding from scratch may be tried again
 * @param trail     states passed through, in order
 */
public record PhantomResolution(
    PhantomState state,
    Field field,
    String reason,
    boolean retryable,
    List<PhantomState> trail
) {

    public PhantomResolution {
        trail = List.copyOf(trail);
    }

    static PhantomResolution recovered(Field field, List<PhantomState> trail) {
        return new PhantomResolution(PhantomState.RECOVERED, field, null, false, withTerminal(trail, PhantomState.RECOVERED));
    }

    static PhantomResolution unrecoverable(String reason, boolean retryable, List<PhantomState> trail) {
        return new PhantomResolution(PhantomState.UNRECOVERABLE, null, reason, retryable,
                withTerminal(trail, PhantomState.UNRECOVERABLE));
    }

    public boolean isRecovered() {
        return state == PhantomState.RECOVERED;
    }

    public Optional<Field> recoveredField() {
        return Optional.ofNullable(field);
    }

    public boolean passedThrough(PhantomState s) {
        return trail.contains(s);
    }

    private static List<PhantomState> withTerminal(List<PhantomState> trail, PhantomState terminal) {
        var all = new ArrayList<>(trail);
        all.add(terminal);
        return all;
    }
}
