package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.domain.GuardianState;

import java.util.List;

/**
 * Outcome of {@link GuardianTransitions#decide}.
 *
 * @param target state after the tick (may equal the current state)
 * @param effects side effects to execute, in order
 * @param reason short description for logs and events
 */
public record Transition(GuardianState target, List<SideEffect> effects, String reason) {

    public Transition {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    static Transition stay(GuardianState state) {
        return new Transition(state, List.of(), null);
    }

    static Transition to(GuardianState target, SideEffect effect, String reason) {
        return new Transition(target, List.of(effect), reason);
    }

    public boolean changesFrom(GuardianState current) {
        return target != current;
    }
}
