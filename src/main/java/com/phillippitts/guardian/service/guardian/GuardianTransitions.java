package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.domain.GuardianState;

import java.util.Objects;

/**
 * Pure transition function of the guardian state machine.
 *
 * <pre>
 * NORMAL    --soft sustained--&gt; BROWNOUT   [ACTIVATE_BROWNOUT]
 * BROWNOUT  --soft sustained--&gt; DEGRADED   [ESCALATE_BROWNOUT]
 * BROWNOUT, DEGRADED --recovered--&gt; NORMAL [DEACTIVATE_BROWNOUT]
 * EMERGENCY --recovered, kills disabled--&gt; NORMAL [DEACTIVATE_BROWNOUT]
 * any but LOCKDOWN --hard--&gt; EMERGENCY [RUN_EMERGENCY]
 * </pre>
 *
 * <p>With kills enabled EMERGENCY resolves within the same tick through the kill outcome and is
 * never left through recovery here; only a new hard trigger re-runs the emergency action. LOCKDOWN
 * expiry is time-based and handled by the loop, so LOCKDOWN never changes here.
 */
public final class GuardianTransitions {

    private GuardianTransitions() {
    }

    public static Transition decide(GuardianState state, Observation obs, boolean killEnabled) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(obs, "obs");

        if (state == GuardianState.LOCKDOWN) {
            return Transition.stay(state);
        }
        if (obs.hardTrigger()) {
            return Transition.to(GuardianState.EMERGENCY, SideEffect.RUN_EMERGENCY,
                    "hard threshold: " + obs.hardReason());
        }
        if (obs.softSustained()) {
            if (state == GuardianState.NORMAL) {
                return Transition.to(GuardianState.BROWNOUT, SideEffect.ACTIVATE_BROWNOUT,
                        "soft threshold sustained");
            }
            if (state == GuardianState.BROWNOUT) {
                return Transition.to(GuardianState.DEGRADED, SideEffect.ESCALATE_BROWNOUT,
                        "soft threshold sustained under brownout");
            }
        }
        if (state.isRecoverable(killEnabled) && obs.recovered()) {
            return Transition.to(GuardianState.NORMAL, SideEffect.DEACTIVATE_BROWNOUT,
                    "recovery window satisfied");
        }
        return Transition.stay(state);
    }
}
