package com.phillippitts.guardian.service.health;

import com.phillippitts.guardian.domain.GuardianStatus;
import com.phillippitts.guardian.service.guardian.GuardianControlLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the guardian.
 *
 * <p>Maps the guardian state onto actuator status:
 * <ul>
 *   <li>UP: NORMAL</li>
 *   <li>DEGRADED: BROWNOUT or DEGRADED (serving continues with reduced features)</li>
 *   <li>DOWN: EMERGENCY or LOCKDOWN</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as the {@code guardian} component.
 */
@Component("guardian")
public class GuardianHealthIndicator implements HealthIndicator {

    private final GuardianControlLoop loop;

    public GuardianHealthIndicator(GuardianControlLoop loop) {
        this.loop = loop;
    }

    @Override
    public Health health() {
        GuardianStatus status = loop.currentStatus();

        Health.Builder builder = new Health.Builder();
        switch (status.state()) {
            case NORMAL -> builder.up();
            case BROWNOUT, DEGRADED -> builder.status("DEGRADED");
            case EMERGENCY, LOCKDOWN -> builder.down();
        }

        builder.withDetail("state", status.state().name())
                .withDetail("stateDurationSeconds", status.stateDurationSeconds())
                .withDetail("brownoutLevel", status.brownout().level().name())
                .withDetail("killsInWindow", status.killsInWindow());
        if (status.requiresManualIntervention()) {
            builder.withDetail("lockdownUntil", String.valueOf(status.lockdownUntil()))
                    .withDetail("action", "manual intervention required");
        }
        return builder.build();
    }
}
