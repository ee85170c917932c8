package com.phillippitts.guardian.config;

import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.exception.InvalidThresholdConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Validates the ordering of guardian thresholds at startup to fail fast with actionable messages.
 *
 * <p>For RAM and CPU: recovery &lt; soft &lt; hard. Otherwise the guardian could enter brownout and
 * recover on the same sample, or escalate to emergency before brownout ever applies.
 */
@Component
class ThresholdConfigurationValidator {

    private final GuardianProperties props;

    ThresholdConfigurationValidator(GuardianProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        checkOrdering("ram", props.getRamRecoveryPct(), props.getRamSoftPct(), props.getRamHardPct());
        checkOrdering("cpu", props.getCpuRecoveryPct(), props.getCpuSoftPct(), props.getCpuHardPct());
        if (props.getKillCooldownShort().compareTo(props.getKillCooldownLong()) > 0) {
            throw new InvalidThresholdConfigurationException("guardian.kill-cooldown-short",
                    "must not exceed guardian.kill-cooldown-long (" + props.getKillCooldownLong() + ")");
        }
    }

    private static void checkOrdering(String resource, double recovery, double soft, double hard) {
        if (recovery >= soft) {
            throw new InvalidThresholdConfigurationException("guardian." + resource + "-recovery-pct",
                    "must be below " + resource + "-soft-pct (" + recovery + " >= " + soft + ")");
        }
        if (soft >= hard) {
            throw new InvalidThresholdConfigurationException("guardian." + resource + "-soft-pct",
                    "must be below " + resource + "-hard-pct (" + soft + " >= " + hard + ")");
        }
    }
}
