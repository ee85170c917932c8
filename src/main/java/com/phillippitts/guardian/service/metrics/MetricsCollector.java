package com.phillippitts.guardian.service.metrics;

import com.phillippitts.guardian.domain.SystemMetrics;

/**
 * Takes one-shot resource snapshots for the control loop.
 */
public interface MetricsCollector {

    /**
     * Collects a snapshot. Must never throw; unavailable readings degrade to neutral values
     * (zero, null temperature, empty PID list).
     *
     * @return a new snapshot with derived flags cleared
     */
    SystemMetrics collect();
}
