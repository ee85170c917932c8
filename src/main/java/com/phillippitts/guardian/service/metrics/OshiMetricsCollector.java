package com.phillippitts.guardian.service.metrics;

import com.phillippitts.guardian.domain.SystemMetrics;
import com.phillippitts.guardian.service.process.BackendProcessController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OSFileStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link MetricsCollector} backed by the OSHI library.
 *
 * <p>CPU utilisation is averaged over a short blocking sample (default 100 ms). Temperature is
 * reported only when the platform exposes a positive CPU sensor reading. Backend PIDs are
 * discovered through the same canonical serve-invocation match used by the kill sequence.
 */
public class OshiMetricsCollector implements MetricsCollector {

    private static final Logger LOG = LogManager.getLogger(OshiMetricsCollector.class);

    private static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;
    private static final String ROOT_MOUNT = "/";

    private final HardwareAbstractionLayer hardware;
    private final SystemInfo systemInfo;
    private final BackendProcessController processController;
    private final Clock clock;
    private final Duration cpuSample;

    public OshiMetricsCollector(SystemInfo systemInfo,
                                BackendProcessController processController,
                                Clock clock,
                                Duration cpuSample) {
        this.systemInfo = Objects.requireNonNull(systemInfo, "systemInfo");
        this.hardware = systemInfo.getHardware();
        this.processController = Objects.requireNonNull(processController, "processController");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cpuSample = cpuSample == null ? Duration.ofMillis(100) : cpuSample;
    }

    @Override
    public SystemMetrics collect() {
        double[] ram = readMemory();
        return SystemMetrics.of(
                clock.instant(),
                ram[0],
                ram[1],
                readCpu(),
                readDisk(),
                readTemperature(),
                readBackendPids());
    }

    /** Returns {usedPct, usedGiB}. */
    private double[] readMemory() {
        try {
            GlobalMemory memory = hardware.getMemory();
            long total = memory.getTotal();
            if (total <= 0) {
                return new double[] {0.0, 0.0};
            }
            long used = total - memory.getAvailable();
            return new double[] {used * 100.0 / total, used / BYTES_PER_GIB};
        } catch (RuntimeException e) {
            LOG.debug("Memory reading unavailable: {}", e.toString());
            return new double[] {0.0, 0.0};
        }
    }

    private double readCpu() {
        try {
            double load = hardware.getProcessor().getSystemCpuLoad(cpuSample.toMillis());
            return load < 0 ? 0.0 : load * 100.0;
        } catch (RuntimeException e) {
            LOG.debug("CPU reading unavailable: {}", e.toString());
            return 0.0;
        }
    }

    private double readDisk() {
        try {
            List<OSFileStore> stores = systemInfo.getOperatingSystem().getFileSystem().getFileStores();
            for (OSFileStore store : stores) {
                if (ROOT_MOUNT.equals(store.getMount()) && store.getTotalSpace() > 0) {
                    long used = store.getTotalSpace() - store.getUsableSpace();
                    return used * 100.0 / store.getTotalSpace();
                }
            }
            return 0.0;
        } catch (RuntimeException e) {
            LOG.debug("Disk reading unavailable: {}", e.toString());
            return 0.0;
        }
    }

    private Double readTemperature() {
        try {
            double celsius = hardware.getSensors().getCpuTemperature();
            return Double.isNaN(celsius) || celsius <= 0.0 ? null : celsius;
        } catch (RuntimeException e) {
            LOG.debug("Temperature reading unavailable: {}", e.toString());
            return null;
        }
    }

    private List<Long> readBackendPids() {
        try {
            return processController.findBackendPids();
        } catch (RuntimeException e) {
            LOG.debug("Backend process discovery failed: {}", e.toString());
            return List.of();
        }
    }
}
