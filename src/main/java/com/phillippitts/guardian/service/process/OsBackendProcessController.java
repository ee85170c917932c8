package com.phillippitts.guardian.service.process;

import com.phillippitts.guardian.exception.ProcessControlException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BackendProcessController} backed by {@link ProcessHandle} and a {@link ProcessFactory}.
 *
 * <p>Signals follow the JDK mapping: {@link ProcessHandle#destroy()} sends SIGTERM and
 * {@link ProcessHandle#destroyForcibly()} sends SIGKILL on Unix. Permission errors and
 * processes that have already exited are logged and treated as resolved.
 */
public class OsBackendProcessController implements BackendProcessController {

    private static final Logger LOG = LogManager.getLogger(OsBackendProcessController.class);

    private final BackendProcessMatcher matcher;
    private final ProcessFactory processFactory;
    private final List<String> launchCommand;

    public OsBackendProcessController(BackendProcessMatcher matcher,
                                      ProcessFactory processFactory,
                                      List<String> launchCommand) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.launchCommand = List.copyOf(Objects.requireNonNull(launchCommand, "launchCommand"));
        if (this.launchCommand.isEmpty()) {
            throw new IllegalArgumentException("launchCommand must not be empty");
        }
    }

    @Override
    public List<Long> findBackendPids() {
        long self = ProcessHandle.current().pid();
        try {
            return ProcessHandle.allProcesses()
                    .filter(ph -> ph.pid() != self)
                    .filter(this::matchesQuietly)
                    .map(ProcessHandle::pid)
                    .sorted()
                    .toList();
        } catch (RuntimeException e) {
            LOG.warn("Process enumeration failed: {}", e.toString());
            return List.of();
        }
    }

    private boolean matchesQuietly(ProcessHandle handle) {
        try {
            return matcher.matches(handle.info());
        } catch (RuntimeException e) {
            // Process vanished or its info is not readable by this user
            return false;
        }
    }

    @Override
    public boolean terminate(long pid) {
        return signal(pid, false);
    }

    @Override
    public boolean forceKill(long pid) {
        return signal(pid, true);
    }

    private boolean signal(long pid, boolean force) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            LOG.debug("PID {} already exited", pid);
            return true;
        }
        try {
            boolean requested = force ? handle.get().destroyForcibly() : handle.get().destroy();
            LOG.debug("Sent {} to PID {} (accepted={})", force ? "SIGKILL" : "SIGTERM", pid, requested);
            return requested || !handle.get().isAlive();
        } catch (SecurityException e) {
            // Treated as resolved; the caller verifies by re-enumerating
            LOG.warn("Not permitted to signal PID {}: {}", pid, e.getMessage());
            return true;
        } catch (IllegalStateException e) {
            LOG.debug("Cannot signal PID {}: {}", pid, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAlive(long pid) {
        try {
            return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        } catch (SecurityException e) {
            LOG.debug("Cannot query PID {}: {}", pid, e.getMessage());
            return false;
        }
    }

    @Override
    public long launch() {
        try {
            LOG.info("Launching backend: {}", String.join(" ", launchCommand));
            Process process = processFactory.start(launchCommand);
            return process.pid();
        } catch (IOException | SecurityException e) {
            throw new ProcessControlException("Failed to launch backend: " + String.join(" ", launchCommand), e);
        } catch (UnsupportedOperationException e) {
            throw new ProcessControlException("Launched backend has no PID", e);
        }
    }
}
