package com.phillippitts.guardian.service.process;

import java.util.List;

/**
 * OS-level control of the protected backend process.
 *
 * <p>Process identity is always established by live enumeration through the canonical
 * serve-invocation match, never by a stored PID alone.
 */
public interface BackendProcessController {

    /**
     * Enumerates live processes matching the backend's canonical serve invocation.
     * Never throws; enumeration failures yield an empty list.
     *
     * @return matching PIDs, empty if none
     */
    List<Long> findBackendPids();

    /**
     * Sends a graceful terminate signal (SIGTERM).
     *
     * @return true if the signal was delivered, the process had already exited, or signalling was refused
     */
    boolean terminate(long pid);

    /**
     * Sends a forced kill signal (SIGKILL).
     *
     * @return true if the signal was delivered, the process had already exited, or signalling was refused
     */
    boolean forceKill(long pid);

    /**
     * Returns whether the process is still alive.
     */
    boolean isAlive(long pid);

    /**
     * Launches a replacement backend with output discarded, detached from the guardian.
     *
     * @return PID of the new process
     * @throws com.phillippitts.guardian.exception.ProcessControlException if the launch fails
     */
    long launch();
}
