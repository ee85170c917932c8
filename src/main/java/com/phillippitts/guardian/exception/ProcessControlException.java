package com.phillippitts.guardian.exception;

/**
 * Thrown when the backend process cannot be launched or signalled.
 */
public class ProcessControlException extends GuardianException {

    private final Long pid;

    public ProcessControlException(String message) {
        super(message);
        this.pid = null;
    }

    public ProcessControlException(String message, Throwable cause) {
        super(message, cause);
        this.pid = null;
    }

    public ProcessControlException(String message, long pid, Throwable cause) {
        super(message + " (pid: " + pid + ")", cause);
        this.pid = pid;
    }

    /** PID involved, or null when the failure happened before a process existed. */
    public Long getPid() {
        return pid;
    }
}
