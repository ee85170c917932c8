package com.phillippitts.guardian.service.process;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of backend relaunches.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests may provide a stub
 * implementation that returns a fake {@link Process} with controlled liveness.
 */
public interface ProcessFactory {
    /**
     * Starts a new detached process with the given command. Its output is not captured.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;
}
