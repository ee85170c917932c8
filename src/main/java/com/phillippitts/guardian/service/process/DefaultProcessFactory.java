package com.phillippitts.guardian.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 *
 * <p>stdin, stdout and stderr are detached from the guardian so that a long-running backend
 * never blocks on a full pipe. On Unix the command runs through {@code setsid}, which gives the
 * backend its own session and process group: a terminal interrupt or a group signal aimed at the
 * guardian does not reach it. {@code setsid} execs the command in place, so the returned process
 * is the backend itself and its command line still matches {@link BackendProcessMatcher}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    private static final Logger LOG = LogManager.getLogger(DefaultProcessFactory.class);

    private static final List<Path> SETSID_LOCATIONS = List.of(
            Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"), Path.of("/usr/local/bin/setsid"));

    private final boolean windows;
    private final Optional<Path> setsid;

    public DefaultProcessFactory() {
        this(isWindows(System.getProperty("os.name", "")), findSetsid());
    }

    DefaultProcessFactory(boolean windows, Optional<Path> setsid) {
        this.windows = windows;
        this.setsid = windows ? Optional.empty() : setsid;
        if (!windows && this.setsid.isEmpty()) {
            LOG.warn("setsid not found; relaunched backends share the guardian's session");
        }
    }

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(detachedCommand(command));
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        return pb.start();
    }

    // Package-private for tests
    List<String> detachedCommand(List<String> command) {
        if (setsid.isEmpty()) {
            return command;
        }
        List<String> full = new ArrayList<>(command.size() + 1);
        full.add(setsid.get().toString());
        full.addAll(command);
        return full;
    }

    private File nullDevice() {
        return new File(windows ? "NUL" : "/dev/null");
    }

    static boolean isWindows(String osName) {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    private static Optional<Path> findSetsid() {
        return SETSID_LOCATIONS.stream().filter(Files::isExecutable).findFirst();
    }
}
