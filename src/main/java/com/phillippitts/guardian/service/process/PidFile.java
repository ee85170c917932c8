package com.phillippitts.guardian.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Best-effort PID hint for the relaunched backend.
 *
 * <p>The file is informational only: callers must never signal the stored PID without first
 * confirming through live enumeration that it still belongs to the backend.
 */
public final class PidFile {

    private static final Logger LOG = LogManager.getLogger(PidFile.class);

    private final Path path;

    public PidFile(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    /**
     * Writes the PID, replacing any previous content.
     *
     * @return true if written; failures are logged at DEBUG
     */
    public boolean write(long pid) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, Long.toString(pid), StandardCharsets.UTF_8);
            return true;
        } catch (IOException | SecurityException e) {
            LOG.debug("Could not write PID file {}: {}", path, e.toString());
            return false;
        }
    }
}
