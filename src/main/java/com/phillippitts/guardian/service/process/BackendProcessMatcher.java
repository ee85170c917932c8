package com.phillippitts.guardian.service.process;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches the backend's canonical serve invocation, e.g. {@code ollama serve}.
 *
 * <p>A process matches only if the basename of its executable equals the configured executable
 * and its first argument equals the serve sub-command. A process that merely mentions the
 * backend somewhere in its arguments (an editor, a {@code tail} on its log, a shell script)
 * does not match.
 */
public final class BackendProcessMatcher {

    private final String executable;
    private final String subcommand;

    public BackendProcessMatcher(String executable, String subcommand) {
        this.executable = Objects.requireNonNull(executable, "executable").toLowerCase(Locale.ROOT);
        this.subcommand = Objects.requireNonNull(subcommand, "subcommand");
    }

    /**
     * Matches using the structured command and argument list reported by the OS.
     *
     * @param command executable path, may be null
     * @param arguments arguments excluding the executable, may be null
     */
    public boolean matches(String command, List<String> arguments) {
        if (command == null || arguments == null || arguments.isEmpty()) {
            return false;
        }
        return executable.equals(basename(command)) && subcommand.equals(arguments.get(0));
    }

    /**
     * Matches using a flat command line when the OS does not report structured arguments.
     */
    public boolean matchesCommandLine(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return false;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(commandLine.trim().split("\\s+")));
        String command = tokens.remove(0);
        return matches(command, tokens);
    }

    /**
     * Matches a live process handle. Processes whose info is unreadable never match.
     */
    public boolean matches(ProcessHandle.Info info) {
        if (info == null) {
            return false;
        }
        Optional<String> command = info.command();
        Optional<String[]> arguments = info.arguments();
        if (command.isPresent() && arguments.isPresent()) {
            return matches(command.get(), Arrays.asList(arguments.get()));
        }
        return info.commandLine().map(this::matchesCommandLine).orElse(false);
    }

    private static String basename(String command) {
        int slash = Math.max(command.lastIndexOf('/'), command.lastIndexOf('\\'));
        return command.substring(slash + 1).toLowerCase(Locale.ROOT);
    }
}
