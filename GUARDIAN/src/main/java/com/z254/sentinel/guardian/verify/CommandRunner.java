package com.z254.sentinel.guardian.verify;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Runs external commands (build, test, git) against the monitored workspace.
 */
public interface CommandRunner {

    /**
     * Run a command to completion.
     *
     * @throws CommandExecutionException if the command cannot be started or exceeds the timeout
     */
    CommandResult run(List<String> command, Path workingDirectory, Duration timeout);

    record CommandResult(int exitCode, String output) {

        public boolean succeeded() {
            return exitCode == 0;
        }

        /** Last lines of output, for evidence */
        public String tail(int lines) {
            String[] all = output.strip().split("\\R");
            int from = Math.max(0, all.length - lines);
            return String.join("\n", Arrays.copyOfRange(all, from, all.length));
        }
    }

    class CommandExecutionException extends RuntimeException {
        public CommandExecutionException(String message) {
            super(message);
        }

        public CommandExecutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
