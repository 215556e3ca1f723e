package com.z254.sentinel.guardian.verify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
@Slf4j
@Component
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new CommandExecutionException("No command configured");
        }
        log.debug("Running {} in {}", command, workingDirectory);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new CommandExecutionException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // Drained off the caller thread so a full pipe cannot stall waitFor
        CompletableFuture<String> output = Mono.fromCallable(() -> readFully(process.getInputStream()))
                .subscribeOn(Schedulers.boundedElastic())
                .toFuture();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandExecutionException(
                        String.format("%s timed out after %ds", String.join(" ", command), timeout.toSeconds()));
            }
            return new CommandResult(process.exitValue(), output.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CommandExecutionException("Interrupted while running " + command.get(0), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new CommandExecutionException("Failed to read output of " + command.get(0), e);
        }
    }

    private String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CommandExecutionException("Failed to read process output", e);
        }
    }
}
