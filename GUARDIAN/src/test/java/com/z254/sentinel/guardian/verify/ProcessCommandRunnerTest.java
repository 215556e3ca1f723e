package com.z254.sentinel.guardian.verify;

import com.z254.sentinel.guardian.verify.CommandRunner.CommandExecutionException;
import com.z254.sentinel.guardian.verify.CommandRunner.CommandResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    @TempDir
    Path workspace;

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesOutputAndExitCode() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo built; echo failed 1>&2; exit 3"),
                workspace, Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.succeeded()).isFalse();
        assertThat(result.output()).contains("built").contains("failed");
    }

    @Test
    void drainsLargeOutputWhileWaiting() {
        CommandResult result = runner.run(List.of("sh", "-c", "yes line | head -n 50000"),
                workspace, Duration.ofSeconds(10));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output().split("\n")).hasSize(50000);
    }

    @Test
    void slowCommandTimesOut() {
        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "sleep 5"), workspace, Duration.ofMillis(200)))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void emptyCommandIsRejected() {
        assertThatThrownBy(() -> runner.run(List.of(), workspace, Duration.ofSeconds(1)))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessage("No command configured");
    }
}
