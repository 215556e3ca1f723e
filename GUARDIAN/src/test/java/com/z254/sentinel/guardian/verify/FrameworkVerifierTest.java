package com.z254.sentinel.guardian.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.VerificationResult;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FrameworkVerifierTest {

    @TempDir
    Path workspace;

    private GuardianProperties properties;
    private CommandRunner commandRunner;
    private FrameworkVerifier verifier;
    private WorkingContext context;

    @BeforeEach
    void setUp() {
        properties = new GuardianProperties();
        commandRunner = mock(CommandRunner.class);
        verifier = new FrameworkVerifier(properties, commandRunner, new ObjectMapper());
        context = WorkingContext.builder().workingDirectory(workspace).build();
    }

    @Test
    void failedBuildIsConfirmedWithFullConfidence() {
        when(commandRunner.run(eq(properties.getCommands().getBuild()), eq(workspace), any(Duration.class)))
                .thenReturn(new CommandRunner.CommandResult(2, "error TS2304: Cannot find name 'x'"));

        VerificationResult result = verifier.verify(issue("build", "Build failed after merge"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(100);
        assertThat(result.getRecommendedFix()).isEqualTo("Run a clean build and fix the first reported compiler error");
    }

    @Test
    void greenBuildRefutesClaim() {
        when(commandRunner.run(eq(properties.getCommands().getBuild()), eq(workspace), any(Duration.class)))
                .thenReturn(new CommandRunner.CommandResult(0, "done"));

        VerificationResult result = verifier.verify(issue("build", "Build failed after merge"), context);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getRecommendedFix()).isEqualTo("Claim not confirmed; no fix recommended");
    }

    @Test
    void everyClaimMustHold() throws IOException {
        when(commandRunner.run(eq(properties.getCommands().getBuild()), eq(workspace), any(Duration.class)))
                .thenReturn(new CommandRunner.CommandResult(1, "failed"));
        Files.writeString(workspace.resolve(".mcp.json"), "{\"servers\": {}}");

        Issue issue = issue("build-mcp", "Build error while loading MCP servers");
        assertThat(verifier.extractClaims(issue))
                .containsExactly(FrameworkVerifier.Claim.BUILD_FAILURE, FrameworkVerifier.Claim.MCP_ERROR);

        VerificationResult result = verifier.verify(issue, context);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getEvidence()).anyMatch(line -> line.startsWith("[mcp/refuted]"));
    }

    @Test
    void typeErrorInUnknownFileIsRefuted() {
        VerificationResult result = verifier.verify(
                issue("typescript", "Type error in src/missing.ts:12"), context);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getEvidence()).containsExactly(
                "[compile/refuted] Referenced file does not exist: src/missing.ts");
    }

    @Test
    void typeCheckNotMentioningFileLowersConfidence() throws IOException {
        Files.createDirectories(workspace.resolve("src"));
        Files.writeString(workspace.resolve("src/app.ts"), "const x: number = 'a';");
        when(commandRunner.run(eq(properties.getCommands().getTypecheck()), eq(workspace), any(Duration.class)))
                .thenReturn(new CommandRunner.CommandResult(2, "src/other.ts(1,7): error TS2322"));

        VerificationResult result = verifier.verify(issue("typescript", "Type error in src/app.ts"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(50);
    }

    @Test
    void agentDefinitionMissingSections() throws IOException {
        Path agents = workspace.resolve(".claude/agents");
        Files.createDirectories(agents);
        Files.writeString(agents.resolve("maria-qa.md"), "# Role\nQA lead\n\n## Tools\n- jest\n");

        VerificationResult result = verifier.verify(
                issue("agents", "Agent maria-qa has an invalid definition"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(90);
        assertThat(result.getEvidence()).anyMatch(line -> line.contains("lacks sections [Activation]"));
    }

    @Test
    void registeredHookRefutesClaim() throws IOException {
        Files.createDirectories(workspace.resolve(".claude"));
        Files.writeString(workspace.resolve(".claude/settings.json"),
                "{\"hooks\": [{\"name\": \"pre-commit-lint\"}, \"post-edit\"]}");

        assertThat(verifier.verify(issue("hooks", "Hook pre-commit-lint not registered"), context).isVerified())
                .isFalse();
        assertThat(verifier.verify(issue("hooks", "Hook session-start not registered"), context).isVerified())
                .isTrue();
    }

    @Test
    void unparseableMcpConfigIsConfirmed() throws IOException {
        Files.writeString(workspace.resolve(".mcp.json"), "{\"servers\": ");

        VerificationResult result = verifier.verify(issue("mcp", "MCP server unreachable"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(85);
    }

    @Test
    void ragHealthChecksSourceAndCompiledFiles() throws IOException {
        Files.createDirectories(workspace.resolve("src/rag"));
        Files.writeString(workspace.resolve("src/rag/vector-memory-store.ts"), "export {};");

        VerificationResult result = verifier.verify(issue("rag", "RAG memory degraded"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getEvidence()).containsExactly(
                "[rag/confirmed] RAG files missing: [dist/rag/vector-memory-store.js]");
    }

    private static Issue issue(String component, String description) {
        return Issue.builder().component(component).description(description).build();
    }
}
