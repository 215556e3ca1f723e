package com.z254.sentinel.guardian.remediation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.MutableClock;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.verify.CommandRunner;
import com.z254.sentinel.guardian.verify.CommandRunner.CommandExecutionException;
import com.z254.sentinel.guardian.verify.CommandRunner.CommandResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutoRemediationEngineTest {

    @Mock
    private CommandRunner commandRunner;

    @TempDir
    Path workspace;

    private GuardianProperties properties;
    private GuardianMetrics metrics;
    private AutoRemediationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new GuardianProperties();
        properties.getRemediation().setReconnectDelay(Duration.ZERO);
        metrics = new GuardianMetrics(new SimpleMeterRegistry());
        engine = new AutoRemediationEngine(properties, commandRunner, new ObjectMapper(), metrics,
                new GuardianStructuredLogger(), new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    @Test
    void missingModuleRunsInstall() {
        when(commandRunner.run(eq(properties.getCommands().getInstall()), eq(workspace), any()))
                .thenReturn(new CommandResult(0, "added 12 packages"));

        RemediationResult result = engine.execute(request(ExecutionContext.FRAMEWORK,
                "dependencies", "Error: Cannot find module 'chalk'"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getScenarioId()).isEqualTo("framework-missing-dependencies");
        assertThat(result.getConfidence()).isEqualTo(95);
        assertThat(result.getActionTaken()).contains("npm install");
        assertThat(result.isLearned()).isTrue();
        assertThat(metrics.getRemediationsSucceeded().count()).isEqualTo(1.0);
    }

    @Test
    void failingCommandReportsNextStep() {
        when(commandRunner.run(eq(properties.getCommands().getInstall()), eq(workspace), any()))
                .thenReturn(new CommandResult(1, "line1\nERR! network timeout"));

        RemediationResult result = engine.execute(request(ExecutionContext.FRAMEWORK,
                "dependencies", "missing dependency: left-pad"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAfterState()).contains("ERR! network timeout");
        assertThat(result.getNextSteps()).singleElement().asString().contains("npm install");
        assertThat(metrics.getRemediationsFailed().count()).isEqualTo(1.0);
    }

    @Test
    void unmatchedIssueNeedsInvestigation() {
        RemediationResult result = engine.execute(request(ExecutionContext.PROJECT, "billing", "Invoice totals drift"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getScenarioId()).isNull();
        assertThat(result.getActionTaken()).isEqualTo(RemediationResult.NO_MATCH_ACTION);
        assertThat(result.getNextSteps()).contains(RemediationResult.MANUAL_INVESTIGATION);
        assertThat(metrics.getRemediationsNoScenario().count()).isEqualTo(1.0);
        verifyNoInteractions(commandRunner);
    }

    @Test
    void manualScenarioReturnsSteps() {
        RemediationResult result = engine.execute(request(ExecutionContext.FRAMEWORK,
                "typescript", "12 type errors"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getScenarioId()).isEqualTo("framework-typescript-errors");
        assertThat(result.getNextSteps()).hasSize(2);
        assertThat(result.isLearned()).isTrue();
        assertThat(metrics.getRemediationsManual().count()).isEqualTo(1.0);
    }

    @Test
    void scenariosAreScopedToContext() {
        Issue buildFailure = Issue.builder().component("build").description("Build failed on main").build();

        assertThat(engine.findScenario(buildFailure, ExecutionContext.FRAMEWORK))
                .map(RemediationScenario::getId).contains("framework-build-failure");
        assertThat(engine.findScenario(buildFailure, ExecutionContext.PROJECT)).isEmpty();
        assertThat(engine.getScenarios(ExecutionContext.PROJECT))
                .allMatch(s -> s.getExecutionContext() != ExecutionContext.FRAMEWORK);
    }

    @Test
    void throwingFixProcedureIsContained() {
        when(commandRunner.run(any(), any(), any())).thenThrow(new CommandExecutionException("npm not found"));

        RemediationResult result = engine.execute(request(ExecutionContext.FRAMEWORK, "build", "Build failed"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getActionTaken()).endsWith("fix procedure failed");
        assertThat(result.getAfterState()).isEqualTo("Error: npm not found");
        assertThat(result.getNextSteps()).containsExactly(RemediationResult.MANUAL_INVESTIGATION);
    }

    @Test
    void missingProjectConfigIsCreatedOnce() throws Exception {
        Files.writeString(workspace.resolve("package.json"), "{\"name\":\"storefront\"}");
        RemediationRequest missingConfig = request(ExecutionContext.PROJECT,
                "framework_config", "Project config file is missing");

        RemediationResult first = engine.execute(missingConfig);
        RemediationResult second = engine.execute(missingConfig);

        Path configFile = workspace.resolve(properties.getRemediation().getProjectConfigFile());
        JsonNode config = new ObjectMapper().readTree(configFile.toFile());
        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getLesson()).contains("Maria-QA, James-Frontend, Marcus-Backend");
        assertThat(config.path("projectName").asText()).isEqualTo("storefront");
        assertThat(config.path("agents")).hasSize(3);
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getActionTaken()).contains("already exists");
        assertThat(second.isLearned()).isFalse();
    }

    @Test
    void sharedScenarioAppliesInProject() {
        RemediationResult result = engine.execute(request(ExecutionContext.PROJECT,
                "rag", "Vector store connection lost"));

        assertThat(result.getScenarioId()).isEqualTo("shared-vector-store-connection-lost");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAfterState()).isEqualTo("Connection restored");
    }

    @Test
    void remediateRunsAsynchronously() {
        when(commandRunner.run(any(), any(), any())).thenReturn(new CommandResult(0, "ok"));

        StepVerifier.create(engine.remediate(request(ExecutionContext.FRAMEWORK,
                        "security", "3 high severity vulnerabilities")))
                .assertNext(result -> assertThat(result.getScenarioId())
                        .isEqualTo("framework-security-vulnerabilities"))
                .verifyComplete();
        verify(commandRunner).run(eq(properties.getCommands().getAuditFix()), eq(workspace), any());
    }

    @Test
    void displayNamesUpperCaseShortParts() {
        assertThat(RemediationCatalogue.displayNames(List.of("maria-qa", "dr-ai-ml")))
                .isEqualTo("Maria-QA, DR-AI-ML");
    }

    private RemediationRequest request(ExecutionContext context, String component, String description) {
        return RemediationRequest.builder()
                .issueId("issue-1")
                .issue(Issue.builder().component(component).description(description).severity(Severity.HIGH).build())
                .executionContext(context)
                .workingDirectory(workspace)
                .build();
    }
}
