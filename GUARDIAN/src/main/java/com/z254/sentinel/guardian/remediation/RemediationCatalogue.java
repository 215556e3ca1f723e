package com.z254.sentinel.guardian.remediation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.verify.CommandRunner;
import com.z254.sentinel.guardian.verify.CommandRunner.CommandResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Built-in remediation scenarios, in match priority order.
 */
@Slf4j
public class RemediationCatalogue {

    static final String DEFAULT_PROJECT_NAME = "my-project";

    private final GuardianProperties properties;
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;

    public RemediationCatalogue(GuardianProperties properties, CommandRunner commandRunner, ObjectMapper objectMapper) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
    }

    public List<RemediationScenario> scenarios() {
        List<RemediationScenario> scenarios = new ArrayList<>();

        // Framework
        scenarios.add(RemediationScenario.builder()
                .id("framework-build-failure")
                .executionContext(ExecutionContext.FRAMEWORK)
                .matcher(component(c -> c.equals("build")).and(description(d -> d.contains("build fail"))))
                .autoFixable(true)
                .confidence(90)
                .description("Framework build failure")
                .fixProcedure(this::cleanAndRebuild)
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("framework-typescript-errors")
                .executionContext(ExecutionContext.FRAMEWORK)
                .matcher(component(c -> c.contains("typescript") || c.contains("compile")))
                .autoFixable(false)
                .confidence(75)
                .description("TypeScript compilation errors")
                .manualStep("Run the type checker and fix the reported errors")
                .manualStep("Re-run the health check once the build is clean")
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("framework-missing-dependencies")
                .executionContext(ExecutionContext.FRAMEWORK)
                .matcher(description(d -> d.contains("cannot find module") || d.contains("missing dependenc")))
                .autoFixable(true)
                .confidence(95)
                .description("Missing dependencies")
                .fixProcedure(request -> runCommand(request, properties.getCommands().getInstall(),
                        "Dependencies missing", "Installed dependencies",
                        "Missing modules are restored by a clean install"))
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("framework-security-vulnerabilities")
                .executionContext(ExecutionContext.FRAMEWORK)
                .matcher(description(d -> d.contains("vulnerabilit")))
                .autoFixable(true)
                .confidence(90)
                .description("Dependency security vulnerabilities")
                .fixProcedure(request -> runCommand(request, properties.getCommands().getAuditFix(),
                        "Vulnerable dependencies present", "Applied dependency audit fixes",
                        "Most advisories are resolved by non-breaking upgrades"))
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("framework-missing-hooks")
                .executionContext(ExecutionContext.FRAMEWORK)
                .matcher(component(c -> c.contains("hook")).and(description(d -> d.contains("missing"))))
                .autoFixable(false)
                .confidence(80)
                .description("Missing framework hooks")
                .manualStep("Restore the hook entry in " + properties.getFramework().getSettingsFile())
                .manualStep("Verify the hook script is executable")
                .build());

        // Project
        scenarios.add(RemediationScenario.builder()
                .id("project-missing-config")
                .executionContext(ExecutionContext.PROJECT)
                .matcher(component(c -> c.equals("framework_config")).and(description(d -> d.contains("missing"))))
                .autoFixable(true)
                .confidence(95)
                .description("Missing project configuration")
                .fixProcedure(this::createProjectConfig)
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("project-outdated-framework")
                .executionContext(ExecutionContext.PROJECT)
                .matcher(issue -> lower(issue.getDescription()).contains("outdated")
                        && (lower(issue.getDescription()).contains("framework")
                        || lower(issue.getComponent()).contains("framework")))
                .autoFixable(false)
                .confidence(85)
                .description("Outdated framework version")
                .manualStep("Review the framework changelog for breaking changes")
                .manualStep("Upgrade the framework dependency and re-run the test suite")
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("project-agent-not-activating")
                .executionContext(ExecutionContext.PROJECT)
                .matcher(component(c -> c.equals("agent_activation")))
                .autoFixable(false)
                .confidence(75)
                .description("Agent not activating")
                .manualStep("Check the agent's activation triggers against the project file patterns")
                .manualStep("Confirm the agent is listed in " + properties.getRemediation().getProjectConfigFile())
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("project-no-agents-configured")
                .executionContext(ExecutionContext.PROJECT)
                .matcher(description(d -> d.contains("no agents configured")))
                .autoFixable(true)
                .confidence(90)
                .description("No agents configured")
                .fixProcedure(this::addDefaultAgents)
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("project-rag-not-initialized")
                .executionContext(ExecutionContext.PROJECT)
                .matcher(component(c -> c.contains("rag")).and(description(d -> d.contains("not initialized"))))
                .autoFixable(true)
                .confidence(90)
                .description("RAG storage not initialized")
                .fixProcedure(this::initializeRagStorage)
                .build());

        // Shared
        scenarios.add(RemediationScenario.builder()
                .id("shared-vector-store-connection-lost")
                .executionContext(ExecutionContext.SHARED)
                .matcher(component(c -> c.contains("rag")).and(description(d -> d.contains("connection lost"))))
                .autoFixable(true)
                .confidence(85)
                .description("Vector store connection lost")
                .fixProcedure(this::awaitReconnect)
                .build());
        scenarios.add(RemediationScenario.builder()
                .id("shared-agent-timeout")
                .executionContext(ExecutionContext.SHARED)
                .matcher(issue -> lower(issue.getDescription()).contains("timeout")
                        && (lower(issue.getDescription()).contains("agent")
                        || lower(issue.getComponent()).contains("agent")))
                .autoFixable(false)
                .confidence(75)
                .description("Agent timeout")
                .manualStep("Check the agent's tool calls for slow external dependencies")
                .manualStep("Raise the agent timeout only if the workload is legitimately long")
                .build());

        return scenarios;
    }

    // ========== Fix Procedures ==========

    private FixOutcome cleanAndRebuild(RemediationRequest request) {
        Duration timeout = properties.getCommands().getTimeout();
        CommandResult clean = commandRunner.run(properties.getCommands().getClean(), request.getWorkingDirectory(), timeout);
        CommandResult build = commandRunner.run(properties.getCommands().getBuild(), request.getWorkingDirectory(), timeout);
        FixOutcome.FixOutcomeBuilder outcome = FixOutcome.builder()
                .success(build.succeeded())
                .beforeState("Build failing")
                .actionTaken("Cleaned build output (exit " + clean.exitCode() + ") and rebuilt");
        if (build.succeeded()) {
            return outcome.afterState("Build passing")
                    .lesson("Stale build output caused the failure; a clean rebuild resolves it")
                    .build();
        }
        return outcome.afterState("Build still failing: " + build.tail(5))
                .lesson("Build failure persists after a clean rebuild; the cause is in source, not output")
                .nextStep("Inspect the build output and fix the failing module")
                .build();
    }

    private FixOutcome runCommand(RemediationRequest request, List<String> command, String before,
                                  String action, String lesson) {
        CommandResult result = commandRunner.run(command, request.getWorkingDirectory(),
                properties.getCommands().getTimeout());
        FixOutcome.FixOutcomeBuilder outcome = FixOutcome.builder()
                .success(result.succeeded())
                .beforeState(before)
                .actionTaken(action + " (" + String.join(" ", command) + ")");
        if (result.succeeded()) {
            return outcome.afterState("Command succeeded").lesson(lesson).build();
        }
        return outcome.afterState("Command exited with " + result.exitCode() + ": " + result.tail(5))
                .nextStep("Run `" + String.join(" ", command) + "` manually and resolve the reported errors")
                .build();
    }

    private FixOutcome createProjectConfig(RemediationRequest request) throws IOException {
        Path configFile = request.getWorkingDirectory().resolve(properties.getRemediation().getProjectConfigFile());
        String fileName = configFile.getFileName().toString();
        if (Files.exists(configFile)) {
            return FixOutcome.builder()
                    .success(true)
                    .beforeState(fileName + " present")
                    .afterState(fileName + " present")
                    .actionTaken("No change, " + fileName + " already exists")
                    .build();
        }

        List<String> agents = properties.getRemediation().getDefaultAgents();
        ObjectNode config = objectMapper.createObjectNode();
        config.put("projectName", projectName(request.getWorkingDirectory()));
        ArrayNode agentArray = config.putArray("agents");
        agents.forEach(agentArray::add);
        config.put("createdBy", "guardian");
        writeJson(configFile, config);

        return FixOutcome.builder()
                .success(true)
                .beforeState(fileName + " missing")
                .afterState(fileName + " created")
                .actionTaken("Created " + fileName + " with default agents")
                .lesson("New projects need a config listing default agents: " + displayNames(agents))
                .build();
    }

    private FixOutcome addDefaultAgents(RemediationRequest request) throws IOException {
        Path configFile = request.getWorkingDirectory().resolve(properties.getRemediation().getProjectConfigFile());
        ObjectNode config = Files.exists(configFile)
                ? (ObjectNode) objectMapper.readTree(configFile.toFile())
                : objectMapper.createObjectNode();
        if (!config.has("projectName")) {
            config.put("projectName", projectName(request.getWorkingDirectory()));
        }
        ArrayNode agents = config.putArray("agents");
        properties.getRemediation().getDefaultAgents().forEach(agents::add);
        writeJson(configFile, config);

        return FixOutcome.builder()
                .success(true)
                .beforeState("No agents configured")
                .afterState(agents.size() + " agents configured")
                .actionTaken("Added default agents to " + configFile.getFileName())
                .lesson("An empty agent list disables activation; defaults restore it")
                .build();
    }

    private FixOutcome initializeRagStorage(RemediationRequest request) throws IOException {
        Path storage = request.getWorkingDirectory().resolve(properties.getRemediation().getRagStorageDirectory());
        boolean existed = Files.isDirectory(storage);
        Files.createDirectories(storage);
        return FixOutcome.builder()
                .success(true)
                .beforeState(existed ? "RAG storage present" : "RAG storage missing")
                .afterState("RAG storage at " + storage)
                .actionTaken("Initialized RAG storage")
                .lesson("RAG storage is ready to store patterns")
                .nextStep("Run /learn to store the first pattern")
                .build();
    }

    private FixOutcome awaitReconnect(RemediationRequest request) throws InterruptedException {
        Duration delay = properties.getRemediation().getReconnectDelay();
        Thread.sleep(delay.toMillis());
        boolean reachable = Files.isDirectory(request.getWorkingDirectory());
        FixOutcome.FixOutcomeBuilder outcome = FixOutcome.builder()
                .success(reachable)
                .beforeState("Connection lost")
                .actionTaken("Waited " + delay.toMillis() + "ms for auto-reconnect");
        if (reachable) {
            return outcome.afterState("Connection restored")
                    .lesson("Transient connection loss recovers automatically via retry logic")
                    .build();
        }
        return outcome.afterState("Store still unreachable")
                .nextStep("Check vector store credentials and network access")
                .build();
    }

    // ========== Helpers ==========

    private String projectName(Path workingDirectory) {
        Path packageJson = workingDirectory.resolve("package.json");
        if (!Files.isRegularFile(packageJson)) {
            return DEFAULT_PROJECT_NAME;
        }
        try {
            JsonNode name = objectMapper.readTree(packageJson.toFile()).path("name");
            return name.isTextual() && !name.asText().isBlank() ? name.asText() : DEFAULT_PROJECT_NAME;
        } catch (IOException e) {
            log.debug("Unreadable package.json, using default project name: {}", e.getMessage());
            return DEFAULT_PROJECT_NAME;
        }
    }

    private void writeJson(Path file, JsonNode node) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), node);
    }

    /**
     * {@code maria-qa} to {@code Maria-QA}.
     */
    static String displayNames(List<String> slugs) {
        List<String> names = new ArrayList<>();
        for (String slug : slugs) {
            StringBuilder name = new StringBuilder();
            for (String part : slug.split("-")) {
                if (part.isEmpty()) {
                    continue;
                }
                if (name.length() > 0) {
                    name.append('-');
                }
                name.append(part.length() <= 2
                        ? part.toUpperCase(Locale.ROOT)
                        : Character.toUpperCase(part.charAt(0)) + part.substring(1));
            }
            names.add(name.toString());
        }
        return String.join(", ", names);
    }

    private static Predicate<Issue> component(Predicate<String> test) {
        return issue -> test.test(lower(issue.getComponent()));
    }

    private static Predicate<Issue> description(Predicate<String> test) {
        return issue -> test.test(lower(issue.getDescription()));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
