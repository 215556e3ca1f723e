package com.z254.sentinel.guardian.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Verifies framework-infrastructure claims: build, compilation, agent definitions,
 * hooks, MCP configuration and RAG files.
 * <p>
 * A framework issue is verified only when every claim extracted from it is confirmed.
 */
@Component
public class FrameworkVerifier extends AbstractGroundTruthVerifier {

    private static final Pattern AGENT_NAME = Pattern.compile("agent\\s+['\"`]?([A-Za-z][\\w.-]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOOK_NAME = Pattern.compile("hook\\s+['\"`]?([A-Za-z][\\w.-]*)", Pattern.CASE_INSENSITIVE);

    private final GuardianProperties properties;
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;

    public FrameworkVerifier(GuardianProperties properties,
                             CommandRunner commandRunner,
                             ObjectMapper objectMapper) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public Layer layer() {
        return Layer.FRAMEWORK;
    }

    @Override
    protected List<CheckOutcome> runChecks(Issue issue, WorkingContext context) {
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (Claim claim : extractClaims(issue)) {
            outcomes.add(switch (claim) {
                case BUILD_FAILURE -> checkBuild(context);
                case COMPILE_ERROR -> checkCompilation(issue, context);
                case AGENT_INVALID -> checkAgentDefinition(issue, context);
                case HOOK_MISSING -> checkHook(issue, context);
                case MCP_ERROR -> checkMcpConfig(context);
                case RAG_HEALTH -> checkRagFiles(context);
            });
        }
        return outcomes;
    }

    /**
     * Every extracted claim must hold.
     */
    @Override
    protected boolean isVerified(List<CheckOutcome> outcomes) {
        return !outcomes.isEmpty() && outcomes.stream().allMatch(CheckOutcome::isConfirmed);
    }

    @Override
    protected String recommendFix(Issue issue, List<CheckOutcome> outcomes) {
        if (outcomes.stream().noneMatch(CheckOutcome::isConfirmed)) {
            return "Claim not confirmed; no fix recommended";
        }
        Set<Claim> claims = extractClaims(issue);
        if (claims.contains(Claim.BUILD_FAILURE)) {
            return "Run a clean build and fix the first reported compiler error";
        }
        if (claims.contains(Claim.COMPILE_ERROR)) {
            return "Fix the type errors reported by the type checker";
        }
        if (claims.contains(Claim.AGENT_INVALID)) {
            return "Add the missing sections (" + String.join(", ",
                    properties.getFramework().getRequiredAgentSections()) + ") to the agent definition";
        }
        if (claims.contains(Claim.HOOK_MISSING)) {
            return "Register the hook in " + properties.getFramework().getSettingsFile();
        }
        if (claims.contains(Claim.MCP_ERROR)) {
            return "Restore a valid " + properties.getFramework().getMcpConfigFile();
        }
        return "Rebuild the RAG module so both source and compiled files exist";
    }

    /**
     * Claims carried by the issue, in check order.
     */
    Set<Claim> extractClaims(Issue issue) {
        String component = issue.componentOrEmpty().toLowerCase(Locale.ROOT);
        String description = issue.descriptionOrEmpty().toLowerCase(Locale.ROOT);
        Set<Claim> claims = EnumSet.noneOf(Claim.class);

        if (component.equals("build") || description.contains("build fail") || description.contains("build error")) {
            claims.add(Claim.BUILD_FAILURE);
        }
        if (component.contains("typescript") || component.contains("compile")
                || description.contains("typescript error") || description.contains("compilation error")
                || description.contains("type error")) {
            claims.add(Claim.COMPILE_ERROR);
        }
        if (component.contains("agent") && (description.contains("invalid") || description.contains("missing section")
                || description.contains("malformed") || description.contains("definition"))) {
            claims.add(Claim.AGENT_INVALID);
        }
        if (component.contains("hook") && (description.contains("not found") || description.contains("missing")
                || description.contains("not registered"))) {
            claims.add(Claim.HOOK_MISSING);
        }
        if (component.contains("mcp")) {
            claims.add(Claim.MCP_ERROR);
        }
        if (component.contains("rag")) {
            claims.add(Claim.RAG_HEALTH);
        }
        return claims;
    }

    // ========== Checks ==========

    private CheckOutcome checkBuild(WorkingContext context) {
        CommandRunner.CommandResult result = commandRunner.run(
                properties.getCommands().getBuild(), context.getWorkingDirectory(),
                properties.getCommands().getTimeout());
        if (result.succeeded()) {
            return CheckOutcome.refuted("build", "Build command exited 0");
        }
        return CheckOutcome.confirmed("build", 100,
                "Build command exited " + result.exitCode(), result.tail(5));
    }

    private CheckOutcome checkCompilation(Issue issue, WorkingContext context) {
        Optional<FileReference> reference = findFileReference(issue.getDescription());
        if (reference.isPresent()) {
            Path file = context.resolve(reference.get().path());
            if (!Files.exists(file)) {
                return CheckOutcome.refuted("compile", "Referenced file does not exist: " + reference.get().path());
            }
        }

        CommandRunner.CommandResult result = commandRunner.run(
                properties.getCommands().getTypecheck(), context.getWorkingDirectory(),
                properties.getCommands().getTimeout());
        if (result.succeeded()) {
            return CheckOutcome.refuted("compile", "Type check exited 0");
        }
        if (reference.isPresent() && !result.output().contains(reference.get().path())) {
            return CheckOutcome.confirmed("compile", 50,
                    "Type check failed but did not mention " + reference.get().path());
        }
        return CheckOutcome.confirmed("compile", 95,
                "Type check exited " + result.exitCode(), result.tail(5));
    }

    private CheckOutcome checkAgentDefinition(Issue issue, WorkingContext context) {
        Matcher matcher = AGENT_NAME.matcher(issue.descriptionOrEmpty());
        if (!matcher.find()) {
            return CheckOutcome.inconclusive("agent", "No agent name in description");
        }
        String agent = matcher.group(1).toLowerCase(Locale.ROOT);
        Path definition = context.resolve(properties.getFramework().getAgentsDirectory()).resolve(agent + ".md");
        if (!Files.exists(definition)) {
            return CheckOutcome.confirmed("agent", 100, "Agent definition missing: " + definition);
        }

        String content = readString(definition);
        List<String> missing = properties.getFramework().getRequiredAgentSections().stream()
                .filter(section -> !Pattern.compile("^#+\\s*" + Pattern.quote(section), Pattern.MULTILINE | Pattern.CASE_INSENSITIVE)
                        .matcher(content).find())
                .toList();
        if (missing.isEmpty()) {
            return CheckOutcome.refuted("agent", "Agent definition " + agent + " has all required sections");
        }
        return CheckOutcome.confirmed("agent", 90, "Agent " + agent + " lacks sections " + missing);
    }

    private CheckOutcome checkHook(Issue issue, WorkingContext context) {
        Matcher matcher = HOOK_NAME.matcher(issue.descriptionOrEmpty());
        if (!matcher.find()) {
            return CheckOutcome.inconclusive("hook", "No hook name in description");
        }
        String hook = matcher.group(1);
        Path settings = context.resolve(properties.getFramework().getSettingsFile());
        if (!Files.exists(settings)) {
            return CheckOutcome.confirmed("hook", 90, "Settings file missing: " + settings);
        }

        JsonNode hooks = readJson(settings).path("hooks");
        for (JsonNode entry : hooks) {
            String text = entry.isTextual() ? entry.asText() : entry.path("name").asText(entry.path("command").asText(""));
            if (text.contains(hook)) {
                return CheckOutcome.refuted("hook", "Hook " + hook + " is registered");
            }
        }
        return CheckOutcome.confirmed("hook", 90, "Hook " + hook + " not in hooks array of " + settings.getFileName());
    }

    private CheckOutcome checkMcpConfig(WorkingContext context) {
        Path config = context.resolve(properties.getFramework().getMcpConfigFile());
        if (!Files.exists(config)) {
            return CheckOutcome.confirmed("mcp", 85, "MCP config missing: " + config.getFileName());
        }
        try {
            objectMapper.readTree(config.toFile());
            return CheckOutcome.refuted("mcp", "MCP config parses");
        } catch (IOException e) {
            return CheckOutcome.confirmed("mcp", 85, "MCP config unparseable: " + e.getMessage());
        }
    }

    private CheckOutcome checkRagFiles(WorkingContext context) {
        Path source = context.resolve(properties.getFramework().getRagSourceFile());
        Path compiled = context.resolve(properties.getFramework().getRagCompiledFile());
        List<String> missing = new ArrayList<>();
        if (!Files.exists(source)) {
            missing.add(properties.getFramework().getRagSourceFile());
        }
        if (!Files.exists(compiled)) {
            missing.add(properties.getFramework().getRagCompiledFile());
        }
        if (missing.isEmpty()) {
            return CheckOutcome.refuted("rag", "RAG source and compiled files present");
        }
        return CheckOutcome.confirmed("rag", 90, "RAG files missing: " + missing);
    }

    private String readString(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + path, e);
        }
    }

    private JsonNode readJson(Path path) {
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot parse " + path, e);
        }
    }

    enum Claim {
        BUILD_FAILURE,
        COMPILE_ERROR,
        AGENT_INVALID,
        HOOK_MISSING,
        MCP_ERROR,
        RAG_HEALTH
    }
}
