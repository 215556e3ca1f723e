package com.z254.sentinel.guardian.verify;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Verifies project-layer claims against the workspace: referenced files, failing tests,
 * dependency manifests and recent git history.
 */
@Component
public class ProjectVerifier extends AbstractGroundTruthVerifier {

    private static final List<String> MANIFESTS = List.of(
            "package.json", "pom.xml", "build.gradle", "build.gradle.kts", "requirements.txt", "go.mod", "Cargo.toml");

    private final GuardianProperties properties;
    private final CommandRunner commandRunner;

    public ProjectVerifier(GuardianProperties properties, CommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
    }

    @Override
    public Layer layer() {
        return Layer.PROJECT;
    }

    @Override
    protected List<CheckOutcome> runChecks(Issue issue, WorkingContext context) {
        String description = issue.descriptionOrEmpty().toLowerCase(Locale.ROOT);
        List<CheckOutcome> outcomes = new ArrayList<>();

        Optional<FileReference> reference = findFileReference(issue.getDescription());
        reference.ifPresent(ref -> outcomes.add(checkFile(ref, description, context)));

        if (description.contains("test") && description.contains("fail")) {
            outcomes.add(checkTests(context));
        }
        if (description.contains("outdated") || description.contains("dependenc") || description.contains("vulnerab")) {
            outcomes.add(checkManifest(context));
        }

        Path target = reference.map(ref -> context.resolve(ref.path()))
                .orElseGet(() -> context.resolve(issue.componentOrEmpty()));
        if (!issue.componentOrEmpty().isBlank() && Files.exists(target) && isGitRepository(context)) {
            outcomes.add(checkGitHistory(target, context));
        }
        return outcomes;
    }

    @Override
    protected String recommendFix(Issue issue, List<CheckOutcome> outcomes) {
        if (issue.getRecommendation() != null && !issue.getRecommendation().isBlank()) {
            return issue.getRecommendation();
        }
        return outcomes.stream().anyMatch(o -> o.check().equals("tests"))
                ? "Run the test suite locally and fix the failing cases"
                : "Review the referenced project files";
    }

    // ========== Checks ==========

    private CheckOutcome checkFile(FileReference reference, String description, WorkingContext context) {
        boolean exists = Files.exists(context.resolve(reference.path()));
        boolean claimsMissing = description.contains("missing") || description.contains("not found");
        if (claimsMissing) {
            return exists
                    ? CheckOutcome.refuted("file", reference.path() + " exists")
                    : CheckOutcome.confirmed("file", 90, reference.path() + " is missing");
        }
        return exists
                ? CheckOutcome.confirmed("file", 70, reference.path() + " exists")
                : CheckOutcome.refuted("file", reference.path() + " does not exist");
    }

    private CheckOutcome checkTests(WorkingContext context) {
        CommandRunner.CommandResult result = commandRunner.run(
                properties.getCommands().getTest(), context.getWorkingDirectory(),
                properties.getCommands().getTimeout());
        if (result.succeeded()) {
            return CheckOutcome.refuted("tests", "Test command exited 0");
        }
        return CheckOutcome.confirmed("tests", 95, "Test command exited " + result.exitCode(), result.tail(5));
    }

    private CheckOutcome checkManifest(WorkingContext context) {
        return MANIFESTS.stream()
                .filter(manifest -> Files.exists(context.resolve(manifest)))
                .findFirst()
                .map(manifest -> CheckOutcome.confirmed("manifest", 75, "Dependency manifest " + manifest + " present"))
                .orElseGet(() -> CheckOutcome.refuted("manifest", "No dependency manifest in workspace"));
    }

    private CheckOutcome checkGitHistory(Path target, WorkingContext context) {
        long days = Math.max(1, properties.getVerification().getGitHistoryWindow().toDays());
        String relative = context.getWorkingDirectory().toAbsolutePath().normalize()
                .relativize(target.toAbsolutePath().normalize()).toString();
        CommandRunner.CommandResult result = commandRunner.run(
                List.of("git", "log", "--since=" + days + ".days", "--format=%H", "--", relative.isEmpty() ? "." : relative),
                context.getWorkingDirectory(), properties.getCommands().getTimeout());
        if (!result.succeeded()) {
            return CheckOutcome.inconclusive("git", "git log exited " + result.exitCode());
        }
        long commits = result.output().lines().filter(line -> !line.isBlank()).count();
        if (commits == 0) {
            return CheckOutcome.inconclusive("git", "No commits touching " + relative + " in " + days + " days");
        }
        int confidence = (int) Math.min(95, 60 + commits * 5);
        return CheckOutcome.confirmed("git", confidence,
                commits + " recent commit(s) touch " + relative + " in the last " + days + " days");
    }

    private boolean isGitRepository(WorkingContext context) {
        return Files.exists(context.resolve(".git"));
    }
}
