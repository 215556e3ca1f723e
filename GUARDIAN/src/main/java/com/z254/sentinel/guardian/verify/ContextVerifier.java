package com.z254.sentinel.guardian.verify;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Verifies preference and convention claims against stored user, team and project
 * preferences.
 */
@Component
public class ContextVerifier extends AbstractGroundTruthVerifier {

    private static final Map<String, Pattern> NAMING_STYLES = Map.of(
            "camelcase", Pattern.compile("camel\\s*case", Pattern.CASE_INSENSITIVE),
            "pascalcase", Pattern.compile("pascal\\s*case", Pattern.CASE_INSENSITIVE),
            "snake_case", Pattern.compile("snake[_\\s]*case", Pattern.CASE_INSENSITIVE),
            "kebab-case", Pattern.compile("kebab[-\\s]*case", Pattern.CASE_INSENSITIVE));

    private final GuardianProperties properties;
    private final PreferenceStore preferenceStore;
    private final CommandRunner commandRunner;

    public ContextVerifier(GuardianProperties properties,
                           PreferenceStore preferenceStore,
                           CommandRunner commandRunner) {
        this.properties = properties;
        this.preferenceStore = preferenceStore;
        this.commandRunner = commandRunner;
    }

    @Override
    public Layer layer() {
        return Layer.CONTEXT;
    }

    @Override
    protected List<CheckOutcome> runChecks(Issue issue, WorkingContext context) {
        String description = issue.descriptionOrEmpty().toLowerCase(Locale.ROOT);
        PreferenceStore.Preferences preferences = preferenceStore.load(context);
        Optional<Path> file = findFileReference(issue.getDescription()).map(ref -> context.resolve(ref.path()));
        List<CheckOutcome> outcomes = new ArrayList<>();

        if (description.contains("indent") || description.contains("tabs") || description.contains("spaces")) {
            outcomes.add(checkIndentation(file, preferences));
        }
        if (description.contains("quote")) {
            outcomes.add(checkQuotes(file, preferences));
        }
        if (description.contains("naming") || description.contains("case")) {
            outcomes.add(checkNaming(issue.descriptionOrEmpty(), preferences));
        }
        if (description.contains("vision") || description.contains("goal")) {
            outcomes.add(checkVision(description, preferences));
        }
        return outcomes;
    }

    @Override
    protected String recommendFix(Issue issue, List<CheckOutcome> outcomes) {
        return outcomes.stream()
                .filter(CheckOutcome::isConfirmed)
                .findFirst()
                .map(outcome -> switch (outcome.check()) {
                    case "indentation" -> "Reformat the file to the preferred indentation";
                    case "quotes" -> "Apply the preferred quote style";
                    case "naming" -> "Rename identifiers to the preferred naming convention";
                    default -> "Align the change with the project vision";
                })
                .orElse("No preference conflict confirmed");
    }

    /**
     * Map the last author of the referenced file to an agent.
     */
    @Override
    protected String responsibleAgent(Issue issue, WorkingContext context) {
        Optional<FileReference> reference = findFileReference(issue.getDescription());
        if (reference.isEmpty() || !Files.exists(context.resolve(".git"))) {
            return null;
        }
        CommandRunner.CommandResult result = commandRunner.run(
                List.of("git", "log", "-1", "--format=%an", "--", reference.get().path()),
                context.getWorkingDirectory(), properties.getCommands().getTimeout());
        String author = result.succeeded() ? result.output().strip() : "";
        if (author.isEmpty()) {
            return null;
        }
        return properties.getContext().getAuthorAgents().get(author);
    }

    // ========== Checks ==========

    private CheckOutcome checkIndentation(Optional<Path> file, PreferenceStore.Preferences preferences) {
        Optional<String> preferred = preferences.get("indentation").map(v -> v.toLowerCase(Locale.ROOT));
        if (preferred.isEmpty()) {
            return CheckOutcome.inconclusive("indentation", "No indentation preference stored");
        }
        if (file.isEmpty() || !Files.isRegularFile(file.get())) {
            return CheckOutcome.inconclusive("indentation", "No readable file referenced");
        }

        long tabs = 0;
        long spaces = 0;
        for (String line : readLines(file.get())) {
            if (line.startsWith("\t")) {
                tabs++;
            } else if (line.startsWith("  ")) {
                spaces++;
            }
        }
        if (tabs == 0 && spaces == 0) {
            return CheckOutcome.inconclusive("indentation", "File has no indented lines");
        }
        String detected = tabs > spaces ? "tabs" : "spaces";
        String summary = String.format("%d tab-indented, %d space-indented lines; preference is %s",
                tabs, spaces, preferred.get());
        return preferred.get().contains(detected.substring(0, 3))
                ? CheckOutcome.refuted("indentation", summary)
                : CheckOutcome.confirmed("indentation", 95, summary);
    }

    private CheckOutcome checkQuotes(Optional<Path> file, PreferenceStore.Preferences preferences) {
        Optional<String> preferred = preferences.get("quotes").map(v -> v.toLowerCase(Locale.ROOT));
        if (preferred.isEmpty() || file.isEmpty() || !Files.isRegularFile(file.get())) {
            return CheckOutcome.inconclusive("quotes", "No quote preference or readable file");
        }
        long single = 0;
        long dbl = 0;
        for (String line : readLines(file.get())) {
            single += line.chars().filter(c -> c == '\'').count();
            dbl += line.chars().filter(c -> c == '"').count();
        }
        if (single == 0 && dbl == 0) {
            return CheckOutcome.inconclusive("quotes", "File has no string literals");
        }
        String detected = single > dbl ? "single" : "double";
        String summary = String.format("%d single, %d double quotes; preference is %s", single, dbl, preferred.get());
        return preferred.get().startsWith(detected)
                ? CheckOutcome.refuted("quotes", summary)
                : CheckOutcome.confirmed("quotes", 85, summary);
    }

    private CheckOutcome checkNaming(String description, PreferenceStore.Preferences preferences) {
        Optional<String> preferred = preferences.get("naming")
                .map(v -> v.toLowerCase(Locale.ROOT).replace(" ", ""));
        if (preferred.isEmpty()) {
            return CheckOutcome.inconclusive("naming", "No naming preference stored");
        }
        Optional<String> mentioned = NAMING_STYLES.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(description).find())
                .map(Map.Entry::getKey)
                .filter(style -> !style.equals(preferred.get()))
                .findFirst();
        return mentioned
                .map(style -> CheckOutcome.confirmed("naming", 85,
                        "Detected " + style + " while preference is " + preferred.get()))
                .orElseGet(() -> CheckOutcome.inconclusive("naming", "No conflicting naming style mentioned"));
    }

    private CheckOutcome checkVision(String description, PreferenceStore.Preferences preferences) {
        return preferences.visionGoals().stream()
                .filter(goal -> description.contains(goal.toLowerCase(Locale.ROOT)))
                .findFirst()
                .map(goal -> CheckOutcome.confirmed("vision", 75, "Issue concerns declared goal '" + goal + "'"))
                .orElseGet(() -> CheckOutcome.inconclusive("vision", "No declared vision goal referenced"));
    }

    private List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
