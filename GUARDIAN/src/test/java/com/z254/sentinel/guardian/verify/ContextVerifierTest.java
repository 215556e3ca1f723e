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
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextVerifierTest {

    @TempDir
    Path workspace;

    private GuardianProperties properties;
    private CommandRunner commandRunner;
    private PreferenceStore preferenceStore;
    private ContextVerifier verifier;
    private WorkingContext context;

    @BeforeEach
    void setUp() {
        properties = new GuardianProperties();
        commandRunner = mock(CommandRunner.class);
        preferenceStore = new PreferenceStore(properties, new ObjectMapper());
        verifier = new ContextVerifier(properties, preferenceStore, commandRunner);
        context = WorkingContext.builder().workingDirectory(workspace).build();
    }

    @Test
    void tabIndentedFileConflictsWithSpacesPreference() throws IOException {
        writePreferences(".guardian/user", "{\"indentation\": \"spaces\"}");
        Files.writeString(workspace.resolve("util.ts"), "function a() {\n\treturn 1;\n\tif (x) {}\n}\n");

        VerificationResult result = verifier.verify(issue("Indentation in util.ts uses tabs"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(95);
        assertThat(result.getRecommendedFix()).isEqualTo("Reformat the file to the preferred indentation");
    }

    @Test
    void matchingIndentationRefutesClaim() throws IOException {
        writePreferences(".guardian/user", "{\"indentation\": \"spaces\"}");
        Files.writeString(workspace.resolve("util.ts"), "function a() {\n  return 1;\n}\n");

        VerificationResult result = verifier.verify(issue("Indentation in util.ts looks wrong"), context);

        assertThat(result.isVerified()).isFalse();
    }

    @Test
    void userPreferenceOverridesTeam() throws IOException {
        writePreferences(".guardian/user", "{\"quotes\": \"single\"}");
        writePreferences(".guardian/team", "{\"quotes\": \"double\", \"naming\": \"camelCase\"}");

        PreferenceStore.Preferences preferences = preferenceStore.load(context);

        assertThat(preferences.get("quotes")).contains("single");
        assertThat(preferences.get("naming")).contains("camelCase");
    }

    @Test
    void conflictingNamingStyleIsConfirmed() throws IOException {
        writePreferences(".guardian/project", "{\"naming\": \"camelCase\"}");

        VerificationResult result = verifier.verify(issue("New module uses snake_case naming"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getEvidence()).anyMatch(line -> line.contains("Detected snake_case while preference is camelcase"));
    }

    @Test
    void visionGoalReferenceIsConfirmed() throws IOException {
        Path dir = workspace.resolve(".guardian/project");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("vision.json"), "{\"goals\": [\"Offline support\"]}");

        VerificationResult result = verifier.verify(issue("Change removes offline support, a stated goal"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(75);
    }

    @Test
    void unreadablePreferenceFileIsIgnored() throws IOException {
        writePreferences(".guardian/user", "{not json");
        writePreferences(".guardian/team", "{\"quotes\": \"double\"}");

        assertThat(preferenceStore.load(context).get("quotes")).contains("double");
    }

    @Test
    void lastAuthorMapsToAgent() throws IOException {
        properties.getContext().getAuthorAgents().put("Jane Doe", "James-Frontend");
        Files.createDirectories(workspace.resolve(".git"));
        writePreferences(".guardian/user", "{\"quotes\": \"single\"}");
        Files.writeString(workspace.resolve("view.tsx"), "const a = \"x\";\nconst b = \"y\";\n");
        when(commandRunner.run(anyList(), any(Path.class), any(Duration.class)))
                .thenReturn(new CommandRunner.CommandResult(0, "Jane Doe\n"));

        VerificationResult result = verifier.verify(issue("Quote style in view.tsx is inconsistent"), context);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getResponsibleAgent()).isEqualTo("James-Frontend");
    }

    private void writePreferences(String directory, String json) throws IOException {
        Path dir = workspace.resolve(directory);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("preferences.json"), json);
    }

    private static Issue issue(String description) {
        return Issue.builder().component("code_style").description(description).build();
    }
}
