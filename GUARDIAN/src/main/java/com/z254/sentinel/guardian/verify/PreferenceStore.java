package com.z254.sentinel.guardian.verify;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads user, team and project preferences.
 * <p>
 * Directories are searched in configured order; the first source defining a key wins.
 * Each directory may hold {@code preferences.json}, {@code conventions.json} and
 * {@code vision.json}.
 */
@Slf4j
@Component
public class PreferenceStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final GuardianProperties properties;
    private final ObjectMapper objectMapper;

    public PreferenceStore(GuardianProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Load the merged preference view for a workspace.
     */
    public Preferences load(WorkingContext context) {
        Map<String, String> merged = new LinkedHashMap<>();
        List<String> visionGoals = new ArrayList<>();
        for (String directory : properties.getContext().getPreferenceDirectories()) {
            Path dir = context.resolve(directory);
            if (!Files.isDirectory(dir)) {
                continue;
            }
            readMap(dir.resolve("preferences.json")).forEach((k, v) -> merged.putIfAbsent(k, String.valueOf(v)));
            readMap(dir.resolve("conventions.json")).forEach((k, v) -> merged.putIfAbsent(k, String.valueOf(v)));
            Object goals = readMap(dir.resolve("vision.json")).get("goals");
            if (goals instanceof List<?> list) {
                list.forEach(goal -> visionGoals.add(String.valueOf(goal)));
            }
        }
        return new Preferences(Map.copyOf(merged), List.copyOf(visionGoals));
    }

    private Map<String, Object> readMap(Path file) {
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException e) {
            log.warn("Ignoring unreadable preference file {}: {}", file, e.getMessage());
            return Map.of();
        }
    }

    public record Preferences(Map<String, String> values, List<String> visionGoals) {

        public Optional<String> get(String key) {
            return Optional.ofNullable(values.get(key));
        }
    }
}
