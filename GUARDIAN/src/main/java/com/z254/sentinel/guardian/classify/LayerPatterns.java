package com.z254.sentinel.guardian.classify;

import com.z254.sentinel.guardian.domain.model.Layer;

import java.util.List;
import java.util.Map;

/**
 * Static classification tables.
 * <p>
 * Exact component names are trusted outright; everything else is decided by pattern votes
 * over the component and description.
 */
public final class LayerPatterns {

    /** Component names with a fixed layer */
    public static final Map<String, Layer> COMPONENT_LAYERS = Map.ofEntries(
            Map.entry("framework", Layer.FRAMEWORK),
            Map.entry("build", Layer.FRAMEWORK),
            Map.entry("agents", Layer.FRAMEWORK),
            Map.entry("agent_definitions", Layer.FRAMEWORK),
            Map.entry("hooks", Layer.FRAMEWORK),
            Map.entry("mcp", Layer.FRAMEWORK),
            Map.entry("mcp_servers", Layer.FRAMEWORK),
            Map.entry("rag", Layer.FRAMEWORK),
            Map.entry("rag_system", Layer.FRAMEWORK),
            Map.entry("guardian", Layer.FRAMEWORK),
            Map.entry("typescript", Layer.FRAMEWORK),
            Map.entry("framework_config", Layer.FRAMEWORK),
            Map.entry("tests", Layer.PROJECT),
            Map.entry("test_coverage", Layer.PROJECT),
            Map.entry("dependencies", Layer.PROJECT),
            Map.entry("security", Layer.PROJECT),
            Map.entry("database", Layer.PROJECT),
            Map.entry("frontend", Layer.PROJECT),
            Map.entry("backend", Layer.PROJECT),
            Map.entry("api", Layer.PROJECT),
            Map.entry("accessibility", Layer.PROJECT),
            Map.entry("performance", Layer.PROJECT),
            Map.entry("code_quality", Layer.PROJECT),
            Map.entry("preferences", Layer.CONTEXT),
            Map.entry("user_preferences", Layer.CONTEXT),
            Map.entry("team_conventions", Layer.CONTEXT),
            Map.entry("conventions", Layer.CONTEXT),
            Map.entry("code_style", Layer.CONTEXT),
            Map.entry("project_vision", Layer.CONTEXT)
    );

    /** Voting patterns, matched against {@code component + " " + description} */
    public static final List<LayerPattern> PATTERNS = List.of(
            LayerPattern.of(Layer.FRAMEWORK, "\\bbuild (failed|failure|error)"),
            LayerPattern.of(Layer.FRAMEWORK, "\\bagent (definition|file|invalid)"),
            LayerPattern.of(Layer.FRAMEWORK, "\\bhooks?\\b"),
            LayerPattern.of(Layer.FRAMEWORK, "\\bmcp\\b"),
            LayerPattern.of(Layer.FRAMEWORK, "\\brag\\b|vector (store|memory)"),
            LayerPattern.of(Layer.FRAMEWORK, "\\bguardian\\b"),
            LayerPattern.of(Layer.FRAMEWORK, "typescript|\\btsc\\b|compil"),
            LayerPattern.of(Layer.FRAMEWORK, "framework"),

            LayerPattern.of(Layer.PROJECT, "\\btests? (failed|failing|failure)|\\bfailing tests?"),
            LayerPattern.of(Layer.PROJECT, "coverage"),
            LayerPattern.of(Layer.PROJECT, "vulnerab|security|\\bcve-"),
            LayerPattern.of(Layer.PROJECT, "\\b(database|migration|query|schema)\\b"),
            LayerPattern.of(Layer.PROJECT, "outdated|dependenc|package"),
            LayerPattern.of(Layer.PROJECT, "performance|latency|slow|memory"),
            LayerPattern.of(Layer.PROJECT, "accessib|a11y|wcag"),
            LayerPattern.of(Layer.PROJECT, "\\b(lint|eslint|quality)\\b"),
            LayerPattern.of(Layer.PROJECT, "\\b(component|endpoint|api|frontend|backend)\\b"),

            LayerPattern.of(Layer.CONTEXT, "indent|tabs|spaces"),
            LayerPattern.of(Layer.CONTEXT, "quote style|single quotes|double quotes"),
            LayerPattern.of(Layer.CONTEXT, "naming|camelcase|snake_case|kebab-case"),
            LayerPattern.of(Layer.CONTEXT, "convention"),
            LayerPattern.of(Layer.CONTEXT, "preference"),
            LayerPattern.of(Layer.CONTEXT, "vision|roadmap|goal alignment"),
            LayerPattern.of(Layer.CONTEXT, "commit (message|format)|conventional commits")
    );

    /** Layer used when no pattern votes */
    public static final Layer DEFAULT_LAYER = Layer.PROJECT;

    public static final int EXACT_MATCH_CONFIDENCE = 95;
    public static final int DEFAULT_CONFIDENCE = 50;

    private LayerPatterns() {
    }
}
