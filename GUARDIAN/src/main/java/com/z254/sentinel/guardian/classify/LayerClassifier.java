package com.z254.sentinel.guardian.classify;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.LayerClassification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a verification layer to an issue.
 * <p>
 * Stateless; safe to call concurrently.
 */
@Component
public class LayerClassifier {

    /** Tie-break order for equal vote counts */
    private static final List<Layer> TIE_BREAK_ORDER = List.of(Layer.PROJECT, Layer.FRAMEWORK, Layer.CONTEXT);

    private final Map<String, Layer> componentLayers;
    private final List<LayerPattern> patterns;

    public LayerClassifier() {
        this(LayerPatterns.COMPONENT_LAYERS, LayerPatterns.PATTERNS);
    }

    public LayerClassifier(Map<String, Layer> componentLayers, List<LayerPattern> patterns) {
        this.componentLayers = Map.copyOf(componentLayers);
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Classify one issue.
     */
    public LayerClassification classify(Issue issue) {
        String component = issue.componentOrEmpty().trim().toLowerCase(Locale.ROOT);

        Layer exact = componentLayers.get(component);
        if (exact != null) {
            return LayerClassification.builder()
                    .layer(exact)
                    .confidence(LayerPatterns.EXACT_MATCH_CONFIDENCE)
                    .matchedPatterns(List.of("component:" + component))
                    .reasoning("Exact component match '" + component + "'")
                    .build();
        }

        String text = issue.componentOrEmpty() + " " + issue.descriptionOrEmpty();
        Map<Layer, Integer> votes = new EnumMap<>(Layer.class);
        List<String> matched = new ArrayList<>();
        for (LayerPattern pattern : patterns) {
            if (pattern.matches(text)) {
                votes.merge(pattern.layer(), 1, Integer::sum);
                matched.add(pattern.layer().slug() + ":" + pattern.name());
            }
        }

        int total = votes.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return LayerClassification.builder()
                    .layer(LayerPatterns.DEFAULT_LAYER)
                    .confidence(LayerPatterns.DEFAULT_CONFIDENCE)
                    .matchedPatterns(List.of())
                    .reasoning("No patterns matched, defaulting to " + LayerPatterns.DEFAULT_LAYER.slug())
                    .build();
        }

        Layer winner = null;
        int winnerVotes = -1;
        for (Layer layer : TIE_BREAK_ORDER) {
            int count = votes.getOrDefault(layer, 0);
            if (count > winnerVotes) {
                winner = layer;
                winnerVotes = count;
            }
        }

        int confidence = (int) Math.round(winnerVotes * 100.0 / total);
        return LayerClassification.builder()
                .layer(winner)
                .confidence(confidence)
                .matchedPatterns(List.copyOf(matched))
                .reasoning(String.format("%d of %d pattern votes for %s", winnerVotes, total, winner.slug()))
                .build();
    }
}
