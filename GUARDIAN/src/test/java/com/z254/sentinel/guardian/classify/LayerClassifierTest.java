package com.z254.sentinel.guardian.classify;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.LayerClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LayerClassifierTest {

    private final LayerClassifier classifier = new LayerClassifier();

    @ParameterizedTest
    @CsvSource({
            "build, FRAMEWORK",
            "RAG, FRAMEWORK",
            "dependencies, PROJECT",
            "tests, PROJECT",
            "code_style, CONTEXT"
    })
    void exactComponentMatchWins(String component, Layer expected) {
        LayerClassification result = classifier.classify(issue(component, "something odd"));

        assertThat(result.getLayer()).isEqualTo(expected);
        assertThat(result.getConfidence()).isEqualTo(LayerPatterns.EXACT_MATCH_CONFIDENCE);
        assertThat(result.getMatchedPatterns()).containsExactly("component:" + component.toLowerCase());
    }

    @Test
    void patternVotesDecideUnknownComponents() {
        LayerClassification result = classifier.classify(
                issue("checkout", "Query latency above budget on the orders endpoint"));

        assertThat(result.getLayer()).isEqualTo(Layer.PROJECT);
        assertThat(result.getConfidence()).isEqualTo(100);
        assertThat(result.getMatchedPatterns()).isNotEmpty();
    }

    @Test
    void mixedVotesLowerConfidence() {
        LayerClassification result = classifier.classify(
                issue("lint", "Naming convention violated"));

        assertThat(result.getLayer()).isEqualTo(Layer.CONTEXT);
        assertThat(result.getConfidence()).isBetween(1, 99);
    }

    @Test
    void noMatchDefaultsToProject() {
        LayerClassification result = classifier.classify(issue("widget", "Something happened"));

        assertThat(result.getLayer()).isEqualTo(LayerPatterns.DEFAULT_LAYER);
        assertThat(result.getConfidence()).isEqualTo(LayerPatterns.DEFAULT_CONFIDENCE);
        assertThat(result.getMatchedPatterns()).isEmpty();
    }

    @Test
    void classificationIsDeterministicAndBounded() {
        Issue issue = issue("service", "TypeScript compilation failed; memory usage high");

        LayerClassification first = classifier.classify(issue);
        LayerClassification second = classifier.classify(issue);

        assertThat(second).isEqualTo(first);
        assertThat(first.getConfidence()).isBetween(0, 100);
    }

    @Test
    void nullComponentAndDescriptionAreTolerated() {
        LayerClassification result = classifier.classify(Issue.builder().build());

        assertThat(result.getLayer()).isEqualTo(Layer.PROJECT);
    }

    private static Issue issue(String component, String description) {
        return Issue.builder().component(component).description(description).build();
    }
}
