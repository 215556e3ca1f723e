package com.z254.sentinel.guardian.classify;

import com.z254.sentinel.guardian.domain.model.Layer;

import java.util.regex.Pattern;

/**
 * One entry of the classification table: a case-insensitive pattern voting for a layer.
 */
public record LayerPattern(Layer layer, String name, Pattern pattern) {

    public static LayerPattern of(Layer layer, String regex) {
        return new LayerPattern(layer, regex, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
