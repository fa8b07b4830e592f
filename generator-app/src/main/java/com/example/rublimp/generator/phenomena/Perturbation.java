package com.example.rublimp.generator.phenomena;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of applying a rule with one alternative value: the altered forms and the feature
 * annotations describing the change.
 */
public final class Perturbation {

    private final FeatureAxis axis;
    private final String sourceValue;
    private final String targetValue;
    private final List<PerturbedForm> forms;
    private final Map<String, String> sourceAnnotations;
    private final Map<String, String> targetAnnotations;

    private Perturbation(FeatureAxis axis, String sourceValue, String targetValue, List<PerturbedForm> forms,
                         Map<String, String> sourceAnnotations, Map<String, String> targetAnnotations) {
        if (forms.isEmpty() || forms.size() > 2) {
            throw new IllegalArgumentException("A perturbation alters one or two tokens, got " + forms.size());
        }
        this.axis = Objects.requireNonNull(axis, "axis");
        this.sourceValue = Objects.requireNonNull(sourceValue, "sourceValue");
        this.targetValue = Objects.requireNonNull(targetValue, "targetValue");
        this.forms = List.copyOf(forms);
        this.sourceAnnotations = Collections.unmodifiableMap(new LinkedHashMap<>(sourceAnnotations));
        this.targetAnnotations = Collections.unmodifiableMap(new LinkedHashMap<>(targetAnnotations));
    }

    public static Perturbation of(FeatureAxis axis, String sourceValue, String targetValue, PerturbedForm form) {
        return new Perturbation(axis, sourceValue, targetValue, List.of(form), Map.of(), Map.of());
    }

    public static Builder builder(FeatureAxis axis, String sourceValue, String targetValue) {
        return new Builder(axis, sourceValue, targetValue);
    }

    public FeatureAxis axis() {
        return axis;
    }

    public String sourceValue() {
        return sourceValue;
    }

    public String targetValue() {
        return targetValue;
    }

    public List<PerturbedForm> forms() {
        return forms;
    }

    /**
     * The form of the candidate's target token.
     */
    public PerturbedForm primary() {
        return forms.get(0);
    }

    /**
     * Extra features recorded next to the source word's features.
     */
    public Map<String, String> sourceAnnotations() {
        return sourceAnnotations;
    }

    public Map<String, String> targetAnnotations() {
        return targetAnnotations;
    }

    @Override
    public String toString() {
        return axis + " " + sourceValue + "->" + targetValue + " " + forms;
    }

    public static final class Builder {
        private final FeatureAxis axis;
        private final String sourceValue;
        private final String targetValue;
        private final List<PerturbedForm> forms = new ArrayList<>();
        private final Map<String, String> sourceAnnotations = new LinkedHashMap<>();
        private final Map<String, String> targetAnnotations = new LinkedHashMap<>();

        private Builder(FeatureAxis axis, String sourceValue, String targetValue) {
            this.axis = axis;
            this.sourceValue = sourceValue;
            this.targetValue = targetValue;
        }

        public Builder form(PerturbedForm form) {
            forms.add(form);
            return this;
        }

        public Builder annotate(String key, String sourceValue, String targetValue) {
            sourceAnnotations.put(key, sourceValue);
            targetAnnotations.put(key, targetValue);
            return this;
        }

        public Builder annotateTarget(String key, String value) {
            targetAnnotations.put(key, value);
            return this;
        }

        public Perturbation build() {
            return new Perturbation(axis, sourceValue, targetValue, forms, sourceAnnotations, targetAnnotations);
        }
    }
}
