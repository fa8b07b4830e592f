package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.sentence.FeatureBundle;

import java.util.List;
import java.util.Optional;

/**
 * Morphological analyzer and synthesizer consumed by the perturbation engine. Implementations
 * must be safe for concurrent reads.
 */
public interface MorphologyAnalyzer {

    /**
     * All readings of a surface form in analyzer order; empty when the form is unknown.
     */
    List<Analysis> analyze(String surface);

    /**
     * Form of the paradigm cell of {@code lemma} that carries every requested feature.
     */
    Optional<String> synthesize(String lemma, String pos, FeatureBundle features);

    List<Analysis> paradigm(String lemma, String pos);

    boolean isKnown(String surface);
}
