package com.example.rublimp.generator.pairs;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders both sentences of a pair and collects the word-level metadata.
 */
public final class PairAssembler {

    private final String domain;

    public PairAssembler(String domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public MinimalPair assemble(AnnotatedSentence sentence, Phenomenon phenomenon, Candidate candidate,
                                Perturbation perturbation) {
        Map<Integer, String> replacements = new LinkedHashMap<>();
        for (PerturbedForm form : perturbation.forms()) {
            replacements.put(form.tokenIndex(), form.target());
        }
        Token target = sentence.token(candidate.target());
        PerturbedForm primary = perturbation.primary();

        Map<String, String> sourceFeatures = new LinkedHashMap<>(target.feats().asMap());
        sourceFeatures.putAll(candidate.details());
        sourceFeatures.putAll(perturbation.sourceAnnotations());
        Map<String, String> targetFeatures = new LinkedHashMap<>(sourceFeatures);
        if (perturbation.axis().isClosed()) {
            sourceFeatures.put(perturbation.axis().category(), perturbation.sourceValue());
            targetFeatures.put(perturbation.axis().category(), perturbation.targetValue());
        }
        targetFeatures.putAll(perturbation.targetAnnotations());

        return MinimalPair.builder()
                .sentenceId(sentence.id())
                .sentences(sentence.render(), sentence.render(replacements))
                .phenomenon(phenomenon.family(), phenomenon.id(), candidate.subtype())
                .words(primary.source(), primary.target())
                .wordFeatures(bundle(sourceFeatures), bundle(targetFeatures))
                .feature(perturbation.axis().category())
                .domain(domain)
                .treeLength(treeLength(sentence, candidate))
                .length(sentence.size())
                .treeDepth(sentence.treeDepth())
                .build();
    }

    /**
     * Path from the target to its controller, or to its head when the candidate has none.
     */
    static int treeLength(AnnotatedSentence sentence, Candidate candidate) {
        Token target = sentence.token(candidate.target());
        if (candidate.hasController()) {
            return sentence.pathLength(target, sentence.token(candidate.controller()));
        }
        return target.isRoot() ? 0 : 1;
    }

    /**
     * Empty values mark categories the target form no longer carries.
     */
    private static FeatureBundle bundle(Map<String, String> features) {
        features.values().removeIf(String::isEmpty);
        return FeatureBundle.of(features);
    }
}
