package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Adjectives, determiners and participles modifying a noun, without modifiers of their own.
 */
final class NounPhraseMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final FeatureAxis axis;

    NounPhraseMatcher(String phenomenonId, FeatureAxis axis) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token modifier : sentence.tokens()) {
            boolean adjectival = modifier.isPos("ADJ", "DET") && (modifier.hasRelation("amod") || modifier.hasRelation("det"));
            boolean participle = Syntax.isParticiple(modifier) && (modifier.hasRelation("amod") || modifier.hasRelation("acl"));
            if (!adjectival && !participle) {
                continue;
            }
            if (modifier.isRoot() || "сам".equals(modifier.lowerLemma()) || modifier.hasFeature("Variant", "Short")) {
                continue;
            }
            Token noun = sentence.token(modifier.head());
            if (!noun.isPos("NOUN", "PROPN") || Syntax.hasNumeralModifier(sentence, noun)) {
                continue;
            }
            String value = modifier.feature(axis.category());
            if (value == null || !value.equals(noun.feature(axis.category()))) {
                continue;
            }
            if (axis == FeatureAxis.GENDER && !modifier.hasFeature("Number", "Sing")) {
                continue;
            }
            if (Syntax.hasDependentsBesides(sentence, modifier)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, modifier.index())
                    .controller(noun.index())
                    .subtype(participle ? phenomenonId + "_participle" : phenomenonId)
                    .detail("control_form", noun.form())
                    .build());
        }
        return candidates.stream();
    }
}
