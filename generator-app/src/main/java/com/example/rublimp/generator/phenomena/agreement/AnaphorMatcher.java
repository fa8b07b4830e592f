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
 * The relative pronoun {@code который} agreeing with the noun its clause modifies.
 */
final class AnaphorMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final FeatureAxis axis;

    AnaphorMatcher(String phenomenonId, FeatureAxis axis) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token pronoun : sentence.tokens()) {
            if (!"который".equals(pronoun.lowerLemma()) || pronoun.isRoot()) {
                continue;
            }
            Token clause = sentence.token(pronoun.head());
            if (!clause.hasRelation("acl") || clause.isRoot()) {
                continue;
            }
            Token noun = sentence.token(clause.head());
            if (!Syntax.isNominal(noun) || Syntax.hasNumeralModifier(sentence, noun)) {
                continue;
            }
            String value = pronoun.feature(axis.category());
            if (value == null || !value.equals(noun.feature(axis.category()))) {
                continue;
            }
            if (axis == FeatureAxis.GENDER && !pronoun.hasFeature("Number", "Sing")) {
                continue;
            }
            if (Syntax.hasDependentsBesides(sentence, pronoun, "case")) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, pronoun.index())
                    .controller(noun.index())
                    .detail("control_form", noun.form())
                    .build());
        }
        return candidates.stream();
    }
}
