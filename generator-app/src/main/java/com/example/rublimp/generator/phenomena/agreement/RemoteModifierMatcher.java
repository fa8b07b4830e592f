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
 * Appositive adjectives ({@code acl}) set off from their noun by punctuation or by at least
 * {@value #MIN_HEAD_DISTANCE} positions.
 */
final class RemoteModifierMatcher implements PatternMatcher {

    static final int MIN_HEAD_DISTANCE = 5;

    private final String phenomenonId;
    private final FeatureAxis axis;

    RemoteModifierMatcher(String phenomenonId, FeatureAxis axis) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token modifier : sentence.tokens()) {
            if (!modifier.isPos("ADJ") || !"acl".equals(modifier.deprel())
                    || modifier.hasFeature("Variant", "Short") || "сам".equals(modifier.lowerLemma())) {
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
            if (!isSetOff(sentence, noun, modifier)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, modifier.index())
                    .controller(noun.index())
                    .detail("control_form", noun.form())
                    .detail("head_distance", Integer.toString(Math.abs(modifier.index() - noun.index())))
                    .build());
        }
        return candidates.stream();
    }

    private static boolean isSetOff(AnnotatedSentence sentence, Token noun, Token modifier) {
        if (Math.abs(modifier.index() - noun.index()) >= MIN_HEAD_DISTANCE) {
            return true;
        }
        for (Token token : sentence.between(noun, modifier)) {
            if (token.isPos("PUNCT")) {
                return true;
            }
        }
        return false;
    }
}
