package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finite predicates agreeing with a nominal subject. An intervening word inside the subject phrase
 * with a different value of the same category is recorded as an attractor.
 */
final class SubjectPredicateMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final FeatureAxis axis;

    SubjectPredicateMatcher(String phenomenonId, FeatureAxis axis) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token predicate : sentence.tokens()) {
            if (!Syntax.isFiniteVerb(predicate) || !inflectsForAxis(predicate)) {
                continue;
            }
            if ("быть".equals(predicate.lowerLemma()) && predicate.hasFeature("Tense", "Pres")) {
                continue;
            }
            for (Token subject : sentence.dependents(predicate, "nsubj")) {
                if (!Syntax.isNominal(subject) || Syntax.hasNumeralModifier(sentence, subject)) {
                    continue;
                }
                if (subject.hasFeature("PronType", "Rel") || subject.hasFeature("Case", "Gen")) {
                    continue;
                }
                String value = controllerValue(subject);
                if (value == null || !value.equals(predicate.feature(axis.category()))) {
                    continue;
                }
                Candidate.Builder builder = Candidate.builder(phenomenonId, predicate.index())
                        .controller(subject.index())
                        .detail("control_form", subject.form());
                Token attractor = findAttractor(sentence, subject, predicate, value);
                if (attractor != null) {
                    builder.attractor(attractor.index())
                            .subtype("subj_predicate_agreement_" + axis.category().toLowerCase(Locale.ROOT) + "_attractor")
                            .detail("attractor_form", attractor.form());
                }
                candidates.add(builder.build());
            }
        }
        return candidates.stream();
    }

    private boolean inflectsForAxis(Token predicate) {
        switch (axis) {
            case NUMBER:
                return predicate.feats().has("Number");
            case GENDER:
                return predicate.hasFeature("Tense", "Past") && predicate.hasFeature("Number", "Sing")
                        && predicate.feats().has("Gender");
            case PERSON:
                return predicate.feats().has("Person") && !predicate.hasFeature("Tense", "Past")
                        && !predicate.hasFeature("Mood", "Imp");
            default:
                return false;
        }
    }

    private String controllerValue(Token subject) {
        if (axis == FeatureAxis.PERSON) {
            if (subject.isPos("PRON")) {
                return subject.feature("Person");
            }
            return "3";
        }
        return subject.feature(axis.category());
    }

    private Token findAttractor(AnnotatedSentence sentence, Token subject, Token predicate, String value) {
        if (axis == FeatureAxis.PERSON) {
            return null;
        }
        Token nearest = null;
        for (Token token : sentence.between(subject, predicate)) {
            if (!Syntax.isNominal(token) || !sentence.isDescendant(token, subject)) {
                continue;
            }
            String attractorValue = token.feature(axis.category());
            if (attractorValue == null || attractorValue.equals(value)) {
                continue;
            }
            if (nearest == null || Math.abs(token.index() - predicate.index())
                    < Math.abs(nearest.index() - predicate.index())) {
                nearest = token;
            }
        }
        return nearest;
    }
}
