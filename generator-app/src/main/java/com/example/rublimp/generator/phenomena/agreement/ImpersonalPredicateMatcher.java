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
 * Finite predicates in the default form (singular, neuter in the past, third person otherwise)
 * because their subject carries no agreement features: a clause, or a genitive noun under
 * negation.
 */
final class ImpersonalPredicateMatcher implements PatternMatcher {

    enum Subject {
        CLAUSE,
        NEGATED_GENITIVE
    }

    private final String phenomenonId;
    private final FeatureAxis axis;
    private final Subject subject;

    ImpersonalPredicateMatcher(String phenomenonId, FeatureAxis axis, Subject subject) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
        this.subject = subject;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token predicate : sentence.tokens()) {
            if (!Syntax.isFiniteVerb(predicate) || !isDefaultForm(predicate)) {
                continue;
            }
            if (axis == FeatureAxis.GENDER && !predicate.hasFeature("Tense", "Past")) {
                continue;
            }
            Token trigger = subject == Subject.CLAUSE ? clausalSubject(sentence, predicate)
                    : genitiveSubject(sentence, predicate);
            if (trigger == null) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, predicate.index())
                    .detail("control_form", trigger.form())
                    .build());
        }
        return candidates.stream();
    }

    static boolean isDefaultForm(Token predicate) {
        if (!predicate.hasFeature("Number", "Sing")) {
            return false;
        }
        if (predicate.hasFeature("Tense", "Past")) {
            return predicate.hasFeature("Gender", "Neut");
        }
        return "3".equals(predicate.feature("Person"));
    }

    private static Token clausalSubject(AnnotatedSentence sentence, Token predicate) {
        if (!sentence.dependents(predicate, "nsubj").isEmpty()) {
            return null;
        }
        List<Token> clauses = sentence.dependents(predicate, "csubj");
        return clauses.isEmpty() ? null : clauses.get(0);
    }

    private static Token genitiveSubject(AnnotatedSentence sentence, Token predicate) {
        if (!Syntax.isNegated(sentence, predicate)) {
            return null;
        }
        for (Token candidate : sentence.dependents(predicate, "nsubj")) {
            if (Syntax.isNominal(candidate) && candidate.hasFeature("Case", "Gen")) {
                return candidate;
            }
        }
        return null;
    }
}
