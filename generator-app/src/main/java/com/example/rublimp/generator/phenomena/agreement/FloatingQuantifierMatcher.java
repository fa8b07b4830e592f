package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@code сам} attached to a verb rather than to the noun it agrees with. The antecedent is an
 * argument of that verb with the same case, number and gender, or failing that an argument of the
 * conjunct the verb is coordinated with.
 */
final class FloatingQuantifierMatcher implements PatternMatcher {

    private static final Set<String> HOSTS = Set.of("nsubj", "obj", "iobj", "obl");

    private final String phenomenonId;
    private final FeatureAxis axis;

    FloatingQuantifierMatcher(String phenomenonId, FeatureAxis axis) {
        this.phenomenonId = phenomenonId;
        this.axis = axis;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token quantifier : sentence.tokens()) {
            if (!"сам".equals(quantifier.lowerLemma()) || quantifier.isRoot()) {
                continue;
            }
            if (quantifier.feature(axis.category()) == null
                    || Syntax.hasDependentWithRelation(sentence, quantifier, "fixed")) {
                continue;
            }
            if (axis == FeatureAxis.GENDER && !quantifier.hasFeature("Number", "Sing")) {
                continue;
            }
            Token verb = sentence.token(quantifier.head());
            if (!verb.isPos("VERB", "AUX") || Syntax.isParticiple(verb)) {
                continue;
            }
            String kind = "same_clause";
            Token antecedent = findAntecedent(sentence, quantifier, verb);
            if (antecedent == null && !verb.isRoot() && (verb.hasRelation("conj") || verb.hasRelation("parataxis"))) {
                antecedent = findAntecedent(sentence, quantifier, sentence.token(verb.head()));
                kind = "conj_clause";
            }
            if (antecedent == null) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, quantifier.index())
                    .controller(antecedent.index())
                    .detail("control_form", antecedent.form())
                    .detail("antecedent_kind", kind)
                    .build());
        }
        return candidates.stream();
    }

    private static Token findAntecedent(AnnotatedSentence sentence, Token quantifier, Token verb) {
        Token nearest = null;
        for (Token argument : sentence.dependents(verb)) {
            if (argument.index() == quantifier.index() || !Syntax.isNominal(argument) || !isHost(argument)) {
                continue;
            }
            if (!sameValue(argument, quantifier, "Case") || !sameValue(argument, quantifier, "Number")) {
                continue;
            }
            if (quantifier.hasFeature("Number", "Sing") && !sameValue(argument, quantifier, "Gender")) {
                continue;
            }
            if (nearest == null || Math.abs(argument.index() - quantifier.index())
                    < Math.abs(nearest.index() - quantifier.index())) {
                nearest = argument;
            }
        }
        return nearest;
    }

    private static boolean isHost(Token argument) {
        for (String relation : HOSTS) {
            if (argument.hasRelation(relation)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameValue(Token a, Token b, String category) {
        String value = a.feature(category);
        return value != null && value.equals(b.feature(category));
    }
}
