package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural predicates shared by the matchers.
 */
public final class Syntax {

    /** Categories a form inflects for; lexical categories such as aspect stay with the lemma. */
    public static final List<String> INFLECTIONAL = List.of(
            "Animacy", "Case", "Degree", "Gender", "Mood", "Number", "Person", "Tense", "Variant", "VerbForm", "Voice");

    private static final Set<String> NOMINALS = Set.of("NOUN", "PROPN", "PRON");

    private Syntax() {
    }

    public static boolean isNominal(Token token) {
        return NOMINALS.contains(token.upos());
    }

    public static boolean isFiniteVerb(Token token) {
        return token.isPos("VERB", "AUX") && token.hasFeature("VerbForm", "Fin");
    }

    public static boolean isParticiple(Token token) {
        return token.isPos("VERB", "AUX") && token.hasFeature("VerbForm", "Part");
    }

    public static boolean isReflexiveVerbForm(String form) {
        String lower = form.toLowerCase(Locale.ROOT);
        return lower.endsWith("ся") || lower.endsWith("сь");
    }

    /**
     * True when the token has a dependent other than punctuation and the listed relations.
     */
    public static boolean hasDependentsBesides(AnnotatedSentence sentence, Token token, String... allowedRelations) {
        for (Token dependent : sentence.dependents(token)) {
            if (dependent.isPos("PUNCT")) {
                continue;
            }
            boolean allowed = false;
            for (String relation : allowedRelations) {
                if (dependent.hasRelation(relation)) {
                    allowed = true;
                    break;
                }
            }
            if (!allowed) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasDependentWithRelation(AnnotatedSentence sentence, Token token, String... relations) {
        for (Token dependent : sentence.dependents(token)) {
            for (String relation : relations) {
                if (dependent.deprel().equals(relation)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Numerals governing or modifying the noun change its agreement pattern.
     */
    public static boolean hasNumeralModifier(AnnotatedSentence sentence, Token token) {
        return hasDependentWithRelation(sentence, token, "nummod", "nummod:gov");
    }

    /**
     * The inflectional part of a reading, the starting point of a synthesis request.
     */
    public static FeatureBundle inflectional(FeatureBundle features) {
        return features.restrictedTo(INFLECTIONAL);
    }

    /**
     * Negated by a {@code не} particle attached to the token.
     */
    public static boolean isNegated(AnnotatedSentence sentence, Token token) {
        return sentence.hasDependent(token, dependent -> "не".equals(dependent.lowerLemma())
                && dependent.isPos("PART"));
    }
}
