package com.example.rublimp.generator.phenomena.inflection;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.phenomena.ValidityChecks;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;
import java.util.stream.Stream;

/**
 * Endings borrowed from the wrong declension or conjugation class.
 */
public final class InflectionPhenomena {

    public static final String FAMILY = "word_inflection";

    static final String DECLENSION = "change_declension_ending";
    static final String CONJUGATION = "change_verb_conjugation";

    private InflectionPhenomena() {
    }

    public static List<Phenomenon> create() {
        return List.of(
                Phenomenon.builder(DECLENSION, FAMILY, FeatureAxis.MORPHEME)
                        .matcher(InflectionPhenomena::declinedNouns)
                        .rule(new DeclensionEndingRule())
                        .check(ValidityChecks.noHomonymy())
                        .build(),
                Phenomenon.builder(CONJUGATION, FAMILY, FeatureAxis.MORPHEME)
                        .matcher(InflectionPhenomena::conjugatedVerbs)
                        .rule(new ConjugationEndingRule())
                        .check(ValidityChecks.noHomonymy())
                        .build());
    }

    static Stream<Candidate> declinedNouns(AnnotatedSentence sentence) {
        return sentence.tokens().stream()
                .filter(token -> token.isPos("NOUN") && token.feats().has("Number") && token.feats().has("Case"))
                .map(token -> withHead(Candidate.builder(DECLENSION, token.index()), token)
                        .subtype(hasAgreeingDependent(sentence, token) ? DECLENSION + "_has_dep" : DECLENSION)
                        .build());
    }

    static Stream<Candidate> conjugatedVerbs(AnnotatedSentence sentence) {
        return sentence.tokens().stream()
                .filter(token -> token.isPos("VERB") && Syntax.isFiniteVerb(token)
                        && (token.hasFeature("Tense", "Pres") || token.hasFeature("Tense", "Fut")))
                .map(token -> withHead(Candidate.builder(CONJUGATION, token.index()), token).build());
    }

    private static Candidate.Builder withHead(Candidate.Builder builder, Token token) {
        return token.isRoot() ? builder : builder.controller(token.head());
    }

    private static boolean hasAgreeingDependent(AnnotatedSentence sentence, Token noun) {
        return sentence.hasDependent(noun, dependent -> dependent.isPos("ADJ", "DET") || Syntax.isParticiple(dependent));
    }
}
