package com.example.rublimp.generator.phenomena.government;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.Set;

/**
 * Restrictions shared by the government matchers: the governed word must be a bare nominal whose
 * case is fixed by its governor alone.
 */
final class GovernedNominals {

    private static final Set<String> STOP_POS = Set.of("NUM", "ADJ", "DET", "ADP");
    private static final Set<String> STOP_RELATIONS = Set.of(
            "amod", "det", "nmod", "nummod", "nummod:gov", "flat:name", "appos", "acl:relcl", "acl");

    private GovernedNominals() {
    }

    static boolean isCaseBearer(Token token) {
        return token.feats().has("Case") && (token.isPos("NOUN", "PRON") || Syntax.isParticiple(token));
    }

    static boolean isBare(AnnotatedSentence sentence, Token token, LexicalResources resources, boolean allowAdposition) {
        for (Token dependent : sentence.dependents(token)) {
            if (STOP_POS.contains(dependent.upos()) && !(allowAdposition && dependent.isPos("ADP"))) {
                return false;
            }
            if (STOP_RELATIONS.contains(dependent.deprel()) || Syntax.isParticiple(dependent)) {
                return false;
            }
            if (Syntax.isNominal(dependent) && dependent.feats().has("Case")) {
                return false;
            }
        }
        return !sentence.isQuoted(token) && !resources.isWhWord(token.lemma());
    }

    /**
     * A finite or participial verb that governs case on its own: not reflexive, not an
     * infinitive, not a modal.
     */
    static boolean isPlainGoverningVerb(Token verb, LexicalResources resources) {
        return verb.isPos("VERB")
                && !Syntax.isReflexiveVerbForm(verb.form())
                && !verb.hasFeature("VerbForm", "Inf")
                && !resources.isModalVerb(verb.lowerLemma());
    }
}
