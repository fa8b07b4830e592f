package com.example.rublimp.generator.phenomena.aspect;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

final class AspectSyntax {

    private AspectSyntax() {
    }

    static boolean isReplaceableImperfective(Token verb, LexicalResources resources) {
        return verb.isPos("VERB") && verb.hasFeature("Aspect", "Imp")
                && !resources.isAspectExcludedForm(verb.form());
    }

    /**
     * Not a complement of another verb and not heading verbal complements, conjuncts or
     * perfective verbs whose aspect would have to change too.
     */
    static boolean isStandalone(AnnotatedSentence sentence, Token verb) {
        if ("xcomp".equals(verb.deprel()) || "csubj".equals(verb.deprel())) {
            return false;
        }
        if (!verb.isRoot() && sentence.token(verb.head()).isPos("VERB")) {
            return false;
        }
        return !sentence.hasDependent(verb, dependent -> dependent.isPos("VERB")
                && ("xcomp".equals(dependent.deprel()) || "csubj".equals(dependent.deprel())
                || "conj".equals(dependent.deprel()) || dependent.hasFeature("Aspect", "Perf")));
    }

    /**
     * A comparison ({@code чем} or a comparative degree) attached to the verb, to its head, or to
     * one of its dependents.
     */
    static boolean inComparison(AnnotatedSentence sentence, Token verb) {
        for (Token token : sentence.tokens()) {
            if (!"чем".equals(token.lowerLemma()) && !token.hasFeature("Degree", "Cmp")) {
                continue;
            }
            if (token.isRoot()) {
                continue;
            }
            if (token.head() == verb.index() || (!verb.isRoot() && token.head() == verb.head())) {
                return true;
            }
            Token head = sentence.token(token.head());
            if (head.head() == verb.index()) {
                return true;
            }
        }
        return false;
    }
}
