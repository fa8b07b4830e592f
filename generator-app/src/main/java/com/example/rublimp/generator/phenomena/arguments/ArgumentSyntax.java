package com.example.rublimp.generator.phenomena.arguments;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.Optional;

final class ArgumentSyntax {

    private ArgumentSyntax() {
    }

    /**
     * A verb whose lexeme takes a direct object; participles only where {@code allowParticiple}.
     */
    static boolean isTransitiveVerb(Token token, LexicalResources resources, boolean allowParticiple) {
        if (!token.isPos("VERB") || token.feats().isEmpty()) {
            return false;
        }
        if (allowParticiple) {
            return true;
        }
        if (!token.hasFeature("VerbForm", "Fin") && !token.hasFeature("VerbForm", "Inf")) {
            return false;
        }
        return !resources.isIntransitive(token.lowerLemma());
    }

    static Optional<Token> argument(AnnotatedSentence sentence, Token verb, String relation) {
        return sentence.firstDependent(verb, dependent -> relation.equals(dependent.deprel()));
    }

    /**
     * Agreeing modifiers, name parts and finite verbal dependents would have to change along with
     * the noun.
     */
    static boolean hasModifiers(AnnotatedSentence sentence, Token token) {
        return sentence.hasDependent(token, dependent -> {
            String relation = dependent.deprel();
            if (("amod".equals(relation) || "det".equals(relation) || "nmod".equals(relation))
                    && dependent.feats().has("Case")) {
                return true;
            }
            if ("flat:name".equals(relation)) {
                return true;
            }
            return dependent.isPos("VERB") && !dependent.feats().isEmpty()
                    && !dependent.hasFeature("VerbForm", "Part");
        });
    }

    static boolean isAnimate(Token token) {
        return !token.hasFeature("Animacy", "Inan");
    }

    static boolean isInanimate(Token token) {
        String animacy = token.feature("Animacy");
        return animacy == null || "Inan".equals(animacy);
    }

    /**
     * Swapping two nouns keeps the verb's agreement only when both share gender and number.
     */
    static boolean isPermutable(Token a, Token b) {
        String gender = a.feature("Gender");
        String number = a.feature("Number");
        return gender != null && number != null
                && gender.equals(b.feature("Gender")) && number.equals(b.feature("Number"));
    }
}
