package com.example.rublimp.generator.phenomena.negation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityCheck;
import com.example.rublimp.generator.phenomena.ValidityChecks;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;
import java.util.Locale;

/**
 * Negative pronouns without negation and indefinite pronouns under negation.
 */
public final class NegationPhenomena {

    public static final String FAMILY = "negation";

    static final String INDEFINITE_CONTEXT = "indefinite_context";

    private NegationPhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        return List.of(
                Phenomenon.builder("negative_pronouns_to", FAMILY, FeatureAxis.PRONOUN_TYPE)
                        .matcher(new NegativePronounMatcher("negative_pronouns_to", false, resources))
                        .rule(new PronounTypeRule(true))
                        .check(ValidityChecks.noHomonymy())
                        .build(),
                Phenomenon.builder("negative_pronouns_from", FAMILY, FeatureAxis.PRONOUN_TYPE)
                        .matcher(new NegativePronounMatcher("negative_pronouns_from", true, resources))
                        .rule(new PronounTypeRule(false))
                        .check(ValidityChecks.noHomonymy())
                        .check(indefiniteContext())
                        .build());
    }

    /**
     * Questions, imperatives and conditionals license {@code -то}/{@code -нибудь} pronouns under
     * negation, so no violation would arise there.
     */
    static ValidityCheck indefiniteContext() {
        return ValidityCheck.named(INDEFINITE_CONTEXT, (candidate, perturbation, context) -> {
            String target = perturbation.primary().target().toLowerCase(Locale.ROOT);
            if (!target.endsWith("нибудь") && !target.endsWith("то")) {
                return true;
            }
            return !isLicensingContext(context.sentence());
        });
    }

    static boolean isLicensingContext(AnnotatedSentence sentence) {
        List<Token> tokens = sentence.tokens();
        if ("?".equals(tokens.get(tokens.size() - 1).lemma())) {
            return true;
        }
        for (Token token : tokens) {
            if (token.isPos("VERB") && token.hasFeature("Mood", "Imp")) {
                return true;
            }
            if ("если".equals(token.lowerLemma()) || "бы".equals(token.lowerLemma())) {
                return true;
            }
        }
        return false;
    }
}
