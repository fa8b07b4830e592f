package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityCheck;
import com.example.rublimp.generator.phenomena.ValidityChecks;

import java.util.List;

/**
 * Affixation that yields non-existent derived words.
 */
public final class WordFormationPhenomena {

    public static final String FAMILY = "word_formation";

    /** Derived verbs at or above this frequency are real words missing from the lexicon. */
    static final double MAX_DERIVED_IPM = 0.4;

    static final String LOW_FREQUENCY = "low_frequency";

    private WordFormationPhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        return List.of(
                Phenomenon.builder("add_new_suffix", FAMILY, FeatureAxis.MORPHEME)
                        .matcher(new SegmentedWordMatcher("add_new_suffix", resources,
                                (sentence, token) -> token.isPos("ADJ") || token.isPos("NOUN")
                                        && sentence.hasDependent(token, dependent -> dependent.isPos("ADJ")
                                        && "amod".equals(dependent.deprel())),
                                segmentation -> true))
                        .rule(new SuffixInsertionRule())
                        .check(ValidityChecks.noHomonymy())
                        .build(),
                Phenomenon.builder("add_verb_prefix", FAMILY, FeatureAxis.MORPHEME)
                        .matcher(new SegmentedWordMatcher("add_verb_prefix", resources,
                                (sentence, token) -> token.isPos("VERB"),
                                segmentation -> segmentation.prefixes().size() == 1))
                        .rule(new PrefixInsertionRule())
                        .check(ValidityChecks.noHomonymy())
                        .check(lowFrequency())
                        .build(),
                Phenomenon.builder("change_verb_prefixes_order", FAMILY, FeatureAxis.MORPHEME)
                        .matcher(new SegmentedWordMatcher("change_verb_prefixes_order", resources,
                                (sentence, token) -> token.isPos("VERB"),
                                segmentation -> segmentation.prefixes().size() == 2))
                        .rule(new PrefixOrderRule())
                        .check(ValidityChecks.noHomonymy())
                        .check(lowFrequency())
                        .build());
    }

    /**
     * The derived lemma must be rare in the frequency list.
     */
    static ValidityCheck lowFrequency() {
        return ValidityCheck.named(LOW_FREQUENCY, (candidate, perturbation, context) -> {
            String lemma = perturbation.targetAnnotations().get("lemma");
            return lemma == null || context.resources().ipm(lemma) < MAX_DERIVED_IPM;
        });
    }
}
