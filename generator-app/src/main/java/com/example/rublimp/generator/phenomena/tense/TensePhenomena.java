package com.example.rublimp.generator.phenomena.tense;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityChecks;

import java.util.List;

/**
 * Verb tense clashing with a time expression.
 */
public final class TensePhenomena {

    public static final String FAMILY = "tense";

    private TensePhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        TenseExpressions expressions = new TenseExpressions(resources);
        return List.of(
                Phenomenon.builder("verb_tense", FAMILY, FeatureAxis.TENSE)
                        .resolveTarget("Tense")
                        .matcher(new VerbTenseMatcher("verb_tense", expressions))
                        .rule(new VerbTenseRule())
                        .check(ValidityChecks.noHomonymy())
                        .build(),
                Phenomenon.builder("tense_marker", FAMILY, FeatureAxis.TENSE)
                        .matcher(new TenseMarkerMatcher("tense_marker", resources, expressions))
                        .rule(new TenseMarkerRule())
                        .build());
    }
}
