package com.example.rublimp.generator.phenomena.government;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityChecks;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Case government by verbs, prepositions and verbal nouns.
 */
public final class GovernmentPhenomena {

    public static final String FAMILY = "government";

    private GovernmentPhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        return List.of(
                phenomenon("verb_acc_object", new ObjectCaseMatcher("verb_acc_object", "Acc", resources),
                        new GovernmentRule(Set.of("Acc", "Nom"), Map.of(), false, false)),
                phenomenon("verb_gen_object", new ObjectCaseMatcher("verb_gen_object", "Gen", resources),
                        new GovernmentRule(Set.of("Gen", "Acc", "Dat", "Nom"), Map.of(), false, false)),
                phenomenon("verb_ins_object", new ObjectCaseMatcher("verb_ins_object", "Ins", resources),
                        new GovernmentRule(Set.of("Acc", "Ins", "Nom", "Gen"), Map.of(), false, true)),
                phenomenon("adp_government_case", new AdpositionCaseMatcher("adp_government_case", resources),
                        new GovernmentRule(Set.of("Nom", "Gen", "Acc"),
                                Map.of("Gen", List.of("Loc", "Dat"), "Loc", List.of("Gen")), true, false)),
                phenomenon("nominalization_case", new NominalizationMatcher("nominalization_case", resources),
                        new GovernmentRule(Set.of(),
                                Map.of("Ins", List.of("Gen"), "Gen", List.of("Ins", "Dat")), false, false)));
    }

    private static Phenomenon phenomenon(String id, PatternMatcher matcher, GovernmentRule rule) {
        return Phenomenon.builder(id, FAMILY, FeatureAxis.CASE)
                .resolveTarget("Case", "Number")
                .matcher(matcher)
                .rule(rule)
                .check(ValidityChecks.noHomonymy())
                .build();
    }
}
