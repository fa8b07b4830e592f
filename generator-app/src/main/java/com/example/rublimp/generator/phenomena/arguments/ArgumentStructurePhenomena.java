package com.example.rublimp.generator.phenomena.arguments;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;

import java.util.List;

/**
 * Violations of the verb's selectional frame: an intransitive verb with an object, or an
 * inanimate noun in an animate argument slot.
 */
public final class ArgumentStructurePhenomena {

    public static final String FAMILY = "argument_structure";

    private ArgumentStructurePhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        return List.of(
                Phenomenon.builder("transitive_verb", FAMILY, FeatureAxis.TRANSITIVITY)
                        .resolveTarget("Aspect")
                        .matcher(new TransitiveVerbMatcher("transitive_verb", resources))
                        .rule(new IntransitiveVerbRule())
                        .build(),
                swap("transitive_verb_subject_perm", ArgumentSwapMatcher.Swap.SUBJECT, resources),
                swap("transitive_verb_passive_perm", ArgumentSwapMatcher.Swap.PASSIVE_AGENT, resources),
                swap("transitive_verb_iobj_perm", ArgumentSwapMatcher.Swap.INDIRECT_OBJECT, resources));
    }

    private static Phenomenon swap(String id, ArgumentSwapMatcher.Swap swap, LexicalResources resources) {
        return Phenomenon.builder(id, FAMILY, FeatureAxis.ANIMACY)
                .resolveTarget("Gender", "Number")
                .matcher(new ArgumentSwapMatcher(id, swap, resources))
                .rule(new ArgumentSwapRule())
                .build();
    }
}
