package com.example.rublimp.generator.phenomena.aspect;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityCheck;
import com.example.rublimp.generator.phenomena.ValidityChecks;

import java.util.List;
import java.util.Locale;

/**
 * Perfective verbs in contexts that require the imperfective.
 */
public final class AspectPhenomena {

    public static final String FAMILY = "aspect";

    static final String REFLEXIVE_POSTFIX = "reflexive_postfix";
    static final String NO_COMPARISON = "no_comparison";

    private AspectPhenomena() {
    }

    public static List<Phenomenon> create(LexicalResources resources) {
        return List.of(
                phenomenon("change_duration_aspect", new AspectContextMatcher("change_duration_aspect",
                        AspectContextMatcher.Context.DURATION, resources)),
                phenomenon("change_repetition_aspect", new AspectContextMatcher("change_repetition_aspect",
                        AspectContextMatcher.Context.REPETITION, resources)),
                phenomenon("deontic_imp", new DeonticMatcher("deontic_imp", resources)));
    }

    private static Phenomenon phenomenon(String id, PatternMatcher matcher) {
        return Phenomenon.builder(id, FAMILY, FeatureAxis.ASPECT)
                .resolveTarget("Aspect")
                .matcher(matcher)
                .rule(new AspectRule())
                .check(ValidityChecks.noHomonymy())
                .check(reflexivePostfix())
                .check(noComparison())
                .build();
    }

    /**
     * The partner must agree with the source form in carrying {@code -ся}/{@code -сь} or not.
     */
    static ValidityCheck reflexivePostfix() {
        return ValidityCheck.named(REFLEXIVE_POSTFIX, (candidate, perturbation, context) -> {
            String source = perturbation.primary().source().toLowerCase(Locale.ROOT);
            String target = perturbation.primary().target().toLowerCase(Locale.ROOT);
            return source.endsWith("ся") == target.endsWith("ся") && source.endsWith("сь") == target.endsWith("сь");
        });
    }

    static ValidityCheck noComparison() {
        return ValidityCheck.named(NO_COMPARISON, (candidate, perturbation, context) ->
                !AspectSyntax.inComparison(context.sentence(), context.token(candidate.target())));
    }
}
