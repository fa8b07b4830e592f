package com.example.rublimp.generator.phenomena.negation;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.PerturbationRule;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;

/**
 * Swaps an indefinite pronoun for its negative counterpart or back, keeping case and number.
 * Values are the counterpart lemmas.
 */
final class PronounTypeRule implements PerturbationRule {

    static final String INDEFINITE = "indefinite";
    static final String NEGATIVE = "negative";

    private final boolean towardsNegative;

    PronounTypeRule(boolean towardsNegative) {
        this.towardsNegative = towardsNegative;
    }

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        String lemma = context.token(candidate.target()).lowerLemma();
        return towardsNegative
                ? context.resources().negativeCounterparts(lemma)
                : context.resources().indefiniteCounterparts(lemma);
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token pronoun = context.token(candidate.target());
        PerturbedForm form;
        if (pronoun.lowerForm().startsWith("что")) {
            form = context.replace(pronoun, "ничего");
        } else {
            FeatureBundle request = pronoun.feats().restrictedTo(
                    pronoun.isPos("PRON") ? List.of("Case", "Number") : List.of("Case", "Gender", "Number"));
            form = request.isEmpty()
                    ? context.replace(pronoun, value)
                    : context.inflectLemma(pronoun, value, pronoun.upos(), request);
        }
        String source = towardsNegative ? INDEFINITE : NEGATIVE;
        String target = towardsNegative ? NEGATIVE : INDEFINITE;
        return Perturbation.builder(FeatureAxis.PRONOUN_TYPE, source, target)
                .form(form)
                .annotate("pronoun_type", source, target)
                .build();
    }
}
