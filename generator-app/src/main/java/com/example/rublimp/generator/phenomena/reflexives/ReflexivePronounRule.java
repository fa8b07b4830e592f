package com.example.rublimp.generator.phenomena.reflexives;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.PerturbationRule;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;

/**
 * Replaces the possessor by the reflexive {@code себя}, which has no antecedent there.
 */
final class ReflexivePronounRule implements PerturbationRule {

    static final String REFLEXIVE = "себя";

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        return List.of(REFLEXIVE);
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token possessor = context.token(candidate.target());
        PerturbedForm form = context.replace(possessor, value);
        String position = Integer.toString(possessor.index());
        return Perturbation.builder(FeatureAxis.LEMMA, possessor.lemma(), value)
                .form(form)
                .annotate("lemma", possessor.lemma(), value)
                .annotate("position", position, position)
                .build();
    }
}
