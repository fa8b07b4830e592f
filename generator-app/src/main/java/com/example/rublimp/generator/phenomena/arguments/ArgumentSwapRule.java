package com.example.rublimp.generator.phenomena.arguments;

import com.example.rublimp.generator.morphology.Analysis;
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
 * Exchanges the lemmas of the animate and the inanimate argument, each keeping the case and
 * number of its slot, so that an inanimate noun ends up in the animate role.
 */
final class ArgumentSwapRule implements PerturbationRule {

    private static final List<String> SLOT_CATEGORIES = List.of("Case", "Number");

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token animate = context.token(candidate.target());
        Analysis reading = context.targetReading(animate);
        if (reading.features().hasValue("Animacy", "Inan") || reading.features().has("NameType")) {
            return List.of();
        }
        return List.of("Inan");
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token animate = context.token(candidate.target());
        Token inanimate = context.token(candidate.controller());
        FeatureBundle animateSlot = animate.feats().restrictedTo(SLOT_CATEGORIES);
        FeatureBundle inanimateSlot = inanimate.feats().restrictedTo(SLOT_CATEGORIES);
        if (animateSlot.isEmpty() || inanimateSlot.isEmpty()) {
            throw new UnsynthesizableException("arguments of " + candidate + " carry no case or number");
        }
        PerturbedForm intoAnimateSlot = context.inflectLemma(animate, inanimate.lemma(), inanimate.upos(), animateSlot);
        PerturbedForm intoInanimateSlot = context.inflectLemma(inanimate, animate.lemma(), animate.upos(), inanimateSlot);
        return Perturbation.builder(FeatureAxis.ANIMACY, "Anim", value)
                .form(intoAnimateSlot)
                .form(intoInanimateSlot)
                .annotate("index", Integer.toString(animate.index()), Integer.toString(inanimate.index()))
                .build();
    }
}
