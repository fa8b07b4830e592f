package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.morphology.Analysis;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.PerturbationRule;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Re-inflects the agreeing word for another value of the agreement category, breaking agreement
 * with its controller.
 */
final class AgreementRule implements PerturbationRule {

    private static final Set<String> NOMINALS = Set.of("NOUN", "PROPN", "PRON");

    private final FeatureAxis axis;

    AgreementRule(FeatureAxis axis) {
        this.axis = Objects.requireNonNull(axis, "axis");
    }

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token target = context.token(candidate.target());
        String source = context.targetReading(target).features().get(axis.category());
        if (source == null) {
            return List.of();
        }
        return axis.alternatives(source);
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token target = context.token(candidate.target());
        Analysis reading = context.targetReading(target);
        String source = reading.features().get(axis.category());
        FeatureBundle request = axis.retarget(Syntax.inflectional(reading.features()), value, reading.pos());
        if (candidate.hasController()) {
            FeatureBundle controller = context.controllerReading(context.token(candidate.controller())).features();
            request = completeFromController(request, controller, reading.pos());
        }
        PerturbedForm form = context.inflect(target, reading, request);
        return Perturbation.of(axis, source, value, form);
    }

    /**
     * Singular past and adjectival forms need a gender, masculine and plural accusative adjectives
     * an animacy; both come from the controller when the target had none.
     */
    private FeatureBundle completeFromController(FeatureBundle request, FeatureBundle controller, String pos)
            throws UnsynthesizableException {
        FeatureBundle result = request;
        boolean nominal = NOMINALS.contains(pos);
        boolean past = result.hasValue("Tense", "Past");
        boolean adjectival = !nominal && result.has("Case");
        if (result.hasValue("Number", "Sing") && !result.has("Gender") && (past || adjectival)) {
            String gender = controller.get("Gender");
            if (gender == null) {
                throw new UnsynthesizableException("gender of the controller is unknown");
            }
            result = result.with("Gender", gender);
        }
        boolean marksAnimacy = result.hasValue("Number", "Plur") || result.hasValue("Gender", "Masc");
        if (adjectival && marksAnimacy && result.hasValue("Case", "Acc") && !result.has("Animacy")
                && controller.has("Animacy")) {
            result = result.with("Animacy", controller.get("Animacy"));
        }
        return result;
    }
}
