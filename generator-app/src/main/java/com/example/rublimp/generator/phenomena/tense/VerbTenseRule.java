package com.example.rublimp.generator.phenomena.tense;

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

/**
 * Moves a perfective verb between past and future: {@code вчера сделал -> вчера сделает}.
 */
final class VerbTenseRule implements PerturbationRule {

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        String tense = context.targetReading(context.token(candidate.target())).features().get("Tense");
        return tense == null ? List.of() : List.of(TenseExpressions.opposite(tense));
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token verb = context.token(candidate.target());
        Analysis reading = context.targetReading(verb);
        String source = reading.features().get("Tense");
        String person = candidate.detail("Person");
        String number = candidate.detail("Number");
        String gender = candidate.detail("Gender");
        if ("1".equals(person) && "Fut".equals(source) && gender == null && !"Plur".equals(number)) {
            throw new UnsynthesizableException("gender of a first person future subject is unknown");
        }

        FeatureBundle request = Syntax.inflectional(reading.features())
                .without("Person").without("Gender").without("Number")
                .with("Tense", value)
                .with("Number", number);
        if ("Past".equals(value)) {
            if (!"Plur".equals(number)) {
                request = request.with("Gender", gender);
            }
        } else {
            request = request.with("Person", person == null ? "3" : person);
        }
        PerturbedForm form = context.inflect(verb, reading, request);

        Perturbation.Builder builder = Perturbation.builder(FeatureAxis.TENSE, source, value).form(form);
        if ("Past".equals(value)) {
            builder.annotateTarget("Person", "");
        } else {
            builder.annotateTarget("Gender", "");
        }
        return builder.build();
    }
}
