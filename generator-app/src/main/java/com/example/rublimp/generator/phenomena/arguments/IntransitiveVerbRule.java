package com.example.rublimp.generator.phenomena.arguments;

import com.example.rublimp.generator.lexicon.LexicalResources;
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
 * Puts an intransitive verb of the same aspect in place of a transitive one, leaving its object
 * without a governor. The first table entry of similar length that has the needed form is used.
 */
final class IntransitiveVerbRule implements PerturbationRule {

    static final String TRANSITIVE = "Tran";
    static final String INTRANSITIVE = "Intr";

    private static final List<String> VERBAL_CATEGORIES = List.of("Gender", "Mood", "Number", "Person", "Tense", "VerbForm");
    private static final int MAX_LENGTH_DIFFERENCE = 2;

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token verb = context.token(candidate.target());
        Analysis reading = context.targetReading(verb);
        String aspect = reading.features().get("Aspect");
        if (aspect == null) {
            return List.of();
        }
        FeatureBundle request = request(reading);
        for (LexicalResources.VerbEntry entry : context.resources().intransitiveVerbs()) {
            if (!aspect.equals(entry.aspect) || entry.lemma.equals(verb.lowerLemma())
                    || Syntax.isReflexiveVerbForm(entry.lemma)
                    || Math.abs(entry.lemma.length() - verb.lemma().length()) > MAX_LENGTH_DIFFERENCE) {
                continue;
            }
            if (context.analyzer().synthesize(entry.lemma, "VERB", request).isPresent()) {
                return List.of(entry.lemma);
            }
        }
        return List.of();
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token verb = context.token(candidate.target());
        PerturbedForm form = context.inflectLemma(verb, value, "VERB", request(context.targetReading(verb)));
        return Perturbation.builder(FeatureAxis.TRANSITIVITY, TRANSITIVE, INTRANSITIVE)
                .form(form)
                .annotate(FeatureAxis.TRANSITIVITY.category(), TRANSITIVE, INTRANSITIVE)
                .annotate("lemma", verb.lemma(), value)
                .build();
    }

    private static FeatureBundle request(Analysis reading) {
        return reading.features().restrictedTo(VERBAL_CATEGORIES);
    }
}
