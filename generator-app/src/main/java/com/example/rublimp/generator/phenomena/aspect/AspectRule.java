package com.example.rublimp.generator.phenomena.aspect;

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
import java.util.Locale;
import java.util.Optional;

/**
 * Replaces an imperfective verb by its most frequent perfective partner, inflected like the
 * original form.
 */
final class AspectRule implements PerturbationRule {

    private static final String PERFECTIVE = "Perf";

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token verb = context.token(candidate.target());
        Analysis reading = context.targetReading(verb);
        return context.resources().perfectivePartner(reading.lemma().toLowerCase(Locale.ROOT)).isPresent()
                ? List.of(PERFECTIVE)
                : List.of();
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token verb = context.token(candidate.target());
        Analysis reading = context.targetReading(verb);
        Optional<String> partner = context.resources()
                .perfectivePartner(reading.lemma().toLowerCase(Locale.ROOT));
        if (partner.isEmpty()) {
            throw new UnsynthesizableException("no perfective partner for " + reading.lemma());
        }
        FeatureBundle request = Syntax.inflectional(reading.features()).with("Aspect", value);
        PerturbedForm form = context.inflectLemma(verb, partner.get(), reading.pos(), request);
        String source = reading.features().get("Aspect") == null ? "Imp" : reading.features().get("Aspect");
        return Perturbation.builder(FeatureAxis.ASPECT, source, value)
                .form(form)
                .annotate("lemma", reading.lemma(), partner.get())
                .build();
    }
}
