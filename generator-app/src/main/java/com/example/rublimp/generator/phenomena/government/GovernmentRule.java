package com.example.rublimp.generator.phenomena.government;

import com.example.rublimp.generator.morphology.Analysis;
import com.example.rublimp.generator.morphology.Orthography;
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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moves a governed nominal to a case its governor does not assign. Cases the governor could
 * assign, and cases whose forms are easily confused with them, are never used; a new form that
 * spells one of their forms, or any form of the other number, is rejected.
 */
final class GovernmentRule implements PerturbationRule {

    private final Set<String> stopCases;
    private final Map<String, List<String>> overlaps;
    private final boolean adpositional;
    private final boolean rejectInstrumentalPronouns;

    GovernmentRule(Set<String> stopCases, Map<String, List<String>> overlaps,
                   boolean adpositional, boolean rejectInstrumentalPronouns) {
        this.stopCases = Set.copyOf(stopCases);
        this.overlaps = Map.copyOf(overlaps);
        this.adpositional = adpositional;
        this.rejectInstrumentalPronouns = rejectInstrumentalPronouns;
    }

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token target = context.token(candidate.target());
        String source = context.targetReading(target).features().get("Case");
        if (source == null) {
            return List.of();
        }
        return FeatureAxis.CASE.alternatives(source).stream()
                .filter(value -> !blockedCases(candidate, source, context).contains(value))
                .collect(Collectors.toList());
    }

    private Set<String> blockedCases(Candidate candidate, String source, PerturbationContext context) {
        Set<String> blocked = new LinkedHashSet<>(stopCases);
        blocked.add(source);
        blocked.addAll(overlaps.getOrDefault(source, List.of()));
        if (adpositional && candidate.detail("adposition") != null) {
            blocked.addAll(context.resources().adpositionCases(candidate.detail("adposition")));
        }
        return blocked;
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token target = context.token(candidate.target());
        Analysis reading = context.targetReading(target);
        String source = reading.features().get("Case");
        FeatureBundle request = Syntax.inflectional(reading.features()).with("Case", value);
        PerturbedForm form = context.inflect(target, reading, request);
        String unified = Orthography.unify(form.target());
        if (rejectInstrumentalPronouns && context.resources().isInstrumentalPronoun(unified)) {
            throw new UnsynthesizableException("'" + unified + "' is an instrumental pronoun form");
        }
        for (String stop : stopForms(candidate, source, reading, context)) {
            if (Orthography.unify(stop).equals(unified)) {
                throw new UnsynthesizableException("'" + unified + "' coincides with a form the governor allows");
            }
        }
        String governor = candidate.hasController() ? Orthography.unify(context.token(candidate.controller()).form()) : "";
        return Perturbation.builder(FeatureAxis.CASE, source, value)
                .form(form)
                .annotate("government_form", governor, governor)
                .build();
    }

    private Set<String> stopForms(Candidate candidate, String source, Analysis reading, PerturbationContext context) {
        Set<String> forms = new LinkedHashSet<>();
        FeatureBundle base = Syntax.inflectional(reading.features());
        for (String blocked : blockedCases(candidate, source, context)) {
            synthesize(context, reading, base.with("Case", blocked)).ifPresent(forms::add);
        }
        String number = base.get("Number");
        if (number != null) {
            String opposite = "Sing".equals(number) ? "Plur" : "Sing";
            for (String grammaticalCase : FeatureAxis.CASE.closedValues()) {
                synthesize(context, reading, base.with("Number", opposite).with("Case", grammaticalCase))
                        .ifPresent(forms::add);
            }
        }
        return forms;
    }

    private static Optional<String> synthesize(PerturbationContext context, Analysis reading, FeatureBundle request) {
        return context.analyzer().synthesize(reading.lemma(), reading.pos(), request);
    }
}
