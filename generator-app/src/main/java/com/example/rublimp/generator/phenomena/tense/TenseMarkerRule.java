package com.example.rublimp.generator.phenomena.tense;

import com.example.rublimp.generator.lexicon.LexicalResources;
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
 * Replaces a time marker by its counterpart of the other tense: {@code вчера -> завтра},
 * {@code на прошлой неделе -> на будущей неделе}. Adjectives prefer the collocation attested
 * with the time noun, then the adjective at the same position of the other tense's list.
 */
final class TenseMarkerRule implements PerturbationRule {

    private static final List<String> ADJECTIVE_CATEGORIES = List.of("Gender", "Number", "Case", "Animacy");

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        String tense = context.token(candidate.controller()).feature("Tense");
        return tense == null ? List.of() : List.of(TenseExpressions.opposite(tense));
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token marker = context.token(candidate.target());
        String source = context.token(candidate.controller()).feature("Tense");
        LexicalResources resources = context.resources();
        Perturbation.Builder builder = Perturbation.builder(FeatureAxis.TENSE, source, value);

        if (candidate.detail("time_noun") == null) {
            String replacement = counterpart(resources.simpleTenseMarkers(source), resources.simpleTenseMarkers(value),
                    marker.lowerLemma());
            PerturbedForm form = context.replace(marker, replacement);
            return builder.form(form)
                    .annotate("TenseMarker", marker.form(), form.target())
                    .build();
        }

        String noun = candidate.detail("time_noun");
        List<String> attested = resources.tenseCollocations(value, noun);
        boolean collocationExists = !attested.isEmpty();
        String adjective = collocationExists
                ? attested.get(0)
                : counterpart(resources.tenseAdjectives(source), resources.tenseAdjectives(value), marker.lowerLemma());
        FeatureBundle request = marker.feats().restrictedTo(ADJECTIVE_CATEGORIES);
        if (!request.has("Case")) {
            throw new UnsynthesizableException("tense adjective '" + marker.form() + "' has no case");
        }
        PerturbedForm form = context.inflectLemma(marker, adjective, "ADJ", request);
        String expression = candidate.detail("TenseMarker");
        return builder.form(form)
                .annotate("TenseMarker", expression, expression.replace(marker.form(), form.target()))
                .annotateTarget("CollocationExists", Boolean.toString(collocationExists))
                .build();
    }

    private static String counterpart(List<String> sourceList, List<String> targetList, String lemma)
            throws UnsynthesizableException {
        int index = sourceList.indexOf(lemma);
        if (targetList.isEmpty()) {
            throw new UnsynthesizableException("no markers of the other tense");
        }
        return index >= 0 && index < targetList.size() ? targetList.get(index) : targetList.get(0);
    }
}
