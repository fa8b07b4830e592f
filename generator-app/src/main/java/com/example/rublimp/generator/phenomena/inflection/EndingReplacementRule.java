package com.example.rublimp.generator.phenomena.inflection;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.PerturbationRule;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Swaps the ending of a form for an ending of another inflection class. Values have the form
 * {@code old>new}. A result the analyzer knows as a word is a real form and is rejected.
 */
abstract class EndingReplacementRule implements PerturbationRule {

    static final String ARROW = ">";

    /**
     * Ending substitutions applicable to the token, keyed by the ending it must carry.
     */
    abstract Map<String, List<String>> substitutions(Token token, PerturbationContext context);

    /**
     * Restricts matching endings; the default keeps all of them.
     */
    List<String> applicableEndings(List<String> matching) {
        return matching;
    }

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token token = context.token(candidate.target());
        String form = token.lowerForm().replace('ё', 'е');
        Map<String, List<String>> substitutions = substitutions(token, context);
        List<String> matching = new ArrayList<>();
        for (String ending : substitutions.keySet()) {
            if (form.endsWith(ending) && form.length() > ending.length()) {
                matching.add(ending);
            }
        }
        List<String> values = new ArrayList<>();
        for (String ending : applicableEndings(matching)) {
            for (String replacement : substitutions.get(ending)) {
                values.add(ending + ARROW + replacement);
            }
        }
        return values;
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token token = context.token(candidate.target());
        int arrow = value.indexOf(ARROW);
        if (arrow < 0) {
            throw new IllegalArgumentException("Expected old>new ending, got " + value);
        }
        String ending = value.substring(0, arrow);
        String replacement = value.substring(arrow + 1);
        String form = token.lowerForm();
        String derived = form.substring(0, form.length() - ending.length()) + replacement;
        PerturbedForm perturbed = context.replace(token, derived);
        if (perturbed.knownWord()) {
            throw new UnsynthesizableException("'" + derived + "' collides with an existing form");
        }
        return Perturbation.builder(FeatureAxis.MORPHEME, ending, replacement)
                .form(perturbed)
                .annotate("morpheme", ending, replacement)
                .build();
    }
}
