package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.lexicon.MorphemeSegmentation;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.PerturbationRule;
import com.example.rublimp.generator.phenomena.PerturbedForm;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.Token;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds a verb with a new prefix chain. Alternative values are the chains joined with
 * {@code +}; the derived verb and its infinitive must both be unknown words.
 */
abstract class PrefixRule implements PerturbationRule {

    static final String SEPARATOR = "+";

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token verb = context.token(candidate.target());
        Optional<MorphemeSegmentation> segmentation = context.resources().segmentation(verb.lemma());
        if (segmentation.isEmpty() || segmentation.get().roots().isEmpty()) {
            return List.of();
        }
        String root = segmentation.get().roots().get(0);
        if (context.resources().isExcludedPrefixRoot(root)) {
            return List.of();
        }
        return chains(segmentation.get().prefixes(), root, verb, context);
    }

    /**
     * Candidate prefix chains for a verb whose lemma carries {@code prefixes} before {@code root}.
     */
    abstract List<String> chains(List<String> prefixes, String root, Token verb, PerturbationContext context);

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token verb = context.token(candidate.target());
        MorphemeSegmentation segmentation = context.resources().segmentation(verb.lemma())
                .orElseThrow(() -> new UnsynthesizableException("no segmentation for " + verb.lemma()));
        List<String> original = segmentation.prefixes();
        String originalPrefix = String.join("", original);
        List<String> chain = Arrays.asList(value.split("\\+"));
        String newPrefix = String.join("", chain);

        String newForm = PrefixRules.replacePrefix(verb.form(), originalPrefix, newPrefix);
        String newLemma = PrefixRules.replacePrefix(verb.lemma(), originalPrefix, newPrefix);
        if (newForm == null || newLemma == null) {
            throw new UnsynthesizableException("'" + verb.form() + "' does not start with prefix " + originalPrefix);
        }
        if (context.resources().hasForbiddenBeginning(newForm)) {
            throw new UnsynthesizableException("'" + newForm + "' has a beginning Russian words do not have");
        }
        PerturbedForm form = context.replace(verb, newForm);
        if (form.knownWord() || context.analyzer().isKnown(newLemma)) {
            throw new UnsynthesizableException("'" + newForm + "' is an existing word");
        }
        Perturbation.Builder builder = Perturbation.builder(FeatureAxis.MORPHEME,
                        String.join(SEPARATOR, original), value)
                .form(form)
                .annotate("morpheme", String.join(SEPARATOR, original), value)
                .annotate("lemma", verb.lemma(), newLemma);
        annotate(builder, original, chain);
        return builder.build();
    }

    void annotate(Perturbation.Builder builder, List<String> original, List<String> chain) {
    }
}
