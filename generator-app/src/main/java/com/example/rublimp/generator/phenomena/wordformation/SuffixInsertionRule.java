package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.lexicon.MorphemeSegmentation;
import com.example.rublimp.generator.morphology.Orthography;
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
import java.util.Optional;
import java.util.Set;

/**
 * Inserts a derivational suffix that combines with the root into the suffix chain of a noun or
 * adjective: {@code плечи -> плечники}. Values have the form {@code suffix@position}.
 */
final class SuffixInsertionRule implements PerturbationRule {

    private static final Set<Character> SOFT_ENDINGS = Set.of('я', 'ю', 'е');

    @Override
    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
        Token token = context.token(candidate.target());
        LexicalResources resources = context.resources();
        Optional<MorphemeSegmentation> found = resources.segmentation(token.lemma());
        if (found.isEmpty() || found.get().roots().isEmpty() || found.get().hasHyphen()) {
            return List.of();
        }
        MorphemeSegmentation segmentation = found.get();
        List<String> existing = segmentation.suffixes();
        for (String suffix : existing) {
            if (!resources.isDerivationalSuffix(suffix) && !resources.isInflectionalSuffix(suffix)) {
                return List.of();
            }
        }
        String root = lastRoot(segmentation);

        List<String> suffixes = new ArrayList<>();
        for (String suffix : resources.suffixesForRoot(root, token.upos())) {
            if (!existing.contains(suffix) && resources.isDerivationalSuffix(suffix)
                    && resources.suffixesForPos(token.upos()).contains(suffix)) {
                suffixes.add(suffix);
            }
        }
        List<String> excluded = new ArrayList<>();
        for (String suffix : suffixes) {
            for (String other : resources.suffixExclusions(suffix, 0)) {
                if (suffixes.contains(other) && !excluded.contains(other)) {
                    excluded.add(other);
                }
            }
        }
        suffixes.removeAll(excluded);
        for (String present : existing) {
            suffixes.removeAll(resources.suffixExclusions(present, 1));
            suffixes.removeAll(resources.suffixExclusions(present, 0));
        }

        List<String> values = new ArrayList<>();
        for (String suffix : suffixes) {
            for (int position = 0; position <= existing.size(); position++) {
                if (derive(token, segmentation, suffix, position, resources).isPresent()) {
                    values.add(suffix + "@" + position);
                }
            }
        }
        return values;
    }

    @Override
    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException {
        Token token = context.token(candidate.target());
        int separator = value.lastIndexOf('@');
        if (separator < 0) {
            throw new IllegalArgumentException("Expected suffix@position, got " + value);
        }
        String suffix = value.substring(0, separator);
        int position = Integer.parseInt(value.substring(separator + 1));
        MorphemeSegmentation segmentation = context.resources().segmentation(token.lemma())
                .orElseThrow(() -> new UnsynthesizableException("no segmentation for " + token.lemma()));
        Derivation derivation = derive(token, segmentation, suffix, position, context.resources())
                .orElseThrow(() -> new UnsynthesizableException("suffix " + suffix + " does not fit at " + position));

        if (segmentation.roots().size() > 1 && derivation.form.contains("-")) {
            String[] parts = derivation.form.split("-");
            if (context.analyzer().isKnown(parts[parts.length - 1])) {
                throw new UnsynthesizableException("last part of '" + derivation.form + "' is an existing word");
            }
        }
        PerturbedForm form = context.replace(token, derivation.form);
        if (form.knownWord() || context.analyzer().isKnown(derivation.lemma)) {
            throw new UnsynthesizableException("'" + derivation.form + "' is an existing word");
        }
        String sourceSuffixes = String.join(PrefixRule.SEPARATOR, segmentation.suffixes());
        String targetSuffixes = String.join(PrefixRule.SEPARATOR, derivation.suffixes);
        return Perturbation.builder(FeatureAxis.MORPHEME, sourceSuffixes, targetSuffixes)
                .form(form)
                .annotate("morpheme", sourceSuffixes, targetSuffixes)
                .annotate("lemma", token.lemma(), derivation.lemma)
                .annotateTarget("new_suffix_position", Integer.toString(position))
                .build();
    }

    private static String lastRoot(MorphemeSegmentation segmentation) {
        List<String> roots = segmentation.roots();
        return roots.get(roots.size() - 1);
    }

    /**
     * Builds the word with {@code suffix} inserted at {@code position} of the suffix chain, or
     * nothing when the result breaks a boundary constraint.
     */
    static Optional<Derivation> derive(Token token, MorphemeSegmentation segmentation, String suffix, int position,
                                       LexicalResources resources) {
        List<String> existing = segmentation.suffixes();
        String root = lastRoot(segmentation);
        String ending = segmentation.ending();
        String form = token.lowerForm();
        String lemma = token.lowerLemma();

        String inserted = suffix;
        boolean keepSoftSign = ending.isEmpty() && position == existing.size() && form.replace(root, "").isEmpty();
        if (suffix.endsWith("ь") && !keepSoftSign) {
            inserted = suffix.substring(0, suffix.length() - 1);
        }
        if (inserted.isEmpty()) {
            return Optional.empty();
        }
        List<String> chain = new ArrayList<>(existing);
        chain.add(position, inserted);
        String next = position + 1 < chain.size() ? chain.get(position + 1) : "";
        String previous = position > 0 ? chain.get(position - 1) : "";
        char chainLast = Orthography.last(chain.get(chain.size() - 1));
        char chainFirst = Orthography.first(chain.get(0));

        if (!ending.isEmpty() && position == existing.size()
                && Orthography.last(suffix) == Orthography.first(ending)) {
            return Optional.empty();
        }
        if (previous.isEmpty() && Orthography.last(root) == Orthography.first(suffix)) {
            return Optional.empty();
        }
        if (!next.isEmpty() && !resources.isDerivationalSuffix(next)) {
            return Optional.empty();
        }
        if (!previous.isEmpty() && (!resources.isDerivationalSuffix(previous)
                || Orthography.last(previous) == Orthography.first(suffix))) {
            return Optional.empty();
        }
        if (!next.isEmpty() && Orthography.isVowel(Orthography.first(next))
                && (Orthography.isVowel(Orthography.last(suffix)) || chainLast == 'ь'
                || chainLast == Orthography.first(next))) {
            return Optional.empty();
        }
        if (!previous.isEmpty() && Orthography.isVowel(Orthography.last(previous))
                && (Orthography.isVowel(Orthography.first(suffix)) || chainFirst == 'ь'
                || chainFirst == Orthography.last(previous))) {
            return Optional.empty();
        }
        if (ending.length() == 2 && Orthography.isVowel(ending.charAt(0))
                && (Orthography.isVowel(ending.charAt(1)) || Orthography.isVowel(Orthography.last(form)))
                && Orthography.isVowel(chainLast)) {
            return Optional.empty();
        }
        if ((ending.length() == 1 || form.replace(lemma, "").length() == 1)
                && SOFT_ENDINGS.contains(Orthography.last(form))
                && (chainLast == 'ь' || Orthography.isVowel(chainLast))) {
            return Optional.empty();
        }
        if (position == existing.size() && !ending.isEmpty() && next.isEmpty()
                && Orthography.isVowel(ending.charAt(0))
                && (chainLast == 'ь' || chainLast == ending.charAt(0))) {
            return Optional.empty();
        }
        String joined = String.join("", chain);
        if (Orthography.first(joined) == Orthography.last(root)) {
            return Optional.empty();
        }

        String originalStem = root + String.join("", existing);
        String newStem = root + joined;
        String derived = form.replace(originalStem, newStem);
        if (derived.equals(form)) {
            return Optional.empty();
        }
        if (derived.length() > 1 && derived.endsWith("й") && !Orthography.isVowel(derived.charAt(derived.length() - 2))) {
            derived = derived.substring(0, derived.length() - 1) + "ый";
        }
        if (derived.length() > 1 && derived.endsWith("и") && derived.charAt(derived.length() - 2) == 'ц') {
            derived = derived.substring(0, derived.length() - 1) + "ы";
        }
        return Optional.of(new Derivation(derived, lemma.replace(originalStem, newStem), chain));
    }

    static final class Derivation {
        final String form;
        final String lemma;
        final List<String> suffixes;

        Derivation(String form, String lemma, List<String> suffixes) {
            this.form = form;
            this.lemma = lemma;
            this.suffixes = List.copyOf(suffixes);
        }
    }
}
