package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.Analysis;
import com.example.rublimp.generator.morphology.MorphologyAnalyzer;
import com.example.rublimp.generator.morphology.Orthography;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything a rule or check may consult for one candidate: the sentence, the analyzer, the
 * curated tables and the resolved readings of the target and controller.
 */
public final class PerturbationContext {

    private final AnnotatedSentence sentence;
    private final MorphologyAnalyzer analyzer;
    private final LexicalResources resources;
    private final Analysis targetAnalysis;
    private final Analysis controllerAnalysis;

    private PerturbationContext(AnnotatedSentence sentence, MorphologyAnalyzer analyzer, LexicalResources resources,
                                Analysis targetAnalysis, Analysis controllerAnalysis) {
        this.sentence = Objects.requireNonNull(sentence, "sentence");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.targetAnalysis = targetAnalysis;
        this.controllerAnalysis = controllerAnalysis;
    }

    public static PerturbationContext of(AnnotatedSentence sentence, MorphologyAnalyzer analyzer,
                                         LexicalResources resources) {
        return new PerturbationContext(sentence, analyzer, resources, null, null);
    }

    public PerturbationContext withAnalyses(Analysis target, Analysis controller) {
        return new PerturbationContext(sentence, analyzer, resources, target, controller);
    }

    public AnnotatedSentence sentence() {
        return sentence;
    }

    public MorphologyAnalyzer analyzer() {
        return analyzer;
    }

    public LexicalResources resources() {
        return resources;
    }

    public Token token(int index) {
        return sentence.token(index);
    }

    public Optional<Analysis> targetAnalysis() {
        return Optional.ofNullable(targetAnalysis);
    }

    public Optional<Analysis> controllerAnalysis() {
        return Optional.ofNullable(controllerAnalysis);
    }

    /**
     * Resolved reading of the target, falling back to the parser's lemma and tags.
     */
    public Analysis targetReading(Token target) {
        return targetAnalysis != null ? targetAnalysis : parserReading(target);
    }

    public Analysis controllerReading(Token controller) {
        return controllerAnalysis != null ? controllerAnalysis : parserReading(controller);
    }

    public static Analysis parserReading(Token token) {
        return new Analysis(token.form(), token.lemma(), token.upos(), token.feats(), Analysis.UNRANKED);
    }

    /**
     * Synthesizes the paradigm cell of the token's own lemma carrying {@code request}.
     */
    public PerturbedForm inflect(Token token, Analysis reading, FeatureBundle request)
            throws UnsynthesizableException {
        return inflectLemma(token, reading.lemma(), reading.pos(), request);
    }

    /**
     * Synthesizes a form of another lemma in the token's slot.
     */
    public PerturbedForm inflectLemma(Token token, String lemma, String pos, FeatureBundle request)
            throws UnsynthesizableException {
        Optional<String> form = analyzer.synthesize(lemma, pos, request);
        if (form.isEmpty()) {
            throw new UnsynthesizableException("no form of " + lemma + " (" + pos + ") for " + request);
        }
        String target = unifyYo(form.get());
        checkChanged(token, target);
        return new PerturbedForm(token.index(), token.form(), Orthography.capitalizeLike(token.form(), target),
                true, isHomonymous(lemma, pos, target, request), true);
    }

    /**
     * Puts a string built by the rule in the token's slot. The string must not contain letter
     * sequences Russian spelling excludes.
     */
    public PerturbedForm replace(Token token, String newForm) throws UnsynthesizableException {
        String target = unifyYo(newForm);
        checkChanged(token, target);
        Optional<String> forbidden = resources.forbiddenSequenceIn(target);
        if (forbidden.isPresent()) {
            throw new UnsynthesizableException("'" + target + "' contains forbidden sequence '" + forbidden.get() + "'");
        }
        return new PerturbedForm(token.index(), token.form(), Orthography.capitalizeLike(token.form(), target),
                false, false, analyzer.isKnown(target));
    }

    /**
     * True when a cell of the lemma other than the intended one has the same spelling.
     */
    public boolean isHomonymous(String lemma, String pos, String form, FeatureBundle intended) {
        String unified = Orthography.unify(form);
        for (Analysis cell : analyzer.paradigm(lemma, pos)) {
            if (Orthography.unify(cell.form()).equals(unified) && !cell.features().contains(intended)) {
                return true;
            }
        }
        return false;
    }

    private static void checkChanged(Token token, String target) throws UnsynthesizableException {
        if (Orthography.unify(target).equals(Orthography.unify(token.form()))) {
            throw new UnsynthesizableException("'" + target + "' does not differ from '" + token.form()
                    + "' beyond the letter ё");
        }
    }

    private static String unifyYo(String form) {
        return form.replace('ё', 'е').replace('Ё', 'Е');
    }
}
