package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.Orthography;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

/**
 * The checks shared across phenomena.
 */
public final class ValidityChecks {

    public static final String NO_HOMONYMY = "no_homonymy";
    public static final String NO_COORDINATION_ESCAPE = "no_coordination_escape";
    public static final String LEXICAL_CLASS_EXCLUSION = "lexical_class_exclusion";
    public static final String ATTRACTOR_CONSISTENCY = "attractor_consistency";

    private ValidityChecks() {
    }

    /**
     * Every altered form must differ from its source and must not spell another cell of its
     * paradigm.
     */
    public static ValidityCheck noHomonymy() {
        return ValidityCheck.named(NO_HOMONYMY, (candidate, perturbation, context) -> {
            for (PerturbedForm form : perturbation.forms()) {
                if (form.homonymous()) {
                    return false;
                }
                if (Orthography.unify(form.target()).equals(Orthography.unify(form.source()))) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * A coordinated controller already licenses plural agreement, so a plural target is not an
     * error there.
     */
    public static ValidityCheck noCoordinationEscape() {
        return ValidityCheck.named(NO_COORDINATION_ESCAPE, (candidate, perturbation, context) -> {
            if (!candidate.hasController() || perturbation.axis() != FeatureAxis.NUMBER) {
                return true;
            }
            if (!"Plur".equals(perturbation.targetValue())) {
                return true;
            }
            return !context.sentence().isConjunct(context.token(candidate.controller()));
        });
    }

    /**
     * Collective nouns license plural predicates in colloquial use; common-gender nouns and proper
     * names do not fix their gender or number, unless another agreeing word of the controller does.
     */
    public static ValidityCheck lexicalClassExclusion(boolean subjectAgreement) {
        return ValidityCheck.named(LEXICAL_CLASS_EXCLUSION, (candidate, perturbation, context) -> {
            if (!candidate.hasController()) {
                return true;
            }
            FeatureAxis axis = perturbation.axis();
            if (axis != FeatureAxis.NUMBER && axis != FeatureAxis.GENDER) {
                return true;
            }
            AnnotatedSentence sentence = context.sentence();
            Token controller = sentence.token(candidate.controller());
            Token target = sentence.token(candidate.target());
            LexicalResources resources = context.resources();
            String value = perturbation.targetValue();
            if (subjectAgreement && axis == FeatureAxis.NUMBER && "Plur".equals(value)
                    && resources.isCollectiveNoun(controller.lemma())) {
                return false;
            }
            boolean fixedElsewhere = fixedByAnotherTarget(sentence, controller, target, axis.category());
            if (axis == FeatureAxis.GENDER && ("Masc".equals(value) || "Fem".equals(value))
                    && resources.isCommonGenderNoun(controller.lemma()) && !fixedElsewhere) {
                return false;
            }
            if ((controller.isPos("PROPN") || sentence.isQuoted(controller)) && !fixedElsewhere) {
                return false;
            }
            return true;
        });
    }

    /**
     * With an attractor present the only accepted value is the attractor's own.
     */
    public static ValidityCheck attractorConsistency() {
        return ValidityCheck.named(ATTRACTOR_CONSISTENCY, (candidate, perturbation, context) -> {
            if (!candidate.hasAttractor()) {
                return true;
            }
            Token attractor = context.token(candidate.attractor());
            return perturbation.targetValue().equals(attractor.feature(perturbation.axis().category()));
        });
    }

    static boolean fixedByAnotherTarget(AnnotatedSentence sentence, Token controller, Token target, String category) {
        for (Token dependent : sentence.dependents(controller)) {
            if (dependent.index() != target.index()
                    && (dependent.hasRelation("amod") || dependent.hasRelation("det"))
                    && dependent.feats().has(category)) {
                return true;
            }
        }
        if (controller.hasRelation("nsubj") && !controller.isRoot()) {
            Token predicate = sentence.token(controller.head());
            return predicate.index() != target.index() && predicate.feats().has(category);
        }
        return false;
    }
}
