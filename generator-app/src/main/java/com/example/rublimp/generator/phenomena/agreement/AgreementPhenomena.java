package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.ValidityChecks;

import java.util.List;

/**
 * Subject-predicate, noun phrase, floating quantifier and relative pronoun agreement.
 */
public final class AgreementPhenomena {

    public static final String FAMILY = "agreement";

    private AgreementPhenomena() {
    }

    public static List<Phenomenon> create() {
        return List.of(
                subjectPredicate("noun_subj_predicate_agreement_number", FeatureAxis.NUMBER),
                subjectPredicate("noun_subj_predicate_agreement_gender", FeatureAxis.GENDER),
                subjectPredicate("noun_subj_predicate_agreement_person", FeatureAxis.PERSON),
                impersonal("clause_subj_predicate_agreement_number", FeatureAxis.NUMBER,
                        ImpersonalPredicateMatcher.Subject.CLAUSE),
                impersonal("clause_subj_predicate_agreement_gender", FeatureAxis.GENDER,
                        ImpersonalPredicateMatcher.Subject.CLAUSE),
                impersonal("genitive_subj_predicate_agreement_number", FeatureAxis.NUMBER,
                        ImpersonalPredicateMatcher.Subject.NEGATED_GENITIVE),
                impersonal("genitive_subj_predicate_agreement_gender", FeatureAxis.GENDER,
                        ImpersonalPredicateMatcher.Subject.NEGATED_GENITIVE),
                nounPhrase("np_agreement_number", FeatureAxis.NUMBER),
                nounPhrase("np_agreement_gender", FeatureAxis.GENDER),
                nounPhrase("np_agreement_case", FeatureAxis.CASE),
                remoteModifier("np_agreement_number_remote_modifier", FeatureAxis.NUMBER),
                remoteModifier("np_agreement_gender_remote_modifier", FeatureAxis.GENDER),
                remoteModifier("np_agreement_case_remote_modifier", FeatureAxis.CASE),
                floatingQuantifier("floating_quantifier_agreement_number", FeatureAxis.NUMBER),
                floatingQuantifier("floating_quantifier_agreement_gender", FeatureAxis.GENDER),
                floatingQuantifier("floating_quantifier_agreement_case", FeatureAxis.CASE),
                anaphor("anaphor_agreement_number", FeatureAxis.NUMBER),
                anaphor("anaphor_agreement_gender", FeatureAxis.GENDER));
    }

    private static Phenomenon subjectPredicate(String id, FeatureAxis axis) {
        Phenomenon.Builder builder = Phenomenon.builder(id, FAMILY, axis)
                .resolveTarget(axis.category())
                .agreeOn(axis.category())
                .matcher(new SubjectPredicateMatcher(id, axis))
                .rule(new AgreementRule(axis))
                .check(ValidityChecks.noHomonymy())
                .check(ValidityChecks.noCoordinationEscape())
                .check(ValidityChecks.lexicalClassExclusion(true))
                .check(ValidityChecks.attractorConsistency());
        if (axis == FeatureAxis.PERSON) {
            builder.resolveController();
        } else {
            builder.resolveController(axis.category());
        }
        return builder.build();
    }

    /**
     * The predicate has no controller to agree with, so only the target reading is resolved.
     */
    private static Phenomenon impersonal(String id, FeatureAxis axis, ImpersonalPredicateMatcher.Subject subject) {
        return Phenomenon.builder(id, FAMILY, axis)
                .resolveTarget(axis.category())
                .matcher(new ImpersonalPredicateMatcher(id, axis, subject))
                .rule(new AgreementRule(axis))
                .check(ValidityChecks.noHomonymy())
                .build();
    }

    private static Phenomenon nounPhrase(String id, FeatureAxis axis) {
        return modifier(id, axis, new NounPhraseMatcher(id, axis));
    }

    private static Phenomenon remoteModifier(String id, FeatureAxis axis) {
        return modifier(id, axis, new RemoteModifierMatcher(id, axis));
    }

    private static Phenomenon floatingQuantifier(String id, FeatureAxis axis) {
        return modifier(id, axis, new FloatingQuantifierMatcher(id, axis));
    }

    private static Phenomenon modifier(String id, FeatureAxis axis, PatternMatcher matcher) {
        return Phenomenon.builder(id, FAMILY, axis)
                .resolveTarget(axis.category())
                .resolveController(axis.category())
                .agreeOn(axis.category())
                .matcher(matcher)
                .rule(new AgreementRule(axis))
                .check(ValidityChecks.noHomonymy())
                .check(ValidityChecks.noCoordinationEscape())
                .check(ValidityChecks.lexicalClassExclusion(false))
                .build();
    }

    private static Phenomenon anaphor(String id, FeatureAxis axis) {
        return Phenomenon.builder(id, FAMILY, axis)
                .resolveTarget(axis.category())
                .resolveController(axis.category())
                .agreeOn(axis.category())
                .matcher(new AnaphorMatcher(id, axis))
                .rule(new AgreementRule(axis))
                .check(ValidityChecks.noHomonymy())
                .check(ValidityChecks.noCoordinationEscape())
                .check(ValidityChecks.lexicalClassExclusion(false))
                .build();
    }
}
