package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.TestFixtures;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Test;

import static com.example.rublimp.generator.TestFixtures.sentence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidityChecksTest {

    @Test
    void attractorFixesTheOnlyAcceptedValue() {
        AnnotatedSentence sentence = sentence("key",
                "Ключ ключ NOUN Animacy=Inan|Case=Nom|Gender=Masc|Number=Sing 4 nsubj",
                "от от ADP _ 3 case",
                "шкафов шкаф NOUN Animacy=Inan|Case=Gen|Gender=Masc|Number=Plur 1 nmod",
                "лежал лежать VERB Aspect=Imp|Gender=Masc|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root");
        Candidate withAttractor = Candidate.builder("test", 4).controller(1).attractor(3).build();
        Candidate plain = Candidate.builder("test", 4).controller(1).build();
        ValidityCheck check = ValidityChecks.attractorConsistency();

        assertEquals(ValidityChecks.ATTRACTOR_CONSISTENCY, check.name());
        assertTrue(check.test(withAttractor, number("лежал", "лежали", "Plur"), context(sentence)));
        assertFalse(check.test(withAttractor, number("лежал", "лежал", "Sing"), context(sentence)));
        assertTrue(check.test(plain, number("лежал", "лежал", "Sing"), context(sentence)));
    }

    @Test
    void coordinatedSubjectDoesNotMakeAPluralError() {
        AnnotatedSentence sentence = sentence("coordinated",
                "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 4 nsubj",
                "и и CCONJ _ 3 cc",
                "папа папа NOUN Animacy=Anim|Case=Nom|Gender=Masc|Number=Sing 1 conj",
                "спала спать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root");
        Candidate candidate = Candidate.builder("test", 4).controller(1).build();
        ValidityCheck check = ValidityChecks.noCoordinationEscape();

        assertFalse(check.test(candidate, number("спала", "спали", "Plur"), context(sentence)));
    }

    @Test
    void properNameNeedsAnotherAgreeingWord() {
        AnnotatedSentence bare = sentence("bare",
                "Маша Маша PROPN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
                "спала спать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root");
        AnnotatedSentence modified = sentence("modified",
                "Наша наш DET Case=Nom|Gender=Fem|Number=Sing 2 det",
                "Маша Маша PROPN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 3 nsubj",
                "спала спать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root");
        ValidityCheck check = ValidityChecks.lexicalClassExclusion(true);
        Perturbation gender = Perturbation.of(FeatureAxis.GENDER, "Fem", "Masc",
                new PerturbedForm(2, "спала", "спал", true, false, true));
        Perturbation shiftedGender = Perturbation.of(FeatureAxis.GENDER, "Fem", "Masc",
                new PerturbedForm(3, "спала", "спал", true, false, true));

        assertFalse(check.test(Candidate.builder("test", 2).controller(1).build(), gender, context(bare)));
        assertTrue(check.test(Candidate.builder("test", 3).controller(2).build(), shiftedGender, context(modified)));
    }

    @Test
    void unchangedFormIsRejected() {
        AnnotatedSentence sentence = sentence("yo",
                "Всё всё PRON Case=Nom|Gender=Neut|Number=Sing 0 root");
        Perturbation same = Perturbation.of(FeatureAxis.NUMBER, "Sing", "Plur",
                new PerturbedForm(1, "Всё", "Все", true, false, true));

        assertFalse(ValidityChecks.noHomonymy().test(Candidate.builder("test", 1).build(), same, context(sentence)));
    }

    private static Perturbation number(String source, String target, String value) {
        return Perturbation.of(FeatureAxis.NUMBER, "Sing", value, new PerturbedForm(4, source, target, true, false, true));
    }

    private static PerturbationContext context(AnnotatedSentence sentence) {
        return PerturbationContext.of(sentence, TestFixtures.analyzer(), TestFixtures.resources());
    }
}
