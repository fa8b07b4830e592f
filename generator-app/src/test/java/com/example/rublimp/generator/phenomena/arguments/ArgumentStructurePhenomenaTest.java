package com.example.rublimp.generator.phenomena.arguments;

import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.rublimp.generator.TestFixtures.generate;
import static com.example.rublimp.generator.TestFixtures.sentence;
import static com.example.rublimp.generator.TestFixtures.targets;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentStructurePhenomenaTest {

    @Test
    void transitiveVerbIsReplacedByAnIntransitiveOne() {
        AnnotatedSentence sentence = sentence("wash",
                "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
                "мыла мыть VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "раму рама NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
                ". . PUNCT _ 2 punct");

        List<MinimalPair> pairs = generate(sentence, "transitive_verb");

        assertEquals(List.of("Мама спала раму."), targets(pairs), "Первый подходящий непереходный глагол");
        MinimalPair pair = pairs.get(0);
        assertEquals("Transitivity", pair.feature());
        assertEquals("Tran", pair.sourceWordFeatures().get("Transitivity"));
        assertEquals("Intr", pair.targetWordFeatures().get("Transitivity"));
        assertEquals("спать", pair.targetWordFeatures().get("lemma"));
        assertEquals(1, pair.treeLength());
    }

    @Test
    void verbWithoutSubjectIsSkipped() {
        AnnotatedSentence sentence = sentence("no-subject",
                "Мыла мыть VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "раму рама NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 1 obj");
        GenerationReport report = new GenerationReport();

        assertTrue(generate(sentence, report, "transitive_verb").isEmpty());
        assertEquals(0, report.count(GenerationReport.CANDIDATES));
    }

    @Test
    void animateSubjectAndInanimateObjectTradePlaces() {
        AnnotatedSentence sentence = sentence("read",
                "Девушка девушка NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
                "читала читать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "книгу книга NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
                ". . PUNCT _ 2 punct");

        List<MinimalPair> pairs = generate(sentence, "transitive_verb_subject_perm");

        assertEquals(List.of("Книга читала девушку."), targets(pairs));
        MinimalPair pair = pairs.get(0);
        assertEquals("Anim", pair.sourceWordFeatures().get("Animacy"));
        assertEquals("Inan", pair.targetWordFeatures().get("Animacy"));
        assertEquals("1", pair.sourceWordFeatures().get("index"));
        assertEquals("3", pair.targetWordFeatures().get("index"));
        assertEquals("Девушка", pair.sourceWord());
        assertEquals("Книга", pair.targetWord());
    }

    @Test
    void argumentsOfDifferentGenderAreNotSwapped() {
        AnnotatedSentence sentence = sentence("letter",
                "Девушка девушка NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
                "читала читать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "письмо письмо NOUN Animacy=Inan|Case=Acc|Gender=Neut|Number=Sing 2 obj");

        assertTrue(generate(sentence, "transitive_verb_subject_perm").isEmpty());
    }
}
