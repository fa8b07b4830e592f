package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.TestFixtures;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class WordFormationPhenomenaTest {

    @Test
    void nounWithAdjectiveGetsANewSuffix() {
        AnnotatedSentence shoulders = TestFixtures.sentence("shoulders",
                "Руками рука NOUN Animacy=Inan|Case=Ins|Gender=Fem|Number=Plur 2 obl",
                "обхватила обхватить VERB Aspect=Perf|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "широкие широкий ADJ Case=Acc|Degree=Pos|Number=Plur 4 amod",
                "плечи плечо NOUN Animacy=Inan|Case=Acc|Gender=Neut|Number=Plur 2 obj",
                "Окота Окот PROPN Animacy=Anim|Case=Gen|Gender=Masc|Number=Sing 4 nmod NoSpace",
                ". . PUNCT _ 2 punct");

        List<MinimalPair> pairs = TestFixtures.generate(shoulders, "add_new_suffix");

        Assertions.assertEquals(1, pairs.size());
        MinimalPair pair = pairs.get(0);
        Assertions.assertEquals("Руками обхватила широкие плечи Окота.", pair.sourceSentence());
        Assertions.assertEquals("Руками обхватила широкие плечники Окота.", pair.targetSentence());
        Assertions.assertEquals("плечи", pair.sourceWord());
        Assertions.assertEquals("плечники", pair.targetWord());
        Assertions.assertEquals("ник", pair.targetWordFeatures().get("morpheme"));
        Assertions.assertEquals("0", pair.targetWordFeatures().get("new_suffix_position"));
        Assertions.assertEquals("word_formation", pair.phenomenon());
    }

    @Test
    void stackedPrefixMustNotBeAFrequentVerb() {
        AnnotatedSentence wrote = TestFixtures.sentence("wrote",
                "Он он PRON Case=Nom|Gender=Masc|Number=Sing|Person=3 2 nsubj",
                "записал записать VERB Aspect=Perf|Gender=Masc|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
                "письмо письмо NOUN Animacy=Inan|Case=Acc|Gender=Neut|Number=Sing 2 obj NoSpace",
                ". . PUNCT _ 2 punct");
        GenerationReport report = new GenerationReport();

        List<MinimalPair> pairs = TestFixtures.generate(wrote, report, "add_verb_prefix");
        List<String> targets = TestFixtures.targets(pairs);

        Assertions.assertTrue(targets.contains("Он прозаписал письмо."), targets.toString());
        Assertions.assertTrue(targets.contains("Он запрописал письмо."), targets.toString());
        Assertions.assertFalse(targets.contains("Он перезаписал письмо."), "перезаписать is a real verb");
        Assertions.assertEquals(1, report.rejections(WordFormationPhenomena.LOW_FREQUENCY));
        for (MinimalPair pair : pairs) {
            String position = pair.targetWordFeatures().get("new_prefix_position");
            String expected = pair.targetWord().startsWith("за") ? "1" : "0";
            Assertions.assertEquals(expected, position, pair.targetWord());
        }
    }

    @Test
    void twoPrefixesSwapPlaces() {
        AnnotatedSentence tired = TestFixtures.sentence("tired",
                "Он он PRON Case=Nom|Gender=Masc|Number=Sing|Person=3 2 nsubj",
                "подустал подустать VERB Aspect=Perf|Gender=Masc|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root NoSpace",
                ". . PUNCT _ 2 punct");

        List<MinimalPair> pairs = TestFixtures.generate(tired, "change_verb_prefixes_order");

        Assertions.assertEquals(List.of("Он уподстал."), TestFixtures.targets(pairs));
        Assertions.assertEquals("под+у", pairs.get(0).sourceWordFeatures().get("morpheme"));
        Assertions.assertEquals("у+под", pairs.get(0).targetWordFeatures().get("morpheme"));
    }

    @Test
    void verbWithoutSegmentationIsNotACandidate() {
        AnnotatedSentence sleeps = TestFixtures.sentence("sleeps",
                "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
                "спала спать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root");
        GenerationReport report = new GenerationReport();

        TestFixtures.generate(sleeps, report, WordFormationPhenomena.FAMILY);

        Assertions.assertEquals(0, report.count(GenerationReport.CANDIDATES));
    }
}
