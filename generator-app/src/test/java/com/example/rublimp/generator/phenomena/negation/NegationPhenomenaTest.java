package com.example.rublimp.generator.phenomena.negation;

import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.rublimp.generator.TestFixtures.generate;
import static com.example.rublimp.generator.TestFixtures.sentence;
import static com.example.rublimp.generator.TestFixtures.targets;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NegationPhenomenaTest {

    private static final String CAME = "пришёл прийти VERB Aspect=Perf|Gender=Masc|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin";

    @Test
    void indefinitePronounBecomesNegativeWithoutNegation() {
        AnnotatedSentence sentence = sentence("someone",
                "Кто-то кто-то PRON Case=Nom 2 nsubj",
                CAME + " 0 root NoSpace",
                ". . PUNCT _ 2 punct");

        List<MinimalPair> pairs = generate(sentence, "negative_pronouns_to");

        assertEquals(List.of("Никто пришёл."), targets(pairs));
        MinimalPair pair = pairs.get(0);
        assertEquals("indefinite", pair.sourceWordFeatures().get("pronoun_type"));
        assertEquals("negative", pair.targetWordFeatures().get("pronoun_type"));
        assertEquals("PronounType", pair.feature());
    }

    @Test
    void negativePronounBecomesIndefiniteUnderNegation() {
        List<MinimalPair> pairs = generate(nobodyCame("."), "negative_pronouns_from");

        assertEquals(List.of("Кто-нибудь не пришёл.", "Кто-то не пришёл."), targets(pairs));
        assertEquals(1, pairs.get(0).treeLength());
    }

    @Test
    void questionLicensesTheIndefinitePronoun() {
        GenerationReport report = new GenerationReport();

        assertTrue(generate(nobodyCame("?"), report, "negative_pronouns_from").isEmpty());
        assertEquals(2, report.rejections(NegationPhenomena.INDEFINITE_CONTEXT));
    }

    @Test
    void negatedClauseIsNotTurnedNegative() {
        GenerationReport report = new GenerationReport();

        assertTrue(generate(nobodyCame("."), report, "negative_pronouns_to").isEmpty());
        assertEquals(0, report.count(GenerationReport.CANDIDATES));
    }

    @Test
    void conditionalCountsAsLicensingContext() {
        AnnotatedSentence sentence = sentence("if",
                "Если если SCONJ _ 3 mark",
                "никто никто PRON Case=Nom 3 nsubj",
                CAME + " 0 root");

        assertTrue(NegationPhenomena.isLicensingContext(sentence));
        assertFalse(NegationPhenomena.isLicensingContext(nobodyCame(".")));
    }

    private static AnnotatedSentence nobodyCame(String punctuation) {
        return sentence("nobody",
                "Никто никто PRON Case=Nom 3 nsubj",
                "не не PART Polarity=Neg 3 advmod",
                CAME + " 0 root NoSpace",
                punctuation + " " + punctuation + " PUNCT _ 3 punct");
    }
}
