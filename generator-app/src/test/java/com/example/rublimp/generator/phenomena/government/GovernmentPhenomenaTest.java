package com.example.rublimp.generator.phenomena.government;

import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.TestFixtures;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.phenomena.ValidityChecks;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class GovernmentPhenomenaTest {

    private static final AnnotatedSentence MOTHER = TestFixtures.sentence("mother",
            "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
            "мыла мыть VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
            "раму рама NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
            ". . PUNCT _ 2 punct");

    private static final AnnotatedSentence SADDLE = TestFixtures.sentence("saddle",
            "Седло седло NOUN Animacy=Inan|Case=Nom|Gender=Neut|Number=Sing 3 nsubj",
            "коня конь NOUN Animacy=Anim|Case=Gen|Gender=Masc|Number=Sing 1 nmod",
            "лежит лежать VERB Aspect=Imp|Mood=Ind|Number=Sing|Person=3|Tense=Pres|VerbForm=Fin 0 root",
            "у у ADP _ 5 case",
            "стола стол NOUN Animacy=Inan|Case=Gen|Gender=Masc|Number=Sing 3 obl NoSpace",
            ". . PUNCT _ 3 punct");

    @Test
    void accusativeObjectMovesOnlyToAnUnambiguousCase() {
        GenerationReport report = new GenerationReport();

        List<MinimalPair> pairs = TestFixtures.generate(MOTHER, report, "verb_acc_object");

        Assertions.assertEquals(List.of("Мама мыла рамой."), TestFixtures.targets(pairs));
        Assertions.assertEquals("Ins", pairs.get(0).targetWordFeatures().get("Case"));
        Assertions.assertEquals("мыла", pairs.get(0).targetWordFeatures().get("government_form"));
        Assertions.assertEquals(1, report.count(GenerationReport.UNSYNTHESIZABLE), "рамы is a plural form");
        Assertions.assertEquals(2, report.rejections(ValidityChecks.NO_HOMONYMY), "раме is both Dat and Loc");
    }

    @Test
    void prepositionalObjectAvoidsCasesThePrepositionAllows() {
        List<MinimalPair> pairs = TestFixtures.generate(SADDLE, "adp_government_case");

        Assertions.assertEquals(List.of("Седло коня лежит у столом."), TestFixtures.targets(pairs));
        Assertions.assertEquals("government", pairs.get(0).phenomenon());
        Assertions.assertEquals("у", pairs.get(0).sourceWordFeatures().get("adposition"));
    }

    @Test
    void genitiveModifierIsNotAVerbObject() {
        GenerationReport report = new GenerationReport();

        TestFixtures.generate(SADDLE, report, "verb_gen_object", "verb_acc_object", "verb_ins_object");

        Assertions.assertEquals(0, report.count(GenerationReport.CANDIDATES));
    }
}
