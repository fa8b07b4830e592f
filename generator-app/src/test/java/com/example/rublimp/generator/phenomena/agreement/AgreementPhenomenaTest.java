package com.example.rublimp.generator.phenomena.agreement;

import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.phenomena.ValidityChecks;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.rublimp.generator.TestFixtures.generate;
import static com.example.rublimp.generator.TestFixtures.sentence;
import static com.example.rublimp.generator.TestFixtures.targets;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgreementPhenomenaTest {

    private static final AnnotatedSentence MOTHER = sentence("mother",
            "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 2 nsubj",
            "мыла мыть VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
            "раму рама NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
            ". . PUNCT _ 2 punct");

    private static final AnnotatedSentence MANAGEMENT = sentence("management",
            "Руководство руководство NOUN Animacy=Inan|Case=Nom|Gender=Neut|Number=Sing 2 nsubj",
            "выдало выдать VERB Aspect=Perf|Gender=Neut|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
            "премию премия NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
            ". . PUNCT _ 2 punct");

    private static final AnnotatedSentence BOY = sentence("boy",
            "Мальчик мальчик NOUN Animacy=Anim|Case=Nom|Gender=Masc|Number=Sing 2 nsubj",
            "читает читать VERB Aspect=Imp|Mood=Ind|Number=Sing|Person=3|Tense=Pres|VerbForm=Fin 0 root",
            "книгу книга NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 2 obj NoSpace",
            ". . PUNCT _ 2 punct");

    private static final AnnotatedSentence BOOK_OF_BROTHER = sentence("book-of-brother",
            "Книга книга NOUN Animacy=Inan|Case=Nom|Gender=Fem|Number=Sing 3 nsubj",
            "брата брат NOUN Animacy=Anim|Case=Gen|Gender=Masc|Number=Sing 1 nmod",
            "лежала лежать VERB Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root NoSpace",
            ". . PUNCT _ 3 punct");

    private static final AnnotatedSentence BOOKS_OF_BROTHER = sentence("books-of-brother",
            "Книги книга NOUN Animacy=Inan|Case=Nom|Gender=Fem|Number=Plur 3 nsubj",
            "брата брат NOUN Animacy=Anim|Case=Gen|Gender=Masc|Number=Sing 1 nmod",
            "лежали лежать VERB Aspect=Imp|Mood=Ind|Number=Plur|Tense=Past|VerbForm=Fin 0 root NoSpace",
            ". . PUNCT _ 3 punct");

    private static final AnnotatedSentence LIKED_READING = sentence("liked-reading",
            "Мне я PRON Case=Dat|Number=Sing|Person=1 2 iobj",
            "нравилось нравиться VERB Aspect=Imp|Gender=Neut|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin|Voice=Mid 0 root",
            "читать читать VERB Aspect=Imp|VerbForm=Inf 2 csubj NoSpace",
            ". . PUNCT _ 2 punct");

    private static final AnnotatedSentence NO_WATER = sentence("no-water",
            "Воды вода NOUN Animacy=Inan|Case=Gen|Gender=Fem|Number=Sing 3 nsubj",
            "не не PART Polarity=Neg 3 advmod",
            "было быть VERB Aspect=Imp|Gender=Neut|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root NoSpace",
            ". . PUNCT _ 3 punct");

    private static final AnnotatedSentence MOTHER_HERSELF = sentence("mother-herself",
            "Мама мама NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 3 nsubj",
            "сама сам DET Case=Nom|Gender=Fem|Number=Sing 3 acl",
            "вымыла вымыть VERB Aspect=Perf|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root",
            "раму рама NOUN Animacy=Inan|Case=Acc|Gender=Fem|Number=Sing 3 obj NoSpace",
            ". . PUNCT _ 3 punct");

    private static final AnnotatedSentence PLEASED_GIRL = sentence("pleased-girl",
            "Девушка девушка NOUN Animacy=Anim|Case=Nom|Gender=Fem|Number=Sing 6 nsubj NoSpace",
            ", , PUNCT _ 3 punct",
            "довольная довольный ADJ Case=Nom|Degree=Pos|Gender=Fem|Number=Sing 1 acl",
            "собой себя PRON Case=Ins|Reflex=Yes 3 obl NoSpace",
            ", , PUNCT _ 3 punct",
            "ушла уйти VERB Aspect=Perf|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin 0 root NoSpace",
            ". . PUNCT _ 6 punct");

    @Test
    void predicateTakesThePluralAgainstASingularSubject() {
        List<MinimalPair> pairs = generate(MOTHER, "noun_subj_predicate_agreement_number");

        assertEquals(1, pairs.size());
        MinimalPair pair = pairs.get(0);
        assertEquals("Мама мыли раму.", pair.targetSentence());
        assertEquals("agreement", pair.phenomenon());
        assertEquals("Number", pair.feature());
        assertEquals("Plur", pair.targetWordFeatures().get("Number"));
        assertEquals("Мама", pair.sourceWordFeatures().get("control_form"));
        assertEquals(1, pair.treeLength());
    }

    @Test
    void pastPredicateTakesEveryOtherGender() {
        List<MinimalPair> pairs = generate(MANAGEMENT, "noun_subj_predicate_agreement_gender");

        assertEquals(List.of("Руководство выдал премию.", "Руководство выдала премию."), targets(pairs));
        assertTrue(pairs.stream().noneMatch(pair -> "Neut".equals(pair.targetWordFeatures().get("Gender"))));
    }

    @Test
    void collectiveSubjectLicensesThePlural() {
        GenerationReport report = new GenerationReport();

        List<MinimalPair> pairs = generate(MANAGEMENT, report, "noun_subj_predicate_agreement_number");

        assertTrue(pairs.isEmpty());
        assertEquals(1, report.rejections(ValidityChecks.LEXICAL_CLASS_EXCLUSION));
    }

    @Test
    void presentPredicateTakesAnotherPerson() {
        List<MinimalPair> pairs = generate(BOY, "noun_subj_predicate_agreement_person");

        assertEquals(List.of("Мальчик читаю книгу.", "Мальчик читаешь книгу."), targets(pairs));
        assertEquals("Person", pairs.get(0).feature());
    }

    @Test
    void genderAttractorLeavesOnlyItsOwnValue() {
        GenerationReport report = new GenerationReport();

        List<MinimalPair> pairs = generate(BOOK_OF_BROTHER, report, "noun_subj_predicate_agreement_gender");

        assertEquals(List.of("Книга брата лежал."), targets(pairs));
        assertEquals("subj_predicate_agreement_gender_attractor", pairs.get(0).phenomenonSubtype());
        assertEquals("Masc", pairs.get(0).targetWordFeatures().get("Gender"));
        assertEquals(1, report.rejections(ValidityChecks.ATTRACTOR_CONSISTENCY));
    }

    @Test
    void numberAttractorGivesTheSingularPredicate() {
        List<MinimalPair> pairs = generate(BOOKS_OF_BROTHER, "noun_subj_predicate_agreement_number");

        assertEquals(List.of("Книги брата лежала."), targets(pairs));
        assertEquals("subj_predicate_agreement_number_attractor", pairs.get(0).phenomenonSubtype());
        assertEquals("Sing", pairs.get(0).targetWordFeatures().get("Number"));
    }

    @Test
    void clausalSubjectKeepsTheNeuterSingular() {
        List<MinimalPair> gender = generate(LIKED_READING, "clause_subj_predicate_agreement_gender");
        List<MinimalPair> number = generate(LIKED_READING, "clause_subj_predicate_agreement_number");

        assertEquals(List.of("Мне нравился читать.", "Мне нравилась читать."), targets(gender));
        assertEquals(List.of("Мне нравились читать."), targets(number));
        assertEquals("читать", number.get(0).sourceWordFeatures().get("control_form"));
    }

    @Test
    void negatedGenitiveSubjectKeepsTheNeuterSingular() {
        List<MinimalPair> gender = generate(NO_WATER, "genitive_subj_predicate_agreement_gender");
        List<MinimalPair> number = generate(NO_WATER, "genitive_subj_predicate_agreement_number");

        assertEquals(List.of("Воды не был.", "Воды не была."), targets(gender));
        assertEquals(List.of("Воды не были."), targets(number));
        assertTrue(generate(NO_WATER, "noun_subj_predicate_agreement_number").isEmpty());
    }

    @Test
    void floatingQuantifierAgreesWithTheSubjectOfItsVerb() {
        GenerationReport report = new GenerationReport();

        List<MinimalPair> pairs = generate(MOTHER_HERSELF, report, "floating_quantifier_agreement_case");

        assertEquals(List.of("Мама саму вымыла раму."), targets(pairs));
        assertEquals("Мама", pairs.get(0).sourceWordFeatures().get("control_form"));
        assertEquals("same_clause", pairs.get(0).sourceWordFeatures().get("antecedent_kind"));
        assertEquals(4, report.rejections(ValidityChecks.NO_HOMONYMY));
    }

    @Test
    void appositiveSetOffByCommasIsARemoteModifier() {
        List<MinimalPair> pairs = generate(PLEASED_GIRL, "np_agreement_case_remote_modifier");

        assertEquals(List.of("Девушка, довольную собой, ушла."), targets(pairs));
        assertTrue(generate(PLEASED_GIRL, "np_agreement_case").isEmpty());
    }

    @Test
    void familyNameSelectsAllAgreementPhenomena() {
        GenerationReport report = new GenerationReport();

        generate(MOTHER, report, AgreementPhenomena.FAMILY);

        assertEquals(1, report.count(GenerationReport.SENTENCES));
        assertTrue(report.accepted("noun_subj_predicate_agreement_gender") > 0);
        assertTrue(report.accepted("noun_subj_predicate_agreement_number") > 0);
    }
}
