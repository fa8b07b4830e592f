package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MorphAgreementResolverTest {

    private MorphAgreementResolver resolver;

    @BeforeEach
    void setUp() {
        LexiconMorphologyAnalyzer analyzer = LexiconMorphologyAnalyzer.builder()
                .add("мыла", "мыло", "NOUN", "Animacy=Inan|Case=Gen|Gender=Neut|Number=Sing")
                .add("мыла", "мыть", "VERB", "Aspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin")
                .add("раме", "рама", "NOUN", "Animacy=Inan|Case=Dat|Gender=Fem|Number=Sing", 3)
                .add("раме", "рама", "NOUN", "Animacy=Inan|Case=Loc|Gender=Fem|Number=Sing", 1)
                .add("икс", "икс", "NOUN", "Case=Gen|Gender=Fem|Number=Plur")
                .add("икс", "икс", "NOUN", "Case=Acc|Gender=Masc|Number=Sing")
                .build();
        resolver = new MorphAgreementResolver(analyzer);
    }

    @Test
    void picksTheReadingOfTheParsersLemma() {
        Token verb = token("мыла", "мыть", "VERB", "Gender=Fem|Number=Sing|Tense=Past|VerbForm=Fin");

        Resolution resolution = resolver.resolve(verb, Set.of("Number", "Gender"));

        assertTrue(resolution.isResolved());
        assertEquals("VERB", resolution.analysis().pos());
    }

    @Test
    void overlapTieGoesToTheLowerRank() {
        Token noun = token("раме", "рама", "NOUN", "Gender=Fem|Number=Sing");

        Resolution resolution = resolver.resolve(noun, Set.of("Number"));

        assertEquals("Loc", resolution.analysis().features().get("Case"));
    }

    @Test
    void disagreementOnARequiredCategoryIsUnresolved() {
        Token verb = token("мыла", "мыть", "VERB", "Gender=Fem|Number=Plur|Tense=Past");

        Resolution resolution = resolver.resolve(verb, Set.of("Number"));

        assertFalse(resolution.isResolved());
        assertTrue(resolution.reason().contains("Number"));
        assertThrows(IllegalStateException.class, resolution::analysis);
    }

    @Test
    void readingAgreeingOnRequiredCategoriesWinsOverHigherOverlap() {
        Token noun = token("икс", "икс", "NOUN", "Case=Gen|Gender=Fem|Number=Sing");

        Resolution resolution = resolver.resolve(noun, Set.of("Number"));

        assertTrue(resolution.isResolved());
        assertEquals("Sing", resolution.analysis().features().get("Number"));
        assertEquals("Acc", resolution.analysis().features().get("Case"));
    }

    @Test
    void unknownFormIsUnresolved() {
        Resolution resolution = resolver.resolve(token("окно", "окно", "NOUN", "_"), Set.of());

        assertFalse(resolution.isResolved());
    }

    @Test
    void verifyAgreementFlagsContradictingReadings() {
        Analysis feminine = new Analysis("мыла", "мыть", "VERB", FeatureBundle.of("Gender", "Fem"), 0);
        Analysis masculine = new Analysis("стол", "стол", "NOUN", FeatureBundle.of("Gender", "Masc"), 0);
        Analysis unmarked = new Analysis("мыли", "мыть", "VERB", FeatureBundle.of("Number", "Plur"), 0);

        assertFalse(resolver.verifyAgreement("s1", feminine, masculine, Set.of("Gender")));
        assertTrue(resolver.verifyAgreement("s1", unmarked, masculine, Set.of("Gender")));
    }

    private static Token token(String form, String lemma, String upos, String feats) {
        return new Token(1, form, lemma, upos, FeatureBundle.parse(feats), 0, "root", true);
    }
}
