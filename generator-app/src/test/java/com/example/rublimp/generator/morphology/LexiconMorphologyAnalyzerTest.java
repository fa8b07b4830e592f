package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.sentence.FeatureBundle;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexiconMorphologyAnalyzerTest {

    private final LexiconMorphologyAnalyzer analyzer = LexiconMorphologyAnalyzer.builder()
            .add("стол", "стол", "NOUN", "Animacy=Inan|Case=Nom|Gender=Masc|Number=Sing")
            .add("стола", "стол", "NOUN", "Animacy=Inan|Case=Gen|Gender=Masc|Number=Sing")
            .add("стол", "стол", "NOUN", "Animacy=Inan|Case=Acc|Gender=Masc|Number=Sing")
            .add("столы", "стол", "NOUN", "Animacy=Inan|Case=Nom|Gender=Masc|Number=Plur")
            .add("пришёл", "прийти", "VERB", "Aspect=Perf|Gender=Masc|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin")
            .build();

    @Test
    void analyzeReturnsEveryReadingOfAForm() {
        List<Analysis> readings = analyzer.analyze("Стол");

        assertEquals(2, readings.size());
        assertEquals("Nom", readings.get(0).features().get("Case"));
        assertEquals("Acc", readings.get(1).features().get("Case"));
    }

    @Test
    void analyzeIgnoresTheLetterYo() {
        assertTrue(analyzer.isKnown("пришел"));
        assertTrue(analyzer.isKnown("пришёл"));
        assertFalse(analyzer.isKnown("ушел"));
    }

    @Test
    void synthesizePrefersTheCellWithFewestExtraCategories() {
        Optional<String> genitive = analyzer.synthesize("стол", "NOUN", FeatureBundle.of("Case", "Gen"));
        Optional<String> plural = analyzer.synthesize("стол", "NOUN", FeatureBundle.of("Number", "Plur", "Case", "Nom"));

        assertEquals(Optional.of("стола"), genitive);
        assertEquals(Optional.of("столы"), plural);
        assertEquals(Optional.empty(), analyzer.synthesize("стол", "NOUN", FeatureBundle.of("Case", "Ins")));
        assertEquals(Optional.empty(), analyzer.synthesize("стол", "VERB", FeatureBundle.of("Case", "Gen")));
    }

    @Test
    void readsLexiconFileFormat() throws IOException {
        String lexicon = "# form\tlemma\tupos\tfeats\n"
                + "мама\tмама\tNOUN\tCase=Nom|Number=Sing\n"
                + "мамы\tмама\tNOUN\tCase=Gen|Number=Sing\t7\n";

        LexiconMorphologyAnalyzer read = LexiconMorphologyAnalyzer.read(new StringReader(lexicon));

        assertEquals(2, read.paradigm("мама", "NOUN").size());
        assertEquals(7, read.analyze("мамы").get(0).frequencyRank());
    }

    @Test
    void rejectsShortLines() {
        assertThrows(GenerationException.class,
                () -> LexiconMorphologyAnalyzer.read(new StringReader("мама\tмама\n")));
    }

    @Test
    void nonNumericRankIsReportedWithItsLine() {
        GenerationException error = assertThrows(GenerationException.class,
                () -> LexiconMorphologyAnalyzer.read(new StringReader("мама\tмама\tNOUN\tCase=Nom\n"
                        + "мамы\tмама\tNOUN\tCase=Gen\tseven\n")));

        assertTrue(error.getMessage().contains("line 2"));
        assertTrue(error.getCause() instanceof NumberFormatException);
    }

    @Test
    void missingFileIsReported() {
        assertThrows(GenerationException.class, () -> LexiconMorphologyAnalyzer.load(Path.of("no-such-lexicon.tsv")));
    }

    @Test
    void bundledLexiconCoversTheCommonParadigms() {
        LexiconMorphologyAnalyzer bundled = LexiconMorphologyAnalyzer.loadResource(LexiconMorphologyAnalyzer.DEFAULT_RESOURCE);

        assertEquals(Optional.of("мыли"), bundled.synthesize("мыть", "VERB",
                FeatureBundle.parse("Aspect=Imp|Mood=Ind|Number=Plur|Tense=Past|VerbForm=Fin")));
        assertFalse(bundled.isKnown("плечники"));
    }
}
