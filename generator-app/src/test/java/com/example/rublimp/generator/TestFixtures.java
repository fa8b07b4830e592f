package com.example.rublimp.generator;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.LexiconMorphologyAnalyzer;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.phenomena.PhenomenonRegistry;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.FeatureBundle;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bundled tables and lexicon shared by the tests, plus a compact way to write parsed sentences.
 */
public final class TestFixtures {

    private static LexicalResources resources;
    private static LexiconMorphologyAnalyzer analyzer;

    private TestFixtures() {
        // Utility class
    }

    public static synchronized LexicalResources resources() {
        if (resources == null) {
            resources = LexicalResources.fromClasspath("/tables/");
        }
        return resources;
    }

    public static synchronized LexiconMorphologyAnalyzer analyzer() {
        if (analyzer == null) {
            analyzer = LexiconMorphologyAnalyzer.loadDefault();
        }
        return analyzer;
    }

    /**
     * Builds a sentence from rows of {@code form lemma UPOS FEATS head deprel [NoSpace]}, separated
     * by whitespace. Positions follow the row order.
     */
    public static AnnotatedSentence sentence(String id, String... rows) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            String[] cells = rows[i].trim().split("\\s+");
            if (cells.length < 6) {
                throw new IllegalArgumentException("Row needs six cells: " + Arrays.toString(cells));
            }
            boolean spaceAfter = cells.length < 7 || !"NoSpace".equals(cells[6]);
            tokens.add(new Token(i + 1, cells[0], cells[1], cells[2], FeatureBundle.parse(cells[3]),
                    Integer.parseInt(cells[4]), cells[5], spaceAfter));
        }
        return AnnotatedSentence.of(id, null, tokens);
    }

    public static PerturbationEngine engine(String... phenomena) {
        PhenomenonRegistry registry = PhenomenonRegistry.standard(resources()).select(Arrays.asList(phenomena));
        return new PerturbationEngine(registry, analyzer(), resources(), GeneratorConfig.DEFAULT_DOMAIN);
    }

    public static List<MinimalPair> generate(AnnotatedSentence sentence, GenerationReport report, String... phenomena) {
        return engine(phenomena).generate(sentence, report);
    }

    public static List<MinimalPair> generate(AnnotatedSentence sentence, String... phenomena) {
        return generate(sentence, new GenerationReport(), phenomena);
    }

    public static List<String> targets(List<MinimalPair> pairs) {
        List<String> targets = new ArrayList<>();
        for (MinimalPair pair : pairs) {
            targets.add(pair.targetSentence());
        }
        return targets;
    }
}
