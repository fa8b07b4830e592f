package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.sentence.FeatureBundle;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Analyzer backed by a full-form paradigm lexicon. Each line of the lexicon holds
 * {@code form<TAB>lemma<TAB>UPOS<TAB>FEATS[<TAB>rank]}; lines starting with {@code #} are
 * comments. Without an explicit rank, lemmas are ranked by their first appearance, so a lexicon
 * sorted by frequency ranks readings by frequency.
 */
public final class LexiconMorphologyAnalyzer implements MorphologyAnalyzer {

    static final String DEFAULT_RESOURCE = "/lexicon/ru_paradigms.tsv";

    private final Map<String, List<Analysis>> byForm;
    private final Map<String, List<Analysis>> byLemma;

    private LexiconMorphologyAnalyzer(Map<String, List<Analysis>> byForm,
                                      Map<String, List<Analysis>> byLemma) {
        this.byForm = freeze(byForm);
        this.byLemma = freeze(byLemma);
    }

    /**
     * Loads the lexicon named by {@code rublimp.lexicon.path}, then {@code RUBLIMP_LEXICON}, then the
     * bundled resource.
     */
    public static LexiconMorphologyAnalyzer loadDefault() {
        String systemProperty = System.getProperty("rublimp.lexicon.path");
        if (systemProperty != null && !systemProperty.isBlank()) {
            return load(Path.of(systemProperty));
        }
        String envPath = System.getenv("RUBLIMP_LEXICON");
        if (envPath != null && !envPath.isBlank()) {
            return load(Path.of(envPath));
        }
        return loadResource(DEFAULT_RESOURCE);
    }

    public static LexiconMorphologyAnalyzer load(Path lexiconPath) {
        Objects.requireNonNull(lexiconPath, "lexiconPath");
        if (!Files.isRegularFile(lexiconPath)) {
            throw new GenerationException("Paradigm lexicon not found: " + lexiconPath.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(lexiconPath, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException ex) {
            throw new GenerationException("Failed to load paradigm lexicon from " + lexiconPath.toAbsolutePath(), ex);
        }
    }

    static LexiconMorphologyAnalyzer loadResource(String resource) {
        try (InputStream stream = LexiconMorphologyAnalyzer.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new GenerationException("Missing paradigm lexicon resource " + resource
                        + ". Provide a path via system property 'rublimp.lexicon.path' or environment variable 'RUBLIMP_LEXICON'.");
            }
            return read(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new GenerationException("Failed to read paradigm lexicon resource " + resource, ex);
        }
    }

    public static LexiconMorphologyAnalyzer read(Reader source) throws IOException {
        Builder builder = builder();
        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] columns = line.split("\t");
            if (columns.length < 4) {
                throw new GenerationException("Invalid lexicon line " + lineNumber + ": " + line);
            }
            FeatureBundle features;
            try {
                features = FeatureBundle.parse(columns[3]);
            } catch (IllegalArgumentException ex) {
                throw new GenerationException("Invalid features on lexicon line " + lineNumber + ": " + line, ex);
            }
            if (columns.length > 4) {
                int rank;
                try {
                    rank = Integer.parseInt(columns[4].strip());
                } catch (NumberFormatException ex) {
                    throw new GenerationException("Invalid rank on lexicon line " + lineNumber + ": " + line, ex);
                }
                builder.add(columns[0].strip(), columns[1].strip(), columns[2].strip(), features, rank);
            } else {
                builder.add(columns[0].strip(), columns[1].strip(), columns[2].strip(), features);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Analysis> analyze(String surface) {
        if (surface == null || surface.isEmpty()) {
            return List.of();
        }
        return byForm.getOrDefault(Orthography.unify(surface), List.of());
    }

    @Override
    public Optional<String> synthesize(String lemma, String pos, FeatureBundle features) {
        Analysis best = null;
        int bestExtra = Integer.MAX_VALUE;
        for (Analysis cell : paradigm(lemma, pos)) {
            if (!cell.features().contains(features)) {
                continue;
            }
            int extra = cell.features().categories().size() - features.categories().size();
            if (best == null || extra < bestExtra
                    || (extra == bestExtra && cell.frequencyRank() < best.frequencyRank())) {
                best = cell;
                bestExtra = extra;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.form());
    }

    @Override
    public List<Analysis> paradigm(String lemma, String pos) {
        if (lemma == null || pos == null) {
            return List.of();
        }
        return byLemma.getOrDefault(lemmaKey(lemma, pos), List.of());
    }

    @Override
    public boolean isKnown(String surface) {
        return !analyze(surface).isEmpty();
    }

    private static String lemmaKey(String lemma, String pos) {
        return Orthography.unify(lemma) + '\t' + pos.toUpperCase(Locale.ROOT);
    }

    private static Map<String, List<Analysis>> freeze(Map<String, List<Analysis>> source) {
        Map<String, List<Analysis>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Collections.unmodifiableList(new ArrayList<>(value))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Collects paradigm cells; used by the file loader and by tests that need a small lexicon.
     */
    public static final class Builder {

        private final Map<String, List<Analysis>> byForm = new LinkedHashMap<>();
        private final Map<String, List<Analysis>> byLemma = new LinkedHashMap<>();
        private final Map<String, Integer> lemmaRanks = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String form, String lemma, String pos, FeatureBundle features) {
            int rank = lemmaRanks.computeIfAbsent(lemmaKey(lemma, pos), key -> lemmaRanks.size());
            return add(form, lemma, pos, features, rank);
        }

        public Builder add(String form, String lemma, String pos, String feats) {
            return add(form, lemma, pos, FeatureBundle.parse(feats));
        }

        public Builder add(String form, String lemma, String pos, String feats, int rank) {
            return add(form, lemma, pos, FeatureBundle.parse(feats), rank);
        }

        public Builder add(String form, String lemma, String pos, FeatureBundle features, int rank) {
            Analysis analysis = new Analysis(form, lemma, pos, features, rank);
            byForm.computeIfAbsent(Orthography.unify(form), key -> new ArrayList<>()).add(analysis);
            byLemma.computeIfAbsent(lemmaKey(lemma, pos), key -> new ArrayList<>()).add(analysis);
            lemmaRanks.putIfAbsent(lemmaKey(lemma, pos), rank);
            return this;
        }

        public LexiconMorphologyAnalyzer build() {
            return new LexiconMorphologyAnalyzer(byForm, byLemma);
        }
    }
}
