package com.example.rublimp.generator.lexicon;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.morphology.Orthography;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;

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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Curated tables consulted by the perturbation rules: affix co-occurrence, morpheme segmentation,
 * forbidden letter sequences, semantic noun classes, temporal and aspectual markers, aspect pairs,
 * lemma frequencies, ending tables, government tables and pronoun tables. Loaded once and read-only
 * afterwards.
 */
public final class LexicalResources {

    static final String DEFAULT_DIRECTORY = "/tables/";

    /** Affix co-occurrence data ({@code affixes.json}). */
    public static final class AffixTables {
        public Map<String, List<String>> prefixRoot = new HashMap<>();
        public Map<String, List<String>> suffixRoot = new HashMap<>();
        public Map<String, List<String>> suffixPos = new HashMap<>();
        /** suffix -> [suffixes it excludes among candidates, suffixes it excludes when already present]. */
        public Map<String, List<List<String>>> derivationalSuffixes = new LinkedHashMap<>();
        public List<String> inflectionalSuffixes = new ArrayList<>();
        public List<String> lexicalPrefixes = new ArrayList<>();
        public Map<String, List<String>> prefixOverlap = new HashMap<>();
        public List<String> excludedPrefixRoots = new ArrayList<>();
    }

    /** Permitted-sequence table ({@code orthography.json}). */
    public static final class OrthographyTables {
        public List<String> forbiddenSequences = new ArrayList<>();
        public List<String> forbiddenBeginnings = new ArrayList<>();
    }

    /** Semantic exclusion lexicon ({@code semantic_classes.json}). */
    public static final class SemanticClasses {
        public List<String> collectiveNouns = new ArrayList<>();
        public List<String> commonGenderNouns = new ArrayList<>();
    }

    /** Tense markers ({@code temporal_markers.json}), keyed by UD tense value. */
    public static final class TemporalMarkers {
        public Map<String, List<String>> simple = new HashMap<>();
        public Map<String, List<String>> adjectives = new HashMap<>();
        public Map<String, Map<String, List<String>>> collocations = new HashMap<>();
        public List<String> expressionPrepositions = new ArrayList<>();
    }

    /** Aspect contexts ({@code aspect.json}). */
    public static final class AspectTables {
        public List<String> durationAdverbs = new ArrayList<>();
        public List<String> repetitionAdverbs = new ArrayList<>();
        public List<String> repetitionQuantifiers = new ArrayList<>();
        public List<String> timePeriods = new ArrayList<>();
        public List<String> deonticPredicates = new ArrayList<>();
        public List<String> excludedForms = new ArrayList<>();
    }

    /** Ending replacement tables ({@code endings.json}). */
    public static final class EndingTables {
        public Map<String, String> conjugation = new LinkedHashMap<>();
        /** Number -> Case -> ending -> replacement endings. */
        public Map<String, Map<String, Map<String, List<String>>>> declension = new HashMap<>();
    }

    /** Government constraints ({@code government.json}). */
    public static final class GovernmentTables {
        public Map<String, List<String>> adpositionCases = new HashMap<>();
        public List<String> modalVerbs = new ArrayList<>();
        public List<String> whWords = new ArrayList<>();
        public List<String> instrumentalPronouns = new ArrayList<>();
    }

    /** Indefinite and negative pronoun correspondences ({@code pronouns.json}). */
    public static final class PronounTables {
        public Map<String, List<String>> indefiniteToNegative = new LinkedHashMap<>();
        public Map<String, List<String>> negativeToIndefinite = new LinkedHashMap<>();
    }

    /** An intransitive verb lemma with its aspect ({@code verbs.json}). */
    public static final class VerbEntry {
        public String lemma;
        public String aspect;
    }

    /** Verb classes ({@code verbs.json}). */
    public static final class VerbTables {
        public List<VerbEntry> intransitive = new ArrayList<>();
    }

    @FunctionalInterface
    interface TableSource {
        Reader open(String name) throws IOException;
    }

    private final AffixTables affixes;
    private final OrthographyTables orthography;
    private final SemanticClasses semanticClasses;
    private final TemporalMarkers temporalMarkers;
    private final AspectTables aspect;
    private final EndingTables endings;
    private final GovernmentTables government;
    private final PronounTables pronouns;
    private final VerbTables verbs;
    private final Map<String, MorphemeSegmentation> segmentation;
    private final Map<String, List<String>> aspectPairs;
    private final Map<String, Double> frequencies;

    private LexicalResources(AffixTables affixes, OrthographyTables orthography, SemanticClasses semanticClasses,
                             TemporalMarkers temporalMarkers, AspectTables aspect, EndingTables endings,
                             GovernmentTables government, PronounTables pronouns, VerbTables verbs,
                             Map<String, MorphemeSegmentation> segmentation, Map<String, List<String>> aspectPairs,
                             Map<String, Double> frequencies) {
        this.affixes = affixes;
        this.orthography = orthography;
        this.semanticClasses = semanticClasses;
        this.temporalMarkers = temporalMarkers;
        this.aspect = aspect;
        this.endings = endings;
        this.government = government;
        this.pronouns = pronouns;
        this.verbs = verbs;
        this.segmentation = Collections.unmodifiableMap(segmentation);
        this.aspectPairs = Collections.unmodifiableMap(aspectPairs);
        this.frequencies = Collections.unmodifiableMap(frequencies);
    }

    /**
     * Loads the tables from the directory named by {@code rublimp.tables.dir}, then
     * {@code RUBLIMP_TABLES_DIR}, then the bundled classpath resources.
     */
    public static LexicalResources loadDefault() {
        String systemProperty = System.getProperty("rublimp.tables.dir");
        if (systemProperty != null && !systemProperty.isBlank()) {
            return load(Path.of(systemProperty));
        }
        String envPath = System.getenv("RUBLIMP_TABLES_DIR");
        if (envPath != null && !envPath.isBlank()) {
            return load(Path.of(envPath));
        }
        return fromClasspath(DEFAULT_DIRECTORY);
    }

    public static LexicalResources load(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new GenerationException("Table directory not found: " + directory.toAbsolutePath());
        }
        return read(name -> {
            Path file = directory.resolve(name);
            if (!Files.isRegularFile(file)) {
                throw new GenerationException("Missing table " + file.toAbsolutePath());
            }
            return Files.newBufferedReader(file, StandardCharsets.UTF_8);
        });
    }

    public static LexicalResources fromClasspath(String directory) {
        String prefix = directory.endsWith("/") ? directory : directory + "/";
        return read(name -> {
            InputStream stream = LexicalResources.class.getResourceAsStream(prefix + name);
            if (stream == null) {
                throw new GenerationException("Missing table resource " + prefix + name);
            }
            return new InputStreamReader(stream, StandardCharsets.UTF_8);
        });
    }

    static LexicalResources read(TableSource source) {
        Gson gson = new GsonBuilder().create();
        return new LexicalResources(
                readJson(gson, source, "affixes.json", AffixTables.class),
                readJson(gson, source, "orthography.json", OrthographyTables.class),
                readJson(gson, source, "semantic_classes.json", SemanticClasses.class),
                readJson(gson, source, "temporal_markers.json", TemporalMarkers.class),
                readJson(gson, source, "aspect.json", AspectTables.class),
                readJson(gson, source, "endings.json", EndingTables.class),
                readJson(gson, source, "government.json", GovernmentTables.class),
                readJson(gson, source, "pronouns.json", PronounTables.class),
                readJson(gson, source, "verbs.json", VerbTables.class),
                readSegmentation(source),
                readAspectPairs(source),
                readFrequencies(source));
    }

    private static <T> T readJson(Gson gson, TableSource source, String name, Class<T> type) {
        try (Reader reader = source.open(name)) {
            T value = gson.fromJson(new JsonReader(reader), type);
            if (value == null) {
                throw new GenerationException("Table " + name + " is empty");
            }
            return value;
        } catch (IOException | JsonParseException ex) {
            throw new GenerationException("Failed to read table " + name, ex);
        }
    }

    private static List<String[]> readTsv(TableSource source, String name, int columns) {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(source.open(name))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length < columns) {
                    throw new GenerationException("Invalid line " + lineNumber + " in table " + name + ": " + line);
                }
                rows.add(parts);
            }
        } catch (IOException ex) {
            throw new GenerationException("Failed to read table " + name, ex);
        }
        return rows;
    }

    private static Map<String, MorphemeSegmentation> readSegmentation(TableSource source) {
        Map<String, MorphemeSegmentation> map = new HashMap<>();
        for (String[] row : readTsv(source, "segmentation.tsv", 2)) {
            String word = row[0].strip();
            map.put(word, MorphemeSegmentation.parse(word, row[1].strip()));
        }
        return map;
    }

    private static Map<String, List<String>> readAspectPairs(TableSource source) {
        Map<String, List<String>> map = new HashMap<>();
        for (String[] row : readTsv(source, "aspect_pairs.tsv", 2)) {
            map.computeIfAbsent(row[0].strip(), key -> new ArrayList<>()).add(row[1].strip());
        }
        return map;
    }

    private static Map<String, Double> readFrequencies(TableSource source) {
        Map<String, Double> map = new HashMap<>();
        for (String[] row : readTsv(source, "frequencies.tsv", 2)) {
            try {
                map.put(row[0].strip(), Double.parseDouble(row[1].strip()));
            } catch (NumberFormatException ex) {
                throw new GenerationException("Invalid frequency for " + row[0] + " in frequencies.tsv", ex);
            }
        }
        return map;
    }

    // -------------------- Word formation --------------------

    public Optional<MorphemeSegmentation> segmentation(String lemma) {
        return Optional.ofNullable(segmentation.get(lemma.toLowerCase(Locale.ROOT)));
    }

    public List<String> suffixesForRoot(String root, String pos) {
        return affixes.suffixRoot.getOrDefault(root + "_" + pos, List.of());
    }

    public List<String> suffixesForPos(String pos) {
        return affixes.suffixPos.getOrDefault(pos, List.of());
    }

    public boolean isDerivationalSuffix(String suffix) {
        return affixes.derivationalSuffixes.containsKey(suffix);
    }

    public boolean isInflectionalSuffix(String suffix) {
        return affixes.inflectionalSuffixes.contains(suffix);
    }

    /**
     * Suffixes that a derivational suffix rules out: index 0 among new candidates, index 1 when
     * it is already present in the word.
     */
    public List<String> suffixExclusions(String suffix, int group) {
        List<List<String>> groups = affixes.derivationalSuffixes.getOrDefault(suffix, List.of());
        return group < groups.size() ? groups.get(group) : List.of();
    }

    public List<String> prefixesForRoot(String root, String pos) {
        return affixes.prefixRoot.getOrDefault(root + "_" + pos, List.of());
    }

    public List<String> lexicalPrefixes() {
        return Collections.unmodifiableList(affixes.lexicalPrefixes);
    }

    public boolean isLexicalPrefix(String prefix) {
        return affixes.lexicalPrefixes.contains(prefix);
    }

    public List<String> overlappingPrefixes(String prefix) {
        return affixes.prefixOverlap.getOrDefault(prefix, List.of());
    }

    public boolean isExcludedPrefixRoot(String root) {
        return affixes.excludedPrefixRoots.contains(root);
    }

    // -------------------- Orthography --------------------

    public Optional<String> forbiddenSequenceIn(String word) {
        String unified = Orthography.unify(word);
        for (String sequence : orthography.forbiddenSequences) {
            if (unified.contains(sequence)) {
                return Optional.of(sequence);
            }
        }
        return Optional.empty();
    }

    public boolean hasForbiddenBeginning(String word) {
        String unified = Orthography.unify(word);
        for (String beginning : orthography.forbiddenBeginnings) {
            if (unified.startsWith(beginning)) {
                return true;
            }
        }
        return false;
    }

    // -------------------- Semantic classes --------------------

    public boolean isCollectiveNoun(String lemma) {
        return semanticClasses.collectiveNouns.contains(lemma.toLowerCase(Locale.ROOT));
    }

    public boolean isCommonGenderNoun(String lemma) {
        return semanticClasses.commonGenderNouns.contains(lemma.toLowerCase(Locale.ROOT));
    }

    // -------------------- Tense and aspect --------------------

    public List<String> simpleTenseMarkers(String tense) {
        return temporalMarkers.simple.getOrDefault(tense, List.of());
    }

    public List<String> tenseAdjectives(String tense) {
        return temporalMarkers.adjectives.getOrDefault(tense, List.of());
    }

    /**
     * Adjectives that combine with a time noun in the given tense ("на прошлой неделе").
     */
    public List<String> tenseCollocations(String tense, String noun) {
        return temporalMarkers.collocations.getOrDefault(tense, Map.of()).getOrDefault(noun, List.of());
    }

    public boolean isTenseExpressionPreposition(String lemma) {
        return temporalMarkers.expressionPrepositions.contains(lemma);
    }

    public boolean isDurationAdverb(String lemma) {
        return aspect.durationAdverbs.contains(lemma);
    }

    public boolean isRepetitionAdverb(String lemma) {
        return aspect.repetitionAdverbs.contains(lemma);
    }

    public boolean isRepetitionQuantifier(String lemma) {
        return aspect.repetitionQuantifiers.contains(lemma);
    }

    public boolean isTimePeriod(String lemma) {
        return aspect.timePeriods.contains(lemma);
    }

    public boolean isDeonticPredicate(String lemma) {
        return aspect.deonticPredicates.contains(lemma);
    }

    public boolean isAspectExcludedForm(String form) {
        return aspect.excludedForms.contains(form.toLowerCase(Locale.ROOT));
    }

    /**
     * Perfective partner of an imperfective lemma; with several partners the most frequent wins,
     * partners without a known frequency are ignored.
     */
    public Optional<String> perfectivePartner(String imperfective) {
        String best = null;
        double bestIpm = -1;
        for (String candidate : aspectPairs.getOrDefault(imperfective, List.of())) {
            Double ipm = frequencies.get(candidate);
            if (ipm != null && ipm > bestIpm) {
                best = candidate;
                bestIpm = ipm;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Instances per million for a lemma, 0 when unlisted.
     */
    public double ipm(String lemma) {
        return frequencies.getOrDefault(lemma, 0.0);
    }

    // -------------------- Inflection --------------------

    public Map<String, String> conjugationEndings() {
        return Collections.unmodifiableMap(endings.conjugation);
    }

    public Map<String, List<String>> declensionEndings(String number, String grammaticalCase) {
        return endings.declension.getOrDefault(number, Map.of()).getOrDefault(grammaticalCase, Map.of());
    }

    // -------------------- Government --------------------

    public Set<String> adpositionCases(String adposition) {
        return new LinkedHashSet<>(government.adpositionCases.getOrDefault(adposition.toLowerCase(Locale.ROOT), List.of()));
    }

    public boolean isModalVerb(String lemma) {
        return government.modalVerbs.contains(lemma);
    }

    public boolean isWhWord(String lemma) {
        return government.whWords.contains(lemma.toLowerCase(Locale.ROOT));
    }

    public boolean isInstrumentalPronoun(String form) {
        return government.instrumentalPronouns.contains(form.toLowerCase(Locale.ROOT));
    }

    // -------------------- Pronouns and verbs --------------------

    public List<String> negativeCounterparts(String indefinite) {
        return pronouns.indefiniteToNegative.getOrDefault(indefinite, List.of());
    }

    public List<String> indefiniteCounterparts(String negative) {
        return pronouns.negativeToIndefinite.getOrDefault(negative, List.of());
    }

    public List<VerbEntry> intransitiveVerbs() {
        return Collections.unmodifiableList(verbs.intransitive);
    }

    public boolean isIntransitive(String lemma) {
        for (VerbEntry entry : verbs.intransitive) {
            if (entry.lemma.equals(lemma)) {
                return true;
            }
        }
        return false;
    }
}
