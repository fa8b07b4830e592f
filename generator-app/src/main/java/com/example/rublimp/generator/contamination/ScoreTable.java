package com.example.rublimp.generator.contamination;

import com.example.rublimp.generator.GenerationException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-model min-k% statistics of grammatical sentences, keyed by sentence text. Built from
 * precomputed token log-probabilities ({@code {"model": {"sentence": [logprob, ...]}}}) or by
 * querying a {@link SentenceScorer}.
 */
public final class ScoreTable {

    private static final Type LOG_PROBS_TYPE = new TypeToken<Map<String, Map<String, List<Double>>>>() {
    }.getType();

    private final Map<String, Map<String, Double>> scoresByModel;

    private ScoreTable(Map<String, Map<String, Double>> scoresByModel) {
        this.scoresByModel = Collections.unmodifiableMap(scoresByModel);
    }

    public static ScoreTable read(Path file, double ratio) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, ratio);
        } catch (IOException ex) {
            throw new GenerationException("Failed to read token log-probabilities from " + file.toAbsolutePath(), ex);
        }
    }

    static ScoreTable read(Reader source, double ratio) {
        Map<String, Map<String, List<Double>>> logProbs;
        try {
            logProbs = new Gson().fromJson(new JsonReader(source), LOG_PROBS_TYPE);
        } catch (JsonParseException ex) {
            throw new GenerationException("Invalid token log-probability file: " + ex.getMessage(), ex);
        }
        if (logProbs == null || logProbs.isEmpty()) {
            throw new GenerationException("Token log-probability file lists no models");
        }
        Map<String, Map<String, Double>> scores = new LinkedHashMap<>();
        logProbs.forEach((model, sentences) -> {
            Map<String, Double> byText = new LinkedHashMap<>();
            sentences.forEach((sentence, tokens) -> byText.put(sentence, MinKProbability.score(tokens, ratio)));
            scores.put(model, byText);
        });
        return new ScoreTable(scores);
    }

    public static ScoreTable score(SentenceScorer scorer, Collection<String> models, Collection<String> sentences,
                                   double ratio) {
        Map<String, Map<String, Double>> scores = new LinkedHashMap<>();
        for (String model : models) {
            Map<String, Double> byText = new LinkedHashMap<>();
            for (String sentence : sentences) {
                if (!byText.containsKey(sentence)) {
                    byText.put(sentence, MinKProbability.score(scorer.score(sentence, model), ratio));
                }
            }
            scores.put(model, byText);
        }
        return new ScoreTable(scores);
    }

    public Map<String, Map<String, Double>> scoresByModel() {
        return scoresByModel;
    }
}
