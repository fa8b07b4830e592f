package com.example.rublimp.generator.contamination;

import com.example.rublimp.generator.pairs.MinimalPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the score threshold at which the sentences scored at or below it by every model form a
 * pool of the requested size. Scores equal to the threshold enter together, so the pool can be
 * larger than requested when they straddle the target.
 */
public final class ContaminationThresholdSearch {

    private static final Logger log = LoggerFactory.getLogger(ContaminationThresholdSearch.class);

    /**
     * @param scoresByModel per model, the statistic of each sentence
     * @param targetSize    pool size to reach, at least one
     */
    public ThresholdResult selectThreshold(Map<String, Map<String, Double>> scoresByModel, int targetSize) {
        if (targetSize < 1) {
            throw new IllegalArgumentException("Target size must be positive: " + targetSize);
        }
        if (scoresByModel.isEmpty()) {
            throw new IllegalArgumentException("No model scores to search");
        }
        int models = scoresByModel.size();
        List<Entry> entries = new ArrayList<>();
        for (Map<String, Double> scores : scoresByModel.values()) {
            scores.forEach((sentence, score) -> {
                requireScore(sentence, score);
                entries.add(new Entry(sentence, score));
            });
        }
        entries.sort(Comparator.comparingDouble((Entry entry) -> entry.score).thenComparing(entry -> entry.sentence));

        Map<String, Integer> seenBy = new HashMap<>();
        Set<String> intersection = new LinkedHashSet<>();
        double threshold = Double.NaN;
        int i = 0;
        while (i < entries.size()) {
            threshold = entries.get(i).score;
            while (i < entries.size() && entries.get(i).score == threshold) {
                String sentence = entries.get(i).sentence;
                int count = seenBy.merge(sentence, 1, Integer::sum);
                if (count == models) {
                    intersection.add(sentence);
                }
                i++;
            }
            if (intersection.size() >= targetSize) {
                log.info("Threshold {} gives {} sentences across {} models (target {})",
                        threshold, intersection.size(), models, targetSize);
                return ThresholdResult.attained(threshold, targetSize, intersection);
            }
        }
        log.warn("No threshold reaches {} sentences across {} models; best is {}", targetSize, models, intersection.size());
        return ThresholdResult.unattainable(threshold, targetSize, intersection);
    }

    /**
     * Sentences every model scored at or below {@code threshold}.
     */
    public Set<String> eligibleSentences(Map<String, Map<String, Double>> scoresByModel, double threshold) {
        Set<String> eligible = null;
        for (Map<String, Double> scores : scoresByModel.values()) {
            Set<String> below = new LinkedHashSet<>();
            scores.forEach((sentence, score) -> {
                if (requireScore(sentence, score) <= threshold) {
                    below.add(sentence);
                }
            });
            if (eligible == null) {
                eligible = below;
            } else {
                eligible.retainAll(below);
            }
        }
        return eligible == null ? Set.of() : eligible;
    }

    /**
     * Pairs whose grammatical sentence is in the eligible pool.
     */
    public static List<MinimalPair> retainEligible(Collection<MinimalPair> pairs, Set<String> eligible) {
        List<MinimalPair> kept = new ArrayList<>();
        for (MinimalPair pair : pairs) {
            if (eligible.contains(pair.sourceSentence())) {
                kept.add(pair);
            }
        }
        return kept;
    }

    private static double requireScore(String sentence, Double score) {
        if (score == null || score.isNaN()) {
            throw new IllegalArgumentException("Missing score for sentence '" + sentence + "'");
        }
        return score;
    }

    private static final class Entry {
        private final String sentence;
        private final double score;

        private Entry(String sentence, double score) {
            this.sentence = sentence;
            this.score = score;
        }
    }
}
