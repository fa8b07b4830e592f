package com.example.rublimp.generator.contamination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Min-k% probability of a sentence: the negated mean of its lowest {@code ratio} share of token
 * log-probabilities. Lower values mean the model finds even its least likely tokens familiar.
 */
public final class MinKProbability {

    public static final List<Double> DEFAULT_RATIOS = List.of(0.3, 0.4, 0.5, 0.6);

    private MinKProbability() {
    }

    /**
     * @throws IllegalArgumentException for an empty sequence or a ratio outside {@code (0, 1]}
     */
    public static double score(List<Double> tokenLogProbs, double ratio) {
        if (tokenLogProbs.isEmpty()) {
            throw new IllegalArgumentException("No token log-probabilities to score");
        }
        if (!(ratio > 0.0 && ratio <= 1.0)) {
            throw new IllegalArgumentException("Ratio must be in (0, 1]: " + ratio);
        }
        List<Double> sorted = new ArrayList<>(tokenLogProbs);
        Collections.sort(sorted);
        int k = Math.max(1, (int) (sorted.size() * ratio));
        double sum = 0.0;
        for (int i = 0; i < k; i++) {
            sum += sorted.get(i);
        }
        return -sum / k;
    }
}
