package com.example.rublimp.generator.contamination;

import java.util.List;

/**
 * A language model that assigns a log-probability to every token of a sentence.
 */
@FunctionalInterface
public interface SentenceScorer {

    List<Double> score(String sentence, String modelId);
}
