package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.sentence.AnnotatedSentence;

import java.util.stream.Stream;

/**
 * Finds the constructions a phenomenon can perturb. Implementations never modify the sentence
 * and may be called repeatedly on the same input.
 */
@FunctionalInterface
public interface PatternMatcher {

    Stream<Candidate> find(AnnotatedSentence sentence);
}
