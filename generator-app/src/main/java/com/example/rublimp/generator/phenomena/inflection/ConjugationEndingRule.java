package com.example.rublimp.generator.phenomena.inflection;

import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.sentence.Token;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gives a present or future verb form the personal ending of the other conjugation:
 * {@code читает -> читаит}. Only the longest matching ending is replaced.
 */
final class ConjugationEndingRule extends EndingReplacementRule {

    @Override
    Map<String, List<String>> substitutions(Token token, PerturbationContext context) {
        Map<String, List<String>> substitutions = new HashMap<>();
        context.resources().conjugationEndings()
                .forEach((ending, replacement) -> substitutions.put(ending, List.of(replacement)));
        return substitutions;
    }

    @Override
    List<String> applicableEndings(List<String> matching) {
        return matching.stream()
                .max(Comparator.comparingInt(String::length))
                .map(List::of)
                .orElse(List.of());
    }
}
