package com.example.rublimp.generator.phenomena.tense;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Time markers attached to a past or future verb: the adverb of a simple marker, or the tense
 * adjective of a prepositional group. Present verbs are skipped because of the historical present.
 */
final class TenseMarkerMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final LexicalResources resources;
    private final TenseExpressions expressions;

    TenseMarkerMatcher(String phenomenonId, LexicalResources resources, TenseExpressions expressions) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
        this.expressions = expressions;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token marker : sentence.tokens()) {
            if (marker.isRoot()) {
                continue;
            }
            Token verb = sentence.token(marker.head());
            String tense = verb.feature("Tense");
            if (!verb.isPos("VERB") || !("Past".equals(tense) || "Fut".equals(tense))) {
                continue;
            }
            if (resources.simpleTenseMarkers(tense).contains(marker.lowerLemma())) {
                candidates.add(Candidate.builder(phenomenonId, marker.index())
                        .controller(verb.index())
                        .subtype(phenomenonId + "_" + TenseExpressions.SIMPLE)
                        .detail("TenseMarker", marker.form())
                        .build());
                continue;
            }
            if (!marker.isPos("NOUN") || !(marker.deprel().startsWith("obl") || marker.deprel().startsWith("advmod"))) {
                continue;
            }
            Optional<Token> adjective = expressions.adpositionAdjective(sentence, marker, verb);
            if (adjective.isEmpty() || !resources.tenseAdjectives(tense).contains(adjective.get().lowerLemma())) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, adjective.get().index())
                    .controller(verb.index())
                    .subtype(phenomenonId + "_" + TenseExpressions.EXPRESSION)
                    .detail("TenseMarker", expressions.adpositionGroup(sentence, marker, verb).orElse(marker.form()))
                    .detail("time_noun", marker.lowerLemma())
                    .build());
        }
        return candidates.stream();
    }
}
