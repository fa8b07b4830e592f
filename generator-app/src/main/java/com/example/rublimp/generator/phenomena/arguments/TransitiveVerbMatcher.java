package com.example.rublimp.generator.phenomena.arguments;

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
 * Finite or infinitive transitive verbs with both a subject and a direct object.
 */
final class TransitiveVerbMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final LexicalResources resources;

    TransitiveVerbMatcher(String phenomenonId, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token verb : sentence.tokens()) {
            if (!ArgumentSyntax.isTransitiveVerb(verb, resources, false)) {
                continue;
            }
            Optional<Token> object = ArgumentSyntax.argument(sentence, verb, "obj");
            if (object.isEmpty() || ArgumentSyntax.argument(sentence, verb, "nsubj").isEmpty()) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, verb.index())
                    .controller(object.get().index())
                    .build());
        }
        return candidates.stream();
    }
}
