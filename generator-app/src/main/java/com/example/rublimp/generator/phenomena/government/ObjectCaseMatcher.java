package com.example.rublimp.generator.phenomena.government;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Direct objects in a given case governed by a plain verb.
 */
final class ObjectCaseMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final String objectCase;
    private final LexicalResources resources;

    ObjectCaseMatcher(String phenomenonId, String objectCase, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.objectCase = objectCase;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token object : sentence.tokens()) {
            if (!"obj".equals(object.deprel()) || !GovernedNominals.isCaseBearer(object)
                    || !object.hasFeature("Case", objectCase)) {
                continue;
            }
            Token verb = sentence.token(object.head());
            if (!GovernedNominals.isPlainGoverningVerb(verb, resources)) {
                continue;
            }
            if (!GovernedNominals.isBare(sentence, object, resources, false)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, object.index())
                    .controller(verb.index())
                    .build());
        }
        return candidates.stream();
    }
}
