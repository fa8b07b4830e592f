package com.example.rublimp.generator.phenomena.aspect;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imperfective infinitives under a negated deontic predicate ({@code не стоит мыть}), where the
 * perfective is ungrammatical.
 */
final class DeonticMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final LexicalResources resources;

    DeonticMatcher(String phenomenonId, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token predicate : sentence.tokens()) {
            if (!predicate.isPos("VERB", "ADV") || Syntax.isParticiple(predicate)
                    || !resources.isDeonticPredicate(predicate.lowerLemma())
                    || !Syntax.isNegated(sentence, predicate)) {
                continue;
            }
            for (Token infinitive : sentence.dependents(predicate)) {
                if (!infinitive.hasFeature("VerbForm", "Inf")
                        || !AspectSyntax.isReplaceableImperfective(infinitive, resources)) {
                    continue;
                }
                boolean coordinated = sentence.hasDependent(infinitive,
                        dependent -> dependent.isPos("VERB") && "conj".equals(dependent.deprel()));
                candidates.add(Candidate.builder(phenomenonId, infinitive.index())
                        .controller(predicate.index())
                        .subtype(coordinated ? phenomenonId + "_conj" : phenomenonId)
                        .build());
            }
        }
        return candidates.stream();
    }
}
