package com.example.rublimp.generator.phenomena.reflexives;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Possessors in the {@code у кого есть} construction: a bare genitive nominal with the
 * preposition {@code у}, governed by {@code быть}/{@code есть} directly or through a copula at
 * most ten tokens after the preposition, and not preceded by the clause's subject.
 */
final class ExternalPossessorMatcher implements PatternMatcher {

    private static final Set<String> EXISTENTIAL_VERBS = Set.of("быть", "есть");
    private static final Set<String> MODIFIER_RELATIONS = Set.of("det", "nmod", "amod");
    private static final int MAX_DISTANCE = 10;

    private final String phenomenonId;

    ExternalPossessorMatcher(String phenomenonId) {
        this.phenomenonId = phenomenonId;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token possessor : sentence.tokens()) {
            if (!possessor.isPos("NOUN", "PROPN", "PRON") || "себя".equals(possessor.lowerForm())) {
                continue;
            }
            if (sentence.hasDependent(possessor, dependent -> MODIFIER_RELATIONS.contains(dependent.deprel()))) {
                continue;
            }
            Optional<Token> preposition = sentence.firstDependent(possessor, dependent -> "у".equals(dependent.lowerLemma()));
            if (preposition.isEmpty() || possessor.feats().has("Case") && !possessor.hasFeature("Case", "Gen")) {
                continue;
            }
            Token existential;
            Token clauseHead;
            if ("obl".equals(possessor.deprel())) {
                existential = sentence.token(possessor.head());
                clauseHead = existential;
                if (!existential.isPos("VERB")) {
                    continue;
                }
            } else if (possessor.isRoot()) {
                Optional<Token> copula = sentence.firstDependent(possessor, dependent -> "cop".equals(dependent.deprel()));
                if (copula.isEmpty()) {
                    continue;
                }
                existential = copula.get();
                clauseHead = possessor;
            } else {
                continue;
            }
            int distance = existential.index() - preposition.get().index();
            if (!EXISTENTIAL_VERBS.contains(existential.lowerLemma()) || distance < 1 || distance > MAX_DISTANCE) {
                continue;
            }
            Optional<Token> subject = sentence.firstDependent(clauseHead, dependent -> "nsubj".equals(dependent.deprel()));
            if (subject.isPresent() && subject.get().index() < preposition.get().index()) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, possessor.index())
                    .controller(existential.index())
                    .build());
        }
        return candidates.stream();
    }
}
