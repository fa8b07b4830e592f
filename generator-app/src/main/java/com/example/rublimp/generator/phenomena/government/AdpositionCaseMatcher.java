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
 * Nominals introduced by a preposition inside a verb's argument.
 */
final class AdpositionCaseMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final LexicalResources resources;

    AdpositionCaseMatcher(String phenomenonId, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token adposition : sentence.tokens()) {
            if (!adposition.isPos("ADP") || !"case".equals(adposition.deprel())
                    || "как".equals(adposition.lowerLemma()) || adposition.isRoot()) {
                continue;
            }
            if (!sentence.dependents(adposition).isEmpty()) {
                continue;
            }
            Token nominal = sentence.token(adposition.head());
            if (adposition.index() > nominal.index() || !GovernedNominals.isCaseBearer(nominal)) {
                continue;
            }
            if (nominal.isRoot() || nominal.hasRelation("nsubj") || "det".equals(nominal.deprel())) {
                continue;
            }
            Token verb = sentence.token(nominal.head());
            if (!GovernedNominals.isPlainGoverningVerb(verb, resources)) {
                continue;
            }
            if (!GovernedNominals.isBare(sentence, nominal, resources, true)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, nominal.index())
                    .controller(verb.index())
                    .detail("adposition", adposition.lowerLemma())
                    .build());
        }
        return candidates.stream();
    }
}
