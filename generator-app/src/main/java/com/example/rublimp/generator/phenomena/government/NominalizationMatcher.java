package com.example.rublimp.generator.phenomena.government;

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
 * Bare nominal dependents of verbal nouns in {@code -ние}.
 */
final class NominalizationMatcher implements PatternMatcher {

    private static final String NOMINALIZATION_SUFFIX = "ние";

    private final String phenomenonId;
    private final LexicalResources resources;

    NominalizationMatcher(String phenomenonId, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token dependent : sentence.tokens()) {
            if (!"nmod".equals(dependent.deprel()) || !dependent.isPos("NOUN", "PRON")
                    || !dependent.feats().has("Case")) {
                continue;
            }
            Token noun = sentence.token(dependent.head());
            if (!noun.isPos("NOUN") || !noun.lowerLemma().endsWith(NOMINALIZATION_SUFFIX)) {
                continue;
            }
            if (!noun.isRoot()) {
                Token governor = sentence.token(noun.head());
                if (governor.isPos("VERB") && Syntax.isReflexiveVerbForm(governor.form())) {
                    continue;
                }
            }
            if (!GovernedNominals.isBare(sentence, dependent, resources, false)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, dependent.index())
                    .controller(noun.index())
                    .build());
        }
        return candidates.stream();
    }
}
