package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.lexicon.MorphemeSegmentation;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Words whose lemma has a known morpheme segmentation of the required shape. The syntactic head,
 * when there is one, is recorded as the controller.
 */
final class SegmentedWordMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final LexicalResources resources;
    private final BiPredicate<AnnotatedSentence, Token> tokenFilter;
    private final Predicate<MorphemeSegmentation> shape;

    SegmentedWordMatcher(String phenomenonId, LexicalResources resources,
                         BiPredicate<AnnotatedSentence, Token> tokenFilter, Predicate<MorphemeSegmentation> shape) {
        this.phenomenonId = phenomenonId;
        this.resources = resources;
        this.tokenFilter = tokenFilter;
        this.shape = shape;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token token : sentence.tokens()) {
            if (!tokenFilter.test(sentence, token)) {
                continue;
            }
            Optional<MorphemeSegmentation> segmentation = resources.segmentation(token.lemma());
            if (segmentation.isEmpty() || segmentation.get().roots().isEmpty() || segmentation.get().hasHyphen()
                    || !shape.test(segmentation.get())) {
                continue;
            }
            Candidate.Builder builder = Candidate.builder(phenomenonId, token.index());
            if (!token.isRoot()) {
                builder.controller(token.head());
            }
            candidates.add(builder.build());
        }
        return candidates.stream();
    }
}
