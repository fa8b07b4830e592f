package com.example.rublimp.generator.phenomena.aspect;

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
 * Imperfective verbs modified by an expression of duration ({@code долго}) or of repetition
 * ({@code часто}, {@code каждый день}), contexts that reject the perfective.
 */
final class AspectContextMatcher implements PatternMatcher {

    enum Context {
        DURATION("adverb_lemma"),
        REPETITION("repetition_adverb");

        private final String detailKey;

        Context(String detailKey) {
            this.detailKey = detailKey;
        }
    }

    private final String phenomenonId;
    private final Context context;
    private final LexicalResources resources;

    AspectContextMatcher(String phenomenonId, Context context, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.context = context;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token verb : sentence.tokens()) {
            if (!AspectSyntax.isReplaceableImperfective(verb, resources)
                    || !(verb.hasFeature("VerbForm", "Fin") || verb.hasFeature("VerbForm", "Inf"))) {
                continue;
            }
            if (!AspectSyntax.isStandalone(sentence, verb)) {
                continue;
            }
            Optional<String> marker = context == Context.DURATION
                    ? durationMarker(sentence, verb)
                    : repetitionMarker(sentence, verb);
            if (marker.isEmpty()) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, verb.index())
                    .detail(context.detailKey, marker.get())
                    .build());
        }
        return candidates.stream();
    }

    private Optional<String> durationMarker(AnnotatedSentence sentence, Token verb) {
        return sentence.firstDependent(verb, dependent -> "advmod".equals(dependent.deprel())
                        && resources.isDurationAdverb(dependent.lowerLemma()))
                .map(Token::lowerLemma);
    }

    /**
     * A repetition adverb on the verb, or a quantifier on a time-period noun that is an oblique
     * of the verb.
     */
    private Optional<String> repetitionMarker(AnnotatedSentence sentence, Token verb) {
        for (Token token : sentence.tokens()) {
            if (token.isRoot()) {
                continue;
            }
            Token head = sentence.token(token.head());
            if (resources.isRepetitionQuantifier(token.lowerLemma())) {
                if (resources.isTimePeriod(head.lowerLemma()) && "obl".equals(head.deprel())
                        && head.head() == verb.index()) {
                    return Optional.of(token.lowerLemma() + " " + head.lowerLemma());
                }
            } else if (resources.isRepetitionAdverb(token.lowerLemma()) && token.head() == verb.index()) {
                return Optional.of(token.lowerLemma());
            }
        }
        return Optional.empty();
    }
}
