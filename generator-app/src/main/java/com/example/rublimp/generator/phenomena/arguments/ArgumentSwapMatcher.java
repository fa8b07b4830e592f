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
 * An animate and an inanimate argument of the same verb, of equal gender and number, that can
 * trade places. The animate one is the target, the inanimate one the controller.
 */
final class ArgumentSwapMatcher implements PatternMatcher {

    private static final int MIN_FORM_LENGTH = 2;

    /** Which arguments trade places. */
    enum Swap {
        /** {@code Девушка читала книгу} to {@code Книга читала девушку}. */
        SUBJECT("nsubj", "obj", true, true),
        /** {@code Книга была прочитана девушкой} to {@code Девушка была прочитана книгой}. */
        PASSIVE_AGENT("obl:agent", "nsubj:pass", false, true),
        /** {@code Мама подарила дочке книгу} to {@code Мама подарила книге дочку}. */
        INDIRECT_OBJECT("iobj", "obj", false, false);

        private final String animateRelation;
        private final String inanimateRelation;
        private final boolean animateMustBeNoun;
        private final boolean inanimateMustBeNoun;

        Swap(String animateRelation, String inanimateRelation, boolean animateMustBeNoun, boolean inanimateMustBeNoun) {
            this.animateRelation = animateRelation;
            this.inanimateRelation = inanimateRelation;
            this.animateMustBeNoun = animateMustBeNoun;
            this.inanimateMustBeNoun = inanimateMustBeNoun;
        }
    }

    private final String phenomenonId;
    private final Swap swap;
    private final LexicalResources resources;

    ArgumentSwapMatcher(String phenomenonId, Swap swap, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.swap = swap;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token verb : sentence.tokens()) {
            if (!ArgumentSyntax.isTransitiveVerb(verb, resources, swap == Swap.PASSIVE_AGENT)) {
                continue;
            }
            Optional<Token> animate = ArgumentSyntax.argument(sentence, verb, swap.animateRelation);
            Optional<Token> inanimate = ArgumentSyntax.argument(sentence, verb, swap.inanimateRelation);
            if (animate.isEmpty() || inanimate.isEmpty()) {
                continue;
            }
            Token target = animate.get();
            Token controller = inanimate.get();
            if (!isArgument(sentence, target, swap.animateMustBeNoun) || !ArgumentSyntax.isAnimate(target)
                    || target.isPos("PROPN")) {
                continue;
            }
            if (!isArgument(sentence, controller, swap.inanimateMustBeNoun) || !ArgumentSyntax.isInanimate(controller)) {
                continue;
            }
            if (swap == Swap.INDIRECT_OBJECT && !hasAnimateSubject(sentence, verb)) {
                continue;
            }
            if (!ArgumentSyntax.isPermutable(target, controller)) {
                continue;
            }
            candidates.add(Candidate.builder(phenomenonId, target.index())
                    .controller(controller.index())
                    .build());
        }
        return candidates.stream();
    }

    private static boolean isArgument(AnnotatedSentence sentence, Token token, boolean mustBeNoun) {
        if (token.form().length() < MIN_FORM_LENGTH || token.feats().isEmpty() || !token.feats().has("Gender")) {
            return false;
        }
        if (mustBeNoun && !token.isPos("NOUN", "PROPN")) {
            return false;
        }
        return !ArgumentSyntax.hasModifiers(sentence, token);
    }

    private static boolean hasAnimateSubject(AnnotatedSentence sentence, Token verb) {
        Optional<Token> subject = ArgumentSyntax.argument(sentence, verb, "nsubj");
        return subject.isPresent()
                && subject.get().form().length() >= MIN_FORM_LENGTH
                && subject.get().isPos("NOUN", "PROPN")
                && subject.get().feats().has("Gender")
                && ArgumentSyntax.isAnimate(subject.get());
    }
}
