package com.example.rublimp.generator.phenomena.negation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Indefinite pronouns in clauses without negation ({@code кто-то пришёл}), or negative pronouns
 * in negated clauses ({@code никто не пришёл}). The clause is the pronoun's verb, or that verb's
 * own verbal head.
 */
final class NegativePronounMatcher implements PatternMatcher {

    private final String phenomenonId;
    private final boolean negatedClause;
    private final LexicalResources resources;

    NegativePronounMatcher(String phenomenonId, boolean negatedClause, LexicalResources resources) {
        this.phenomenonId = phenomenonId;
        this.negatedClause = negatedClause;
        this.resources = resources;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token pronoun : sentence.tokens()) {
            String lemma = pronoun.lowerLemma();
            List<String> counterparts = negatedClause
                    ? resources.indefiniteCounterparts(lemma)
                    : resources.negativeCounterparts(lemma);
            if (counterparts.isEmpty() || pronoun.isRoot()) {
                continue;
            }
            if ("ничто".equals(lemma) && "advmod".equals(pronoun.deprel())
                    || "что-то".equals(lemma) && ("advmod".equals(pronoun.deprel()) || pronoun.isPos("ADV"))) {
                continue;
            }
            if (("никто".equals(pronoun.lowerForm()) || "ничто".equals(lemma) && pronoun.isPos("PRON"))
                    && !"nsubj".equals(pronoun.deprel())) {
                continue;
            }
            Optional<Token> clause = clauseVerb(sentence, pronoun);
            if (clause.isEmpty()) {
                continue;
            }
            Token verb = clause.get();
            boolean negated = Syntax.isNegated(sentence, verb);
            if (!verb.isRoot() && sentence.token(verb.head()).isPos("VERB")) {
                Token governor = sentence.token(verb.head());
                if (Syntax.isNegated(sentence, governor)) {
                    if (negated) {
                        continue;
                    }
                    negated = true;
                }
                verb = governor;
            }
            if (negated != negatedClause) {
                continue;
            }
            Candidate.Builder builder = Candidate.builder(phenomenonId, pronoun.index()).controller(verb.index());
            additionalCondition(sentence, pronoun).ifPresent(condition -> builder.detail("additional_condition", condition));
            candidates.add(builder.build());
        }
        return candidates.stream();
    }

    /**
     * Arguments attach to the verb directly; adverbial and nominal modifiers through their head.
     */
    private static Optional<Token> clauseVerb(AnnotatedSentence sentence, Token pronoun) {
        String relation = pronoun.deprel();
        Token verb;
        if ("obj".equals(relation) || "nsubj".equals(relation)) {
            verb = sentence.token(pronoun.head());
        } else if ("advmod".equals(relation) || "nmod".equals(relation) || "det".equals(relation)) {
            Token head = sentence.token(pronoun.head());
            if (head.isRoot()) {
                return Optional.empty();
            }
            verb = sentence.token(head.head());
            if (!verb.isPos("VERB")) {
                if (verb.isRoot()) {
                    return Optional.empty();
                }
                verb = sentence.token(verb.head());
            }
        } else {
            return Optional.empty();
        }
        return verb.isPos("VERB") ? Optional.of(verb) : Optional.empty();
    }

    /**
     * {@code без} and comparisons license negative pronouns without verbal negation.
     */
    private static Optional<String> additionalCondition(AnnotatedSentence sentence, Token pronoun) {
        for (Token token : sentence.tokens()) {
            boolean marker = "без".equals(token.lowerLemma()) || "чем".equals(token.lowerLemma())
                    || token.hasFeature("Degree", "Cmp");
            if (!marker || token.isRoot()) {
                continue;
            }
            boolean related = token.head() == pronoun.index() || token.head() == pronoun.head()
                    || sentence.token(token.head()).head() == pronoun.index();
            if (related) {
                return Optional.of("без".equals(token.lowerLemma()) ? "without" : "comparative");
            }
        }
        return Optional.empty();
    }
}
