package com.example.rublimp.generator.phenomena.tense;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds the time expressions that fix the tense of a verb: simple adverbs ({@code вчера}),
 * {@code только что}, numeral groups ({@code три дня назад}) and prepositional groups
 * ({@code на прошлой неделе}).
 */
final class TenseExpressions {

    static final String SIMPLE = "simple";
    static final String EXPRESSION = "expression";

    private final LexicalResources resources;

    TenseExpressions(LexicalResources resources) {
        this.resources = resources;
    }

    static String opposite(String tense) {
        return "Past".equals(tense) ? "Fut" : "Past";
    }

    /**
     * A marker attached to the verb or to one of its conjuncts, as {@code kind} and text.
     */
    Optional<Marker> find(AnnotatedSentence sentence, Token verb, String tense, List<Token> conjuncts) {
        List<String> simple = resources.simpleTenseMarkers(tense);
        for (Token dependent : sentence.dependents(verb)) {
            if ("advmod".equals(dependent.deprel()) && simple.contains(dependent.lowerLemma())
                    && !sentence.hasDependent(dependent, token -> token.isPos("ADP"))) {
                return Optional.of(new Marker(SIMPLE, dependent.form()));
            }
        }
        List<Integer> heads = new ArrayList<>();
        heads.add(verb.index());
        conjuncts.forEach(conjunct -> heads.add(conjunct.index()));
        for (Token marker : sentence.tokens()) {
            if (marker.isRoot() || !heads.contains(marker.head())
                    || !(marker.deprel().startsWith("obl") || marker.deprel().startsWith("advmod"))
                    || !marker.isPos("NOUN", "PART", "ADV") || sentence.dependents(marker).isEmpty()) {
                continue;
            }
            if (marker.isPos("PART") && "только".equals(marker.lowerForm())
                    && sentence.hasDependent(marker, token -> "что".equals(token.lowerForm()))
                    && !sentence.hasDependent(verb, token -> "не".equals(token.lowerForm()))
                    && marker.head() == verb.index()) {
                return Optional.of(new Marker(EXPRESSION, marker.form() + " что"));
            }
            if (marker.isPos("NOUN")) {
                Optional<String> expression = numeralGroup(sentence, marker, verb);
                if (expression.isEmpty()) {
                    expression = adpositionGroup(sentence, marker, verb);
                }
                if (expression.isPresent()) {
                    return Optional.of(new Marker(EXPRESSION, expression.get()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> numeralGroup(AnnotatedSentence sentence, Token noun, Token verb) {
        List<Token> dependents = sentence.dependents(noun);
        Optional<Token> ago = dependents.stream().filter(token -> "назад".equals(token.lowerForm())).findFirst();
        if (ago.isEmpty() || dependents.stream().anyMatch(token -> token.isPos("ADP"))) {
            return Optional.empty();
        }
        Optional<Token> numeral = dependents.stream().filter(token -> token.isPos("NUM")).findFirst();
        if (numeral.isEmpty() || noun.head() != verb.index()) {
            return Optional.empty();
        }
        return Optional.of(join(List.of(ago.get(), noun, numeral.get())));
    }

    /**
     * Preposition {@code в}/{@code на} with a noun in the locative or accusative and a single
     * tense adjective.
     */
    Optional<String> adpositionGroup(AnnotatedSentence sentence, Token noun, Token verb) {
        return adpositionAdjective(sentence, noun, verb).map(adjective -> {
            Token adposition = sentence.firstDependent(noun, token -> token.isPos("ADP")).orElseThrow();
            return join(List.of(adjective, noun, adposition));
        });
    }

    Optional<Token> adpositionAdjective(AnnotatedSentence sentence, Token noun, Token verb) {
        if (noun.head() != verb.index() || !(noun.hasFeature("Case", "Loc") || noun.hasFeature("Case", "Acc"))) {
            return Optional.empty();
        }
        List<Token> dependents = sentence.dependents(noun);
        if (dependents.stream().anyMatch(token -> "det".equals(token.deprel()))
                || dependents.stream().filter(token -> "amod".equals(token.deprel())).count() > 1) {
            return Optional.empty();
        }
        List<Token> adjectives = dependents.stream()
                .filter(token -> "amod".equals(token.deprel()) && isTenseAdjective(token.lowerLemma()))
                .collect(Collectors.toList());
        List<Token> adpositions = dependents.stream()
                .filter(token -> token.isPos("ADP") && ("в".equals(token.lowerLemma()) || "на".equals(token.lowerLemma())))
                .collect(Collectors.toList());
        if (adjectives.size() != 1 || adpositions.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(adjectives.get(0));
    }

    private boolean isTenseAdjective(String lemma) {
        return resources.tenseAdjectives("Past").contains(lemma) || resources.tenseAdjectives("Fut").contains(lemma);
    }

    private static String join(List<Token> tokens) {
        return tokens.stream()
                .sorted(Comparator.comparingInt(Token::index))
                .map(Token::form)
                .collect(Collectors.joining(" "));
    }

    static final class Marker {
        final String kind;
        final String text;

        Marker(String kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }
}
