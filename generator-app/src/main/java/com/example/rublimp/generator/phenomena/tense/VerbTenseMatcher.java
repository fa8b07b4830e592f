package com.example.rublimp.generator.phenomena.tense;

import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.PatternMatcher;
import com.example.rublimp.generator.phenomena.Syntax;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Perfective past or future verbs next to a time expression of the same tense. The person,
 * number and gender the verb form needs in the other tense are taken from the verb and its
 * subject and recorded as details.
 */
final class VerbTenseMatcher implements PatternMatcher {

    static final List<String> AGREEMENT = List.of("Person", "Number", "Gender");

    private final String phenomenonId;
    private final TenseExpressions expressions;

    VerbTenseMatcher(String phenomenonId, TenseExpressions expressions) {
        this.phenomenonId = phenomenonId;
        this.expressions = expressions;
    }

    @Override
    public Stream<Candidate> find(AnnotatedSentence sentence) {
        List<Candidate> candidates = new ArrayList<>();
        for (Token verb : sentence.tokens()) {
            String tense = eligibleTense(sentence, verb);
            if (tense == null) {
                continue;
            }
            List<Token> conjuncts = conjuncts(sentence, verb);
            Optional<TenseExpressions.Marker> marker = expressions.find(sentence, verb, tense, conjuncts);
            if (marker.isEmpty()) {
                continue;
            }
            Optional<Token> subject = subject(sentence, verb, conjuncts);
            if (subject.isEmpty()) {
                continue;
            }
            Map<String, String> features = agreementFeatures(sentence, verb, subject.get());
            if (features == null) {
                continue;
            }
            Candidate.Builder builder = Candidate.builder(phenomenonId, verb.index())
                    .controller(subject.get().index())
                    .subtype((conjuncts.isEmpty() ? "single" : "conj") + "_verb_tense_" + marker.get().kind + "_marker")
                    .detail("TenseMarker", marker.get().text);
            features.forEach(builder::detail);
            candidates.add(builder.build());
        }
        return candidates.stream();
    }

    /**
     * Past or future tense of a finite perfective verb without an infinitive complement, or null.
     * Future forms tagged for gender and past forms tagged for person are annotation errors.
     */
    private static String eligibleTense(AnnotatedSentence sentence, Token verb) {
        if (!verb.isPos("VERB") || !verb.hasFeature("Aspect", "Perf")) {
            return null;
        }
        String verbForm = verb.feature("VerbForm");
        if (verbForm != null && !"Fin".equals(verbForm)) {
            return null;
        }
        String tense = verb.feature("Tense");
        if ("Fut".equals(tense) && verb.feats().has("Gender") || "Past".equals(tense) && verb.feats().has("Person")) {
            return null;
        }
        if (!"Fut".equals(tense) && !"Past".equals(tense)) {
            return null;
        }
        boolean infinitiveComplement = sentence.hasDependent(verb, dependent -> "xcomp".equals(dependent.deprel())
                && dependent.isPos("VERB") && dependent.hasFeature("VerbForm", "Inf"));
        return infinitiveComplement ? null : tense;
    }

    /**
     * Coordinated verbs sharing the verb's subject.
     */
    static List<Token> conjuncts(AnnotatedSentence sentence, Token verb) {
        Optional<Token> ownSubject = nominalSubject(sentence, verb);
        List<Token> related = new ArrayList<>(sentence.dependents(verb, "conj"));
        if ("conj".equals(verb.deprel())) {
            Token head = sentence.token(verb.head());
            related.add(head);
            for (Token sibling : sentence.dependents(head, "conj")) {
                if (sibling.index() != verb.index()) {
                    related.add(sibling);
                }
            }
        }
        List<Token> shared = new ArrayList<>();
        for (Token conjunct : related) {
            Optional<Token> subject = nominalSubject(sentence, conjunct);
            if (subject.isEmpty() || ownSubject.isEmpty() && subject.get().index() < verb.index()
                    || ownSubject.isPresent() && ownSubject.get().index() == subject.get().index()) {
                shared.add(conjunct);
            }
        }
        return shared;
    }

    private static Optional<Token> nominalSubject(AnnotatedSentence sentence, Token verb) {
        return sentence.firstDependent(verb, dependent -> dependent.hasRelation("nsubj"));
    }

    static Optional<Token> subject(AnnotatedSentence sentence, Token verb, List<Token> conjuncts) {
        Optional<Token> subject = nominalSubject(sentence, verb);
        for (int i = 0; subject.isEmpty() && i < conjuncts.size(); i++) {
            subject = nominalSubject(sentence, conjuncts.get(i));
        }
        return subject;
    }

    /**
     * Person, number and gender for the verb: its own tags first, then an adjectival modifier of
     * the subject for gender, then the subject's tags. Nominal subjects are third person; plural
     * forms need no gender. Null when a needed category stays unknown.
     */
    static Map<String, String> agreementFeatures(AnnotatedSentence sentence, Token verb, Token subject) {
        Map<String, String> features = new LinkedHashMap<>();
        for (String category : AGREEMENT) {
            if (verb.feats().has(category)) {
                features.put(category, verb.feature(category));
            }
        }
        if (features.size() == AGREEMENT.size()) {
            return null;
        }
        if (!features.containsKey("Gender")) {
            sentence.firstDependent(subject, dependent -> "amod".equals(dependent.deprel())
                            && dependent.feats().has("Gender"))
                    .ifPresent(modifier -> features.put("Gender", modifier.feature("Gender")));
        }
        for (String category : AGREEMENT) {
            if (!features.containsKey(category) && subject.feats().has(category)) {
                features.put(category, subject.feature(category));
            }
        }
        if (!features.containsKey("Person") && Syntax.isNominal(subject) && !subject.isPos("PRON")) {
            features.put("Person", "3");
        }
        List<String> required = "Plur".equals(features.get("Number")) ? List.of("Person", "Number") : AGREEMENT;
        if (!features.keySet().containsAll(required)) {
            return null;
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        AGREEMENT.stream().filter(features::containsKey).forEach(key -> ordered.put(key, features.get(key)));
        return ordered;
    }
}
