package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.sentence.FeatureBundle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Grammatical category a phenomenon perturbs. Closed axes carry their value set; open axes
 * (morpheme structure, lexical substitution, pronoun type, transitivity) take values computed by
 * the rule.
 */
public enum FeatureAxis {
    NUMBER("Number", "Sing", "Plur"),
    GENDER("Gender", "Masc", "Fem", "Neut"),
    PERSON("Person", "1", "2", "3"),
    CASE("Case", "Nom", "Gen", "Dat", "Acc", "Ins", "Loc"),
    TENSE("Tense", "Past", "Pres", "Fut"),
    ASPECT("Aspect", "Imp", "Perf"),
    ANIMACY("Animacy", "Anim", "Inan"),
    MORPHEME("Morpheme"),
    LEMMA("Lemma"),
    PRONOUN_TYPE("PronounType"),
    TRANSITIVITY("Transitivity");

    private static final Set<String> NOMINALS = Set.of("NOUN", "PROPN", "PRON");

    private final String category;
    private final List<String> values;

    FeatureAxis(String category, String... values) {
        this.category = category;
        this.values = List.of(values);
    }

    /**
     * UD feature name, also used as the {@code feature} column of the output.
     */
    public String category() {
        return category;
    }

    public List<String> closedValues() {
        return values;
    }

    public boolean isClosed() {
        return !values.isEmpty();
    }

    /**
     * Closed values other than {@code source}, restricted to {@code allowed} when it is not empty,
     * in declaration order.
     */
    public List<String> alternatives(String source, Collection<String> allowed) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (value.equals(source)) {
                continue;
            }
            if (allowed.isEmpty() || allowed.contains(value)) {
                result.add(value);
            }
        }
        return result;
    }

    public List<String> alternatives(String source) {
        return alternatives(source, List.of());
    }

    /**
     * Sets this category to {@code value} and drops the categories Russian does not mark together
     * with it: finite past forms carry no person, finite non-past forms carry no gender, plural
     * past and adjectival forms carry no gender.
     */
    public FeatureBundle retarget(FeatureBundle source, String value, String pos) {
        FeatureBundle result = source.with(category, value);
        boolean finite = result.hasValue("VerbForm", "Fin") || (result.has("Tense") && !result.has("Case"));
        if (finite) {
            if (result.hasValue("Tense", "Past")) {
                result = result.without("Person");
                if (result.hasValue("Number", "Plur")) {
                    result = result.without("Gender");
                }
            } else if (result.has("Tense")) {
                result = result.without("Gender");
            }
        } else if (result.hasValue("Number", "Plur") && !NOMINALS.contains(pos)) {
            result = result.without("Gender");
        }
        return result;
    }
}
