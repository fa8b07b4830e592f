package com.example.rublimp.generator.phenomena.reflexives;

import com.example.rublimp.generator.phenomena.FeatureAxis;
import com.example.rublimp.generator.phenomena.Phenomenon;

import java.util.List;

public final class ReflexivePhenomena {

    public static final String FAMILY = "reflexives";

    private ReflexivePhenomena() {
    }

    public static List<Phenomenon> create() {
        return List.of(Phenomenon.builder("external_possessor", FAMILY, FeatureAxis.LEMMA)
                .matcher(new ExternalPossessorMatcher("external_possessor"))
                .rule(new ReflexivePronounRule())
                .build());
    }
}
