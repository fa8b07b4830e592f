package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.sentence.FeatureBundle;

import java.util.Objects;

/**
 * One reading of a surface form: the paradigm cell it occupies.
 */
public final class Analysis {

    public static final int UNRANKED = Integer.MAX_VALUE;

    private final String form;
    private final String lemma;
    private final String pos;
    private final FeatureBundle features;
    private final int frequencyRank;

    public Analysis(String form, String lemma, String pos, FeatureBundle features, int frequencyRank) {
        this.form = Objects.requireNonNull(form, "form");
        this.lemma = Objects.requireNonNull(lemma, "lemma");
        this.pos = Objects.requireNonNull(pos, "pos");
        this.features = Objects.requireNonNull(features, "features");
        this.frequencyRank = frequencyRank;
    }

    public String form() {
        return form;
    }

    public String lemma() {
        return lemma;
    }

    public String pos() {
        return pos;
    }

    public FeatureBundle features() {
        return features;
    }

    /**
     * Lower ranks are more frequent readings.
     */
    public int frequencyRank() {
        return frequencyRank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Analysis)) {
            return false;
        }
        Analysis other = (Analysis) o;
        return form.equals(other.form) && lemma.equals(other.lemma) && pos.equals(other.pos)
                && features.equals(other.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, lemma, pos, features);
    }

    @Override
    public String toString() {
        return form + "\t" + lemma + "\t" + pos + "\t" + features;
    }
}
