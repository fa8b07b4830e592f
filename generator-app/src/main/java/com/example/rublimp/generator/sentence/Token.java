package com.example.rublimp.generator.sentence;

import java.util.Locale;
import java.util.Objects;

/**
 * One syntactic word of a dependency-annotated sentence. Positions are 1-based, head 0 marks the
 * root.
 */
public final class Token {

    private final int index;
    private final String form;
    private final String lemma;
    private final String upos;
    private final FeatureBundle feats;
    private final int head;
    private final String deprel;
    private final boolean spaceAfter;

    public Token(int index, String form, String lemma, String upos, FeatureBundle feats,
                 int head, String deprel, boolean spaceAfter) {
        this.index = index;
        this.form = Objects.requireNonNull(form, "form");
        this.lemma = Objects.requireNonNull(lemma, "lemma");
        this.upos = Objects.requireNonNull(upos, "upos");
        this.feats = Objects.requireNonNull(feats, "feats");
        this.head = head;
        this.deprel = Objects.requireNonNull(deprel, "deprel");
        this.spaceAfter = spaceAfter;
    }

    public int index() {
        return index;
    }

    public String form() {
        return form;
    }

    public String lemma() {
        return lemma;
    }

    public String upos() {
        return upos;
    }

    public FeatureBundle feats() {
        return feats;
    }

    public int head() {
        return head;
    }

    public String deprel() {
        return deprel;
    }

    public boolean spaceAfter() {
        return spaceAfter;
    }

    public boolean isRoot() {
        return head == 0;
    }

    public String feature(String category) {
        return feats.get(category);
    }

    public boolean hasFeature(String category, String value) {
        return feats.hasValue(category, value);
    }

    public boolean isPos(String... tags) {
        for (String tag : tags) {
            if (tag.equals(upos)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Matches the relation exactly or as its subtype: {@code nsubj} matches {@code nsubj:pass}.
     */
    public boolean hasRelation(String relation) {
        return deprel.equals(relation) || deprel.startsWith(relation + ':');
    }

    public String lowerForm() {
        return form.toLowerCase(Locale.ROOT);
    }

    public String lowerLemma() {
        return lemma.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return index + ":" + form + "/" + upos + "/" + deprel + "->" + head;
    }
}
