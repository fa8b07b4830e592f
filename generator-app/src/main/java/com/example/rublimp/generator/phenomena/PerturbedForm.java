package com.example.rublimp.generator.phenomena;

import java.util.Objects;

/**
 * One altered token of a perturbation.
 */
public final class PerturbedForm {

    private final int tokenIndex;
    private final String source;
    private final String target;
    private final boolean synthesized;
    private final boolean homonymous;
    private final boolean knownWord;

    public PerturbedForm(int tokenIndex, String source, String target,
                         boolean synthesized, boolean homonymous, boolean knownWord) {
        this.tokenIndex = tokenIndex;
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.synthesized = synthesized;
        this.homonymous = homonymous;
        this.knownWord = knownWord;
    }

    public int tokenIndex() {
        return tokenIndex;
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    /**
     * True when the form was produced by the analyzer rather than by string surgery.
     */
    public boolean synthesized() {
        return synthesized;
    }

    /**
     * True when another paradigm cell of the same lemma spells the same way.
     */
    public boolean homonymous() {
        return homonymous;
    }

    public boolean knownWord() {
        return knownWord;
    }

    @Override
    public String toString() {
        return tokenIndex + ":" + source + "->" + target;
    }
}
