package com.example.rublimp.generator.pairs;

import com.example.rublimp.generator.sentence.FeatureBundle;

import java.util.Objects;

/**
 * One benchmark item: a corpus sentence and its copy with exactly one rule-defined violation.
 */
public final class MinimalPair {

    private final String sentenceId;
    private final String sourceSentence;
    private final String targetSentence;
    private final String phenomenon;
    private final String phenomenonId;
    private final String phenomenonSubtype;
    private final String sourceWord;
    private final String targetWord;
    private final FeatureBundle sourceWordFeatures;
    private final FeatureBundle targetWordFeatures;
    private final String feature;
    private final String domain;
    private final int treeLength;
    private final int length;
    private final int treeDepth;

    private MinimalPair(Builder builder) {
        this.sentenceId = Objects.requireNonNull(builder.sentenceId, "sentenceId");
        this.sourceSentence = Objects.requireNonNull(builder.sourceSentence, "sourceSentence");
        this.targetSentence = Objects.requireNonNull(builder.targetSentence, "targetSentence");
        this.phenomenon = Objects.requireNonNull(builder.phenomenon, "phenomenon");
        this.phenomenonId = Objects.requireNonNull(builder.phenomenonId, "phenomenonId");
        this.phenomenonSubtype = Objects.requireNonNull(builder.phenomenonSubtype, "phenomenonSubtype");
        this.sourceWord = Objects.requireNonNull(builder.sourceWord, "sourceWord");
        this.targetWord = Objects.requireNonNull(builder.targetWord, "targetWord");
        this.sourceWordFeatures = Objects.requireNonNull(builder.sourceWordFeatures, "sourceWordFeatures");
        this.targetWordFeatures = Objects.requireNonNull(builder.targetWordFeatures, "targetWordFeatures");
        this.feature = Objects.requireNonNull(builder.feature, "feature");
        this.domain = Objects.requireNonNull(builder.domain, "domain");
        this.treeLength = builder.treeLength;
        this.length = builder.length;
        this.treeDepth = builder.treeDepth;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String sentenceId() {
        return sentenceId;
    }

    public String sourceSentence() {
        return sourceSentence;
    }

    public String targetSentence() {
        return targetSentence;
    }

    /** Phenomenon family, e.g. {@code agreement}. */
    public String phenomenon() {
        return phenomenon;
    }

    public String phenomenonId() {
        return phenomenonId;
    }

    public String phenomenonSubtype() {
        return phenomenonSubtype;
    }

    public String sourceWord() {
        return sourceWord;
    }

    public String targetWord() {
        return targetWord;
    }

    public FeatureBundle sourceWordFeatures() {
        return sourceWordFeatures;
    }

    public FeatureBundle targetWordFeatures() {
        return targetWordFeatures;
    }

    /** Name of the perturbed category. */
    public String feature() {
        return feature;
    }

    public String domain() {
        return domain;
    }

    /** Edges between the target and its controller, or its head when there is none. */
    public int treeLength() {
        return treeLength;
    }

    public int length() {
        return length;
    }

    public int treeDepth() {
        return treeDepth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MinimalPair)) {
            return false;
        }
        MinimalPair that = (MinimalPair) o;
        return treeLength == that.treeLength && length == that.length && treeDepth == that.treeDepth
                && sentenceId.equals(that.sentenceId) && sourceSentence.equals(that.sourceSentence)
                && targetSentence.equals(that.targetSentence) && phenomenon.equals(that.phenomenon)
                && phenomenonId.equals(that.phenomenonId) && phenomenonSubtype.equals(that.phenomenonSubtype)
                && sourceWord.equals(that.sourceWord) && targetWord.equals(that.targetWord)
                && sourceWordFeatures.equals(that.sourceWordFeatures)
                && targetWordFeatures.equals(that.targetWordFeatures)
                && feature.equals(that.feature) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sentenceId, targetSentence, phenomenonId, phenomenonSubtype, sourceWord, targetWord);
    }

    @Override
    public String toString() {
        return phenomenonId + "[" + sentenceId + "]: " + sourceSentence + " -> " + targetSentence;
    }

    public static final class Builder {
        private String sentenceId;
        private String sourceSentence;
        private String targetSentence;
        private String phenomenon;
        private String phenomenonId;
        private String phenomenonSubtype;
        private String sourceWord;
        private String targetWord;
        private FeatureBundle sourceWordFeatures = FeatureBundle.empty();
        private FeatureBundle targetWordFeatures = FeatureBundle.empty();
        private String feature;
        private String domain;
        private int treeLength;
        private int length;
        private int treeDepth;

        private Builder() {
        }

        public Builder sentenceId(String sentenceId) {
            this.sentenceId = sentenceId;
            return this;
        }

        public Builder sentences(String source, String target) {
            this.sourceSentence = source;
            this.targetSentence = target;
            return this;
        }

        public Builder phenomenon(String family, String id, String subtype) {
            this.phenomenon = family;
            this.phenomenonId = id;
            this.phenomenonSubtype = subtype;
            return this;
        }

        public Builder words(String source, String target) {
            this.sourceWord = source;
            this.targetWord = target;
            return this;
        }

        public Builder wordFeatures(FeatureBundle source, FeatureBundle target) {
            this.sourceWordFeatures = source;
            this.targetWordFeatures = target;
            return this;
        }

        public Builder feature(String feature) {
            this.feature = feature;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder treeLength(int treeLength) {
            this.treeLength = treeLength;
            return this;
        }

        public Builder length(int length) {
            this.length = length;
            return this;
        }

        public Builder treeDepth(int treeDepth) {
            this.treeDepth = treeDepth;
            return this;
        }

        public MinimalPair build() {
            return new MinimalPair(this);
        }
    }
}
