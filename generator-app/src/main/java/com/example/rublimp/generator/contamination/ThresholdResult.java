package com.example.rublimp.generator.contamination;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of a threshold search. When the target was unattainable the threshold is the largest
 * observed score and the size is the best intersection reachable.
 */
public final class ThresholdResult {

    private final boolean attained;
    private final double threshold;
    private final int targetSize;
    private final Set<String> eligibleSentences;

    private ThresholdResult(boolean attained, double threshold, int targetSize, Set<String> eligibleSentences) {
        this.attained = attained;
        this.threshold = threshold;
        this.targetSize = targetSize;
        this.eligibleSentences = Collections.unmodifiableSet(new LinkedHashSet<>(eligibleSentences));
    }

    static ThresholdResult attained(double threshold, int targetSize, Set<String> eligible) {
        return new ThresholdResult(true, threshold, targetSize, eligible);
    }

    static ThresholdResult unattainable(double threshold, int targetSize, Set<String> eligible) {
        return new ThresholdResult(false, threshold, targetSize, eligible);
    }

    public boolean isAttained() {
        return attained;
    }

    public double threshold() {
        return threshold;
    }

    public int targetSize() {
        return targetSize;
    }

    /** Size of the intersection at the threshold; may exceed the target when scores tie. */
    public int size() {
        return eligibleSentences.size();
    }

    public Set<String> eligibleSentences() {
        return eligibleSentences;
    }

    @Override
    public String toString() {
        return (attained ? "attained" : "unattainable") + " threshold=" + threshold
                + " size=" + size() + " target=" + targetSize;
    }
}
