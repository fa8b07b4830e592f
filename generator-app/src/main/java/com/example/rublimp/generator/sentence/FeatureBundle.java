package com.example.rublimp.generator.sentence;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Immutable set of grammatical features keyed by category, using Universal Dependencies names
 * ({@code Number=Sing}, {@code Case=Gen}, ...). Rendered in the CoNLL-U {@code FEATS} syntax.
 */
public final class FeatureBundle {

    private static final FeatureBundle EMPTY = new FeatureBundle(new TreeMap<>());

    private final SortedMap<String, String> features;

    private FeatureBundle(SortedMap<String, String> features) {
        this.features = Collections.unmodifiableSortedMap(features);
    }

    public static FeatureBundle empty() {
        return EMPTY;
    }

    /**
     * Builds a bundle from alternating category/value arguments.
     */
    public static FeatureBundle of(String... categoriesAndValues) {
        if (categoriesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected category/value pairs");
        }
        SortedMap<String, String> map = new TreeMap<>();
        for (int i = 0; i < categoriesAndValues.length; i += 2) {
            map.put(Objects.requireNonNull(categoriesAndValues[i], "category"),
                    Objects.requireNonNull(categoriesAndValues[i + 1], "value"));
        }
        return new FeatureBundle(map);
    }

    public static FeatureBundle of(Map<String, String> features) {
        return features.isEmpty() ? EMPTY : new FeatureBundle(new TreeMap<>(features));
    }

    /**
     * Parses the {@code FEATS} column. {@code _} and blank strings give the empty bundle.
     */
    public static FeatureBundle parse(String feats) {
        if (feats == null || feats.isBlank() || "_".equals(feats.strip())) {
            return EMPTY;
        }
        SortedMap<String, String> map = new TreeMap<>();
        for (String part : feats.strip().split("\\|")) {
            int eq = part.indexOf('=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new IllegalArgumentException("Invalid feature: '" + part + "' in " + feats);
            }
            map.put(part.substring(0, eq), part.substring(eq + 1));
        }
        return new FeatureBundle(map);
    }

    public String get(String category) {
        return features.get(category);
    }

    public Optional<String> value(String category) {
        return Optional.ofNullable(features.get(category));
    }

    public boolean has(String category) {
        return features.containsKey(category);
    }

    public boolean hasValue(String category, String value) {
        return value.equals(features.get(category));
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public Set<String> categories() {
        return features.keySet();
    }

    public Map<String, String> asMap() {
        return features;
    }

    public FeatureBundle with(String category, String value) {
        if (value.equals(features.get(category))) {
            return this;
        }
        SortedMap<String, String> copy = new TreeMap<>(features);
        copy.put(category, value);
        return new FeatureBundle(copy);
    }

    public FeatureBundle without(String category) {
        if (!features.containsKey(category)) {
            return this;
        }
        SortedMap<String, String> copy = new TreeMap<>(features);
        copy.remove(category);
        return new FeatureBundle(copy);
    }

    public FeatureBundle restrictedTo(Collection<String> categories) {
        SortedMap<String, String> copy = new TreeMap<>();
        for (String category : categories) {
            String value = features.get(category);
            if (value != null) {
                copy.put(category, value);
            }
        }
        return new FeatureBundle(copy);
    }

    /**
     * Number of categories on which both bundles carry the same value.
     */
    public int overlap(FeatureBundle other) {
        int count = 0;
        for (Map.Entry<String, String> entry : features.entrySet()) {
            if (entry.getValue().equals(other.features.get(entry.getKey()))) {
                count++;
            }
        }
        return count;
    }

    /**
     * True when every feature of {@code other} is present here with the same value.
     */
    public boolean contains(FeatureBundle other) {
        for (Map.Entry<String, String> entry : other.features.entrySet()) {
            if (!entry.getValue().equals(features.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureBundle)) {
            return false;
        }
        return features.equals(((FeatureBundle) o).features);
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        if (features.isEmpty()) {
            return "_";
        }
        StringJoiner joiner = new StringJoiner("|");
        features.forEach((category, value) -> joiner.add(category + '=' + value));
        return joiner.toString();
    }
}
