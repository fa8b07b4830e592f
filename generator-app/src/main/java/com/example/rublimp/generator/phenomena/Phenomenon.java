package com.example.rublimp.generator.phenomena;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One registered phenomenon: the matcher that finds candidates, the rule that alters them and the
 * checks the result must pass. The category sets say which parser tags the analyzer reading of the
 * target and controller must confirm before a candidate is used; {@code null} skips resolution.
 */
public final class Phenomenon {

    private final String id;
    private final String family;
    private final FeatureAxis axis;
    private final Set<String> targetCategories;
    private final Set<String> controllerCategories;
    private final Set<String> agreementCategories;
    private final PatternMatcher matcher;
    private final PerturbationRule rule;
    private final ValidityFilter filter;

    private Phenomenon(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.family = Objects.requireNonNull(builder.family, "family");
        this.axis = Objects.requireNonNull(builder.axis, "axis");
        this.targetCategories = builder.targetCategories;
        this.controllerCategories = builder.controllerCategories;
        this.agreementCategories = builder.agreementCategories;
        this.matcher = Objects.requireNonNull(builder.matcher, "matcher");
        this.rule = Objects.requireNonNull(builder.rule, "rule");
        this.filter = ValidityFilter.of(builder.checks);
    }

    public static Builder builder(String id, String family, FeatureAxis axis) {
        return new Builder(id, family, axis);
    }

    public String id() {
        return id;
    }

    public String family() {
        return family;
    }

    public FeatureAxis axis() {
        return axis;
    }

    public boolean resolvesTarget() {
        return targetCategories != null;
    }

    public Set<String> targetCategories() {
        return targetCategories == null ? Set.of() : targetCategories;
    }

    public boolean resolvesController() {
        return controllerCategories != null;
    }

    public Set<String> controllerCategories() {
        return controllerCategories == null ? Set.of() : controllerCategories;
    }

    public Set<String> agreementCategories() {
        return agreementCategories;
    }

    public PatternMatcher matcher() {
        return matcher;
    }

    public PerturbationRule rule() {
        return rule;
    }

    public ValidityFilter filter() {
        return filter;
    }

    @Override
    public String toString() {
        return family + "/" + id;
    }

    public static final class Builder {
        private final String id;
        private final String family;
        private final FeatureAxis axis;
        private Set<String> targetCategories;
        private Set<String> controllerCategories;
        private Set<String> agreementCategories = Set.of();
        private PatternMatcher matcher;
        private PerturbationRule rule;
        private final List<ValidityCheck> checks = new ArrayList<>();

        private Builder(String id, String family, FeatureAxis axis) {
            this.id = id;
            this.family = family;
            this.axis = axis;
        }

        public Builder resolveTarget(String... categories) {
            this.targetCategories = Set.of(categories);
            return this;
        }

        public Builder resolveController(String... categories) {
            this.controllerCategories = Set.of(categories);
            return this;
        }

        public Builder agreeOn(String... categories) {
            this.agreementCategories = Set.of(categories);
            return this;
        }

        public Builder matcher(PatternMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder rule(PerturbationRule rule) {
            this.rule = rule;
            return this;
        }

        public Builder check(ValidityCheck check) {
            checks.add(check);
            return this;
        }

        public Phenomenon build() {
            return new Phenomenon(this);
        }
    }
}
