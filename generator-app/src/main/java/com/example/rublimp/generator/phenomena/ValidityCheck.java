package com.example.rublimp.generator.phenomena;

import java.util.Objects;

/**
 * A single acceptance test run on a perturbation before it becomes a pair.
 */
public interface ValidityCheck {

    String name();

    boolean test(Candidate candidate, Perturbation perturbation, PerturbationContext context);

    static ValidityCheck named(String name, Test test) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(test, "test");
        return new ValidityCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean test(Candidate candidate, Perturbation perturbation, PerturbationContext context) {
                return test.test(candidate, perturbation, context);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    @FunctionalInterface
    interface Test {
        boolean test(Candidate candidate, Perturbation perturbation, PerturbationContext context);
    }
}
