package com.example.rublimp.generator.phenomena;

import java.util.List;
import java.util.Optional;

/**
 * Conjunction of validity checks; a perturbation is accepted only when every check passes.
 */
public final class ValidityFilter {

    private static final ValidityFilter NONE = new ValidityFilter(List.of());

    private final List<ValidityCheck> checks;

    private ValidityFilter(List<ValidityCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static ValidityFilter of(ValidityCheck... checks) {
        return checks.length == 0 ? NONE : new ValidityFilter(List.of(checks));
    }

    public static ValidityFilter of(List<ValidityCheck> checks) {
        return new ValidityFilter(checks);
    }

    public List<ValidityCheck> checks() {
        return checks;
    }

    public boolean accept(Candidate candidate, Perturbation perturbation, PerturbationContext context) {
        return firstRejection(candidate, perturbation, context).isEmpty();
    }

    /**
     * Name of the first failing check, if any.
     */
    public Optional<String> firstRejection(Candidate candidate, Perturbation perturbation,
                                           PerturbationContext context) {
        for (ValidityCheck check : checks) {
            if (!check.test(candidate, perturbation, context)) {
                return Optional.of(check.name());
            }
        }
        return Optional.empty();
    }
}
