package com.example.rublimp.generator.phenomena;

import java.util.List;

/**
 * Produces the altered forms for a candidate along the phenomenon's axis.
 */
public interface PerturbationRule {

    /**
     * Values the candidate may be moved to; never contains the source value.
     */
    List<String> alternatives(Candidate candidate, PerturbationContext context);

    Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
            throws UnsynthesizableException;
}
