package com.example.rublimp.generator.phenomena.inflection;

import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;
import java.util.Map;

/**
 * Gives a noun the ending another declension class uses in the same number and case:
 * {@code стола -> столи}.
 */
final class DeclensionEndingRule extends EndingReplacementRule {

    @Override
    Map<String, List<String>> substitutions(Token token, PerturbationContext context) {
        String number = token.feature("Number");
        String grammaticalCase = token.feature("Case");
        if (number == null || grammaticalCase == null) {
            return Map.of();
        }
        return context.resources().declensionEndings(number, grammaticalCase);
    }
}
