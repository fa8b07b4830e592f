package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.sentence.Token;

import java.util.List;

/**
 * Swaps the two prefixes of a verb so that the outer prefix ends up inside:
 * {@code подустать -> уподстать}.
 */
final class PrefixOrderRule extends PrefixRule {

    @Override
    List<String> chains(List<String> prefixes, String root, Token verb, PerturbationContext context) {
        if (prefixes.size() != 2 || !context.resources().isLexicalPrefix(prefixes.get(1))) {
            return List.of();
        }
        List<String> swapped = List.of(prefixes.get(1), prefixes.get(0));
        if (swapped.equals(prefixes) || PrefixRules.hasVowelClash(swapped, root)) {
            return List.of();
        }
        if (!PrefixRules.fits(swapped.get(1), root) || !PrefixRules.chainFits(swapped)
                || !PrefixRules.fits(String.join("", swapped), root)) {
            return List.of();
        }
        return List.of(String.join(SEPARATOR, swapped));
    }
}
