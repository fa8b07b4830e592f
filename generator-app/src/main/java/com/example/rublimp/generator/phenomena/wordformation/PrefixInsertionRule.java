package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.Orthography;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.sentence.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Stacks a second lexical prefix that combines with the root before or after the verb's single
 * prefix: {@code записать -> прозаписать}.
 */
final class PrefixInsertionRule extends PrefixRule {

    @Override
    List<String> chains(List<String> prefixes, String root, Token verb, PerturbationContext context) {
        if (prefixes.size() != 1) {
            return List.of();
        }
        LexicalResources resources = context.resources();
        String existing = prefixes.get(0);
        List<String> compatible = new ArrayList<>();
        for (String prefix : resources.lexicalPrefixes()) {
            if (resources.prefixesForRoot(root, "VERB").contains(prefix) && !prefixes.contains(prefix)
                    && !resources.overlappingPrefixes(existing).contains(prefix)) {
                compatible.add(prefix);
            }
        }

        List<List<String>> stacks = new ArrayList<>();
        for (String prefix : compatible) {
            if (Orthography.last(prefix) == Orthography.first(existing) && Orthography.isVowel(Orthography.last(prefix))) {
                continue;
            }
            if (!prefix.contains("ъ")) {
                stacks.add(List.of(prefix, existing));
            }
            if (resources.isLexicalPrefix(existing) && !existing.contains("ъ")) {
                if (Orthography.last(existing) == Orthography.first(prefix) && Orthography.isVowel(Orthography.first(prefix))) {
                    continue;
                }
                stacks.add(List.of(existing, prefix));
            }
        }

        List<String> chains = new ArrayList<>();
        for (List<String> stack : stacks) {
            if (PrefixRules.hasVowelClash(stack, root) || !PrefixRules.chainFits(stack)
                    || !PrefixRules.fits(String.join("", stack), root)) {
                continue;
            }
            chains.add(String.join(SEPARATOR, stack));
        }
        return chains;
    }

    @Override
    void annotate(Perturbation.Builder builder, List<String> original, List<String> chain) {
        builder.annotateTarget("new_prefix_position", chain.get(0).equals(original.get(0)) ? "1" : "0");
    }
}
