package com.example.rublimp.generator.phenomena.wordformation;

import com.example.rublimp.generator.morphology.Orthography;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Spelling constraints on a prefix followed by another prefix or a root.
 */
final class PrefixRules {

    private static final Set<Character> IOTATED = Set.of('е', 'ё', 'ю', 'я');
    private static final Set<String> VOICING_PREFIXES = Set.of("рас", "раз", "из", "ис");

    private PrefixRules() {
    }

    /**
     * A hard sign needs an iotated vowel after it; {@code з} prefixes need a voiced consonant or a
     * vowel; {@code с} prefixes need a voiceless consonant; no letter is doubled at the boundary.
     */
    static boolean fits(String prefix, String next) {
        if (prefix.isEmpty() || next.isEmpty()) {
            return false;
        }
        char last = Orthography.last(prefix);
        char first = Orthography.first(next);
        if (last == 'ъ' && !IOTATED.contains(first)) {
            return false;
        }
        if (last == 'з' && !Orthography.VOICED.contains(first) && !Orthography.isVowel(first)
                && VOICING_PREFIXES.contains(prefix)) {
            return false;
        }
        if (last == 'с' && (!Orthography.VOICELESS.contains(first) || Orthography.isVowel(first))) {
            return false;
        }
        return last != first;
    }

    static boolean chainFits(List<String> prefixes) {
        for (int i = 0; i + 1 < prefixes.size(); i++) {
            if (!fits(prefixes.get(i), prefixes.get(i + 1))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Vowels may not meet across the two prefixes or between the inner prefix and the root.
     */
    static boolean hasVowelClash(List<String> prefixes, String root) {
        String outer = prefixes.get(0);
        String inner = prefixes.get(prefixes.size() - 1);
        return Orthography.isVowel(Orthography.last(outer)) && Orthography.isVowel(Orthography.first(inner))
                || Orthography.isVowel(Orthography.last(inner)) && Orthography.isVowel(Orthography.first(root));
    }

    /**
     * Replaces the original prefix string at the start of {@code word}, or returns null when the
     * word does not start with it.
     */
    static String replacePrefix(String word, String originalPrefix, String newPrefix) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (!lower.startsWith(originalPrefix)) {
            return null;
        }
        return newPrefix + lower.substring(originalPrefix.length());
    }
}
