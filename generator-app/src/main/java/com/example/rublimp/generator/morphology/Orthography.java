package com.example.rublimp.generator.morphology;

import java.util.Locale;
import java.util.Set;

/**
 * Spelling helpers shared by the analyzer and the rules.
 */
public final class Orthography {

    public static final Set<Character> VOWELS = Set.of('а', 'о', 'и', 'ы', 'у', 'э', 'ё', 'е', 'я', 'ю');
    public static final Set<Character> VOICELESS = Set.of('к', 'п', 'с', 'т', 'ф', 'х', 'ц', 'ч', 'ш', 'щ');
    public static final Set<Character> VOICED = Set.of('б', 'в', 'г', 'д', 'ж', 'з', 'й', 'л', 'м', 'н', 'р');

    private Orthography() {
    }

    /**
     * Lower-cases and replaces ё by е, the spelling most texts use.
     */
    public static String unify(String word) {
        return word.toLowerCase(Locale.ROOT).replace('ё', 'е');
    }

    public static boolean differsOnlyByYo(String a, String b) {
        return !a.equals(b) && unify(a).equals(unify(b));
    }

    public static boolean isVowel(char c) {
        return VOWELS.contains(Character.toLowerCase(c));
    }

    public static char first(String word) {
        return word.charAt(0);
    }

    public static char last(String word) {
        return word.charAt(word.length() - 1);
    }

    /**
     * Copies the capitalisation pattern of {@code source} onto {@code replacement}.
     */
    public static String capitalizeLike(String source, String replacement) {
        if (source.isEmpty() || replacement.isEmpty()) {
            return replacement;
        }
        if (source.length() > 1 && source.equals(source.toUpperCase(Locale.ROOT))
                && !source.equals(source.toLowerCase(Locale.ROOT))) {
            return replacement.toUpperCase(Locale.ROOT);
        }
        String lower = replacement.toLowerCase(Locale.ROOT);
        if (Character.isUpperCase(source.charAt(0))) {
            return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        }
        return lower;
    }
}
