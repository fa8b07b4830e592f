package com.example.rublimp.generator.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Morpheme structure of a dictionary word, parsed from notation such as
 * {@code за:PREF/пис:ROOT/а:SUFF/ть:END}.
 */
public final class MorphemeSegmentation {

    public enum Type {
        PREF, ROOT, LINK, HYPH, SUFF, POSTFIX, END
    }

    private static final Pattern SEGMENT = Pattern.compile("([а-яё-]+):([A-Z]+)");

    private final String word;
    private final Map<Type, List<String>> morphemes;

    private MorphemeSegmentation(String word, Map<Type, List<String>> morphemes) {
        this.word = word;
        this.morphemes = morphemes;
    }

    public static MorphemeSegmentation parse(String word, String notation) {
        Map<Type, List<String>> morphemes = new EnumMap<>(Type.class);
        for (Type type : Type.values()) {
            morphemes.put(type, new ArrayList<>());
        }
        Matcher matcher = SEGMENT.matcher(notation);
        while (matcher.find()) {
            Type type;
            try {
                type = Type.valueOf(matcher.group(2));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown morpheme type in '" + notation + "'", ex);
            }
            morphemes.get(type).add(matcher.group(1));
        }
        Map<Type, List<String>> frozen = new EnumMap<>(Type.class);
        morphemes.forEach((type, list) -> frozen.put(type, Collections.unmodifiableList(list)));
        return new MorphemeSegmentation(word, Collections.unmodifiableMap(frozen));
    }

    public String word() {
        return word;
    }

    public List<String> get(Type type) {
        return morphemes.get(type);
    }

    public List<String> prefixes() {
        return morphemes.get(Type.PREF);
    }

    public List<String> roots() {
        return morphemes.get(Type.ROOT);
    }

    public List<String> suffixes() {
        return morphemes.get(Type.SUFF);
    }

    /**
     * First ending, or an empty string for words without one.
     */
    public String ending() {
        List<String> endings = morphemes.get(Type.END);
        return endings.isEmpty() ? "" : endings.get(0);
    }

    public boolean hasHyphen() {
        return !morphemes.get(Type.HYPH).isEmpty();
    }

    @Override
    public String toString() {
        return word + " " + morphemes;
    }
}
