package com.example.rublimp.generator.lexicon;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MorphemeSegmentationTest {

    @Test
    void splitsNotationByMorphemeType() {
        MorphemeSegmentation segmentation = MorphemeSegmentation.parse("подустать", "под:PREF/у:PREF/ста:ROOT/ть:END");

        assertEquals(List.of("под", "у"), segmentation.prefixes());
        assertEquals(List.of("ста"), segmentation.roots());
        assertEquals("ть", segmentation.ending());
        assertTrue(segmentation.suffixes().isEmpty());
    }

    @Test
    void recognisesHyphenatedCompounds() {
        MorphemeSegmentation segmentation = MorphemeSegmentation.parse("черно-белый",
                "черн:ROOT/о:LINK/-:HYPH/бел:ROOT/ый:END");

        assertTrue(segmentation.hasHyphen());
        assertEquals(List.of("черн", "бел"), segmentation.roots());
    }

    @Test
    void wordsWithoutEndingHaveAnEmptyOne() {
        MorphemeSegmentation segmentation = MorphemeSegmentation.parse("стол", "стол:ROOT");

        assertEquals("", segmentation.ending());
        assertFalse(segmentation.hasHyphen());
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MorphemeSegmentation.parse("стол", "стол:STEM"));
    }
}
