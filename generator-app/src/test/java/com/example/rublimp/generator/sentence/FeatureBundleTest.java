package com.example.rublimp.generator.sentence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureBundleTest {

    @Test
    void parsesFeatsColumnAndRendersItSorted() {
        FeatureBundle bundle = FeatureBundle.parse("Number=Sing|Case=Nom|Gender=Fem");

        assertEquals("Fem", bundle.get("Gender"));
        assertEquals("Case=Nom|Gender=Fem|Number=Sing", bundle.toString());
    }

    @Test
    void underscoreIsTheEmptyBundle() {
        assertSame(FeatureBundle.empty(), FeatureBundle.parse("_"));
        assertEquals("_", FeatureBundle.empty().toString());
    }

    @Test
    void rejectsFeatureWithoutValue() {
        assertThrows(IllegalArgumentException.class, () -> FeatureBundle.parse("Case=|Number=Sing"));
    }

    @Test
    void withAndWithoutLeaveTheOriginalUntouched() {
        FeatureBundle source = FeatureBundle.of("Number", "Sing", "Case", "Acc");

        FeatureBundle plural = source.with("Number", "Plur");
        FeatureBundle caseless = source.without("Case");

        assertEquals("Sing", source.get("Number"));
        assertEquals("Plur", plural.get("Number"));
        assertFalse(caseless.has("Case"));
        assertSame(source, source.with("Number", "Sing"));
        assertThrows(NullPointerException.class, () -> source.with("Number", null));
    }

    @Test
    void overlapCountsSharedValuesOnly() {
        FeatureBundle a = FeatureBundle.parse("Case=Acc|Gender=Fem|Number=Sing");
        FeatureBundle b = FeatureBundle.parse("Case=Gen|Gender=Fem|Number=Sing|Animacy=Inan");

        assertEquals(2, a.overlap(b));
        assertTrue(b.contains(FeatureBundle.of("Gender", "Fem")));
        assertFalse(a.contains(b));
        assertEquals(FeatureBundle.of("Case", "Acc"), a.restrictedTo(List.of("Case", "Tense")));
    }
}
