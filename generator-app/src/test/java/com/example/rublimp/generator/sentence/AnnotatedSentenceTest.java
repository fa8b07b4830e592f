package com.example.rublimp.generator.sentence;

import com.example.rublimp.generator.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotatedSentenceTest {

    private final AnnotatedSentence sentence = TestFixtures.sentence("t1",
            "Седло седло NOUN Case=Nom|Gender=Neut|Number=Sing 3 nsubj",
            "коня конь NOUN Animacy=Anim|Case=Gen|Gender=Masc|Number=Sing 1 nmod",
            "лежит лежать VERB Aspect=Imp|Mood=Ind|Number=Sing|Person=3|Tense=Pres|VerbForm=Fin 0 root",
            "у у ADP _ 5 case",
            "стола стол NOUN Case=Gen|Gender=Masc|Number=Sing 3 obl NoSpace",
            ". . PUNCT _ 3 punct");

    @Test
    void navigatesTheTree() {
        Token root = sentence.root();

        assertEquals("лежит", root.form());
        assertEquals(List.of(sentence.token(1), sentence.token(5), sentence.token(6)), sentence.dependents(root));
        assertEquals(sentence.token(1), sentence.head(sentence.token(2)).orElseThrow());
        assertTrue(sentence.isDescendant(sentence.token(4), root));
        assertFalse(sentence.isDescendant(root, sentence.token(4)));
        assertEquals(2, sentence.depth(sentence.token(2)));
        assertEquals(3, sentence.treeDepth());
        assertEquals(3, sentence.pathLength(sentence.token(2), sentence.token(5)));
    }

    @Test
    void rendersWithReplacements() {
        assertEquals("Седло коня лежит у стола.", sentence.render());
        assertEquals("Седло коня лежит у столи.", sentence.render(Map.of(5, "столи")));
    }

    @Test
    void rejectsTwoRoots() {
        List<Token> tokens = List.of(
                new Token(1, "Мама", "мама", "NOUN", FeatureBundle.empty(), 0, "root", true),
                new Token(2, "спит", "спать", "VERB", FeatureBundle.empty(), 0, "root", true));

        assertThrows(MalformedSentenceException.class, () -> AnnotatedSentence.of("t2", null, tokens));
    }

    @Test
    void rejectsCycles() {
        List<Token> tokens = List.of(
                new Token(1, "Мама", "мама", "NOUN", FeatureBundle.empty(), 0, "root", true),
                new Token(2, "мыла", "мыть", "VERB", FeatureBundle.empty(), 3, "dep", true),
                new Token(3, "раму", "рама", "NOUN", FeatureBundle.empty(), 2, "dep", true));

        assertThrows(MalformedSentenceException.class, () -> AnnotatedSentence.of("t3", null, tokens));
    }

    @Test
    void rejectsHeadOutOfRange() {
        List<Token> tokens = List.of(
                new Token(1, "Мама", "мама", "NOUN", FeatureBundle.empty(), 0, "root", true),
                new Token(2, "мыла", "мыть", "VERB", FeatureBundle.empty(), 7, "dep", true));

        assertThrows(MalformedSentenceException.class, () -> AnnotatedSentence.of("t4", null, tokens));
    }
}
