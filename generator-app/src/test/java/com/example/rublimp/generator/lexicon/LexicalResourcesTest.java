package com.example.rublimp.generator.lexicon;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.TestFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

class LexicalResourcesTest {

    private final LexicalResources resources = TestFixtures.resources();

    @Test
    void bundledTablesLoad() {
        Assertions.assertEquals(List.of("ник"), resources.suffixesForRoot("плеч", "NOUN"));
        Assertions.assertTrue(resources.isDerivationalSuffix("ник"));
        Assertions.assertEquals(List.of("ик"), resources.suffixExclusions("ник", 0));
        Assertions.assertEquals(List.of(), resources.suffixExclusions("ник", 5));
        Assertions.assertEquals(List.of("за"), resources.segmentation("Записать").orElseThrow().prefixes());
    }

    @Test
    void perfectivePartnerIsTheMostFrequentOne() {
        Assertions.assertEquals(Optional.of("написать"), resources.perfectivePartner("писать"));
        Assertions.assertEquals(Optional.empty(), resources.perfectivePartner("спать"));
        Assertions.assertEquals(0.0, resources.ipm("несуществующий"));
    }

    @Test
    void orthographyTablesFlagForbiddenSpellings() {
        Assertions.assertEquals(Optional.of("жы"), resources.forbiddenSequenceIn("жыр"));
        Assertions.assertEquals(Optional.empty(), resources.forbiddenSequenceIn("плечники"));
        Assertions.assertTrue(resources.hasForbiddenBeginning("ьезд"));
    }

    @Test
    void governmentAndPronounTables() {
        Assertions.assertEquals(Set.of("Acc", "Loc"), resources.adpositionCases("В"));
        Assertions.assertEquals(List.of("никто"), resources.negativeCounterparts("кто-то"));
        Assertions.assertEquals(List.of("кто-нибудь", "кто-то"), resources.indefiniteCounterparts("никто"));
        Assertions.assertTrue(resources.isCollectiveNoun("Руководство"));
        Assertions.assertTrue(resources.isIntransitive("спать"));
    }

    @Test
    void missingTableInDirectoryIsReported(@TempDir Path directory) throws IOException {
        Files.writeString(directory.resolve("affixes.json"), "{}", StandardCharsets.UTF_8);

        GenerationException ex = Assertions.assertThrows(GenerationException.class,
                () -> LexicalResources.load(directory));
        Assertions.assertTrue(ex.getMessage().contains("orthography.json"), ex.getMessage());
    }

    @Test
    void missingDirectoryIsReported() {
        Assertions.assertThrows(GenerationException.class, () -> LexicalResources.load(Path.of("no-such-tables")));
    }
}
