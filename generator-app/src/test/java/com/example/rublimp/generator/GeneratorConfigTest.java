package com.example.rublimp.generator;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneratorConfigTest {

    @Test
    void propertyWinsOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty(GeneratorConfig.WORKERS_PROPERTY, " 3 ");
        Map<String, String> environment = Map.of(
                GeneratorConfig.WORKERS_ENV, "8",
                GeneratorConfig.DOMAIN_ENV, "wiki",
                GeneratorConfig.LEXICON_ENV, "/data/lexicon.tsv");

        GeneratorConfig config = GeneratorConfig.from(properties, environment);

        assertEquals(3, config.workers());
        assertEquals("wiki", config.domain());
        assertEquals(Path.of("/data/lexicon.tsv"), config.lexiconPath().orElseThrow());
        assertTrue(config.tablesDirectory().isEmpty());
    }

    @Test
    void defaultsApplyWhenNothingIsSet() {
        GeneratorConfig config = GeneratorConfig.from(new Properties(), Map.of());

        assertEquals(GeneratorConfig.DEFAULT_DOMAIN, config.domain());
        assertTrue(config.lexiconPath().isEmpty());
        assertTrue(config.phenomena().isEmpty());
        assertTrue(config.workers() >= 1);
    }

    @Test
    void invalidWorkerCountIsReported() {
        Properties properties = new Properties();
        properties.setProperty(GeneratorConfig.WORKERS_PROPERTY, "many");

        GenerationException ex = assertThrows(GenerationException.class,
                () -> GeneratorConfig.from(properties, Map.of()));
        assertTrue(ex.getMessage().contains("many"));
    }

    @Test
    void workerCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.defaults().withWorkers(0));
    }

    @Test
    void phenomenaSelectionIsCopied() {
        List<String> selection = new ArrayList<>(List.of("tense"));
        GeneratorConfig config = GeneratorConfig.defaults().withPhenomena(selection);
        selection.add("aspect");

        assertEquals(List.of("tense"), config.phenomena());
    }
}
