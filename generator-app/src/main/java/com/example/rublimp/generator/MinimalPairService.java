package com.example.rublimp.generator;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.LexiconMorphologyAnalyzer;
import com.example.rublimp.generator.morphology.MorphologyAnalyzer;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.phenomena.PhenomenonRegistry;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Generates pairs for many sentences on a fixed pool of workers. Results come back in input
 * order regardless of which worker finished first.
 */
public class MinimalPairService implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(MinimalPairService.class);

    private final PerturbationEngine engine;
    private final ExecutorService executor;

    public MinimalPairService(GeneratorConfig config) {
        this(createEngine(config), config.workers());
    }

    MinimalPairService(PerturbationEngine engine, int workers) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "pair-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    static PerturbationEngine createEngine(GeneratorConfig config) {
        MorphologyAnalyzer analyzer = config.lexiconPath()
                .map(LexiconMorphologyAnalyzer::load)
                .orElseGet(LexiconMorphologyAnalyzer::loadDefault);
        LexicalResources resources = config.tablesDirectory()
                .map(LexicalResources::load)
                .orElseGet(LexicalResources::loadDefault);
        PhenomenonRegistry registry = PhenomenonRegistry.standard(resources).select(config.phenomena());
        log.info("Loaded {} phenomena with {}", registry.size(), config);
        return new PerturbationEngine(registry, analyzer, resources, config.domain());
    }

    public PerturbationEngine engine() {
        return engine;
    }

    public List<MinimalPair> generate(List<AnnotatedSentence> sentences, GenerationReport report) {
        List<Future<List<MinimalPair>>> futures = new ArrayList<>(sentences.size());
        for (AnnotatedSentence sentence : sentences) {
            futures.add(executor.submit(() -> engine.generate(sentence, report)));
        }
        List<MinimalPair> pairs = new ArrayList<>();
        for (Future<List<MinimalPair>> future : futures) {
            try {
                pairs.addAll(future.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(pending -> pending.cancel(true));
                throw new GenerationException("Interrupted while generating minimal pairs", ex);
            } catch (ExecutionException ex) {
                futures.forEach(pending -> pending.cancel(true));
                Throwable cause = ex.getCause();
                if (cause instanceof GenerationException) {
                    throw (GenerationException) cause;
                }
                throw new GenerationException("Minimal pair generation failed: " + cause.getMessage(), cause);
            }
        }
        log.info("Generated {} pairs from {} sentences", pairs.size(), sentences.size());
        return pairs;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
