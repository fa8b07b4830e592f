package com.example.rublimp.generator;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.morphology.Analysis;
import com.example.rublimp.generator.morphology.MorphAgreementResolver;
import com.example.rublimp.generator.morphology.MorphologyAnalyzer;
import com.example.rublimp.generator.morphology.Resolution;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.pairs.PairAssembler;
import com.example.rublimp.generator.phenomena.Candidate;
import com.example.rublimp.generator.phenomena.Perturbation;
import com.example.rublimp.generator.phenomena.PerturbationContext;
import com.example.rublimp.generator.phenomena.Phenomenon;
import com.example.rublimp.generator.phenomena.PhenomenonRegistry;
import com.example.rublimp.generator.phenomena.UnsynthesizableException;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every registered phenomenon over one sentence: match, resolve readings, perturb, filter and
 * assemble. Holds no per-sentence state, so one instance serves all workers.
 */
public final class PerturbationEngine {

    private static final Logger log = LoggerFactory.getLogger(PerturbationEngine.class);

    private final PhenomenonRegistry registry;
    private final MorphologyAnalyzer analyzer;
    private final LexicalResources resources;
    private final MorphAgreementResolver resolver;
    private final PairAssembler assembler;

    public PerturbationEngine(PhenomenonRegistry registry, MorphologyAnalyzer analyzer,
                              LexicalResources resources, String domain) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.resolver = new MorphAgreementResolver(analyzer);
        this.assembler = new PairAssembler(domain);
    }

    public PhenomenonRegistry registry() {
        return registry;
    }

    public List<MinimalPair> generate(AnnotatedSentence sentence, GenerationReport report) {
        report.record(GenerationReport.SENTENCES);
        PerturbationContext context = PerturbationContext.of(sentence, analyzer, resources);
        List<MinimalPair> pairs = new ArrayList<>();
        for (Phenomenon phenomenon : registry.all()) {
            pairs.addAll(generate(sentence, phenomenon, context, report));
        }
        return pairs;
    }

    List<MinimalPair> generate(AnnotatedSentence sentence, Phenomenon phenomenon, PerturbationContext context,
                               GenerationReport report) {
        List<MinimalPair> pairs = new ArrayList<>();
        Set<String> targetSentences = new HashSet<>();
        Iterator<Candidate> candidates = phenomenon.matcher().find(sentence).iterator();
        while (candidates.hasNext()) {
            Candidate candidate = candidates.next();
            report.record(GenerationReport.CANDIDATES);
            Optional<PerturbationContext> resolved = resolve(sentence, phenomenon, candidate, context, report);
            if (resolved.isEmpty()) {
                continue;
            }
            PerturbationContext candidateContext = resolved.get();
            for (String value : phenomenon.rule().alternatives(candidate, candidateContext)) {
                Perturbation perturbation;
                try {
                    perturbation = phenomenon.rule().perturb(candidate, value, candidateContext);
                } catch (UnsynthesizableException ex) {
                    log.debug("{} in {}: {} -> {} unsynthesizable: {}",
                            phenomenon, sentence.id(), candidate, value, ex.getMessage());
                    report.record(GenerationReport.UNSYNTHESIZABLE);
                    continue;
                }
                Optional<String> rejection = phenomenon.filter().firstRejection(candidate, perturbation, candidateContext);
                if (rejection.isPresent()) {
                    log.debug("{} in {}: {} rejected by {}", phenomenon, sentence.id(), perturbation, rejection.get());
                    report.recordRejection(rejection.get());
                    continue;
                }
                MinimalPair pair = assembler.assemble(sentence, phenomenon, candidate, perturbation);
                if (!targetSentences.add(pair.targetSentence())) {
                    report.record(GenerationReport.DUPLICATE);
                    continue;
                }
                report.recordAccepted(phenomenon.id());
                pairs.add(pair);
            }
        }
        return pairs;
    }

    private Optional<PerturbationContext> resolve(AnnotatedSentence sentence, Phenomenon phenomenon,
                                                  Candidate candidate, PerturbationContext context,
                                                  GenerationReport report) {
        Analysis target = null;
        Analysis controller = null;
        if (phenomenon.resolvesTarget()) {
            Resolution resolution = resolver.resolve(sentence.token(candidate.target()), phenomenon.targetCategories());
            if (!resolution.isResolved()) {
                log.debug("{} in {}: target unresolved: {}", phenomenon, sentence.id(), resolution.reason());
                report.record(GenerationReport.UNRESOLVED);
                return Optional.empty();
            }
            target = resolution.analysis();
        }
        if (phenomenon.resolvesController() && candidate.hasController()) {
            Resolution resolution = resolver.resolve(sentence.token(candidate.controller()),
                    phenomenon.controllerCategories());
            if (!resolution.isResolved()) {
                log.debug("{} in {}: controller unresolved: {}", phenomenon, sentence.id(), resolution.reason());
                report.record(GenerationReport.UNRESOLVED);
                return Optional.empty();
            }
            controller = resolution.analysis();
        }
        if (target != null && controller != null && !phenomenon.agreementCategories().isEmpty()
                && !resolver.verifyAgreement(sentence.id(), target, controller, phenomenon.agreementCategories())) {
            report.record(GenerationReport.AGREEMENT_DEFECT);
            return Optional.empty();
        }
        return Optional.of(context.withAnalyses(target, controller));
    }
}
