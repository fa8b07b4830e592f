package com.example.rublimp.generator.morphology;

import com.example.rublimp.generator.sentence.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the analyzer reading that agrees best with the parser's tags. Only readings that match the
 * parser on every required category qualify; among them ties on feature overlap go to the lower
 * frequency rank, then to the earlier reading.
 */
public final class MorphAgreementResolver {

    private static final Logger log = LoggerFactory.getLogger(MorphAgreementResolver.class);

    private final MorphologyAnalyzer analyzer;

    public MorphAgreementResolver(MorphologyAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public Resolution resolve(Token token, Set<String> requiredCategories) {
        List<Analysis> analyses = analyzer.analyze(token.form());
        if (analyses.isEmpty()) {
            return Resolution.unresolved("unknown form '" + token.form() + "'");
        }
        String lemma = Orthography.unify(token.lemma().toLowerCase(Locale.ROOT));
        Analysis best = null;
        int bestOverlap = -1;
        Analysis firstDisagreeing = null;
        String disagreement = null;
        for (Analysis analysis : analyses) {
            if (!Orthography.unify(analysis.lemma()).equals(lemma)) {
                continue;
            }
            String category = firstDisagreement(analysis, token, requiredCategories);
            if (category != null) {
                if (firstDisagreeing == null) {
                    firstDisagreeing = analysis;
                    disagreement = category;
                }
                continue;
            }
            int overlap = analysis.features().overlap(token.feats());
            if (overlap > bestOverlap
                    || (overlap == bestOverlap && analysis.frequencyRank() < best.frequencyRank())) {
                best = analysis;
                bestOverlap = overlap;
            }
        }
        if (best != null) {
            return Resolution.resolved(best);
        }
        if (firstDisagreeing == null) {
            return Resolution.unresolved("no reading of '" + token.form() + "' with lemma '" + token.lemma() + "'");
        }
        return Resolution.unresolved("no reading of '" + token.form() + "' agrees with parser tags "
                + token.feats() + "; reading " + firstDisagreeing.features() + " disagrees on " + disagreement);
    }

    private static String firstDisagreement(Analysis analysis, Token token, Set<String> requiredCategories) {
        for (String category : requiredCategories) {
            String parsed = token.feature(category);
            if (parsed == null || !parsed.equals(analysis.features().get(category))) {
                return category;
            }
        }
        return null;
    }

    /**
     * Re-checks that two resolved readings share the same values on the agreement categories.
     * A mismatch means the annotation contradicts itself.
     */
    public boolean verifyAgreement(String sentenceId, Analysis target, Analysis controller,
                                   Collection<String> categories) {
        for (String category : categories) {
            String targetValue = target.features().get(category);
            String controllerValue = controller.features().get(category);
            if (targetValue != null && controllerValue != null && !targetValue.equals(controllerValue)) {
                log.warn("Agreement defect in sentence {}: '{}' has {}={} but controller '{}' has {}={}",
                        sentenceId, target.form(), category, targetValue, controller.form(), category, controllerValue);
                return false;
            }
        }
        return true;
    }
}
