package io.mersel.services.patterns.infrastructure.identify;

import io.mersel.services.patterns.application.enums.Verdict;
import io.mersel.services.patterns.application.interfaces.IIdentifyEngine;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.models.GapReport;
import io.mersel.services.patterns.application.models.MatchExplanation;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternMatch;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fact'leri pattern kütüphanesine karşı sınıflandırır.
 * <p>
 * Eşik değerleri sabittir; ağırlıklar ve cezalar {@link PatternScorer} üzerinden yapılandırılır.
 */
@Service
public class IdentifyEngine implements IIdentifyEngine {

    private static final Logger log = LoggerFactory.getLogger(IdentifyEngine.class);

    static final double EXACT_THRESHOLD = 0.95;
    static final double HIGH_THRESHOLD = 0.85;
    static final double PARTIAL_THRESHOLD = 0.70;
    static final double LOW_THRESHOLD = 0.50;

    private final IPatternCatalog catalog;
    private final PatternScorer scorer;
    private final PatternMetrics metrics;

    public IdentifyEngine(IPatternCatalog catalog, PatternScorer scorer, PatternMetrics metrics) {
        this.catalog = catalog;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    public static Verdict classify(double score) {
        if (score >= EXACT_THRESHOLD) return Verdict.EXACT;
        if (score >= HIGH_THRESHOLD) return Verdict.HIGH;
        if (score >= PARTIAL_THRESHOLD) return Verdict.PARTIAL;
        if (score >= LOW_THRESHOLD) return Verdict.LOW;
        return Verdict.NO_MATCH;
    }

    @Override
    public PatternMatch identify(NodeFact fact, List<NodeRelationship> relationships, List<Pattern> candidates) {
        if (candidates.isEmpty()) {
            metrics.recordVerdict(Verdict.NEW_PATTERN);
            return new PatternMatch(UUID.randomUUID().toString(), fact.workspaceId(), fact.runId(), fact.id(),
                    null, 0.0, Verdict.NEW_PATTERN,
                    MatchExplanation.none("Kapsamda aday pattern yok"), Instant.now());
        }

        Pattern best = null;
        MatchExplanation bestExplanation = null;
        for (Pattern candidate : candidates) {
            MatchExplanation explanation = scorer.score(fact, relationships, candidate);
            if (best == null || isBetter(explanation, candidate, bestExplanation, best)) {
                best = candidate;
                bestExplanation = explanation;
            }
        }

        Verdict verdict = classify(bestExplanation.finalScore());
        if (verdict.isHighConfidence()) {
            catalog.incrementTimesSeen(fact.workspaceId(), best.id());
        }
        metrics.recordVerdict(verdict);
        log.debug("[{}] {}#{} → {} ({}, {})", fact.runId(), fact.sectionPath(), fact.ordinal(),
                best.id(), bestExplanation.finalScore(), verdict);

        return new PatternMatch(UUID.randomUUID().toString(), fact.workspaceId(), fact.runId(), fact.id(),
                best.id(), bestExplanation.finalScore(), verdict, bestExplanation, Instant.now());
    }

    /**
     * Eşit skorda daha sık görülen, o da eşitse kimliği küçük olan pattern kazanır.
     */
    private static boolean isBetter(MatchExplanation explanation, Pattern candidate,
                                    MatchExplanation bestExplanation, Pattern best) {
        int byScore = Double.compare(explanation.finalScore(), bestExplanation.finalScore());
        if (byScore != 0) {
            return byScore > 0;
        }
        if (candidate.timesSeen() != best.timesSeen()) {
            return candidate.timesSeen() > best.timesSeen();
        }
        return candidate.id().compareTo(best.id()) < 0;
    }

    @Override
    public GapReport analyzeGaps(List<NodeFact> facts, List<PatternMatch> matches, List<Pattern> library) {
        Map<Verdict, Integer> verdictCounts = new EnumMap<>(Verdict.class);
        Map<String, PatternMatch> byFact = new HashMap<>();
        Set<String> matchedPatterns = new HashSet<>();
        int matched = 0;
        int highConfidence = 0;

        for (PatternMatch match : matches) {
            verdictCounts.merge(match.verdict(), 1, Integer::sum);
            byFact.put(match.factId(), match);
            if (match.verdict().isMatched()) {
                matched++;
                matchedPatterns.add(match.patternId());
            }
            if (match.verdict().isHighConfidence()) {
                highConfidence++;
            }
        }

        var missing = new ArrayList<GapReport.MissingPattern>();
        for (Pattern pattern : library) {
            if (!matchedPatterns.contains(pattern.id())) {
                missing.add(new GapReport.MissingPattern(pattern.id(), pattern.sectionPath(),
                        pattern.nodeType(), pattern.timesSeen()));
            }
        }

        var newStructures = new ArrayList<GapReport.NewStructure>();
        for (NodeFact fact : facts) {
            PatternMatch match = byFact.get(fact.id());
            if (match != null && match.verdict() == Verdict.NEW_PATTERN) {
                newStructures.add(new GapReport.NewStructure(fact.id(), fact.sectionPath(),
                        fact.nodeType(), fact.ordinal()));
            }
        }

        double matchRate = facts.isEmpty() ? 0.0 : (double) matched / facts.size();
        return new GapReport(facts.size(), matched, highConfidence, PatternScorer.round(matchRate),
                verdictCounts, missing, newStructures);
    }
}
