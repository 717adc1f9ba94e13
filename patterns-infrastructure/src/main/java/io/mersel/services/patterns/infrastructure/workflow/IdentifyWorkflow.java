package io.mersel.services.patterns.infrastructure.workflow;

import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.interfaces.ExtractionException;
import io.mersel.services.patterns.application.interfaces.IIdentifyEngine;
import io.mersel.services.patterns.application.interfaces.IIdentifyWorkflow;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.interfaces.IRelationshipAnalyzer;
import io.mersel.services.patterns.application.interfaces.IRunStore;
import io.mersel.services.patterns.application.interfaces.IStructuralExtractor;
import io.mersel.services.patterns.application.interfaces.RunFailedException;
import io.mersel.services.patterns.application.models.CandidateScope;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.GapReport;
import io.mersel.services.patterns.application.models.IdentifyResult;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternMatch;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;
import io.mersel.services.patterns.application.models.RunConfig;
import io.mersel.services.patterns.application.models.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Identify: çıkarım → ilişki analizi → kapsamdaki adaylara karşı skorlama → boşluk raporu.
 * <p>
 * Boş kütüphane hata değildir; tüm fact'ler NEW_PATTERN olur ve çalıştırmaya uyarı eklenir.
 */
@Service
public class IdentifyWorkflow implements IIdentifyWorkflow {

    private static final Logger log = LoggerFactory.getLogger(IdentifyWorkflow.class);

    private final IStructuralExtractor extractor;
    private final IRelationshipAnalyzer relationshipAnalyzer;
    private final IPatternCatalog catalog;
    private final IIdentifyEngine identifyEngine;
    private final IRunStore runStore;
    private final RunLifecycle lifecycle;

    public IdentifyWorkflow(IStructuralExtractor extractor,
                            IRelationshipAnalyzer relationshipAnalyzer,
                            IPatternCatalog catalog,
                            IIdentifyEngine identifyEngine,
                            IRunStore runStore,
                            RunLifecycle lifecycle) {
        this.extractor = extractor;
        this.relationshipAnalyzer = relationshipAnalyzer;
        this.catalog = catalog;
        this.identifyEngine = identifyEngine;
        this.runStore = runStore;
        this.lifecycle = lifecycle;
    }

    @Override
    public IdentifyResult runIdentify(DocumentSource document, RunConfig config) throws RunFailedException {
        RunRecord run = lifecycle.start(RunKind.IDENTIFY, document, config);
        try {
            return execute(run, document, config);
        } catch (ExtractionException e) {
            runStore.saveFacts(e.getPartialFacts());
            throw new RunFailedException(lifecycle.fail(run, e), "Identify başarısız: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new RunFailedException(lifecycle.fail(run, e), "Identify kalıcılık hatası: " + e.getMessage(), e);
        }
    }

    private IdentifyResult execute(RunRecord run, DocumentSource document, RunConfig config)
            throws ExtractionException {
        ExtractionResult extraction = extractor.extract(document, config, run.id());
        runStore.saveFacts(extraction.facts());

        DocumentDialect dialect = extraction.dialect();
        String owner = config.ownerCode() != null ? config.ownerCode() : dialect.ownerCode();
        var warnings = new ArrayList<>(extraction.warnings());
        Map<String, Long> statistics = new LinkedHashMap<>(RunStatistics.extraction(extraction));

        List<NodeFact> facts = extraction.usableFacts();
        if (extraction.cancelled()) {
            RunRecord cancelled = lifecycle.finish(run, RunStatus.CANCELLED, dialect, owner, warnings, statistics);
            return new IdentifyResult(cancelled, List.of(), identifyEngine.analyzeGaps(List.of(), List.of(), List.of()));
        }

        RelationshipAnalysis relationships = relationshipAnalyzer.analyze(facts);
        runStore.saveRelationships(relationships.relationships());
        statistics.putAll(RunStatistics.relationships(relationships.statistics()));

        var scope = new CandidateScope(config.workspaceId(), dialect.messageRoot(), dialect.version(),
                config.crossVersion(), owner, config.ownerScoped());
        List<Pattern> candidates = catalog.findCandidates(scope);
        if (candidates.isEmpty()) {
            warnings.add("Kütüphanede " + dialect.messageRoot() + " v" + dialect.version()
                    + " için pattern yok; tüm fact'ler yeni yapı olarak işaretlendi");
        }

        Map<String, List<NodeRelationship>> bySource = new HashMap<>();
        for (NodeRelationship rel : relationships.relationships()) {
            bySource.computeIfAbsent(rel.sourceFactId(), k -> new ArrayList<>()).add(rel);
        }

        var matches = new ArrayList<PatternMatch>();
        var scored = new ArrayList<NodeFact>();
        RunStatus status = RunStatus.COMPLETED;
        for (NodeFact fact : facts) {
            if (config.cancellation().isCancelled()) {
                status = RunStatus.CANCELLED;
                warnings.add("Çalıştırma iptal edildi; " + matches.size() + " fact skorlanmıştı");
                break;
            }
            matches.add(identifyEngine.identify(fact, bySource.getOrDefault(fact.id(), List.of()), candidates));
            scored.add(fact);
        }
        runStore.saveMatches(matches);

        GapReport gapReport = identifyEngine.analyzeGaps(scored, matches, candidates);
        statistics.put("candidates", (long) candidates.size());
        statistics.put("facts_identified", (long) scored.size());
        statistics.put("facts_matched", (long) gapReport.matched());
        statistics.put("facts_high_confidence", (long) gapReport.highConfidence());
        statistics.put("missing_patterns", (long) gapReport.missingPatterns().size());
        statistics.put("new_structures", (long) gapReport.newStructures().size());
        for (var entry : gapReport.verdictCounts().entrySet()) {
            statistics.put("verdict_" + entry.getKey().name().toLowerCase(Locale.ROOT), (long) entry.getValue());
        }

        log.info("[{}] Identify sonucu: {} fact, {} eşleşti (oran {}), {} yeni yapı, {} eksik pattern",
                run.id(), scored.size(), gapReport.matched(), gapReport.matchRate(),
                gapReport.newStructures().size(), gapReport.missingPatterns().size());

        RunRecord finished = lifecycle.finish(run, status, dialect, owner, warnings, statistics);
        return new IdentifyResult(finished, matches, gapReport);
    }
}
