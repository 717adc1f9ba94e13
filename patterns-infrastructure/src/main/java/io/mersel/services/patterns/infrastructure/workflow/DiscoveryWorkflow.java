package io.mersel.services.patterns.infrastructure.workflow;

import io.mersel.services.patterns.application.enums.DeltaType;
import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.interfaces.ExtractionException;
import io.mersel.services.patterns.application.interfaces.IDiscoveryWorkflow;
import io.mersel.services.patterns.application.interfaces.IPatternGenerator;
import io.mersel.services.patterns.application.interfaces.IRelationshipAnalyzer;
import io.mersel.services.patterns.application.interfaces.IRunStore;
import io.mersel.services.patterns.application.interfaces.IStructuralExtractor;
import io.mersel.services.patterns.application.interfaces.RunFailedException;
import io.mersel.services.patterns.application.models.DiscoveryResult;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.PatternConflict;
import io.mersel.services.patterns.application.models.PatternDelta;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;
import io.mersel.services.patterns.application.models.RunConfig;
import io.mersel.services.patterns.application.models.RunRecord;
import io.mersel.services.patterns.infrastructure.generation.PatternConflictDetector;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Discovery: çıkarım → ilişki analizi → pattern üretimi → çakışma tespiti.
 * <p>
 * Senkron çalışır. Oracle hataları ve boş sonuçlar istatistik/uyarı olarak
 * çalıştırma kaydına yazılır; yalnızca parse edilemeyen belge, şema açısından
 * kritik section hatası ve kalıcılık hataları çalıştırmayı FAILED yapar.
 */
@Service
public class DiscoveryWorkflow implements IDiscoveryWorkflow {

    private final IStructuralExtractor extractor;
    private final IRelationshipAnalyzer relationshipAnalyzer;
    private final IPatternGenerator patternGenerator;
    private final PatternConflictDetector conflictDetector;
    private final IRunStore runStore;
    private final RunLifecycle lifecycle;

    public DiscoveryWorkflow(IStructuralExtractor extractor,
                             IRelationshipAnalyzer relationshipAnalyzer,
                             IPatternGenerator patternGenerator,
                             PatternConflictDetector conflictDetector,
                             IRunStore runStore,
                             RunLifecycle lifecycle) {
        this.extractor = extractor;
        this.relationshipAnalyzer = relationshipAnalyzer;
        this.patternGenerator = patternGenerator;
        this.conflictDetector = conflictDetector;
        this.runStore = runStore;
        this.lifecycle = lifecycle;
    }

    @Override
    public DiscoveryResult runDiscovery(DocumentSource document, RunConfig config) throws RunFailedException {
        RunRecord run = lifecycle.start(RunKind.DISCOVERY, document, config);
        try {
            return execute(run, document, config);
        } catch (ExtractionException e) {
            runStore.saveFacts(e.getPartialFacts());
            throw new RunFailedException(lifecycle.fail(run, e), "Discovery başarısız: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new RunFailedException(lifecycle.fail(run, e), "Discovery kalıcılık hatası: " + e.getMessage(), e);
        }
    }

    private DiscoveryResult execute(RunRecord run, DocumentSource document, RunConfig config)
            throws ExtractionException {
        ExtractionResult extraction = extractor.extract(document, config, run.id());
        runStore.saveFacts(extraction.facts());

        DocumentDialect dialect = extraction.dialect();
        String owner = config.ownerCode() != null ? config.ownerCode() : dialect.ownerCode();
        var warnings = new ArrayList<>(extraction.warnings());
        Map<String, Long> statistics = new LinkedHashMap<>(RunStatistics.extraction(extraction));

        if (extraction.cancelled()) {
            RunRecord cancelled = lifecycle.finish(run, RunStatus.CANCELLED, dialect, owner, warnings, statistics);
            return new DiscoveryResult(cancelled, List.of(), List.of());
        }

        RelationshipAnalysis relationships = relationshipAnalyzer.analyze(extraction.usableFacts());
        runStore.saveRelationships(relationships.relationships());
        statistics.putAll(RunStatistics.relationships(relationships.statistics()));

        List<PatternDelta> deltas = patternGenerator.generate(config.workspaceId(), run.id(), owner,
                extraction.facts(), relationships.relationships());
        for (DeltaType type : DeltaType.values()) {
            statistics.put("patterns_" + type.name().toLowerCase(Locale.ROOT),
                    deltas.stream().filter(d -> d.type() == type).count());
        }
        if (deltas.isEmpty()) {
            warnings.add("Hiç pattern üretilmedi");
        }

        List<PatternConflict> conflicts = conflictDetector.detectAndResolve(config.workspaceId(),
                dialect.version(), dialect.messageRoot(),
                deltas.stream().map(PatternDelta::patternId).toList(), config.conflictResolution());
        statistics.put("pattern_conflicts", (long) conflicts.size());
        if (!conflicts.isEmpty()) {
            warnings.add(conflicts.size() + " ebeveyn/çocuk pattern çakışması (" + config.conflictResolution() + ")");
        }

        RunRecord completed = lifecycle.finish(run, RunStatus.COMPLETED, dialect, owner, warnings, statistics);
        return new DiscoveryResult(completed, deltas, conflicts);
    }
}
