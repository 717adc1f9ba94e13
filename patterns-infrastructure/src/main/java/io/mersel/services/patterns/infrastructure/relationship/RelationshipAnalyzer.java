package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.INodeConfigurationService;
import io.mersel.services.patterns.application.interfaces.IRelationshipAnalyzer;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.ProposedReference;
import io.mersel.services.patterns.application.models.ReferenceQuery;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Section grupları arasında çapraz referans keşfi.
 * <p>
 * Her sıralı (kaynak, hedef) section çifti için oracle'a bir örnek gönderilir;
 * önerilen her referans alanı daha sonra kaynak section'ın <b>tüm</b> instance'ları
 * üzerinde deterministik olarak doğrulanır. Oracle yalnızca aday üretir,
 * geçerlilik kararı burada verilir.
 * <p>
 * Oracle hatası yalnızca ilgili çifti atlar; analiz devam eder.
 */
@Service
public class RelationshipAnalyzer implements IRelationshipAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipAnalyzer.class);

    private final IExtractionOracle oracle;
    private final INodeConfigurationService nodeConfigurations;
    private final PatternMetrics metrics;
    private final List<FieldMatcher> fieldMatchers;
    private final ReferenceResolver resolver = new ReferenceResolver();

    @Autowired
    public RelationshipAnalyzer(IExtractionOracle oracle,
                                INodeConfigurationService nodeConfigurations,
                                PatternMetrics metrics) {
        this.oracle = oracle;
        this.nodeConfigurations = nodeConfigurations;
        this.metrics = metrics;
        this.fieldMatchers = List.of(
                new ExactFieldMatcher(),
                new NormalizedFieldMatcher(),
                new SubstringFieldMatcher(),
                new NestedReferenceFieldMatcher());
    }

    @Override
    public RelationshipAnalysis analyze(List<NodeFact> facts) {
        Map<String, List<NodeFact>> bySection = new TreeMap<>();
        for (NodeFact fact : facts) {
            if (!fact.extractionFailed()) {
                bySection.computeIfAbsent(fact.sectionPath(), k -> new ArrayList<>()).add(fact);
            }
        }
        if (bySection.size() < 2) {
            return RelationshipAnalysis.empty();
        }

        var counters = new Counters();
        var relationships = new ArrayList<NodeRelationship>();
        Map<String, Set<String>> proposedBySource = new LinkedHashMap<>();
        Set<String> queriedSources = new HashSet<>();

        for (var source : bySection.entrySet()) {
            NodeFact sourceSample = source.getValue().get(0);
            List<String> expectedRefs = nodeConfigurations.expectedReferences(
                    sourceSample.version(), sourceSample.messageRoot(), source.getKey());

            for (var target : bySection.entrySet()) {
                if (source.getKey().equals(target.getKey())) {
                    continue;
                }
                NodeFact targetSample = target.getValue().get(0);
                var query = new ReferenceQuery(sourceSample.version(), sourceSample.messageRoot(),
                        source.getKey(), sourceSample.nodeType(), sourceSample.payload(),
                        target.getKey(), targetSample.nodeType(), targetSample.payload(), expectedRefs);

                counters.pairs++;
                List<ProposedReference> proposals;
                try {
                    proposals = oracle.proposeReferences(query);
                } catch (OracleException e) {
                    counters.oracleFailures++;
                    log.warn("Referans keşfi başarısız {} → {}: {} - {}",
                            source.getKey(), target.getKey(), e.getKind(), e.getMessage());
                    continue;
                }
                queriedSources.add(source.getKey());

                for (ProposedReference proposal : proposals) {
                    proposedBySource.computeIfAbsent(source.getKey(), k -> new HashSet<>())
                            .add(proposal.referenceType());
                    boolean expected = expectedRefs.contains(proposal.referenceType());
                    int before = relationships.size();
                    validate(source.getValue(), target.getKey(), target.getValue(),
                            proposal, expected, counters, relationships);
                    if (relationships.size() == before) {
                        counters.unmatchedFields++;
                        log.debug("Önerilen alan hiçbir instance'ta bulunamadı: {}.{} ({})",
                                source.getKey(), proposal.fieldName(), proposal.referenceType());
                    }
                }
            }

            if (queriedSources.contains(source.getKey())) {
                Set<String> proposed = proposedBySource.getOrDefault(source.getKey(), Set.of());
                for (String ref : expectedRefs) {
                    if (!proposed.contains(ref)) {
                        counters.expectedMissing++;
                        log.debug("Beklenen referans önerilmedi: {} → {}", source.getKey(), ref);
                    }
                }
            }
        }

        var statistics = counters.toStatistics();
        metrics.recordRelationships(statistics);
        log.info("İlişki analizi tamamlandı: {} çift, {} ilişki ({} beklenen-geçerli, {} beklenen-kırık, "
                        + "{} keşfedilen-geçerli, {} keşfedilen-kırık), {} oracle hatası",
                statistics.pairsAnalyzed(), statistics.relationshipsFound(), statistics.expectedValid(),
                statistics.expectedBroken(), statistics.unexpectedValid(), statistics.unexpectedBroken(),
                statistics.oracleFailures());
        return new RelationshipAnalysis(relationships, statistics);
    }

    private void validate(List<NodeFact> sources, String targetSection, List<NodeFact> targets,
                          ProposedReference proposal, boolean expected,
                          Counters counters, List<NodeRelationship> out) {
        for (NodeFact source : sources) {
            Optional<FieldMatcher.FieldMatch> match = findField(source.payload(), proposal.fieldName());
            if (match.isEmpty()) {
                continue;
            }
            counters.comparisons++;
            boolean valid = resolver.resolves(match.get().value(), targets);
            counters.classify(expected, valid);
            out.add(new NodeRelationship(UUID.randomUUID().toString(), source.workspaceId(), source.runId(),
                    source.id(), source.sectionPath(), targetSection, proposal.referenceType(),
                    match.get().fieldName(), match.get().value(), valid, expected, proposal.confidence()));
        }
    }

    Optional<FieldMatcher.FieldMatch> findField(FactPayload payload, String requestedField) {
        if (requestedField == null || requestedField.isBlank()) {
            return Optional.empty();
        }
        for (FieldMatcher matcher : fieldMatchers) {
            var match = matcher.match(payload, requestedField);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private static final class Counters {
        int pairs;
        int comparisons;
        int oracleFailures;
        int expectedValid;
        int expectedBroken;
        int unexpectedValid;
        int unexpectedBroken;
        int unmatchedFields;
        int expectedMissing;

        void classify(boolean expected, boolean valid) {
            if (expected) {
                if (valid) expectedValid++; else expectedBroken++;
            } else {
                if (valid) unexpectedValid++; else unexpectedBroken++;
            }
        }

        RelationshipAnalysis.Statistics toStatistics() {
            return new RelationshipAnalysis.Statistics(pairs, comparisons, oracleFailures,
                    expectedValid, expectedBroken, unexpectedValid, unexpectedBroken,
                    unmatchedFields, expectedMissing);
        }
    }
}
