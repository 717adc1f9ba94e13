package io.mersel.services.patterns.infrastructure.generation;

import io.mersel.services.patterns.application.enums.DeltaType;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.interfaces.IPatternGenerator;
import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternDelta;
import io.mersel.services.patterns.infrastructure.SectionPathNormalizer;
import io.mersel.services.patterns.infrastructure.config.OracleProperties;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Çalıştırmanın fact'lerinden karar kuralı sentezi ve katalog upsert'ü.
 * <p>
 * Kurallar set semantiğiyle üretilir: bir section'daki instance veya çocuk
 * occurrence sayısı kuralı değiştirmez. Bu sayede aynı yapıdaki, farklı
 * kardinaliteli belgeler tek pattern'e düşer.
 */
@Service
public class PatternGenerator implements IPatternGenerator {

    private static final Logger log = LoggerFactory.getLogger(PatternGenerator.class);

    /** Oracle'ın eklediği, gerçek XML attribute'u olmayan alanlar. */
    static final Set<String> METADATA_KEYS = Set.of(
            "summary", "description", "notes", "child_count",
            "confidence", "node_ordinal", "missing_elements");

    private final IPatternCatalog catalog;
    private final IExtractionOracle oracle;
    private final SignatureHasher hasher;
    private final SectionPathNormalizer normalizer;
    private final PatternMetrics metrics;
    private final int maxExamples;
    private final boolean describePatterns;

    @Autowired
    public PatternGenerator(IPatternCatalog catalog,
                            IExtractionOracle oracle,
                            SignatureHasher hasher,
                            SectionPathNormalizer normalizer,
                            PatternMetrics metrics,
                            PatternEngineProperties engineProperties,
                            OracleProperties oracleProperties) {
        this(catalog, oracle, hasher, normalizer, metrics,
                engineProperties.getMaxExamples(), oracleProperties.isDescribePatterns());
    }

    PatternGenerator(IPatternCatalog catalog,
                     IExtractionOracle oracle,
                     SignatureHasher hasher,
                     SectionPathNormalizer normalizer,
                     PatternMetrics metrics,
                     int maxExamples,
                     boolean describePatterns) {
        this.catalog = catalog;
        this.oracle = oracle;
        this.hasher = hasher;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.maxExamples = maxExamples;
        this.describePatterns = describePatterns;
    }

    private record GroupKey(String version, String messageRoot, String sectionPath, String nodeType)
            implements Comparable<GroupKey> {
        @Override
        public int compareTo(GroupKey o) {
            return toString().compareTo(o.toString());
        }
    }

    @Override
    public List<PatternDelta> generate(String workspaceId, String runId, String ownerCode,
                                       List<NodeFact> facts, List<NodeRelationship> relationships) {
        Map<GroupKey, List<NodeFact>> groups = new TreeMap<>();
        for (NodeFact fact : facts) {
            if (fact.extractionFailed()) {
                continue;
            }
            var key = new GroupKey(fact.version(), fact.messageRoot(),
                    normalizer.normalizePath(fact.sectionPath()), fact.nodeType());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(fact);
        }

        var deltas = new ArrayList<PatternDelta>();
        Instant now = Instant.now();
        for (var entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            DecisionRule rule = synthesize(entry.getValue(), relationships);
            String signature = hasher.signature(rule, key.version(), key.messageRoot(), ownerCode);
            List<String> examples = examples(entry.getValue());

            var candidate = new Pattern(null, workspaceId, key.version(), key.messageRoot(),
                    key.sectionPath(), key.nodeType(), ownerCode, rule, signature, 1, null,
                    examples, null, now, now);
            PatternDelta delta = catalog.upsert(candidate, runId);
            metrics.recordPatternDelta(delta.type());
            deltas.add(delta);
            log.debug("[{}] Pattern {}: {} {} ({})", runId, delta.type(), key.sectionPath(),
                    key.nodeType(), signature.substring(0, 12));

            if (delta.type() == DeltaType.CREATED && describePatterns) {
                oracle.describePattern(rule, examples)
                        .ifPresent(d -> catalog.updateDescription(workspaceId, delta.patternId(), d));
            }
        }

        log.info("[{}] Pattern üretimi tamamlandı: {} grup, {} yeni, {} güncellenen", runId, groups.size(),
                deltas.stream().filter(d -> d.type() == DeltaType.CREATED).count(),
                deltas.stream().filter(d -> d.type() == DeltaType.INCREMENTED).count());
        return deltas;
    }

    @Override
    public DecisionRule synthesize(List<NodeFact> group, List<NodeRelationship> relationships) {
        if (group.isEmpty()) {
            throw new IllegalArgumentException("Boş grup için kural sentezlenemez");
        }
        NodeFact first = group.get(0);

        // ── Attribute'lar: kesişim zorunlu, kalan birleşim opsiyonel ──
        Set<String> required = null;
        Set<String> union = new TreeSet<>();
        for (NodeFact fact : group) {
            Set<String> keys = attributeKeys(fact.payload().attributes());
            union.addAll(keys);
            if (required == null) {
                required = new TreeSet<>(keys);
            } else {
                required.retainAll(keys);
            }
        }
        Set<String> optional = new TreeSet<>(union);
        optional.removeAll(required);

        // ── Çocuk yapısı: tip başına tek shape ──
        Map<String, Set<String>> childRequired = new TreeMap<>();
        Map<String, Set<String>> childReferences = new TreeMap<>();
        for (NodeFact fact : group) {
            for (FactPayload.ChildFact child : fact.payload().children()) {
                String type = child.nodeType();
                Set<String> keys = attributeKeys(child.attributes());
                childRequired.merge(type, new TreeSet<>(keys), (a, b) -> {
                    a.retainAll(b);
                    return a;
                });
                childReferences.computeIfAbsent(type, k -> new TreeSet<>()).addAll(child.references().keySet());
            }
        }
        var childShapes = new ArrayList<DecisionRule.ChildShape>();
        for (var entry : childRequired.entrySet()) {
            childShapes.add(new DecisionRule.ChildShape(entry.getKey(),
                    List.copyOf(entry.getValue()),
                    List.copyOf(childReferences.getOrDefault(entry.getKey(), Set.of()))));
        }

        // ── Referanslar: bu grubun fact'lerinden çıkan ilişkiler ──
        Set<String> factIds = new HashSet<>();
        group.forEach(f -> factIds.add(f.id()));
        Set<String> referenceTypes = new TreeSet<>();
        Map<String, RelationshipTally> byTarget = new TreeMap<>();
        for (NodeRelationship rel : relationships) {
            if (!factIds.contains(rel.sourceFactId())) {
                continue;
            }
            if (rel.referenceType() != null && !rel.referenceType().isBlank()) {
                referenceTypes.add(rel.referenceType());
            }
            byTarget.computeIfAbsent(rel.targetSection(), k -> new RelationshipTally()).add(rel);
        }
        var expected = new ArrayList<DecisionRule.ExpectedRelationship>();
        for (var entry : byTarget.entrySet()) {
            RelationshipTally tally = entry.getValue();
            expected.add(new DecisionRule.ExpectedRelationship(entry.getKey(),
                    List.copyOf(tally.types), tally.valid, tally.broken, tally.broken == 0));
        }

        return new DecisionRule(first.nodeType(), normalizer.normalizePath(first.sectionPath()),
                List.copyOf(required), List.copyOf(optional), childShapes,
                List.copyOf(referenceTypes), expected);
    }

    private static Set<String> attributeKeys(Map<String, String> attributes) {
        Set<String> keys = new TreeSet<>();
        for (String key : attributes.keySet()) {
            if (!METADATA_KEYS.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private List<String> examples(List<NodeFact> group) {
        var snippets = new LinkedHashSet<String>();
        for (NodeFact fact : group) {
            if (fact.snippet() != null && !fact.snippet().isBlank()) {
                snippets.add(fact.snippet());
            }
        }
        var list = new ArrayList<>(snippets);
        return list.size() <= maxExamples ? list : list.subList(list.size() - maxExamples, list.size());
    }

    private static final class RelationshipTally {
        final Set<String> types = new TreeSet<>();
        int valid;
        int broken;

        void add(NodeRelationship rel) {
            if (rel.referenceType() != null) {
                types.add(rel.referenceType());
            }
            if (rel.valid()) valid++; else broken++;
        }
    }
}
