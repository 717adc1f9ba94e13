package io.mersel.services.patterns.infrastructure.identify;

import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.MatchExplanation;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.infrastructure.config.ScoringProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tek bir (fact, pattern) çiftinin açıklanabilir skoru.
 * <p>
 * Dört alt skor ağırlıklarıyla birleştirilip ağırlık toplamına bölünür, ardından
 * ilişki cezası düşülür. Düğüm tipi uyuşmazlığında sonuç tavanla sınırlanır.
 * Skor 4 ondalığa yuvarlanır; aynı girdi her zaman aynı skoru verir.
 */
@Component
public class PatternScorer {

    private final ScoringProperties properties;

    public PatternScorer(ScoringProperties properties) {
        this.properties = properties;
    }

    public MatchExplanation score(NodeFact fact, List<NodeRelationship> relationships, Pattern pattern) {
        DecisionRule rule = pattern.rule();
        var notes = new ArrayList<String>();
        var ownRelationships = relationships.stream()
                .filter(r -> fact.id().equals(r.sourceFactId()))
                .toList();

        boolean typeMatches = pattern.nodeType() != null
                && pattern.nodeType().trim().equalsIgnoreCase(fact.nodeType() == null ? "" : fact.nodeType().trim());
        double nodeTypeScore = typeMatches ? 1.0 : 0.0;
        if (!typeMatches) {
            notes.add("Düğüm tipi uyuşmuyor: " + fact.nodeType() + " ≠ " + pattern.nodeType());
        }

        var missing = new ArrayList<String>();
        double coverage = requiredCoverage(rule.requiredAttributes(), fact.payload().attributes().keySet(), missing);
        double coverageScore = Math.pow(coverage, properties.getRequiredCoverageExponent());
        double childScore = childSimilarity(rule.childShapes(), fact.payload().children());
        double referenceScore = referenceSimilarity(rule.referenceTypes(), ownRelationships);

        double weighted = (properties.getNodeTypeWeight() * nodeTypeScore
                + properties.getRequiredAttributeWeight() * coverageScore
                + properties.getChildStructureWeight() * childScore
                + properties.getReferenceWeight() * referenceScore) / properties.totalWeight();

        double penalty = relationshipPenalty(pattern, ownRelationships, notes);
        double result = Math.max(0.0, weighted - penalty);
        if (!typeMatches) {
            result = Math.min(result, properties.getNodeTypeMismatchCap());
        }

        return new MatchExplanation(nodeTypeScore, round(coverage), round(childScore), round(referenceScore),
                round(weighted), round(penalty), round(result), missing, notes);
    }

    // ── Alt skorlar ─────────────────────────────────────────────────

    static double requiredCoverage(List<String> required, Set<String> present, List<String> missingOut) {
        if (required.isEmpty()) {
            return 1.0;
        }
        int found = 0;
        for (String attribute : required) {
            if (present.contains(attribute)) {
                found++;
            } else {
                missingOut.add(attribute);
            }
        }
        return (double) found / required.size();
    }

    static double childSimilarity(List<DecisionRule.ChildShape> shapes, List<FactPayload.ChildFact> children) {
        if (shapes.isEmpty() && children.isEmpty()) {
            return 1.0;
        }
        if (shapes.isEmpty() || children.isEmpty()) {
            return 0.0;
        }

        // Çocuk tipi başına occurrence'larda ortak attribute'lar
        Map<String, Set<String>> factAttributes = new HashMap<>();
        for (FactPayload.ChildFact child : children) {
            factAttributes.merge(child.nodeType(), new HashSet<>(child.attributes().keySet()), (a, b) -> {
                a.retainAll(b);
                return a;
            });
        }

        Set<String> union = new TreeSet<>(factAttributes.keySet());
        int shared = 0;
        double coverageSum = 0.0;
        for (DecisionRule.ChildShape shape : shapes) {
            union.add(shape.nodeType());
            Set<String> attributes = factAttributes.get(shape.nodeType());
            if (attributes != null) {
                shared++;
                coverageSum += requiredCoverage(shape.requiredAttributes(), attributes, new ArrayList<>());
            }
        }
        double jaccard = (double) shared / union.size();
        double meanCoverage = shared == 0 ? 0.0 : coverageSum / shared;
        return 0.5 * jaccard + 0.5 * meanCoverage;
    }

    static double referenceSimilarity(List<String> patternTypes, List<NodeRelationship> relationships) {
        if (patternTypes.isEmpty()) {
            return 1.0;
        }
        Set<String> actual = new HashSet<>();
        relationships.forEach(r -> actual.add(r.referenceType()));
        long covered = patternTypes.stream().filter(actual::contains).count();
        return (double) covered / patternTypes.size();
    }

    /**
     * Beklenen ilişki verisi varsa yalnızca geçerlilik uyuşmazlıkları cezalandırılır;
     * beklendiği gibi kırık bir referans ceza üretmez. Veri yoksa kırık ilişki başına sabit ceza.
     */
    double relationshipPenalty(Pattern pattern, List<NodeRelationship> relationships, List<String> notes) {
        double penalty = 0.0;
        if (pattern.hasExpectedRelationships()) {
            for (DecisionRule.ExpectedRelationship expected : pattern.rule().expectedRelationships()) {
                var actual = relationships.stream()
                        .filter(r -> expected.targetSection().equals(r.targetSection()))
                        .toList();
                if (actual.isEmpty()) {
                    continue;
                }
                boolean actualValid = actual.stream().allMatch(NodeRelationship::valid);
                if (actualValid != expected.valid()) {
                    penalty += properties.getMismatchPenalty();
                    notes.add("İlişki geçerliliği beklenenden farklı: " + expected.targetSection()
                            + " (beklenen " + expected.valid() + ", gerçek " + actualValid + ")");
                }
            }
        } else {
            long broken = relationships.stream().filter(r -> !r.valid()).count();
            if (broken > 0) {
                penalty = broken * properties.getBrokenRelationshipPenalty();
                notes.add(broken + " kırık ilişki");
            }
        }
        return Math.min(penalty, properties.getMaxRelationshipPenalty());
    }

    static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
