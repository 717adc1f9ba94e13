package io.mersel.services.patterns.infrastructure.workflow;

import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RunRecord istatistik anahtarları.
 */
final class RunStatistics {

    private RunStatistics() {
    }

    static Map<String, Long> extraction(ExtractionResult extraction) {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("fragments_matched", (long) extraction.fragmentsMatched());
        stats.put("fragments_failed", (long) extraction.fragmentsFailed());
        stats.put("fragments_truncated", (long) extraction.fragmentsTruncated());
        stats.put("facts_extracted", (long) extraction.usableFacts().size());
        stats.put("lenient_mode", extraction.lenientMode() ? 1L : 0L);
        return stats;
    }

    static Map<String, Long> relationships(RelationshipAnalysis.Statistics statistics) {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("relationship_pairs", (long) statistics.pairsAnalyzed());
        stats.put("relationship_comparisons", (long) statistics.totalComparisons());
        stats.put("relationships_found", (long) statistics.relationshipsFound());
        stats.put("relationships_expected_valid", (long) statistics.expectedValid());
        stats.put("relationships_expected_broken", (long) statistics.expectedBroken());
        stats.put("relationships_unexpected_valid", (long) statistics.unexpectedValid());
        stats.put("relationships_unexpected_broken", (long) statistics.unexpectedBroken());
        stats.put("relationship_oracle_failures", (long) statistics.oracleFailures());
        stats.put("relationship_unmatched_fields", (long) statistics.unmatchedFields());
        stats.put("expected_references_missing", (long) statistics.expectedMissing());
        return stats;
    }
}
