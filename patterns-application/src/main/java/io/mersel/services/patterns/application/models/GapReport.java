package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.Verdict;

import java.util.List;
import java.util.Map;

/**
 * Identify çalıştırması için boşluk analizi.
 *
 * @param totalFacts      Skorlanan fact sayısı
 * @param matched         PARTIAL ve üstü eşleşme sayısı
 * @param highConfidence  HIGH ve üstü eşleşme sayısı
 * @param matchRate       matched / total (fact yoksa 0)
 * @param verdictCounts   Verdict dağılımı
 * @param missingPatterns Kapsamdaki ama bu çalıştırmada hiç eşleşmeyen kütüphane pattern'leri
 * @param newStructures   NEW_PATTERN verdict'li fact'ler
 */
public record GapReport(
        int totalFacts,
        int matched,
        int highConfidence,
        double matchRate,
        Map<Verdict, Integer> verdictCounts,
        List<MissingPattern> missingPatterns,
        List<NewStructure> newStructures
) {

    public GapReport {
        verdictCounts = verdictCounts == null ? Map.of() : Map.copyOf(verdictCounts);
        missingPatterns = missingPatterns == null ? List.of() : List.copyOf(missingPatterns);
        newStructures = newStructures == null ? List.of() : List.copyOf(newStructures);
    }

    public record MissingPattern(String patternId, String sectionPath, String nodeType, long timesSeen) {
    }

    public record NewStructure(String factId, String sectionPath, String nodeType, int ordinal) {
    }
}
