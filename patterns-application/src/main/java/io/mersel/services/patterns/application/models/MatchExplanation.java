package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * Bir skorun faktör bazında açıklaması.
 *
 * @param nodeTypeScore        Düğüm tipi eşleşmesi (0 veya 1)
 * @param requiredCoverage     Zorunlu attribute alt skoru
 * @param childSimilarity      Çocuk yapısı benzerliği
 * @param referenceSimilarity  Referans pattern benzerliği
 * @param weightedScore        Ağırlıklı, normalize ham skor
 * @param relationshipPenalty  Uygulanan ilişki cezası (üst sınırlı)
 * @param finalScore           Nihai güven skoru
 * @param missingRequired      NodeFact'te bulunmayan zorunlu attribute'lar
 * @param notes                İnsan okunur notlar (tip uyuşmazlığı, ceza modu vb.)
 */
public record MatchExplanation(
        double nodeTypeScore,
        double requiredCoverage,
        double childSimilarity,
        double referenceSimilarity,
        double weightedScore,
        double relationshipPenalty,
        double finalScore,
        List<String> missingRequired,
        List<String> notes
) {
    public MatchExplanation {
        missingRequired = missingRequired == null ? List.of() : List.copyOf(missingRequired);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static MatchExplanation none(String note) {
        return new MatchExplanation(0, 0, 0, 0, 0, 0, 0, List.of(), List.of(note));
    }
}
