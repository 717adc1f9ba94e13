package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * İlişki analizi çıktısı ve raporlama sayaçları.
 *
 * @param relationships Kaynak instance × önerilen referans başına bir kayıt
 * @param statistics    Raporlama sınıfları
 */
public record RelationshipAnalysis(
        List<NodeRelationship> relationships,
        Statistics statistics
) {

    public RelationshipAnalysis {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static RelationshipAnalysis empty() {
        return new RelationshipAnalysis(List.of(), new Statistics(0, 0, 0, 0, 0, 0, 0, 0, 0));
    }

    /**
     * @param pairsAnalyzed     Oracle'a sorulan section çifti sayısı
     * @param totalComparisons  Doğrulanan (kaynak instance, öneri) sayısı
     * @param oracleFailures    Oracle hatası nedeniyle atlanan çift sayısı
     * @param expectedValid     Beklenen ve çözümlenen
     * @param expectedBroken    Beklenen ama çözümlenemeyen
     * @param unexpectedValid   Keşfedilen ve çözümlenen
     * @param unexpectedBroken  Keşfedilen ama çözümlenemeyen
     * @param unmatchedFields   Hiçbir kaynak instance'ta bulunamayan öneri sayısı
     * @param expectedMissing   Yapılandırmada beklenen ama hiç önerilmeyen referans sayısı
     */
    public record Statistics(
            int pairsAnalyzed,
            int totalComparisons,
            int oracleFailures,
            int expectedValid,
            int expectedBroken,
            int unexpectedValid,
            int unexpectedBroken,
            int unmatchedFields,
            int expectedMissing
    ) {
        public int relationshipsFound() {
            return expectedValid + expectedBroken + unexpectedValid + unexpectedBroken;
        }
    }
}
