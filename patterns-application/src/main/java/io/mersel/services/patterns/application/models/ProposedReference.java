package io.mersel.services.patterns.application.models;

/**
 * Oracle'ın önerdiği aday referans alanı.
 *
 * @param referenceType Semantik referans tipi
 * @param fieldName     Kaynaktaki alan adı
 * @param confidence    Güven (0..1)
 * @param expected      Oracle bu referansı beklenen listeden mi eşleştirdi
 */
public record ProposedReference(
        String referenceType,
        String fieldName,
        double confidence,
        boolean expected
) {
}
