package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.Verdict;

import java.time.Instant;

/**
 * Bir NodeFact'in en iyi aday pattern'e karşı skorlanmasının değiştirilemez denetim kaydı.
 *
 * @param id          Eşleşme kimliği
 * @param workspaceId Partition kimliği
 * @param runId       Identify çalıştırması
 * @param factId      Skorlanan NodeFact
 * @param patternId   Seçilen pattern ({@code NEW_PATTERN} için {@code null})
 * @param confidence  Güven skoru (0..1)
 * @param verdict     Sınıflandırma
 * @param explanation Faktör bazında açıklama
 * @param createdAt   Kayıt zamanı
 */
public record PatternMatch(
        String id,
        String workspaceId,
        String runId,
        String factId,
        String patternId,
        double confidence,
        Verdict verdict,
        MatchExplanation explanation,
        Instant createdAt
) {
}
