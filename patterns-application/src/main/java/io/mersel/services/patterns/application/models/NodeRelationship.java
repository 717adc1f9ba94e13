package io.mersel.services.patterns.application.models;

/**
 * Kaynak NodeFact'in section'ından hedef section'a, isimli bir referans alanı
 * üzerinden yönlü aday kenar.
 *
 * @param id            İlişki kimliği
 * @param workspaceId   Partition kimliği
 * @param runId         Sahip çalıştırma
 * @param sourceFactId  Kaynak NodeFact
 * @param sourceSection Kaynak section yolu
 * @param targetSection Hedef section yolu
 * @param referenceType Semantik referans tipi (örn: "passenger_reference")
 * @param fieldName     Kaynakta eşleşen alan adı
 * @param rawValue      Alandan okunan ham değer
 * @param valid         En az bir hedef instance'a çözümlendi mi
 * @param expected      Yapılandırmada beklenen referans mı (aksi halde keşfedildi)
 * @param confidence    Oracle güven skoru (0..1)
 */
public record NodeRelationship(
        String id,
        String workspaceId,
        String runId,
        String sourceFactId,
        String sourceSection,
        String targetSection,
        String referenceType,
        String fieldName,
        String rawValue,
        boolean valid,
        boolean expected,
        double confidence
) {
}
