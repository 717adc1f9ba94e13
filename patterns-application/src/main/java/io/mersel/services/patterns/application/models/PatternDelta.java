package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.DeltaType;

/**
 * Katalog upsert'ünün tek pattern için sonucu.
 *
 * @param patternId     Pattern kimliği
 * @param signatureHash İmza
 * @param sectionPath   Section yolu
 * @param nodeType      Düğüm tipi
 * @param type          Oluşturuldu / artırıldı / tazelendi
 * @param timesSeen     Upsert sonrası sayaç
 */
public record PatternDelta(
        String patternId,
        String signatureHash,
        String sectionPath,
        String nodeType,
        DeltaType type,
        long timesSeen
) {
}
