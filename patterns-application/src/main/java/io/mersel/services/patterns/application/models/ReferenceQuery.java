package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * Bir (kaynak, hedef) section çifti için oracle'a gönderilen örnekleme isteği.
 *
 * @param version            Şema versiyonu
 * @param messageRoot        Mesaj root'u
 * @param sourceSection      Kaynak section
 * @param sourceNodeType     Kaynak düğüm tipi
 * @param sourceSample       Kaynak örnek içeriği
 * @param targetSection      Hedef section
 * @param targetNodeType     Hedef düğüm tipi
 * @param targetSample       Hedef örnek içeriği
 * @param expectedReferences Kaynak section için beklenen semantik referans adları
 */
public record ReferenceQuery(
        String version,
        String messageRoot,
        String sourceSection,
        String sourceNodeType,
        FactPayload sourceSample,
        String targetSection,
        String targetNodeType,
        FactPayload targetSample,
        List<String> expectedReferences
) {
    public ReferenceQuery {
        expectedReferences = expectedReferences == null ? List.of() : List.copyOf(expectedReferences);
    }
}
