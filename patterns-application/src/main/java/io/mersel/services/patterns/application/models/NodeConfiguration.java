package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * (versiyon, mesaj, section) anahtarlı hedef düğüm yapılandırması.
 * <p>
 * İş kuralı ile yapısal doğrulama arasındaki bağı ("beklenen referanslar")
 * koddan ayırır; ilişki analizine enjekte edilir.
 *
 * @param version            Şema versiyonu
 * @param messageRoot        Mesaj root'u
 * @param sectionPath        Normalize section yolu (root hariç)
 * @param nodeType           Beklenen düğüm tipi ipucu ({@code null} olabilir)
 * @param enabled            Extractor bu section'ı hedefliyor mu
 * @param schemaCritical     Bu section'daki analiz hatası çalıştırmayı durdurur mu
 * @param expectedReferences Beklenen semantik referans adları
 * @param aliases            Aynı mantıksal section'ın alternatif yolları (eski versiyon adlandırmaları)
 */
public record NodeConfiguration(
        String version,
        String messageRoot,
        String sectionPath,
        String nodeType,
        boolean enabled,
        boolean schemaCritical,
        List<String> expectedReferences,
        List<String> aliases
) {
    public NodeConfiguration {
        expectedReferences = expectedReferences == null ? List.of() : List.copyOf(expectedReferences);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
