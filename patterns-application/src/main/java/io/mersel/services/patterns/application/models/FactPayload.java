package io.mersel.services.patterns.application.models;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Oracle tarafından bir fragment'tan çıkarılan yapısal içerik.
 * <p>
 * Map'ler anahtar sırasına göre saklanır; böylece aynı içerik her zaman
 * aynı sırayla serileştirilir.
 *
 * @param attributes Düğümün attribute/alan değerleri (anahtar → değer)
 * @param children   Çocuk düğümler (her occurrence ayrı kayıt)
 * @param references Referans alanları (alan adı → referans edilen değer)
 * @param derived    Oracle'ın türettiği ek alanlar (özet, sayaçlar vb.)
 */
public record FactPayload(
        Map<String, String> attributes,
        List<ChildFact> children,
        Map<String, String> references,
        Map<String, String> derived
) {

    public FactPayload {
        attributes = sorted(attributes);
        children = children == null ? List.of() : List.copyOf(children);
        references = sorted(references);
        derived = sorted(derived);
    }

    public static FactPayload empty() {
        return new FactPayload(Map.of(), List.of(), Map.of(), Map.of());
    }

    /**
     * Tek bir çocuk düğüm occurrence'ı.
     *
     * @param nodeType   Çocuk düğüm tipi (örn: "Adult", "Child")
     * @param attributes Çocuğun attribute'ları
     * @param references Çocuğun referans alanları
     */
    public record ChildFact(
            String nodeType,
            Map<String, String> attributes,
            Map<String, String> references
    ) {
        public ChildFact {
            attributes = sorted(attributes);
            references = sorted(references);
        }
    }

    private static Map<String, String> sorted(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
