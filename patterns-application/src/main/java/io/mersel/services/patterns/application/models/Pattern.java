package io.mersel.services.patterns.application.models;

import java.time.Instant;
import java.util.List;

/**
 * Bir (versiyon, mesaj, section, düğüm tipi) için kanonik yapısal şablon.
 * <p>
 * İmza başına tek satır vardır; katalog hiçbir zaman aynı imzayla ikinci
 * satır eklemez ve pattern'leri otomatik silmez.
 *
 * @param id            Pattern kimliği
 * @param workspaceId   Partition kimliği
 * @param version       Şema versiyonu
 * @param messageRoot   Mesaj root adı
 * @param sectionPath   Normalize section yolu
 * @param nodeType      Düğüm tipi
 * @param ownerCode     Opsiyonel sahip (havayolu) kapsamı; {@code null} ise kapsamsız
 * @param rule          Karar kuralı
 * @param signatureHash SHA-256 yapısal imza (hex)
 * @param timesSeen     Görülme sayacı
 * @param supersededBy  Bu pattern'i supersede eden pattern kimliği ({@code null} ise aktif)
 * @param examples      Son örnek snippet'lar (en fazla 5)
 * @param description   Opsiyonel açıklama
 * @param firstSeenAt   İlk görülme zamanı
 * @param lastSeenAt    Son görülme zamanı
 */
public record Pattern(
        String id,
        String workspaceId,
        String version,
        String messageRoot,
        String sectionPath,
        String nodeType,
        String ownerCode,
        DecisionRule rule,
        String signatureHash,
        long timesSeen,
        String supersededBy,
        List<String> examples,
        String description,
        Instant firstSeenAt,
        Instant lastSeenAt
) {

    public Pattern {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public boolean isActive() {
        return supersededBy == null;
    }

    public boolean hasExpectedRelationships() {
        return rule != null && !rule.expectedRelationships().isEmpty();
    }
}
