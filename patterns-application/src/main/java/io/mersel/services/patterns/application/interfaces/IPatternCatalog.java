package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.CandidateScope;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternDelta;

import java.util.List;
import java.util.Optional;

/**
 * Workspace partition'lı pattern kataloğu.
 * <p>
 * Katalog tek paylaşılan değişken kaynaktır; imzaya göre upsert atomik olmalıdır.
 */
public interface IPatternCatalog {

    /**
     * İmzaya göre bul-veya-oluştur. Mevcutsa (ve bu çalıştırmada henüz görülmediyse)
     * times-seen artırılır, karar kuralı tazelenir; yoksa eklenir.
     * Eşzamanlı aynı imza yarışı güncelleme olarak çözülür.
     *
     * @param candidate Yeni sentezlenmiş pattern (id ve sayaç yok sayılır)
     * @param runId     Kaynak çalıştırma
     */
    PatternDelta upsert(Pattern candidate, String runId);

    Optional<Pattern> findById(String workspaceId, String patternId);

    Optional<Pattern> findBySignature(String workspaceId, String signatureHash);

    /**
     * Identify için kapsamdaki aktif (supersede edilmemiş) aday pattern'ler.
     */
    List<Pattern> findCandidates(CandidateScope scope);

    /**
     * Bir (versiyon, mesaj) için tüm aktif pattern'ler.
     */
    List<Pattern> findActive(String workspaceId, String version, String messageRoot);

    /**
     * Sayacı atomik olarak bir artırır.
     */
    void incrementTimesSeen(String workspaceId, String patternId);

    void markSuperseded(String workspaceId, String patternId, String supersededBy);

    void updateDescription(String workspaceId, String patternId, String description);
}
