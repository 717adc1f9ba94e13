package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.enums.VersionSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Bir çalıştırmanın özeti; çağırana "run summary" olarak döner ve saklanır.
 *
 * @param id            Çalıştırma kimliği
 * @param workspaceId   Partition kimliği
 * @param kind          DISCOVERY veya IDENTIFY
 * @param status        Yaşam döngüsü durumu
 * @param documentName  Girdi belge adı
 * @param version       Tespit edilen versiyon ({@code null}: henüz tespit edilmedi)
 * @param messageRoot   Tespit edilen mesaj root'u
 * @param ownerCode     Kullanılan sahip kodu
 * @param versionSource Versiyon sinyali
 * @param warnings      Çalıştırma seviyesinde uyarılar
 * @param statistics    Sayaçlar (fragment, oracle hatası, ilişki sınıfları vb.)
 * @param errorMessage  Başarısızlık mesajı ({@code null}: hata yok)
 * @param startedAt     Başlangıç
 * @param finishedAt    Bitiş ({@code null}: devam ediyor)
 */
public record RunRecord(
        String id,
        String workspaceId,
        RunKind kind,
        RunStatus status,
        String documentName,
        String version,
        String messageRoot,
        String ownerCode,
        VersionSource versionSource,
        List<String> warnings,
        Map<String, Long> statistics,
        String errorMessage,
        Instant startedAt,
        Instant finishedAt
) {
    public RunRecord {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        statistics = statistics == null ? Map.of() : Map.copyOf(statistics);
    }

    public long statistic(String name) {
        return statistics.getOrDefault(name, 0L);
    }
}
