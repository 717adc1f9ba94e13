package io.mersel.services.patterns.application.interfaces;

import java.util.List;

/**
 * Tek bir {@link Reloadable} bileşenin yeniden yükleme sonucu.
 *
 * @param componentName Bileşen adı
 * @param status        Sonuç durumu
 * @param loadedCount   Yüklenen kayıt sayısı (section yapılandırması vb.)
 * @param durationMs    Süre (milisaniye)
 * @param source        Okunan kaynak (dosya yolu veya classpath konumu)
 * @param errors        Kayıt bazında hatalar; FAILED ise tek genel hata
 */
public record ReloadResult(
        String componentName,
        Status status,
        int loadedCount,
        long durationMs,
        String source,
        List<String> errors
) {
    public enum Status { OK, PARTIAL, FAILED }

    public static ReloadResult success(String name, int count, long durationMs, String source) {
        return new ReloadResult(name, Status.OK, count, durationMs, source, List.of());
    }

    public static ReloadResult partial(String name, int count, long durationMs, String source, List<String> errors) {
        return new ReloadResult(name, Status.PARTIAL, count, durationMs, source, List.copyOf(errors));
    }

    public static ReloadResult failed(String name, long durationMs, String source, String error) {
        return new ReloadResult(name, Status.FAILED, 0, durationMs, source, List.of(error));
    }
}
