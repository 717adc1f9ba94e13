package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * {@code runIdentify} sonucu.
 *
 * @param runSummary Çalıştırma özeti
 * @param matches    Fact başına eşleşme kaydı (belge sırasıyla)
 * @param gapReport  Boşluk analizi
 */
public record IdentifyResult(
        RunRecord runSummary,
        List<PatternMatch> matches,
        GapReport gapReport
) {
    public IdentifyResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
