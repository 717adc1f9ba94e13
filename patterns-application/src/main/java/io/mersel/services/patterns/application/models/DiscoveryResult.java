package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * {@code runDiscovery} sonucu.
 *
 * @param runSummary    Çalıştırma özeti
 * @param patternDeltas Katalogdaki değişiklikler
 * @param conflicts     Tespit edilen section çakışmaları
 */
public record DiscoveryResult(
        RunRecord runSummary,
        List<PatternDelta> patternDeltas,
        List<PatternConflict> conflicts
) {
    public DiscoveryResult {
        patternDeltas = patternDeltas == null ? List.of() : List.copyOf(patternDeltas);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }
}
