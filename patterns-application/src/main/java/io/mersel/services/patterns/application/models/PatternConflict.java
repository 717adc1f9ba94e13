package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.ConflictResolution;

/**
 * Aynı (versiyon, mesaj) içinde ebeveyn/çocuk section yolları çakışan iki aktif pattern.
 *
 * @param parentPatternId Ebeveyn section pattern'i
 * @param parentSection   Ebeveyn section yolu
 * @param childPatternId  Çocuk section pattern'i
 * @param childSection    Çocuk section yolu
 * @param resolution      Uygulanan politika
 */
public record PatternConflict(
        String parentPatternId,
        String parentSection,
        String childPatternId,
        String childSection,
        ConflictResolution resolution
) {
}
