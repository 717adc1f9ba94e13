package io.mersel.services.patterns.application.enums;

/**
 * Bir NodeFact'in en iyi aday pattern'e karşı sınıflandırma sonucu.
 * <p>
 * Eşikler sabittir: ≥0.95 EXACT, ≥0.85 HIGH, ≥0.70 PARTIAL, ≥0.50 LOW, altı NO_MATCH.
 * Kapsamda hiç aday yoksa NEW_PATTERN.
 */
public enum Verdict {
    EXACT,
    HIGH,
    PARTIAL,
    LOW,
    NO_MATCH,
    NEW_PATTERN;

    /**
     * Gap analizinde "eşleşmiş" sayılır mı (PARTIAL ve üstü).
     */
    public boolean isMatched() {
        return this == EXACT || this == HIGH || this == PARTIAL;
    }

    /**
     * Yüksek güvenli eşleşme mi (HIGH ve üstü). Pattern'in times-seen sayacını artırır.
     */
    public boolean isHighConfidence() {
        return this == EXACT || this == HIGH;
    }
}
