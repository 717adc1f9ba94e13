package io.mersel.services.patterns.application.enums;

/**
 * Katalog upsert sonucunun türü.
 */
public enum DeltaType {
    /** Yeni imza: yeni pattern satırı eklendi. */
    CREATED,
    /** Mevcut imza: times-seen artırıldı, karar kuralı tazelendi. */
    INCREMENTED,
    /** Aynı çalıştırma tekrar işlendi: sayaç değişmedi, sadece kural tazelendi. */
    REFRESHED
}
