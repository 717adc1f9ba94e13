package io.mersel.services.patterns.application.enums;

/**
 * Çalıştırma yaşam döngüsü durumu.
 * <p>
 * İptal edilen veya başarısız olan çalıştırmaların o ana kadar üretilmiş
 * NodeFact kayıtları silinmez; çalıştırma incelenebilir kalır.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
