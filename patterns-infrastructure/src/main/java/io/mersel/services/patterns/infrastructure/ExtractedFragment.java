package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.models.NodeConfiguration;

/**
 * Parse aşamasında toplanan, oracle analizini bekleyen subtree.
 *
 * @param sequence  Belgedeki başlangıç sırası (tüm section'lar genelinde)
 * @param target    Eşleşen section yapılandırması
 * @param ordinal   Section içindeki 1 tabanlı sıra
 * @param xml       Boyutu sınırlanmış fragment
 * @param truncated Sınır nedeniyle kısaltıldı mı
 * @param malformed Subtree parse hatası nedeniyle kapanamadı; oracle'a gönderilmez
 */
record ExtractedFragment(
        long sequence,
        NodeConfiguration target,
        int ordinal,
        String xml,
        boolean truncated,
        boolean malformed
) {
}
