package io.mersel.services.patterns.application.models;

/**
 * Bir çalıştırmada belgeden çıkarılan tek bir düğüm occurrence'ı.
 * <p>
 * Extractor tarafından oluşturulur, değiştirilemez ve çalıştırmaya aittir.
 * Ordinal belge sırasına göre (section bazında, 1'den başlayarak) atanır;
 * eşzamanlı işlemede tamamlanma sırası ordinal'i etkilemez.
 *
 * @param id               Fact kimliği
 * @param workspaceId      Partition (workspace) kimliği
 * @param runId            Sahip çalıştırma
 * @param version          Şema versiyonu (örn: "21.3")
 * @param messageRoot      Normalize mesaj root adı (örn: "OrderViewRS")
 * @param sectionPath      Normalize section yolu (örn: "Response/DataLists/PaxList")
 * @param nodeType         Düğüm tipi
 * @param ordinal          Section içindeki 1 tabanlı belge sırası
 * @param payload          Yapısal içerik
 * @param snippet          Kısaltılmış ham fragment (örnek/teşhis için)
 * @param masked           Hassas veri maskelendi mi
 * @param extractionFailed Oracle analizi başarısız oldu mu (pattern üretimine katılmaz)
 */
public record NodeFact(
        String id,
        String workspaceId,
        String runId,
        String version,
        String messageRoot,
        String sectionPath,
        String nodeType,
        int ordinal,
        FactPayload payload,
        String snippet,
        boolean masked,
        boolean extractionFailed
) {
    public NodeFact {
        payload = payload == null ? FactPayload.empty() : payload;
    }
}
