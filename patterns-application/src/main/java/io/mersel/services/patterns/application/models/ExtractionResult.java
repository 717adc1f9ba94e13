package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * Extractor çıktısı.
 *
 * @param dialect           Tespit edilen lehçe
 * @param facts             Belge sırasına göre NodeFact'ler (başarısız olanlar işaretli)
 * @param warnings          Çalıştırmaya yansıtılacak uyarılar
 * @param fragmentsMatched  Trie ile eşleşen subtree sayısı
 * @param fragmentsFailed   Oracle analizi başarısız subtree sayısı
 * @param fragmentsTruncated Boyut sınırı nedeniyle kısaltılan fragment sayısı
 * @param lenientMode       Belge lenient modda mı parse edildi
 * @param cancelled         Çıkarım iptal ile yarıda kaldı mı
 */
public record ExtractionResult(
        DocumentDialect dialect,
        List<NodeFact> facts,
        List<String> warnings,
        int fragmentsMatched,
        int fragmentsFailed,
        int fragmentsTruncated,
        boolean lenientMode,
        boolean cancelled
) {
    public ExtractionResult {
        facts = facts == null ? List.of() : List.copyOf(facts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Pattern üretimi ve skorlama için kullanılabilir (başarısız olmayan) fact'ler.
     */
    public List<NodeFact> usableFacts() {
        return facts.stream().filter(f -> !f.extractionFailed()).toList();
    }
}
