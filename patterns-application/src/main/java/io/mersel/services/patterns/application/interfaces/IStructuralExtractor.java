package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.RunConfig;

/**
 * Akış tabanlı yapısal çıkarım sözleşmesi.
 */
public interface IStructuralExtractor {

    /**
     * Belgeyi sınırlı bellekle dolaşır, hedef subtree'leri oracle'a gönderir
     * ve belge sırasına göre NodeFact'leri döner.
     *
     * @param source Belge kaynağı
     * @param config Çalıştırma parametreleri (workspace, versiyon override, iptal)
     * @param runId  NodeFact'lerin bağlanacağı çalıştırma
     * @throws DocumentParseException Belge lenient modda da parse edilemezse
     * @throws ExtractionException    Şema açısından kritik bir section analiz edilemezse
     */
    ExtractionResult extract(DocumentSource source, RunConfig config, String runId) throws ExtractionException;
}
