package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.IdentifyResult;
import io.mersel.services.patterns.application.models.RunConfig;

/**
 * Identify çalıştırması: belge → fact'ler → kütüphaneye karşı eşleşme + boşluk raporu.
 */
public interface IIdentifyWorkflow {

    /**
     * @throws RunFailedException Belge parse edilemezse veya kritik bir section başarısız olursa
     */
    IdentifyResult runIdentify(DocumentSource document, RunConfig config) throws RunFailedException;
}
