package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.DiscoveryResult;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.RunConfig;

/**
 * Discovery çalıştırması: belge → fact'ler → ilişkiler → pattern kataloğu.
 */
public interface IDiscoveryWorkflow {

    /**
     * @throws RunFailedException Belge parse edilemezse veya kritik bir section başarısız olursa
     */
    DiscoveryResult runDiscovery(DocumentSource document, RunConfig config) throws RunFailedException;
}
