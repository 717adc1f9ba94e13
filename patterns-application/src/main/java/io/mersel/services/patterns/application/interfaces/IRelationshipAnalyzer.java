package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;

import java.util.List;

/**
 * Section grupları arasında çapraz referans keşfi ve doğrulaması.
 */
public interface IRelationshipAnalyzer {

    /**
     * Tek bir çalıştırmanın NodeFact'leri arasındaki referansları keşfeder.
     * Oracle hataları çift bazında yutulur ve sayılır; çalıştırma durmaz.
     *
     * @param facts Aynı çalıştırmaya ait, başarısız olmayan fact'ler
     */
    RelationshipAnalysis analyze(List<NodeFact> facts);
}
