package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.GapReport;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternMatch;

import java.util.List;

/**
 * Ağırlıklı benzerlik skorlama, verdict sınıflandırma ve boşluk analizi.
 */
public interface IIdentifyEngine {

    /**
     * Fact'i adaylara karşı skorlar, en yüksek skorlu adayı seçer ve sınıflandırır.
     * Aday yoksa NEW_PATTERN. Yüksek güvenli eşleşmede pattern sayacı artırılır.
     *
     * @param fact          Skorlanacak fact
     * @param relationships Fact'in kaynak olduğu ilişkiler
     * @param candidates    Kapsamdaki aday pattern'ler
     */
    PatternMatch identify(NodeFact fact, List<NodeRelationship> relationships, List<Pattern> candidates);

    /**
     * Çalıştırma seviyesinde boşluk analizi.
     *
     * @param facts   Skorlanan fact'ler
     * @param matches Fact başına eşleşmeler
     * @param library Kapsamdaki kütüphane pattern'leri
     */
    GapReport analyzeGaps(List<NodeFact> facts, List<PatternMatch> matches, List<Pattern> library);
}
