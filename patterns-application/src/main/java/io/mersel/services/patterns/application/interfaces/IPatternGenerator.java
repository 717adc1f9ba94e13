package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.PatternDelta;

import java.util.List;

/**
 * Tamamlanmış çalıştırmanın fact'lerinden pattern sentezi ve katalog upsert'ü.
 */
public interface IPatternGenerator {

    /**
     * Fact'leri (versiyon, mesaj, section, düğüm tipi) ile gruplar, her grup için
     * karar kuralı sentezler ve imzaya göre kataloğa upsert eder.
     *
     * @param workspaceId   Partition
     * @param runId         Kaynak çalıştırma (aynı çalıştırmanın tekrarı sayacı artırmaz)
     * @param ownerCode     Opsiyonel sahip kapsamı
     * @param facts         Çalıştırmanın fact'leri
     * @param relationships Çalıştırmanın ilişkileri
     * @return Grup başına katalog değişikliği
     */
    List<PatternDelta> generate(String workspaceId, String runId, String ownerCode,
                                List<NodeFact> facts, List<NodeRelationship> relationships);

    /**
     * Aynı gruptaki instance'lardan normal formda karar kuralı sentezler.
     */
    DecisionRule synthesize(List<NodeFact> group, List<NodeRelationship> relationships);
}
