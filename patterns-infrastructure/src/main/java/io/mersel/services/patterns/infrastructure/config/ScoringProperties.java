package io.mersel.services.patterns.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identify skorlama parametreleri.
 * <p>
 * {@code patterns.scoring} prefix'i altındaki değerleri okur. Ağırlıklar ve ceza
 * üst sınırı ampirik olarak ayarlanmış sabitlerdir; kalibrasyon için yapılandırılabilir.
 * Ağırlıklar skorlamada toplamlarına bölünerek normalize edilir.
 */
@ConfigurationProperties(prefix = "patterns.scoring")
public class ScoringProperties {

    private static final Logger log = LoggerFactory.getLogger(ScoringProperties.class);

    private double nodeTypeWeight = 0.30;
    private double requiredAttributeWeight = 0.30;
    private double childStructureWeight = 0.25;
    private double referenceWeight = 0.15;
    private double nodeTypeMismatchCap = 0.20;
    private double requiredCoverageExponent = 2.0;
    private double mismatchPenalty = 0.15;
    private double brokenRelationshipPenalty = 0.10;
    private double maxRelationshipPenalty = 0.6;

    @PostConstruct
    void validate() {
        if (nodeTypeWeight < 0 || requiredAttributeWeight < 0 || childStructureWeight < 0 || referenceWeight < 0
                || totalWeight() <= 0) {
            log.warn("Skor ağırlıkları geçersiz ({}/{}/{}/{}), varsayılan 0.30/0.30/0.25/0.15 kullanılıyor",
                    nodeTypeWeight, requiredAttributeWeight, childStructureWeight, referenceWeight);
            nodeTypeWeight = 0.30;
            requiredAttributeWeight = 0.30;
            childStructureWeight = 0.25;
            referenceWeight = 0.15;
        }
        if (nodeTypeMismatchCap < 0 || nodeTypeMismatchCap > 1) {
            log.warn("node-type-mismatch-cap 0..1 aralığında olmalı (verilen: {}), varsayılan 0.20 kullanılıyor", nodeTypeMismatchCap);
            nodeTypeMismatchCap = 0.20;
        }
        if (requiredCoverageExponent < 1.0) {
            log.warn("required-coverage-exponent en az 1.0 olmalı (verilen: {}), varsayılan 2.0 kullanılıyor", requiredCoverageExponent);
            requiredCoverageExponent = 2.0;
        }
        if (mismatchPenalty < 0) {
            log.warn("mismatch-penalty negatif olamaz (verilen: {}), varsayılan 0.15 kullanılıyor", mismatchPenalty);
            mismatchPenalty = 0.15;
        }
        if (brokenRelationshipPenalty < 0) {
            log.warn("broken-relationship-penalty negatif olamaz (verilen: {}), varsayılan 0.10 kullanılıyor", brokenRelationshipPenalty);
            brokenRelationshipPenalty = 0.10;
        }
        if (maxRelationshipPenalty < 0 || maxRelationshipPenalty > 1) {
            log.warn("max-relationship-penalty 0..1 aralığında olmalı (verilen: {}), varsayılan 0.6 kullanılıyor", maxRelationshipPenalty);
            maxRelationshipPenalty = 0.6;
        }
    }

    public double totalWeight() {
        return nodeTypeWeight + requiredAttributeWeight + childStructureWeight + referenceWeight;
    }

    public double getNodeTypeWeight() {
        return nodeTypeWeight;
    }

    public void setNodeTypeWeight(double nodeTypeWeight) {
        this.nodeTypeWeight = nodeTypeWeight;
    }

    public double getRequiredAttributeWeight() {
        return requiredAttributeWeight;
    }

    public void setRequiredAttributeWeight(double requiredAttributeWeight) {
        this.requiredAttributeWeight = requiredAttributeWeight;
    }

    public double getChildStructureWeight() {
        return childStructureWeight;
    }

    public void setChildStructureWeight(double childStructureWeight) {
        this.childStructureWeight = childStructureWeight;
    }

    public double getReferenceWeight() {
        return referenceWeight;
    }

    public void setReferenceWeight(double referenceWeight) {
        this.referenceWeight = referenceWeight;
    }

    public double getNodeTypeMismatchCap() {
        return nodeTypeMismatchCap;
    }

    public void setNodeTypeMismatchCap(double nodeTypeMismatchCap) {
        this.nodeTypeMismatchCap = nodeTypeMismatchCap;
    }

    public double getRequiredCoverageExponent() {
        return requiredCoverageExponent;
    }

    public void setRequiredCoverageExponent(double requiredCoverageExponent) {
        this.requiredCoverageExponent = requiredCoverageExponent;
    }

    public double getMismatchPenalty() {
        return mismatchPenalty;
    }

    public void setMismatchPenalty(double mismatchPenalty) {
        this.mismatchPenalty = mismatchPenalty;
    }

    public double getBrokenRelationshipPenalty() {
        return brokenRelationshipPenalty;
    }

    public void setBrokenRelationshipPenalty(double brokenRelationshipPenalty) {
        this.brokenRelationshipPenalty = brokenRelationshipPenalty;
    }

    public double getMaxRelationshipPenalty() {
        return maxRelationshipPenalty;
    }

    public void setMaxRelationshipPenalty(double maxRelationshipPenalty) {
        this.maxRelationshipPenalty = maxRelationshipPenalty;
    }
}
