package io.mersel.services.patterns.application.models;

import java.util.List;

/**
 * Bir pattern'i tanımlayan yapısal sözleşme.
 * <p>
 * Tüm listeler sıralı ve tekrarsızdır; generator bu normal formu garanti eder.
 * İmza hesabında {@code optionalAttributes} ve {@code expectedRelationships}
 * kimliğe dahil edilmez, upsert sırasında tazelenir.
 *
 * @param nodeType              Düğüm tipi
 * @param sectionPath           Normalize section yolu
 * @param requiredAttributes    Tüm instance'larda bulunan attribute anahtarları (kesişim)
 * @param optionalAttributes    Bazı instance'larda bulunan attribute anahtarları (birleşim − zorunlu)
 * @param childShapes           Çocuk tipine göre tekilleştirilmiş çocuk yapısı
 * @param referenceTypes        Gözlenen tekil referans tipleri
 * @param expectedRelationships Hedef section bazında gözlenen geçerlilik özeti
 */
public record DecisionRule(
        String nodeType,
        String sectionPath,
        List<String> requiredAttributes,
        List<String> optionalAttributes,
        List<ChildShape> childShapes,
        List<String> referenceTypes,
        List<ExpectedRelationship> expectedRelationships
) {

    public DecisionRule {
        requiredAttributes = requiredAttributes == null ? List.of() : List.copyOf(requiredAttributes);
        optionalAttributes = optionalAttributes == null ? List.of() : List.copyOf(optionalAttributes);
        childShapes = childShapes == null ? List.of() : List.copyOf(childShapes);
        referenceTypes = referenceTypes == null ? List.of() : List.copyOf(referenceTypes);
        expectedRelationships = expectedRelationships == null ? List.of() : List.copyOf(expectedRelationships);
    }

    /**
     * Tek bir çocuk tipinin yapısal parmak izi. Occurrence sayısı içermez.
     *
     * @param nodeType           Çocuk düğüm tipi
     * @param requiredAttributes Bu tipin tüm occurrence'larında ortak attribute'lar
     * @param referenceFields    Bu tipin herhangi bir occurrence'ında görülen referans alanları
     */
    public record ChildShape(
            String nodeType,
            List<String> requiredAttributes,
            List<String> referenceFields
    ) {
        public ChildShape {
            requiredAttributes = requiredAttributes == null ? List.of() : List.copyOf(requiredAttributes);
            referenceFields = referenceFields == null ? List.of() : List.copyOf(referenceFields);
        }
    }

    /**
     * Bir hedef section'a giden referansların gözlenen geçerlilik özeti.
     * <p>
     * Şemada yapısal olarak normal olan dolaylı/kırık referansları yakalar;
     * {@code valid=false} beklentisi, aynı şekilde kırık gelen gerçek referansı cezalandırmaz.
     *
     * @param targetSection  Hedef section yolu
     * @param referenceTypes Bu hedefe giden referans tipleri
     * @param validCount     Geçerli gözlem sayısı
     * @param brokenCount    Kırık gözlem sayısı
     * @param valid          Tüm gözlemler geçerli mi
     */
    public record ExpectedRelationship(
            String targetSection,
            List<String> referenceTypes,
            int validCount,
            int brokenCount,
            boolean valid
    ) {
        public ExpectedRelationship {
            referenceTypes = referenceTypes == null ? List.of() : List.copyOf(referenceTypes);
        }
    }
}
