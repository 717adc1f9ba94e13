package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.OracleRequest;
import io.mersel.services.patterns.application.models.ProposedReference;
import io.mersel.services.patterns.application.models.ReferenceQuery;

import java.util.List;
import java.util.Optional;

/**
 * Harici semantik anlama servisi (extraction oracle) sözleşmesi.
 * <p>
 * Oracle güvenilmez ve deterministik olmayan bir kara kutudur; uygulamalar
 * yanıtın zorunlu alanlarını kullanmadan önce doğrulamalıdır.
 */
public interface IExtractionOracle {

    /**
     * Sınırlı bir fragment'ı yapısal fact nesnesine dönüştürür.
     *
     * @throws OracleException Zaman aşımı, hız sınırı, erişilemezlik veya şemaya uymayan yanıt
     */
    OracleFact extract(OracleRequest request) throws OracleException;

    /**
     * Bir kaynak/hedef örnek çifti için aday referans alanlarını önerir.
     */
    List<ProposedReference> proposeReferences(ReferenceQuery query) throws OracleException;

    /**
     * Pattern için kısa açıklama üretir. En iyi çaba; hata durumunda boş döner.
     */
    default Optional<String> describePattern(DecisionRule rule, List<String> examples) {
        return Optional.empty();
    }
}
