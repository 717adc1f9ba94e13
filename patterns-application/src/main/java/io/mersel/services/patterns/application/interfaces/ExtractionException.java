package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.NodeFact;

import java.util.List;

/**
 * Belge çıkarımı kurtarılamaz şekilde başarısız olduğunda fırlatılan istisna.
 * <p>
 * Şema açısından kritik işaretli bir section'ın analizi başarısız olduğunda da
 * kullanılır; bu durumda o ana kadar üretilmiş fact'ler çalıştırmanın
 * incelenebilmesi için taşınır.
 */
public class ExtractionException extends Exception {

    private final transient List<NodeFact> partialFacts;

    public ExtractionException(String message) {
        super(message);
        this.partialFacts = List.of();
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
        this.partialFacts = List.of();
    }

    public ExtractionException(String message, List<NodeFact> partialFacts) {
        super(message);
        this.partialFacts = List.copyOf(partialFacts);
    }

    public List<NodeFact> getPartialFacts() {
        return partialFacts;
    }
}
