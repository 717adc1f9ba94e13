package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.FactPayload;

import java.util.Map;
import java.util.Optional;

/**
 * Büyük/küçük harf ve ayraç farklarını yok sayan eşleşme
 * ({@code PaxRefID} ≡ {@code pax_ref_id}).
 */
class NormalizedFieldMatcher implements FieldMatcher {

    @Override
    public Optional<FieldMatch> match(FactPayload payload, String requestedField) {
        String wanted = FieldMatcher.normalize(requestedField);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        return find(payload.attributes(), wanted).or(() -> find(payload.references(), wanted));
    }

    private static Optional<FieldMatch> find(Map<String, String> fields, String wanted) {
        for (var entry : fields.entrySet()) {
            if (ExactFieldMatcher.isPresent(entry.getValue())
                    && FieldMatcher.normalize(entry.getKey()).equals(wanted)) {
                return Optional.of(new FieldMatch(entry.getKey(), entry.getValue()));
            }
        }
        return Optional.empty();
    }
}
