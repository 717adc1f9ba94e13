package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.FactPayload;

import java.util.Optional;

/**
 * Birebir anahtar eşleşmesi; önce attribute'lar, sonra referans haritası.
 */
class ExactFieldMatcher implements FieldMatcher {

    @Override
    public Optional<FieldMatch> match(FactPayload payload, String requestedField) {
        String value = payload.attributes().get(requestedField);
        if (isPresent(value)) {
            return Optional.of(new FieldMatch(requestedField, value));
        }
        value = payload.references().get(requestedField);
        if (isPresent(value)) {
            return Optional.of(new FieldMatch(requestedField, value));
        }
        return Optional.empty();
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
