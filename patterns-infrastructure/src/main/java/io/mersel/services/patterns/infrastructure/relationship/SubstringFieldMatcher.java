package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.FactPayload;

import java.util.Map;
import java.util.Optional;

/**
 * Normalize adlardan biri diğerini içeriyorsa eşleşir. Yanlış pozitifleri
 * sınırlamak için yalnızca kimlik/referans taşıyan adlara uygulanır.
 */
class SubstringFieldMatcher implements FieldMatcher {

    @Override
    public Optional<FieldMatch> match(FactPayload payload, String requestedField) {
        String wanted = FieldMatcher.normalize(requestedField);
        if (!isIdentifierLike(wanted)) {
            return Optional.empty();
        }
        return find(payload.attributes(), wanted).or(() -> find(payload.references(), wanted));
    }

    private static Optional<FieldMatch> find(Map<String, String> fields, String wanted) {
        for (var entry : fields.entrySet()) {
            String key = FieldMatcher.normalize(entry.getKey());
            if (!ExactFieldMatcher.isPresent(entry.getValue()) || !isIdentifierLike(key)) {
                continue;
            }
            if (key.contains(wanted) || wanted.contains(key)) {
                return Optional.of(new FieldMatch(entry.getKey(), entry.getValue()));
            }
        }
        return Optional.empty();
    }

    static boolean isIdentifierLike(String normalizedName) {
        return normalizedName.contains("id") || normalizedName.contains("ref");
    }
}
