package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.FactPayload;

import java.util.List;
import java.util.Optional;

/**
 * Çocuk düğümlerin referans ve attribute haritalarında arar.
 * Referans taşıyan alan çoğu zaman bir alt elementtedir
 * ({@code Pax/IdentityDoc/PaxRefID} gibi).
 */
class NestedReferenceFieldMatcher implements FieldMatcher {

    @Override
    public Optional<FieldMatch> match(FactPayload payload, String requestedField) {
        String wanted = FieldMatcher.normalize(requestedField);
        for (FactPayload.ChildFact child : payload.children()) {
            for (var fields : List.of(child.references(), child.attributes())) {
                for (var entry : fields.entrySet()) {
                    if (ExactFieldMatcher.isPresent(entry.getValue())
                            && FieldMatcher.normalize(entry.getKey()).equals(wanted)) {
                        return Optional.of(new FieldMatch(entry.getKey(), entry.getValue()));
                    }
                }
            }
        }
        return Optional.empty();
    }
}
