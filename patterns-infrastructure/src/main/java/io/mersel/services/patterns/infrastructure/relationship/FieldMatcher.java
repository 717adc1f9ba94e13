package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.FactPayload;

import java.util.Optional;

/**
 * Oracle'ın önerdiği alan adını fact içeriğinde arayan strateji.
 * <p>
 * Stratejiler sırayla denenir; ilk bulan kazanır. Dönen değer, kaynakta gerçekten
 * eşleşen alan adı ve ham değerdir.
 */
interface FieldMatcher {

    record FieldMatch(String fieldName, String value) {}

    Optional<FieldMatch> match(FactPayload payload, String requestedField);

    /**
     * Karşılaştırma için normal form: küçük harf, ayraçsız.
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        var sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '-' || c == '.' || Character.isWhitespace(c)) {
                continue;
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }
}
