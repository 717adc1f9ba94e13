package io.mersel.services.patterns.infrastructure.relationship;

import io.mersel.services.patterns.application.models.NodeFact;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ham referans değerini hedef section instance'larına çözümler.
 * <p>
 * Referans değerleri boşlukla ayrılmış birden çok kimlik taşıyabilir
 * ({@code PaxRefID="PAX1 PAX2"}); herhangi bir token'ın çözümlenmesi yeterlidir.
 */
class ReferenceResolver {

    private static final List<String> KEY_FIELDS = List.of("ID", "Key", "ObjectKey");

    static List<String> tokens(String rawValue) {
        var result = new ArrayList<String>();
        if (rawValue == null) {
            return result;
        }
        for (String token : rawValue.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Token'lardan herhangi biri bir hedef instance'ın kimlik alanına eşitse {@code true}.
     */
    boolean resolves(String rawValue, List<NodeFact> targets) {
        var tokens = tokens(rawValue);
        if (tokens.isEmpty()) {
            return false;
        }
        for (NodeFact target : targets) {
            for (String token : tokens) {
                if (identifies(target, token)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean identifies(NodeFact target, String token) {
        Map<String, String> attributes = target.payload().attributes();
        for (String keyField : KEY_FIELDS) {
            if (token.equals(attributes.get(keyField))) {
                return true;
            }
        }
        for (var entry : attributes.entrySet()) {
            if (token.equals(entry.getValue()) && isKeyName(entry.getKey())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isKeyName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("id") || lower.contains("key");
    }
}
