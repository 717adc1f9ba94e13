package io.mersel.services.patterns.infrastructure.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.mersel.services.patterns.application.models.DecisionRule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Karar kuralının yapısal imzası.
 * <p>
 * Kanonik JSON (sıralı anahtarlar, sıralı ve tekrarsız kümeler, daraltılmış boşluk)
 * üzerinden SHA-256 hex. Opsiyonel attribute'lar ve gözlenen ilişki özeti kimliğe
 * dahil değildir; instance sayısı veya occurrence sırası imzayı değiştirmez.
 * Sahip kodu verildiğinde kimliğe girer: aynı yapıyı keşfeden iki sahip ayrı
 * pattern satırına sahip olur. Sahipsiz imza bu bileşeni hiç içermez.
 */
@Component
public class SignatureHasher {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String signature(DecisionRule rule, String version, String messageRoot, String ownerCode) {
        return sha256(canonicalForm(rule, version, messageRoot, ownerCode));
    }

    String canonicalForm(DecisionRule rule, String version, String messageRoot, String ownerCode) {
        Map<String, Object> components = new TreeMap<>();
        components.put("node_type", collapse(rule.nodeType()));
        if (!collapse(ownerCode).isEmpty()) {
            components.put("owner_code", collapse(ownerCode));
        }
        components.put("section_path", collapse(rule.sectionPath()));
        components.put("version", collapse(version));
        components.put("message_root", collapse(messageRoot));
        components.put("required_attributes", sortedSet(rule.requiredAttributes()));
        components.put("reference_types", sortedSet(rule.referenceTypes()));

        var shapes = new ArrayList<Map<String, Object>>();
        rule.childShapes().stream()
                .sorted(Comparator.comparing(s -> collapse(s.nodeType())))
                .forEach(shape -> {
                    Map<String, Object> canonical = new TreeMap<>();
                    canonical.put("node_type", collapse(shape.nodeType()));
                    canonical.put("required_attributes", sortedSet(shape.requiredAttributes()));
                    canonical.put("reference_fields", sortedSet(shape.referenceFields()));
                    shapes.add(canonical);
                });
        components.put("child_shapes", shapes);

        try {
            return objectMapper.writeValueAsString(components);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("İmza için kanonik form üretilemedi", e);
        }
    }

    private static List<String> sortedSet(List<String> values) {
        var set = new TreeSet<String>();
        for (String value : values) {
            String collapsed = collapse(value);
            if (!collapsed.isEmpty()) {
                set.add(collapsed);
            }
        }
        return new ArrayList<>(set);
    }

    private static String collapse(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }

    private static String sha256(String text) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            var hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 desteklenmiyor", e);
        }
    }
}
