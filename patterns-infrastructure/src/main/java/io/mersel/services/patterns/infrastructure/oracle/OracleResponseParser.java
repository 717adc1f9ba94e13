package io.mersel.services.patterns.infrastructure.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.ProposedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle metin yanıtlarını doğrulayıp tipli nesnelere çevirir.
 * <p>
 * Yanıt güvenilmezdir: zorunlu alanlar eksikse veya JSON değilse
 * {@link OracleException.Kind#INVALID_RESPONSE} fırlatılır. Markdown kod
 * blokları ve JSON öncesi/sonrası serbest metin tolere edilir.
 */
public class OracleResponseParser {

    private static final Logger log = LoggerFactory.getLogger(OracleResponseParser.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Fragment analiz yanıtı. Zorunlu: {@code node_type} (metin), {@code attributes} (nesne).
     */
    public OracleFact parseFact(String response) throws OracleException {
        JsonNode root = readObject(response);

        String nodeType = text(root.get("node_type"));
        if (nodeType.isEmpty()) {
            throw invalid("'node_type' alanı eksik veya boş");
        }
        JsonNode attributes = root.get("attributes");
        if (attributes == null || !attributes.isObject()) {
            throw invalid("'attributes' alanı nesne olmalı");
        }

        var children = new ArrayList<FactPayload.ChildFact>();
        JsonNode childArray = root.get("children");
        if (childArray != null && !childArray.isNull()) {
            if (!childArray.isArray()) {
                throw invalid("'children' alanı dizi olmalı");
            }
            for (JsonNode child : childArray) {
                String childType = text(child.get("node_type"));
                if (childType.isEmpty()) {
                    throw invalid("Çocuk düğümde 'node_type' eksik");
                }
                children.add(new FactPayload.ChildFact(childType,
                        flatten(child.get("attributes")), flatten(child.get("references"))));
            }
        }

        return new OracleFact(nodeType, new FactPayload(
                flatten(attributes), children, flatten(root.get("references")), flatten(root.get("derived"))));
    }

    /**
     * Referans önerisi yanıtı. Zorunlu: {@code references} dizisi; her öğede
     * {@code reference_type} ve {@code reference_field}. Eksik öğeler atlanır.
     */
    public List<ProposedReference> parseReferences(String response) throws OracleException {
        JsonNode root = readObject(response);
        JsonNode array = root.get("references");
        if (array == null || !array.isArray()) {
            throw invalid("'references' alanı dizi olmalı");
        }

        var result = new ArrayList<ProposedReference>();
        for (JsonNode item : array) {
            String type = text(item.get("reference_type"));
            String field = text(item.get("reference_field"));
            if (type.isEmpty() || field.isEmpty()) {
                log.debug("Eksik alanlı referans önerisi atlandı: {}", item);
                continue;
            }
            double confidence = item.path("confidence").asDouble(0.5);
            confidence = Math.max(0.0, Math.min(1.0, confidence));
            result.add(new ProposedReference(type, field, confidence, item.path("was_expected").asBoolean(false)));
        }
        return result;
    }

    private JsonNode readObject(String response) throws OracleException {
        if (response == null || response.isBlank()) {
            throw invalid("Boş yanıt");
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw invalid("Yanıtta JSON nesnesi bulunamadı");
        }
        try {
            JsonNode node = objectMapper.readTree(response.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw invalid("Yanıt JSON nesnesi değil");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.INVALID_RESPONSE,
                    "JSON parse hatası: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Nesneyi anahtar → metin map'ine indirger. Dizi değerleri boşlukla birleştirilir
     * (çoklu referans değeri), iç içe nesneler kompakt JSON olarak saklanır.
     * {@code null} değerli anahtarlar boş metinle korunur; anahtarın varlığı yapısal bilgidir.
     */
    private Map<String, String> flatten(JsonNode node) {
        var result = new LinkedHashMap<String, String>();
        if (node == null || !node.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String key = field.getKey().trim();
            if (key.isEmpty()) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                result.put(key, "");
            } else if (value.isArray()) {
                var parts = new ArrayList<String>();
                value.forEach(v -> parts.add(v.isValueNode() ? v.asText() : v.toString()));
                result.put(key, String.join(" ", parts));
            } else if (value.isValueNode()) {
                result.put(key, value.asText());
            } else {
                result.put(key, value.toString());
            }
        }
        return result;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() || !node.isValueNode() ? "" : node.asText().trim();
    }

    private static OracleException invalid(String message) {
        return new OracleException(OracleException.Kind.INVALID_RESPONSE, message);
    }
}
