package io.mersel.services.patterns.infrastructure.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.OracleRequest;
import io.mersel.services.patterns.application.models.ProposedReference;
import io.mersel.services.patterns.application.models.ReferenceQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * LangChain4j {@link ChatModel} üzerinden çalışan extraction oracle.
 * <p>
 * Yanıtlar {@link OracleResponseParser} ile doğrulanır. İstemci hataları
 * tipli {@link OracleException}'a sınıflandırılır; yeniden deneme ve zaman
 * aşımı {@link ResilientExtractionOracle} sorumluluğundadır.
 */
public class LangChain4jExtractionOracle implements IExtractionOracle {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jExtractionOracle.class);
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final String EXTRACT_PROMPT = """
            You analyze one fragment of a versioned XML business message and describe its structure.
            Message: %s, schema version: %s, section: %s%s

            Return ONLY a JSON object of this form:
            {"node_type": "<semantic type of the fragment root>",
             "attributes": {"<field>": "<value>", ...},
             "children": [{"node_type": "<type>", "attributes": {...}, "references": {...}}],
             "references": {"<field that points to another element>": "<referenced id>"},
             "derived": {"summary": "<one line>"}}
            Include every child occurrence. Use element and attribute names as field names.
            %s
            Fragment:
            %s
            """;

    private static final String REFERENCE_PROMPT = """
            Two sections of a %s message (schema version %s) are shown with one sample each.
            Identify fields in the SOURCE sample whose value points to an element of the TARGET section.
            Expected reference names for the source section: %s

            Return ONLY a JSON object:
            {"references": [{"reference_type": "<semantic name>", "reference_field": "<source field name>",
                             "confidence": <0..1>, "was_expected": <true if it is one of the expected names>}]}
            Return {"references": []} if there is none.

            SOURCE section %s (%s):
            %s

            TARGET section %s (%s):
            %s
            """;

    private static final String DESCRIBE_PROMPT = """
            Describe in one sentence the business meaning of this structural pattern of a %s node
            in section %s. Required fields: %s. Child types: %s.
            Examples:
            %s
            """;

    private final ChatModel chatModel;
    private final OracleResponseParser parser;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LangChain4jExtractionOracle(ChatModel chatModel, OracleResponseParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public OracleFact extract(OracleRequest request) throws OracleException {
        var hint = request.schemaHint();
        String typeHint = hint.nodeTypeHint() != null ? ", expected node type: " + hint.nodeTypeHint() : "";
        String correction = request.correction() != null ? request.correction() : "";
        String prompt = EXTRACT_PROMPT.formatted(
                hint.messageRoot(), hint.version(), hint.sectionPath(), typeHint, correction, request.fragment());
        return parser.parseFact(chat(prompt));
    }

    @Override
    public List<ProposedReference> proposeReferences(ReferenceQuery query) throws OracleException {
        String prompt = REFERENCE_PROMPT.formatted(
                query.messageRoot(), query.version(),
                query.expectedReferences().isEmpty() ? "(none)" : String.join(", ", query.expectedReferences()),
                query.sourceSection(), query.sourceNodeType(), toJson(query.sourceSample()),
                query.targetSection(), query.targetNodeType(), toJson(query.targetSample()));
        return parser.parseReferences(chat(prompt));
    }

    @Override
    public Optional<String> describePattern(DecisionRule rule, List<String> examples) {
        String childTypes = rule.childShapes().stream().map(DecisionRule.ChildShape::nodeType).toList().toString();
        String prompt = DESCRIBE_PROMPT.formatted(rule.nodeType(), rule.sectionPath(),
                rule.requiredAttributes(), childTypes, String.join("\n", examples));
        try {
            String text = chat(prompt).trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(text.length() > MAX_DESCRIPTION_LENGTH ? text.substring(0, MAX_DESCRIPTION_LENGTH) : text);
        } catch (OracleException e) {
            log.debug("Pattern açıklaması alınamadı: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String chat(String prompt) throws OracleException {
        try {
            String response = chatModel.chat(prompt);
            if (response == null) {
                throw new OracleException(OracleException.Kind.INVALID_RESPONSE, "Boş yanıt");
            }
            return response;
        } catch (RuntimeException e) {
            throw classify(e);
        }
    }

    /**
     * İstemci istisnasını oracle hata türüne eşler (sınıf adı ve mesaj üzerinden;
     * sağlayıcıya özgü istisna tipleri sürümler arasında değişiyor).
     */
    static OracleException classify(RuntimeException e) {
        String name = e.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (name.contains("ratelimit") || message.contains("429") || message.contains("rate limit")) {
            return new OracleException(OracleException.Kind.RATE_LIMITED, e.getMessage(), e);
        }
        if (name.contains("timeout") || message.contains("timed out") || message.contains("timeout")) {
            return new OracleException(OracleException.Kind.TIMEOUT, e.getMessage(), e);
        }
        return new OracleException(OracleException.Kind.UNAVAILABLE, e.getMessage(), e);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
