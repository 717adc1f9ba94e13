package io.mersel.services.patterns.infrastructure.workflow;

import io.mersel.services.patterns.application.enums.VersionSource;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Workflow testleri için ortak veri.
 */
final class WorkflowFixtures {

    static final String PAX = "Response/DataLists/PaxList/Pax";
    static final String CONTACT = "Response/DataLists/ContactInfoList/ContactInfo";

    static final DocumentDialect DIALECT =
            new DocumentDialect("21.3", "OrderViewRS", null, "LH", VersionSource.NAMESPACE, false);

    static final DocumentSource DOCUMENT = DocumentSource.ofBytes("order.xml",
            "<OrderViewRS/>".getBytes(StandardCharsets.UTF_8));

    private WorkflowFixtures() {
    }

    static NodeFact fact(String id, String section, String type, boolean failed) {
        return new NodeFact(id, "ws1", "run", "21.3", "OrderViewRS", section, type, 1,
                new FactPayload(Map.of("ID", id), List.of(), Map.of(), Map.of()), "<x/>", false, failed);
    }

    static ExtractionResult extraction(List<NodeFact> facts, boolean cancelled) {
        return new ExtractionResult(DIALECT, facts, List.of("uyarı"), facts.size(),
                (int) facts.stream().filter(NodeFact::extractionFailed).count(), 0, false, cancelled);
    }

    static RelationshipAnalysis analysis(List<NodeRelationship> relationships) {
        return new RelationshipAnalysis(relationships,
                new RelationshipAnalysis.Statistics(1, 1, 0, relationships.size(), 0, 0, 0, 0, 0));
    }

    static NodeRelationship relationship(String sourceFactId) {
        return new NodeRelationship("r-" + sourceFactId, "ws1", "run", sourceFactId, PAX, CONTACT,
                "contact_info_reference", "ContactInfoRefID", "C1", true, true, 0.9);
    }
}
