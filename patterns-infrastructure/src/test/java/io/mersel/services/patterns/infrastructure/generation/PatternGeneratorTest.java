package io.mersel.services.patterns.infrastructure.generation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mersel.services.patterns.application.enums.DeltaType;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternDelta;
import io.mersel.services.patterns.infrastructure.SectionPathNormalizer;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PatternGenerator birim testleri.
 * <p>
 * Set semantiği (kardinalite değişmezliği), metadata ayıklama, ilişki özeti
 * ve katalog upsert akışı doğrulanır.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PatternGenerator")
class PatternGeneratorTest {

    private static final String PAX = "Response/DataLists/PaxList/Pax";
    private static final String CONTACT = "Response/DataLists/ContactInfoList/ContactInfo";

    @Mock
    IPatternCatalog catalog;

    @Mock
    IExtractionOracle oracle;

    private PatternGenerator generator(int maxExamples, boolean describe) {
        return new PatternGenerator(catalog, oracle, new SignatureHasher(),
                new SectionPathNormalizer(List.of("IATA_")),
                new PatternMetrics(new SimpleMeterRegistry()), maxExamples, describe);
    }

    // ── Kural Sentezi ────────────────────────────────────────────────

    @Nested
    @DisplayName("Kural sentezi")
    class Synthesis {

        @Test
        @DisplayName("Zorunlu = kesişim, opsiyonel = birleşim − kesişim")
        void requiredIsIntersection() {
            DecisionRule rule = generator(5, false).synthesize(List.of(
                    pax("p1", Map.of("PaxID", "PAX1", "PTC", "ADT", "Birthdate", "1980-01-01")),
                    pax("p2", Map.of("PaxID", "PAX2", "PTC", "CHD")),
                    pax("p3", Map.of("PaxID", "PAX3", "PTC", "INF", "Gender", "F"))), List.of());

            assertThat(rule.requiredAttributes()).containsExactly("PTC", "PaxID");
            assertThat(rule.optionalAttributes()).containsExactly("Birthdate", "Gender");
            assertThat(rule.nodeType()).isEqualTo("Passenger");
            assertThat(rule.sectionPath()).isEqualTo(PAX);
        }

        @Test
        @DisplayName("Oracle metadata alanları attribute sayılmaz")
        void metadataKeysExcluded() {
            DecisionRule rule = generator(5, false).synthesize(List.of(
                    pax("p1", Map.of("PaxID", "PAX1", "summary", "adult", "child_count", "2", "confidence", "0.9"))),
                    List.of());

            assertThat(rule.requiredAttributes()).containsExactly("PaxID");
            assertThat(rule.optionalAttributes()).isEmpty();
        }

        @Test
        @DisplayName("Çocuk tipi başına tek shape: occurrence sayısı önemsiz")
        void childShapes_perType() {
            var doc1 = new FactPayload.ChildFact("IdentityDoc", Map.of("IdentityDocID", "D1", "ExpiryDate", "2030"),
                    Map.of());
            var doc2 = new FactPayload.ChildFact("IdentityDoc", Map.of("IdentityDocID", "D2"),
                    Map.of("IssuingCountryRefID", "TR"));
            var facts = List.of(
                    paxWithChildren("p1", List.of(doc1, doc2)),
                    paxWithChildren("p2", List.of(doc2)));

            DecisionRule rule = generator(5, false).synthesize(facts, List.of());

            assertThat(rule.childShapes()).singleElement().satisfies(shape -> {
                assertThat(shape.nodeType()).isEqualTo("IdentityDoc");
                assertThat(shape.requiredAttributes()).containsExactly("IdentityDocID");
                assertThat(shape.referenceFields()).containsExactly("IssuingCountryRefID");
            });
        }

        @Test
        @DisplayName("Kardinalite farklı ama yapısı aynı gruplar aynı kuralı üretir")
        void cardinalityInvariant() {
            var g = generator(5, false);
            var child = new FactPayload.ChildFact("IdentityDoc", Map.of("IdentityDocID", "D"), Map.of());
            var small = new ArrayList<NodeFact>();
            var large = new ArrayList<NodeFact>();
            for (int i = 0; i < 2; i++) {
                small.add(paxWithChildren("s" + i, List.of(child)));
            }
            for (int i = 0; i < 7; i++) {
                large.add(paxWithChildren("l" + i, List.of(child, child, child)));
            }

            DecisionRule smallRule = g.synthesize(small, List.of());
            DecisionRule largeRule = g.synthesize(large, List.of());

            assertThat(largeRule).isEqualTo(smallRule);
            var hasher = new SignatureHasher();
            assertThat(hasher.signature(largeRule, "21.3", "OrderViewRS", null))
                    .isEqualTo(hasher.signature(smallRule, "21.3", "OrderViewRS", null));
        }

        @Test
        @DisplayName("Grubun ilişkileri hedef section başına özetlenir")
        void expectedRelationships_tallied() {
            var facts = List.of(pax("p1", Map.of("PaxID", "PAX1")), pax("p2", Map.of("PaxID", "PAX2")));
            var relationships = List.of(
                    rel("p1", CONTACT, "contact_info_reference", true),
                    rel("p2", CONTACT, "contact_info_reference", false),
                    rel("other", CONTACT, "foreign_reference", true));

            DecisionRule rule = generator(5, false).synthesize(facts, relationships);

            assertThat(rule.referenceTypes()).containsExactly("contact_info_reference");
            assertThat(rule.expectedRelationships()).singleElement().satisfies(expected -> {
                assertThat(expected.targetSection()).isEqualTo(CONTACT);
                assertThat(expected.validCount()).isEqualTo(1);
                assertThat(expected.brokenCount()).isEqualTo(1);
                assertThat(expected.valid()).isFalse();
            });
        }

        @Test
        @DisplayName("Boş grup → IllegalArgumentException")
        void emptyGroup_throws() {
            assertThatThrownBy(() -> generator(5, false).synthesize(List.of(), List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ── Katalog Akışı ────────────────────────────────────────────────

    @Nested
    @DisplayName("Üretim ve upsert")
    class Generate {

        @Test
        @DisplayName("Section/tip grubu başına bir upsert, başarısız fact'ler hariç")
        void onePatternPerGroup() {
            when(catalog.upsert(any(), eq("run-1"))).thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.CREATED));
            var failed = new NodeFact("f1", "ws1", "run-1", "21.3", "OrderViewRS", PAX, "Broken", 3,
                    FactPayload.empty(), "<Pax/>", false, true);
            var facts = List.of(
                    pax("p1", Map.of("PaxID", "PAX1")),
                    pax("p2", Map.of("PaxID", "PAX2")),
                    contact("c1"),
                    failed);

            List<PatternDelta> deltas = generator(5, false).generate("ws1", "run-1", "TK", facts, List.of());

            assertThat(deltas).hasSize(2);
            var captor = ArgumentCaptor.forClass(Pattern.class);
            verify(catalog, times(2)).upsert(captor.capture(), eq("run-1"));
            assertThat(captor.getAllValues()).extracting(Pattern::sectionPath).containsExactly(CONTACT, PAX);
            Pattern paxCandidate = captor.getAllValues().get(1);
            assertThat(paxCandidate.workspaceId()).isEqualTo("ws1");
            assertThat(paxCandidate.ownerCode()).isEqualTo("TK");
            assertThat(paxCandidate.timesSeen()).isEqualTo(1);
            assertThat(paxCandidate.signatureHash())
                    .isEqualTo(new SignatureHasher().signature(paxCandidate.rule(), "21.3", "OrderViewRS", "TK"));
            assertThat(paxCandidate.examples()).containsExactly("<Pax>p1</Pax>", "<Pax>p2</Pax>");
        }

        @Test
        @DisplayName("Legacy prefix'li section yolu normalize edilerek gruplanır")
        void legacySectionPath_normalized() {
            when(catalog.upsert(any(), any())).thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.CREATED));
            var legacy = new NodeFact("p9", "ws1", "run-1", "21.3", "OrderViewRS",
                    "Response/DataLists/IATA_PaxList/Pax", "Passenger", 1,
                    new FactPayload(Map.of("PaxID", "PAX9"), List.of(), Map.of(), Map.of()),
                    "<Pax>p9</Pax>", false, false);

            List<PatternDelta> deltas = generator(5, false).generate("ws1", "run-1", null,
                    List.of(pax("p1", Map.of("PaxID", "PAX1")), legacy), List.of());

            assertThat(deltas).singleElement().extracting(PatternDelta::sectionPath).isEqualTo(PAX);
        }

        @Test
        @DisplayName("Örnekler son N farklı snippet ile sınırlanır")
        void examples_limited() {
            when(catalog.upsert(any(), any())).thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.CREATED));
            var facts = new ArrayList<NodeFact>();
            for (int i = 1; i <= 4; i++) {
                facts.add(pax("p" + i, Map.of("PaxID", "PAX" + i)));
            }
            facts.add(pax("p2", Map.of("PaxID", "PAX2")));

            generator(2, false).generate("ws1", "run-1", null, facts, List.of());

            var captor = ArgumentCaptor.forClass(Pattern.class);
            verify(catalog).upsert(captor.capture(), any());
            assertThat(captor.getValue().examples()).containsExactly("<Pax>p3</Pax>", "<Pax>p4</Pax>");
        }

        @Test
        @DisplayName("Açıklama etkinse yalnızca yeni pattern için oracle'a sorulur")
        void describe_onlyCreated() {
            when(catalog.upsert(any(), any()))
                    .thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.CREATED))
                    .thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.INCREMENTED));
            when(oracle.describePattern(any(), anyList())).thenReturn(Optional.of("İletişim bilgisi"));

            generator(5, true).generate("ws1", "run-1", null,
                    List.of(contact("c1"), pax("p1", Map.of("PaxID", "PAX1"))), List.of());

            verify(oracle, times(1)).describePattern(any(), anyList());
            verify(catalog).updateDescription("ws1", "id-" + CONTACT, "İletişim bilgisi");
        }

        @Test
        @DisplayName("Açıklama kapalıysa oracle çağrılmaz")
        void describe_disabled() {
            when(catalog.upsert(any(), any())).thenAnswer(inv -> delta(inv.getArgument(0), DeltaType.CREATED));

            generator(5, false).generate("ws1", "run-1", null, List.of(contact("c1")), List.of());

            verify(oracle, never()).describePattern(any(), anyList());
        }
    }

    // ── Yardımcı Metodlar ────────────────────────────────────────────

    private static PatternDelta delta(Pattern candidate, DeltaType type) {
        return new PatternDelta("id-" + candidate.sectionPath(), candidate.signatureHash(),
                candidate.sectionPath(), candidate.nodeType(), type, 1);
    }

    private static NodeFact pax(String id, Map<String, String> attributes) {
        return new NodeFact(id, "ws1", "run-1", "21.3", "OrderViewRS", PAX, "Passenger", 1,
                new FactPayload(attributes, List.of(), Map.of(), Map.of()), "<Pax>" + id + "</Pax>", false, false);
    }

    private static NodeFact paxWithChildren(String id, List<FactPayload.ChildFact> children) {
        return new NodeFact(id, "ws1", "run-1", "21.3", "OrderViewRS", PAX, "Passenger", 1,
                new FactPayload(Map.of("PaxID", id, "PTC", "ADT"), children, Map.of(), Map.of()),
                "<Pax>" + id + "</Pax>", false, false);
    }

    private static NodeFact contact(String id) {
        return new NodeFact(id, "ws1", "run-1", "21.3", "OrderViewRS", CONTACT, "ContactInfo", 1,
                new FactPayload(Map.of("ContactInfoID", id), List.of(), Map.of(), Map.of()),
                "<ContactInfo>" + id + "</ContactInfo>", false, false);
    }

    private static NodeRelationship rel(String sourceFactId, String target, String type, boolean valid) {
        return new NodeRelationship("r-" + sourceFactId, "ws1", "run-1", sourceFactId, PAX, target, type,
                "ContactInfoRefID", "C1", valid, true, 0.9);
    }
}
