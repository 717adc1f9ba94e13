package io.mersel.services.patterns.infrastructure;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mersel.services.patterns.application.interfaces.DocumentParseException;
import io.mersel.services.patterns.application.interfaces.ExtractionException;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.CancellationToken;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.OracleRequest;
import io.mersel.services.patterns.application.models.RunConfig;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * StreamingStructuralExtractor birim testleri.
 * <p>
 * Oracle mock'lanır; gerçek SAX parse, trie eşleştirme, fragment buffer'lama
 * ve worker havuzu kullanılır.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StreamingStructuralExtractor")
class StreamingStructuralExtractorTest {

    private static final String NODE_CONFIG = """
            node-configurations:
              - version: "21.3"
                message: OrderViewRS
                sections:
                  - path: Response/DataLists/PaxList/Pax
                    node-type: Passenger
                    schema-critical: true
                  - path: Response/DataLists/ContactInfoList/ContactInfo
                    node-type: ContactInfo
                  - path: Response/Order/OrderItem
                    node-type: OrderItem
              - version: "17.2"
                message: OrderViewRS
                sections:
                  - path: Response/DataLists/ContactList/ContactInformation
                    node-type: ContactInfo
                    aliases: [Response/DataLists/ContactInfoList/ContactInfo]
            """;

    private static final String ORDER_VIEW_21_3 = """
            <IATA_OrderViewRS xmlns="http://www.iata.org/IATA/2015/EASD/00/IATA_OffersAndOrdersMessage">
              <Response>
                <DataLists>
                  <ContactInfoList>
                    <ContactInfo><ContactInfoID>C1</ContactInfoID></ContactInfo>
                  </ContactInfoList>
                  <PaxList>
                    <Pax><PaxID>PAX1</PaxID><PTC>ADT</PTC><ContactInfoRefID>C1</ContactInfoRefID></Pax>
                    <Pax><PaxID>PAX2</PaxID><PTC>INF</PTC></Pax>
                  </PaxList>
                </DataLists>
                <Order>
                  <OrderItem><OrderItemID>OI1</OrderItemID></OrderItem>
                </Order>
              </Response>
            </IATA_OrderViewRS>
            """;

    @TempDir
    Path tempDir;

    @Mock
    IExtractionOracle oracle;

    private NodeConfigurationRegistry registry;
    private DialectDetector dialectDetector;
    private SectionPathNormalizer normalizer;
    private PatternEngineProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService workers;
    private StreamingStructuralExtractor extractor;

    @BeforeEach
    void setUp() throws Exception {
        Path config = tempDir.resolve("node-configurations.yml");
        Files.writeString(config, NODE_CONFIG);
        normalizer = new SectionPathNormalizer(List.of("IATA_"));
        registry = new NodeConfigurationRegistry(normalizer, config);
        registry.reload();
        dialectDetector = new DialectDetector(normalizer, "21.3");
        properties = new PatternEngineProperties();
        meterRegistry = new SimpleMeterRegistry();
        workers = Executors.newSingleThreadExecutor();
        extractor = extractor(workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    // ── Temel Çıkarım ────────────────────────────────────────────────

    @Nested
    @DisplayName("Fragment çıkarımı")
    class Extraction {

        @Test
        @DisplayName("Hedef section'lar belge sırasıyla, section içi ordinal ile çıkarılır")
        void extract_documentOrderAndOrdinals() throws Exception {
            answerWithHintedType();

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.facts()).extracting(NodeFact::sectionPath, NodeFact::ordinal).containsExactly(
                    tuple("Response/DataLists/ContactInfoList/ContactInfo", 1),
                    tuple("Response/DataLists/PaxList/Pax", 1),
                    tuple("Response/DataLists/PaxList/Pax", 2),
                    tuple("Response/Order/OrderItem", 1));
            assertThat(result.fragmentsMatched()).isEqualTo(4);
            assertThat(result.fragmentsFailed()).isZero();
            assertThat(result.lenientMode()).isFalse();
            assertThat(result.cancelled()).isFalse();
        }

        @Test
        @DisplayName("Fact'ler lehçe, workspace ve run bilgisini taşır")
        void extract_factProvenance() throws Exception {
            answerWithHintedType();

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");
            NodeFact pax = result.facts().get(1);

            assertThat(result.dialect().messageRoot()).isEqualTo("OrderViewRS");
            assertThat(result.dialect().version()).isEqualTo("21.3");
            assertThat(pax.workspaceId()).isEqualTo("ws1");
            assertThat(pax.runId()).isEqualTo("run-1");
            assertThat(pax.version()).isEqualTo("21.3");
            assertThat(pax.messageRoot()).isEqualTo("OrderViewRS");
            assertThat(pax.nodeType()).isEqualTo("Passenger");
            assertThat(pax.snippet()).startsWith("<Pax><PaxID>PAX1</PaxID>");
            assertThat(pax.extractionFailed()).isFalse();
        }

        @Test
        @DisplayName("Oracle'a giden fragment yalnızca eşleşen subtree'yi içerir")
        void extract_fragmentIsSubtree() throws Exception {
            answerWithHintedType();

            extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            var captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle, atLeastOnce()).extract(captor.capture());
            OracleRequest firstPax = captor.getAllValues().stream()
                    .filter(r -> r.schemaHint().sectionPath().endsWith("/Pax"))
                    .findFirst().orElseThrow();
            assertThat(firstPax.fragment())
                    .isEqualTo("<Pax><PaxID>PAX1</PaxID><PTC>ADT</PTC><ContactInfoRefID>C1</ContactInfoRefID></Pax>");
            assertThat(firstPax.schemaHint().nodeTypeHint()).isEqualTo("Passenger");
            assertThat(firstPax.correction()).isNull();
        }

        @Test
        @DisplayName("Oracle node_type vermezse yapılandırmadaki tip kullanılır")
        void extract_blankOracleType_fallsBackToConfig() throws Exception {
            when(oracle.extract(any())).thenReturn(new OracleFact("  ", FactPayload.empty()));

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.facts()).extracting(NodeFact::nodeType)
                    .containsExactly("ContactInfo", "Passenger", "Passenger", "OrderItem");
        }

        @Test
        @DisplayName("derived.masked=true fact'i maskeli işaretler")
        void extract_maskedFlag() throws Exception {
            when(oracle.extract(any())).thenReturn(new OracleFact("Passenger",
                    new FactPayload(Map.of("PaxID", "PAX1"), List.of(), Map.of(), Map.of("masked", "true"))));

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.facts()).allMatch(NodeFact::masked);
        }

        @Test
        @DisplayName("17.2 belgesinde alias yol kanonik section'a eşlenir")
        void extract_aliasPath() throws Exception {
            answerWithHintedType();
            String legacy = """
                    <OrderViewRS xmlns="http://www.iata.org/IATA/EDIST/2017.2">
                      <Response>
                        <DataLists>
                          <ContactInfoList><ContactInfo><ContactInfoID>C9</ContactInfoID></ContactInfo></ContactInfoList>
                        </DataLists>
                      </Response>
                    </OrderViewRS>
                    """;

            ExtractionResult result = extractor.extract(source(legacy), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.dialect().version()).isEqualTo("17.2");
            assertThat(result.facts()).singleElement()
                    .extracting(NodeFact::sectionPath)
                    .isEqualTo("Response/DataLists/ContactList/ContactInformation");
        }

        @Test
        @DisplayName("Çok worker'lı havuzda da sonuçlar belge sırasındadır")
        void extract_parallelWorkers_keepDocumentOrder() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                when(oracle.extract(any())).thenAnswer(inv -> {
                    OracleRequest request = inv.getArgument(0);
                    // Önce başlayan fragment'lar daha geç tamamlanır
                    if (request.schemaHint().sectionPath().endsWith("ContactInfo")) {
                        Thread.sleep(150);
                    }
                    return new OracleFact(request.schemaHint().nodeTypeHint(), FactPayload.empty());
                });

                ExtractionResult result = extractor(pool)
                        .extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

                assertThat(result.facts()).extracting(NodeFact::nodeType)
                        .containsExactly("ContactInfo", "Passenger", "Passenger", "OrderItem");
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Fragment metrikleri kaydedilir")
        void extract_recordsFragmentMetrics() throws Exception {
            answerWithHintedType();

            extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(meterRegistry.get("patterns_fragments_total").tag("result", "matched").counter().count())
                    .isEqualTo(4.0);
        }
    }

    // ── Sınırlar ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Boyut sınırları")
    class Limits {

        @Test
        @DisplayName("Fragment sınırı aşılırsa kısaltılır ama iyi biçimli kalır")
        void fragment_truncated_wellFormed() throws Exception {
            answerWithHintedType();
            properties.setMaxFragmentKb(1);
            var pax = new StringBuilder("<Pax><PaxID>PAX1</PaxID>");
            for (int i = 0; i < 80; i++) {
                pax.append("<Remark><Text>REMARK-").append(i).append("-PADDING-PADDING</Text></Remark>");
            }
            pax.append("</Pax>");
            String xml = "<OrderViewRS Version=\"21.3\"><Response><DataLists><PaxList>" + pax
                    + "</PaxList></DataLists></Response></OrderViewRS>";

            ExtractionResult result = extractor(workers).extract(source(xml), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.fragmentsTruncated()).isEqualTo(1);
            var captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle).extract(captor.capture());
            String fragment = captor.getValue().fragment();
            assertThat(fragment).startsWith("<Pax><PaxID>PAX1</PaxID>").endsWith("</Pax>");
            assertThat(fragment.length()).isLessThan(1024 + 200);
        }

        @Test
        @DisplayName("Belge boyutu sınırı aşılırsa parse edilmeden reddedilir")
        void document_tooLarge_rejected() {
            var huge = new DocumentSource() {
                @Override
                public InputStream openStream() {
                    throw new AssertionError("açılmamalı");
                }

                @Override
                public String name() {
                    return "huge.xml";
                }

                @Override
                public long size() {
                    return 500L * 1024 * 1024;
                }
            };

            assertThatThrownBy(() -> extractor.extract(huge, RunConfig.forWorkspace("ws1"), "run-1"))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessageContaining("sınırı");
            verifyNoInteractions(oracle);
        }

        @Test
        @DisplayName("Yapılandırılmamış versiyon için uyarı, fact yok")
        void unknownVersion_warning() throws Exception {
            ExtractionResult result = extractor.extract(
                    source("<OrderViewRS Version=\"18.1\"><Response/></OrderViewRS>"),
                    RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.facts()).isEmpty();
            assertThat(result.warnings()).anyMatch(w -> w.contains("etkin hedef section yapılandırması yok"));
            verifyNoInteractions(oracle);
        }

        @Test
        @DisplayName("Versiyon sinyali yoksa düşük güven uyarısı eklenir")
        void noVersionSignal_lowConfidenceWarning() throws Exception {
            answerWithHintedType();

            ExtractionResult result = extractor.extract(
                    source("<OrderViewRS><Response><Order><OrderItem/></Order></Response></OrderViewRS>"),
                    RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.dialect().isLowConfidence()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("düşük güven"));
            assertThat(result.facts()).hasSize(1);
        }
    }

    // ── Kurtarma Modu ────────────────────────────────────────────────

    @Nested
    @DisplayName("Bozuk XML")
    class MalformedXml {

        @Test
        @DisplayName("Çıplak & içeren belge kurtarma modunda işlenir")
        void bareAmpersand_lenientMode() throws Exception {
            answerWithHintedType();
            String xml = """
                    <OrderViewRS Version="21.3">
                      <Response>
                        <Order>
                          <OrderItem><Note>Tom & Jerry</Note></OrderItem>
                        </Order>
                      </Response>
                    </OrderViewRS>
                    """;

            ExtractionResult result = extractor.extract(source(xml), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.lenientMode()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("kurtarma modunda"));
            var captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle).extract(captor.capture());
            assertThat(captor.getValue().fragment()).isEqualTo("<OrderItem><Note>Tom &amp; Jerry</Note></OrderItem>");
            assertThat(meterRegistry.get("patterns_parse_recovery_total").tag("result", "recovered").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Kritik olmayan subtree'de kapanmayan tag: subtree başarısız, önceki kardeşler korunur")
        void unclosedNonCriticalSubtree_siblingsKept() throws Exception {
            answerWithHintedType();
            String xml = """
                    <OrderViewRS Version="21.3">
                      <Response>
                        <DataLists>
                          <PaxList>
                            <Pax><PaxID>PAX1</PaxID></Pax>
                            <Pax><PaxID>PAX2</PaxID></Pax>
                          </PaxList>
                          <ContactInfoList>
                            <ContactInfo><ContactInfoID>C1</ContactInfo>
                          </ContactInfoList>
                        </DataLists>
                      </Response>
                    </OrderViewRS>
                    """;

            ExtractionResult result = extractor.extract(source(xml), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.lenientMode()).isTrue();
            assertThat(result.facts())
                    .extracting(NodeFact::sectionPath, NodeFact::ordinal, NodeFact::extractionFailed)
                    .containsExactly(
                            tuple("Response/DataLists/PaxList/Pax", 1, false),
                            tuple("Response/DataLists/PaxList/Pax", 2, false),
                            tuple("Response/DataLists/ContactInfoList/ContactInfo", 1, true));
            NodeFact contact = result.facts().get(2);
            assertThat(contact.nodeType()).isEqualTo("ContactInfo");
            assertThat(contact.snippet()).startsWith("<ContactInfo><ContactInfoID>");
            assertThat(result.fragmentsFailed()).isEqualTo(1);
            assertThat(result.warnings()).anyMatch(w -> w.contains("1 açık subtree başarısız"));

            var captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle, times(2)).extract(captor.capture());
            assertThat(captor.getAllValues())
                    .allMatch(r -> r.schemaHint().sectionPath().endsWith("/Pax"));
        }

        @Test
        @DisplayName("Şema açısından kritik subtree'de kapanmayan tag → DocumentParseException")
        void unclosedCriticalSubtree_throws() {
            String xml = """
                    <OrderViewRS Version="21.3">
                      <Response>
                        <DataLists>
                          <ContactInfoList>
                            <ContactInfo><ContactInfoID>C1</ContactInfoID></ContactInfo>
                          </ContactInfoList>
                          <PaxList>
                            <Pax><PaxID>PAX1</Pax>
                          </PaxList>
                        </DataLists>
                      </Response>
                    </OrderViewRS>
                    """;

            assertThatThrownBy(() -> extractor.extract(source(xml), RunConfig.forWorkspace("ws1"), "run-1"))
                    .isInstanceOf(DocumentParseException.class)
                    .hasMessageContaining("PaxID");
            verifyNoInteractions(oracle);
            assertThat(meterRegistry.get("patterns_parse_recovery_total").tag("result", "failed").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Kurtarılamayan belge → DocumentParseException")
        void unrecoverable_throws() {
            assertThatThrownBy(() -> extractor.extract(
                    source("<OrderViewRS Version=\"21.3\"><Response><Order>"),
                    RunConfig.forWorkspace("ws1"), "run-1"))
                    .isInstanceOf(DocumentParseException.class);
            verifyNoInteractions(oracle);
        }
    }

    // ── Oracle Hataları ──────────────────────────────────────────────

    @Nested
    @DisplayName("Oracle hataları")
    class OracleFailures {

        @Test
        @DisplayName("Kritik olmayan section hatası başarısız fact olarak kaydedilir, çalıştırma sürer")
        void nonCritical_failure_recorded() throws Exception {
            when(oracle.extract(any())).thenAnswer(inv -> {
                OracleRequest request = inv.getArgument(0);
                if (request.schemaHint().sectionPath().endsWith("ContactInfo")) {
                    throw new OracleException(OracleException.Kind.TIMEOUT, "timeout");
                }
                return new OracleFact(request.schemaHint().nodeTypeHint(), FactPayload.empty());
            });

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1");

            assertThat(result.facts()).hasSize(4);
            assertThat(result.fragmentsFailed()).isEqualTo(1);
            assertThat(result.usableFacts()).hasSize(3);
            NodeFact failed = result.facts().get(0);
            assertThat(failed.extractionFailed()).isTrue();
            assertThat(failed.nodeType()).isEqualTo("ContactInfo");
            assertThat(failed.payload().attributes()).isEmpty();
            assertThat(result.warnings()).anyMatch(w -> w.contains("1 fragment"));
        }

        @Test
        @DisplayName("Şema açısından kritik section hatası çalıştırmayı kısmi fact'lerle durdurur")
        void critical_failure_aborts() throws Exception {
            when(oracle.extract(any())).thenAnswer(inv -> {
                OracleRequest request = inv.getArgument(0);
                if (request.schemaHint().sectionPath().endsWith("/Pax")) {
                    throw new OracleException(OracleException.Kind.UNAVAILABLE, "down");
                }
                return new OracleFact(request.schemaHint().nodeTypeHint(), FactPayload.empty());
            });

            assertThatThrownBy(() -> extractor.extract(source(ORDER_VIEW_21_3), RunConfig.forWorkspace("ws1"), "run-1"))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessageContaining("Response/DataLists/PaxList/Pax")
                    .satisfies(e -> assertThat(((ExtractionException) e).getPartialFacts())
                            .extracting(NodeFact::extractionFailed)
                            .containsExactly(false, true));
        }
    }

    // ── İptal ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("İptal")
    class Cancellation {

        @Test
        @DisplayName("Başlamadan iptal edilen çalıştırma oracle çağırmaz")
        void cancelledBeforeStart() throws Exception {
            var token = new CancellationToken();
            token.cancel();

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3),
                    RunConfig.forWorkspace("ws1").withCancellation(token), "run-1");

            assertThat(result.cancelled()).isTrue();
            assertThat(result.facts()).isEmpty();
            verifyNoInteractions(oracle);
        }

        @Test
        @DisplayName("Analiz sırasında iptal: kalan fragment'lar atlanır, üretilenler korunur")
        void cancelledDuringAnalysis() throws Exception {
            var token = new CancellationToken();
            when(oracle.extract(any())).thenAnswer(inv -> {
                token.cancel();
                OracleRequest request = inv.getArgument(0);
                return new OracleFact(request.schemaHint().nodeTypeHint(), FactPayload.empty());
            });

            ExtractionResult result = extractor.extract(source(ORDER_VIEW_21_3),
                    RunConfig.forWorkspace("ws1").withCancellation(token), "run-1");

            assertThat(result.cancelled()).isTrue();
            assertThat(result.facts()).singleElement().extracting(NodeFact::nodeType).isEqualTo("ContactInfo");
            assertThat(result.warnings()).anyMatch(w -> w.contains("iptal"));
        }
    }

    // ── Trie Önbelleği ───────────────────────────────────────────────

    @Nested
    @DisplayName("Trie önbelleği")
    class TrieCache {

        @Test
        @DisplayName("Aynı versiyon/mesaj için derlenmiş trie tekrar kullanılır")
        void sameKey_sameInstance() {
            assertThat(extractor.trieFor("21.3", "OrderViewRS")).isSameAs(extractor.trieFor("21.3", "OrderViewRS"));
        }

        @Test
        @DisplayName("Yapılandırma reload sonrası yeni trie derlenir")
        void reload_invalidates() {
            TargetPathTrie before = extractor.trieFor("21.3", "OrderViewRS");

            registry.reload();

            assertThat(extractor.trieFor("21.3", "OrderViewRS")).isNotSameAs(before);
        }
    }

    // ── Yardımcı Metodlar ────────────────────────────────────────────

    private StreamingStructuralExtractor extractor(ExecutorService pool) {
        return new StreamingStructuralExtractor(oracle, registry, dialectDetector, normalizer, properties,
                new PatternMetrics(meterRegistry), pool);
    }

    private void answerWithHintedType() throws OracleException {
        when(oracle.extract(any())).thenAnswer(inv -> {
            OracleRequest request = inv.getArgument(0);
            return new OracleFact(request.schemaHint().nodeTypeHint(), FactPayload.empty());
        });
    }

    private static DocumentSource source(String xml) {
        return DocumentSource.ofBytes("order-view.xml", xml.strip().getBytes(StandardCharsets.UTF_8));
    }
}
