package io.mersel.services.patterns.infrastructure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.patterns.application.interfaces.DocumentParseException;
import io.mersel.services.patterns.application.interfaces.ExtractionException;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.IStructuralExtractor;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.CancellationToken;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.ExtractionResult;
import io.mersel.services.patterns.application.models.FactPayload;
import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.OracleRequest;
import io.mersel.services.patterns.application.models.RunConfig;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SAX tabanlı akış çıkarımı.
 * <p>
 * İki geçişlidir ve hiçbir aşamada tam ağacı belleğe almaz:
 * <ol>
 *   <li>{@link DialectDetector} ile versiyon/mesaj tespiti (erken durdurulan parse)</li>
 *   <li>Hedef trie ile eşleşen subtree'lerin seçici olarak buffer'lanması</li>
 * </ol>
 * Toplanan fragment'lar sınırlı worker havuzunda oracle'a gönderilir. Sonuçlar
 * tamamlanma sırasına değil belge sırasına göre toplanır. Bozuk XML bir kez
 * kurtarma modunda tekrar denenir. Kurtarma modunda parse hatası açık bir hedef
 * subtree içinde kalırsa o subtree başarısız fact olarak kaydedilir ve o ana kadar
 * toplanan fragment'lar korunur. Subtree şema açısından kritikse veya hiçbir hedefe
 * ulaşılmamışsa çalıştırma durur.
 */
@Service
public class StreamingStructuralExtractor implements IStructuralExtractor {

    private static final Logger log = LoggerFactory.getLogger(StreamingStructuralExtractor.class);

    private final IExtractionOracle oracle;
    private final NodeConfigurationRegistry registry;
    private final DialectDetector dialectDetector;
    private final SectionPathNormalizer normalizer;
    private final PatternEngineProperties properties;
    private final PatternMetrics metrics;
    private final ExecutorService workers;

    /** (versiyon, mesaj, yapılandırma nesli) → derlenmiş trie. */
    private record TrieKey(String version, String messageRoot, long generation) {}
    private final Cache<TrieKey, TargetPathTrie> trieCache;

    @Autowired
    public StreamingStructuralExtractor(IExtractionOracle oracle,
                                        NodeConfigurationRegistry registry,
                                        DialectDetector dialectDetector,
                                        SectionPathNormalizer normalizer,
                                        PatternEngineProperties properties,
                                        PatternMetrics metrics) {
        this(oracle, registry, dialectDetector, normalizer, properties, metrics,
                newWorkerPool(properties.getWorkerThreads()));
    }

    StreamingStructuralExtractor(IExtractionOracle oracle,
                                 NodeConfigurationRegistry registry,
                                 DialectDetector dialectDetector,
                                 SectionPathNormalizer normalizer,
                                 PatternEngineProperties properties,
                                 PatternMetrics metrics,
                                 ExecutorService workers) {
        this.oracle = oracle;
        this.registry = registry;
        this.dialectDetector = dialectDetector;
        this.normalizer = normalizer;
        this.properties = properties;
        this.metrics = metrics;
        this.workers = workers;
        this.trieCache = Caffeine.newBuilder().maximumSize(256).build();
        metrics.registerTrieCacheSizeGauge(trieCache);
    }

    private static ExecutorService newWorkerPool(int threads) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "fragment-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
        log.debug("Fragment worker havuzu kapatıldı");
    }

    @Override
    public ExtractionResult extract(DocumentSource source, RunConfig config, String runId) throws ExtractionException {
        long size = source.size();
        if (size > properties.getMaxDocumentSizeBytes()) {
            throw new ExtractionException("Belge boyutu sınırı aşıyor: " + size + " byte (en fazla "
                    + properties.getMaxDocumentSizeMb() + " MB)");
        }

        var warnings = new ArrayList<String>();
        ParsedDocument parsed;
        try {
            parsed = parse(source, config, false);
        } catch (IOException | SAXException | ParserConfigurationException strictError) {
            log.warn("[{}] Belge parse edilemedi, kurtarma modunda tekrar deneniyor: {} - {}",
                    runId, source.name(), strictError.getMessage());
            try {
                parsed = parse(source, config, true);
                metrics.recordParseRecovery(true);
                warnings.add("Belge bozuk XML içeriyordu, kurtarma modunda işlendi: " + strictError.getMessage());
            } catch (IOException | SAXException | ParserConfigurationException lenientError) {
                metrics.recordParseRecovery(false);
                throw new DocumentParseException("Belge kurtarma modunda da parse edilemedi: "
                        + lenientError.getMessage(), lenientError);
            }
        }

        DocumentDialect dialect = parsed.dialect();
        if (dialect.isLowConfidence()) {
            warnings.add("Versiyon sinyali bulunamadı, varsayılan " + dialect.version()
                    + " kullanıldı (düşük güven)");
        }
        if (parsed.interruption() != null) {
            warnings.add("Parse satır " + parsed.interruption().getLineNumber() + " konumunda durdu, "
                    + parsed.malformedSubtrees() + " açık subtree başarısız işaretlendi, sonraki içerik işlenmedi: "
                    + parsed.interruption().getMessage());
        }
        if (parsed.targetCount() == 0) {
            warnings.add("v" + dialect.version() + " " + dialect.messageRoot()
                    + " için etkin hedef section yapılandırması yok");
        }

        int truncated = (int) parsed.fragments().stream().filter(ExtractedFragment::truncated).count();
        Analysis analysis = analyze(parsed.fragments(), dialect, config, runId);
        boolean cancelled = parsed.cancelled() || analysis.cancelled();
        if (cancelled) {
            warnings.add("Çalıştırma iptal edildi; " + analysis.facts().size() + " fact üretilmişti");
        }
        if (analysis.failed() > 0) {
            warnings.add(analysis.failed() + " fragment oracle tarafından analiz edilemedi");
        }

        metrics.recordFragments(parsed.fragments().size(), analysis.failed(), truncated);
        log.info("[{}] Çıkarım tamamlandı: {} v{}, {} fragment, {} fact, {} başarısız, {} kısaltılmış{}",
                runId, dialect.messageRoot(), dialect.version(), parsed.fragments().size(),
                analysis.facts().size(), analysis.failed(), truncated, parsed.lenient() ? " (kurtarma modu)" : "");

        return new ExtractionResult(dialect, analysis.facts(), warnings, parsed.fragments().size(),
                analysis.failed(), truncated, parsed.lenient(), cancelled);
    }

    // ── Parse ───────────────────────────────────────────────────────

    private record ParsedDocument(DocumentDialect dialect, List<ExtractedFragment> fragments,
                                  int targetCount, boolean cancelled, boolean lenient,
                                  SAXParseException interruption, int malformedSubtrees) {}

    private ParsedDocument parse(DocumentSource source, RunConfig config, boolean lenient)
            throws IOException, SAXException, ParserConfigurationException {
        DocumentDialect dialect = dialectDetector.detect(source, lenient, config.versionOverride());
        TargetPathTrie trie = trieFor(dialect.version(), dialect.messageRoot());
        if (trie.isEmpty()) {
            return new ParsedDocument(dialect, List.of(), 0, false, lenient, null, 0);
        }

        var handler = new ExtractionHandler(trie, config.cancellation(), properties.getMaxFragmentChars());
        SAXParseException interruption = null;
        int malformedSubtrees = 0;
        try {
            XmlSupport.parse(source, lenient, handler);
        } catch (ExtractionStopException e) {
            // Normal akış: root kapandı veya iptal istendi
        } catch (SAXParseException e) {
            if (!lenient) {
                throw e;
            }
            malformedSubtrees = handler.recover(e);
            interruption = e;
        }

        var fragments = new ArrayList<>(handler.fragments);
        fragments.sort(Comparator.comparingLong(ExtractedFragment::sequence));
        return new ParsedDocument(dialect, fragments, trie.targetCount(), handler.cancelled, lenient,
                interruption, malformedSubtrees);
    }

    TargetPathTrie trieFor(String version, String messageRoot) {
        var key = new TrieKey(version, messageRoot, registry.generation());
        return trieCache.get(key, k -> TargetPathTrie.compile(
                registry.getEnabledConfigurations(k.version(), k.messageRoot()), normalizer));
    }

    // ── Oracle analizi ──────────────────────────────────────────────

    private record Analysis(List<NodeFact> facts, int failed, boolean cancelled) {}

    private Analysis analyze(List<ExtractedFragment> fragments, DocumentDialect dialect,
                             RunConfig config, String runId) throws ExtractionException {
        var futures = new ArrayList<Future<NodeFact>>(fragments.size());
        for (var fragment : fragments) {
            futures.add(workers.submit(() -> analyzeFragment(fragment, dialect, config, runId)));
        }

        var facts = new ArrayList<NodeFact>();
        int failed = 0;
        boolean cancelled = false;
        for (int i = 0; i < futures.size(); i++) {
            NodeFact fact;
            try {
                fact = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRemaining(futures, i);
                throw new ExtractionException("Fragment analizi kesildi", e);
            } catch (ExecutionException e) {
                cancelRemaining(futures, i);
                throw new ExtractionException("Fragment analizi beklenmedik şekilde başarısız: "
                        + e.getCause().getMessage(), e.getCause());
            }

            if (fact == null) {
                cancelled = true;
                continue;
            }
            facts.add(fact);
            if (fact.extractionFailed()) {
                failed++;
                var target = fragments.get(i).target();
                if (target.schemaCritical()) {
                    cancelRemaining(futures, i + 1);
                    throw new ExtractionException("Şema açısından kritik section analiz edilemedi: "
                            + target.sectionPath() + " #" + fact.ordinal(), facts);
                }
            }
        }
        return new Analysis(facts, failed, cancelled);
    }

    /**
     * Tek fragment'ı analiz eder. İptal istenmişse {@code null} döner;
     * oracle hatası extraction-failed işaretli fact olarak döner.
     */
    private NodeFact analyzeFragment(ExtractedFragment fragment, DocumentDialect dialect,
                                     RunConfig config, String runId) {
        if (config.cancellation().isCancelled()) {
            return null;
        }
        var target = fragment.target();
        if (fragment.malformed()) {
            log.warn("[{}] Subtree parse edilemedi, başarısız işaretlendi: {}#{}",
                    runId, target.sectionPath(), fragment.ordinal());
            return failedFact(fragment, dialect, config, runId);
        }
        var hint = new OracleRequest.SchemaHint(dialect.version(), dialect.messageRoot(),
                target.sectionPath(), target.nodeType());
        String snippet = XmlSupport.snippet(fragment.xml(), properties.getMaxSnippetLength());

        try {
            OracleFact result = oracle.extract(new OracleRequest(fragment.xml(), hint, null));
            String nodeType = result.nodeType() == null || result.nodeType().isBlank()
                    ? fallbackNodeType(target.nodeType(), target.sectionPath())
                    : result.nodeType().trim();
            boolean masked = "true".equalsIgnoreCase(result.payload().derived().get("masked"));
            log.debug("[{}] Fragment analiz edildi: {}#{} → {}", runId, target.sectionPath(), fragment.ordinal(), nodeType);
            return new NodeFact(UUID.randomUUID().toString(), config.workspaceId(), runId,
                    dialect.version(), dialect.messageRoot(), target.sectionPath(), nodeType,
                    fragment.ordinal(), result.payload(), snippet, masked, false);
        } catch (OracleException e) {
            log.warn("[{}] Fragment analizi başarısız {}#{}: {} - {}",
                    runId, target.sectionPath(), fragment.ordinal(), e.getKind(), e.getMessage());
            return failedFact(fragment, dialect, config, runId);
        }
    }

    private NodeFact failedFact(ExtractedFragment fragment, DocumentDialect dialect, RunConfig config, String runId) {
        var target = fragment.target();
        return new NodeFact(UUID.randomUUID().toString(), config.workspaceId(), runId,
                dialect.version(), dialect.messageRoot(), target.sectionPath(),
                fallbackNodeType(target.nodeType(), target.sectionPath()),
                fragment.ordinal(), FactPayload.empty(),
                XmlSupport.snippet(fragment.xml(), properties.getMaxSnippetLength()), false, true);
    }

    private static String fallbackNodeType(String configured, String sectionPath) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        int slash = sectionPath.lastIndexOf('/');
        return slash >= 0 ? sectionPath.substring(slash + 1) : sectionPath;
    }

    private static void cancelRemaining(List<Future<NodeFact>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    // ── SAX Handler ─────────────────────────────────────────────────

    /**
     * Root kapandığında veya iptal istendiğinde parse'ı durduran sentinel exception.
     */
    private static class ExtractionStopException extends SAXException {
        ExtractionStopException() {
            super("Extraction stopped");
        }
    }

    /**
     * Trie üzerinde yürür, hedef subtree'leri buffer'lar.
     * İç içe hedefler desteklenir: her olay tüm açık buffer'lara yazılır.
     */
    private static class ExtractionHandler extends DefaultHandler {

        private final TargetPathTrie trie;
        private final CancellationToken cancellation;
        private final int maxFragmentChars;

        private final List<TargetPathTrie.Node> trieStack = new ArrayList<>();
        private final List<FragmentBuffer> open = new ArrayList<>();
        private final Map<String, Integer> ordinals = new HashMap<>();
        private final List<ExtractedFragment> fragments = new ArrayList<>();
        private long sequence = 0;
        private int depth = 0;
        private boolean cancelled = false;

        ExtractionHandler(TargetPathTrie trie, CancellationToken cancellation, int maxFragmentChars) {
            this.trie = trie;
            this.cancellation = cancellation;
            this.maxFragmentChars = maxFragmentChars;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes)
                throws SAXException {
            depth++;
            TargetPathTrie.Node node;
            if (depth == 1) {
                node = trie.root();
            } else {
                TargetPathTrie.Node parent = trieStack.get(trieStack.size() - 1);
                node = parent == null ? null : parent.child(qName);
            }
            trieStack.add(node);

            for (FragmentBuffer buffer : open) {
                buffer.startElement(qName, attributes);
            }

            if (depth > 1 && node != null && node.target() != null) {
                // İptal kontrolü subtree'ler arasında yapılır
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    throw new ExtractionStopException();
                }
                String section = node.target().sectionPath();
                int ordinal = ordinals.merge(section, 1, Integer::sum);
                var buffer = new FragmentBuffer(sequence++, node.target(), ordinal, depth, maxFragmentChars);
                buffer.startElement(qName, attributes);
                open.add(buffer);
            }
        }

        /**
         * Kurtarma modunda parse hatası sonrası açık subtree'leri başarısız fragment olarak kapatır.
         * Hiçbir hedefe ulaşılmamışsa veya açık subtree şema açısından kritikse hata yeniden fırlatılır.
         *
         * @return başarısız işaretlenen subtree sayısı
         */
        int recover(SAXParseException error) throws SAXParseException {
            if (fragments.isEmpty() && open.isEmpty()) {
                throw error;
            }
            for (FragmentBuffer buffer : open) {
                if (buffer.target().schemaCritical()) {
                    throw error;
                }
            }
            for (FragmentBuffer buffer : open) {
                fragments.add(buffer.toMalformedFragment());
            }
            int recovered = open.size();
            open.clear();
            return recovered;
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            for (FragmentBuffer buffer : open) {
                buffer.characters(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) throws SAXException {
            for (int i = open.size() - 1; i >= 0; i--) {
                FragmentBuffer buffer = open.get(i);
                buffer.endElement(qName);
                if (buffer.closesAt(depth)) {
                    fragments.add(buffer.toFragment());
                    open.remove(i);
                }
            }
            trieStack.remove(trieStack.size() - 1);
            depth--;
            if (depth == 0) {
                // Root kapandı: kurtarma modunda sondaki çöp içerik okunmaz
                throw new ExtractionStopException();
            }
        }
    }
}
