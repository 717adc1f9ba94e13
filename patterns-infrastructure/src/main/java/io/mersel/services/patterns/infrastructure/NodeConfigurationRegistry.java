package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.interfaces.INodeConfigurationService;
import io.mersel.services.patterns.application.interfaces.Reloadable;
import io.mersel.services.patterns.application.interfaces.ReloadResult;
import io.mersel.services.patterns.application.models.NodeConfiguration;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hedef düğüm yapılandırmaları kayıt defteri.
 * <p>
 * YAML dosyasından (versiyon, mesaj, section) anahtarlı yapılandırmaları yükler:
 * section etkin mi, şema açısından kritik mi, beklenen düğüm tipi, beklenen
 * referans adları ve alias yollar. {@link Reloadable} ile hot-reload destekler;
 * yükleme başarısız olursa önceki veri korunur.
 * <p>
 * Dosya biçimi:
 * <pre>
 * node-configurations:
 *   - version: "21.3"
 *     message: OrderViewRS
 *     sections:
 *       - path: Response/DataLists/PaxList/Pax
 *         node-type: Passenger
 *         schema-critical: false
 *         expected-references: [contact_info_reference]
 * </pre>
 * {@code patterns.engine.node-configuration-path} boşsa classpath'teki
 * {@code node-configurations.yml} kullanılır.
 */
@Service
public class NodeConfigurationRegistry implements INodeConfigurationService, Reloadable {

    private static final Logger log = LoggerFactory.getLogger(NodeConfigurationRegistry.class);
    private static final String CLASSPATH_RESOURCE = "node-configurations.yml";

    private final SectionPathNormalizer normalizer;
    private final Path externalPath;
    private final AtomicLong generation = new AtomicLong();

    /** Yapılandırma verisi: tek volatile reference ile atomik swap. */
    private record ConfigData(Map<String, NodeConfiguration> byKey,
                              Map<String, List<NodeConfiguration>> enabledByScope,
                              List<String> versions) {}
    private volatile ConfigData configData = new ConfigData(Map.of(), Map.of(), List.of());

    @Autowired
    public NodeConfigurationRegistry(PatternEngineProperties properties, SectionPathNormalizer normalizer) {
        this(normalizer, properties.getNodeConfigurationPath() == null || properties.getNodeConfigurationPath().isBlank()
                ? null : Path.of(properties.getNodeConfigurationPath()));
    }

    /**
     * @param externalPath Harici YAML dosyası; {@code null} ise classpath varsayılanı
     */
    NodeConfigurationRegistry(SectionPathNormalizer normalizer, Path externalPath) {
        this.normalizer = normalizer;
        this.externalPath = externalPath;
    }

    @PostConstruct
    void init() {
        var result = reload();
        log.info("Düğüm yapılandırmaları yüklendi: {} section ({}, {} ms)",
                result.loadedCount(), result.status(), result.durationMs());
    }

    // ── Reloadable ──────────────────────────────────────────────────

    @Override
    public String getName() {
        return "Node Configurations";
    }

    @Override
    public ReloadResult reload() {
        long startTime = System.currentTimeMillis();
        String source = externalPath != null ? externalPath.toString() : "classpath:" + CLASSPATH_RESOURCE;

        Map<String, Object> root;
        try (InputStream is = openSource()) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(is);
        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.error("Düğüm yapılandırması okunamadı ({}): {}", source, e.getMessage());
            return ReloadResult.failed(getName(), elapsed, source, e.getMessage());
        }

        var byKey = new LinkedHashMap<String, NodeConfiguration>();
        var errors = new ArrayList<String>();
        for (Map<String, Object> scope : listOfMaps(root == null ? null : root.get("node-configurations"))) {
            String version = asString(scope.get("version"));
            String message = normalizer.normalizeSegment(asString(scope.get("message")));
            if (version.isEmpty() || message.isEmpty()) {
                errors.add("version/message eksik: " + scope);
                continue;
            }
            for (Map<String, Object> section : listOfMaps(scope.get("sections"))) {
                try {
                    var config = parseSection(version, message, section);
                    byKey.put(key(version, message, config.sectionPath()), config);
                } catch (IllegalArgumentException e) {
                    errors.add(version + "/" + message + ": " + e.getMessage());
                    log.warn("  Section yapılandırma hatası: {}/{} - {}", version, message, e.getMessage());
                }
            }
        }

        var enabledByScope = new LinkedHashMap<String, List<NodeConfiguration>>();
        var versions = new TreeSet<String>();
        for (var config : byKey.values()) {
            versions.add(config.version());
            if (config.enabled()) {
                enabledByScope.computeIfAbsent(scopeKey(config.version(), config.messageRoot()), k -> new ArrayList<>())
                        .add(config);
            }
        }
        enabledByScope.replaceAll((k, v) -> List.copyOf(v));

        configData = new ConfigData(Map.copyOf(byKey), Map.copyOf(enabledByScope), List.copyOf(versions));
        generation.incrementAndGet();

        long elapsed = System.currentTimeMillis() - startTime;
        if (errors.isEmpty()) {
            return ReloadResult.success(getName(), byKey.size(), elapsed, source);
        }
        return ReloadResult.partial(getName(), byKey.size(), elapsed, source, errors);
    }

    // ── INodeConfigurationService ───────────────────────────────────

    @Override
    public List<NodeConfiguration> getEnabledConfigurations(String version, String messageRoot) {
        return configData.enabledByScope().getOrDefault(
                scopeKey(version, normalizer.normalizeSegment(messageRoot)), List.of());
    }

    @Override
    public Optional<NodeConfiguration> find(String version, String messageRoot, String sectionPath) {
        if (version == null || messageRoot == null || sectionPath == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(configData.byKey().get(
                key(version, normalizer.normalizeSegment(messageRoot), normalizer.normalizePath(sectionPath))));
    }

    @Override
    public List<String> knownVersions() {
        return configData.versions();
    }

    /**
     * Her başarılı yüklemede artan sayaç. Derlenmiş trie önbelleği anahtarında kullanılır.
     */
    public long generation() {
        return generation.get();
    }

    // ── Parse ───────────────────────────────────────────────────────

    private InputStream openSource() throws IOException {
        if (externalPath != null) {
            return Files.newInputStream(externalPath);
        }
        InputStream is = NodeConfigurationRegistry.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE);
        if (is == null) {
            throw new IOException("Classpath kaynağı bulunamadı: " + CLASSPATH_RESOURCE);
        }
        return is;
    }

    private NodeConfiguration parseSection(String version, String message, Map<String, Object> section) {
        String path = normalizer.normalizePath(asString(section.get("path")));
        if (path.isEmpty()) {
            throw new IllegalArgumentException("section path boş");
        }
        String nodeType = asString(section.get("node-type"));
        var aliases = new ArrayList<String>();
        for (String alias : asStringList(section.get("aliases"))) {
            String normalized = normalizer.normalizePath(alias);
            if (!normalized.isEmpty() && !normalized.equals(path)) {
                aliases.add(normalized);
            }
        }
        return new NodeConfiguration(
                version,
                message,
                path,
                nodeType.isEmpty() ? null : nodeType,
                asBoolean(section.get("enabled"), true),
                asBoolean(section.get("schema-critical"), false),
                List.copyOf(new LinkedHashSet<>(asStringList(section.get("expected-references")))),
                aliases);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var result = new ArrayList<Map<String, Object>>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }

    private static List<String> asStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (Object item : list) {
            String s = asString(item);
            if (!s.isEmpty()) {
                result.add(s);
            }
        }
        return result;
    }

    private static String asString(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static boolean asBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    private static String scopeKey(String version, String message) {
        return version + "|" + message;
    }

    private static String key(String version, String message, String sectionPath) {
        return version + "|" + message + "|" + sectionPath;
    }
}
