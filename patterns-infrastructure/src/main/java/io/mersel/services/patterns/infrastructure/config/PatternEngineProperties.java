package io.mersel.services.patterns.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Çıkarım ve katalog motoru yapılandırma özellikleri.
 * <p>
 * {@code patterns.engine} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code default-version}: Versiyon sinyali bulunamazsa kullanılan versiyon</li>
 *   <li>{@code max-document-size-mb}: Kabul edilen en büyük belge (pozitif olmalı)</li>
 *   <li>{@code max-fragment-kb}: Oracle'a gönderilen fragment üst sınırı (pozitif olmalı)</li>
 *   <li>{@code max-snippet-length}: NodeFact snippet uzunluğu</li>
 *   <li>{@code worker-threads}: Eşzamanlı oracle çağrısı sayısı</li>
 *   <li>{@code legacy-root-prefixes}: Eş kabul edilen legacy element prefix'leri (örn: IATA_)</li>
 *   <li>{@code node-configuration-path}: Harici düğüm yapılandırması (boşsa classpath varsayılanı)</li>
 *   <li>{@code max-examples}: Pattern başına saklanan örnek snippet sayısı</li>
 *   <li>{@code upsert-max-attempts}: İmza çakışmasında upsert deneme sayısı</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "patterns.engine")
public class PatternEngineProperties {

    private static final Logger log = LoggerFactory.getLogger(PatternEngineProperties.class);

    private String defaultVersion = "21.3";
    private int maxDocumentSizeMb = 100;
    private int maxFragmentKb = 4;
    private int maxSnippetLength = 120;
    private int workerThreads = 4;
    private List<String> legacyRootPrefixes = new ArrayList<>(List.of("IATA_"));
    private String nodeConfigurationPath = "";
    private int maxExamples = 5;
    private int upsertMaxAttempts = 5;

    @PostConstruct
    void validate() {
        if (defaultVersion == null || defaultVersion.isBlank()) {
            log.warn("default-version boş olamaz, varsayılan 21.3 kullanılıyor");
            defaultVersion = "21.3";
        }
        if (maxDocumentSizeMb <= 0) {
            log.warn("max-document-size-mb pozitif olmalı (verilen: {}), varsayılan 100 kullanılıyor", maxDocumentSizeMb);
            maxDocumentSizeMb = 100;
        }
        if (maxFragmentKb <= 0) {
            log.warn("max-fragment-kb pozitif olmalı (verilen: {}), varsayılan 4 kullanılıyor", maxFragmentKb);
            maxFragmentKb = 4;
        }
        if (maxSnippetLength <= 0) {
            log.warn("max-snippet-length pozitif olmalı (verilen: {}), varsayılan 120 kullanılıyor", maxSnippetLength);
            maxSnippetLength = 120;
        }
        if (workerThreads <= 0) {
            log.warn("worker-threads pozitif olmalı (verilen: {}), varsayılan 4 kullanılıyor", workerThreads);
            workerThreads = 4;
        }
        if (maxExamples <= 0) {
            log.warn("max-examples pozitif olmalı (verilen: {}), varsayılan 5 kullanılıyor", maxExamples);
            maxExamples = 5;
        }
        if (upsertMaxAttempts <= 0) {
            log.warn("upsert-max-attempts pozitif olmalı (verilen: {}), varsayılan 5 kullanılıyor", upsertMaxAttempts);
            upsertMaxAttempts = 5;
        }
        if (legacyRootPrefixes == null) {
            legacyRootPrefixes = new ArrayList<>();
        }
    }

    public long getMaxDocumentSizeBytes() {
        return maxDocumentSizeMb * 1024L * 1024L;
    }

    public int getMaxFragmentChars() {
        return maxFragmentKb * 1024;
    }

    public String getDefaultVersion() {
        return defaultVersion;
    }

    public void setDefaultVersion(String defaultVersion) {
        this.defaultVersion = defaultVersion;
    }

    public int getMaxDocumentSizeMb() {
        return maxDocumentSizeMb;
    }

    public void setMaxDocumentSizeMb(int maxDocumentSizeMb) {
        this.maxDocumentSizeMb = maxDocumentSizeMb;
    }

    public int getMaxFragmentKb() {
        return maxFragmentKb;
    }

    public void setMaxFragmentKb(int maxFragmentKb) {
        this.maxFragmentKb = maxFragmentKb;
    }

    public int getMaxSnippetLength() {
        return maxSnippetLength;
    }

    public void setMaxSnippetLength(int maxSnippetLength) {
        this.maxSnippetLength = maxSnippetLength;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public List<String> getLegacyRootPrefixes() {
        return legacyRootPrefixes;
    }

    public void setLegacyRootPrefixes(List<String> legacyRootPrefixes) {
        this.legacyRootPrefixes = legacyRootPrefixes;
    }

    public String getNodeConfigurationPath() {
        return nodeConfigurationPath;
    }

    public void setNodeConfigurationPath(String nodeConfigurationPath) {
        this.nodeConfigurationPath = nodeConfigurationPath;
    }

    public int getMaxExamples() {
        return maxExamples;
    }

    public void setMaxExamples(int maxExamples) {
        this.maxExamples = maxExamples;
    }

    public int getUpsertMaxAttempts() {
        return upsertMaxAttempts;
    }

    public void setUpsertMaxAttempts(int upsertMaxAttempts) {
        this.upsertMaxAttempts = upsertMaxAttempts;
    }
}
