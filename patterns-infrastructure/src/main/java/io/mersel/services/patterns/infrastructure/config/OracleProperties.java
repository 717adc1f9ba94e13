package io.mersel.services.patterns.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Extraction oracle (LLM) istemci yapılandırması.
 * <p>
 * {@code patterns.oracle} prefix'i altındaki değerleri okur. Geri çekilme
 * deterministiktir (jitter yok): {@code initial × multiplier^(deneme-1)}, {@code max-backoff-ms} ile sınırlı.
 */
@ConfigurationProperties(prefix = "patterns.oracle")
public class OracleProperties {

    private static final Logger log = LoggerFactory.getLogger(OracleProperties.class);

    private String apiKey = "";
    private String baseUrl = "";
    private String modelName = "gpt-4o-mini";
    private double temperature = 0.1;
    private int maxOutputTokens = 2048;
    private long timeoutMs = 30000;
    private int maxRetries = 3;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 8000;
    private boolean describePatterns = false;

    @PostConstruct
    void validate() {
        if (timeoutMs <= 0) {
            log.warn("timeout-ms pozitif olmalı (verilen: {}), varsayılan 30000 ms kullanılıyor", timeoutMs);
            timeoutMs = 30000;
        }
        if (maxRetries < 0) {
            log.warn("max-retries negatif olamaz (verilen: {}), varsayılan 3 kullanılıyor", maxRetries);
            maxRetries = 3;
        }
        if (initialBackoffMs < 0) {
            log.warn("initial-backoff-ms negatif olamaz (verilen: {}), varsayılan 500 ms kullanılıyor", initialBackoffMs);
            initialBackoffMs = 500;
        }
        if (backoffMultiplier < 1.0) {
            log.warn("backoff-multiplier en az 1.0 olmalı (verilen: {}), varsayılan 2.0 kullanılıyor", backoffMultiplier);
            backoffMultiplier = 2.0;
        }
        if (maxBackoffMs < initialBackoffMs) {
            log.warn("max-backoff-ms initial-backoff-ms değerinden küçük (verilen: {}), {} ms kullanılıyor",
                    maxBackoffMs, Math.max(8000, initialBackoffMs));
            maxBackoffMs = Math.max(8000, initialBackoffMs);
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("patterns.oracle.api-key tanımlı değil: oracle çağrıları UNAVAILABLE ile sonuçlanacak");
        }
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public boolean isDescribePatterns() {
        return describePatterns;
    }

    public void setDescribePatterns(boolean describePatterns) {
        this.describePatterns = describePatterns;
    }
}
