package io.mersel.services.patterns.infrastructure.oracle;

import io.mersel.services.patterns.infrastructure.config.OracleProperties;

/**
 * Sınırlı, deterministik (jitter'sız) üstel geri çekilme.
 * <p>
 * {@code n}. yeniden deneme öncesi bekleme: {@code min(max, initial × multiplier^(n-1))}.
 *
 * @param maxRetries        İlk denemeden sonraki en fazla yeniden deneme
 * @param initialBackoffMs  İlk bekleme
 * @param multiplier        Çarpan
 * @param maxBackoffMs      Üst sınır
 */
public record BackoffPolicy(int maxRetries, long initialBackoffMs, double multiplier, long maxBackoffMs) {

    public static BackoffPolicy from(OracleProperties properties) {
        return new BackoffPolicy(properties.getMaxRetries(), properties.getInitialBackoffMs(),
                properties.getBackoffMultiplier(), properties.getMaxBackoffMs());
    }

    /**
     * @param retry 1 tabanlı yeniden deneme sırası
     */
    public long delayBeforeRetry(int retry) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, retry - 1));
        return (long) Math.min(maxBackoffMs, delay);
    }
}
