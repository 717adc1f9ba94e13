package io.mersel.services.patterns.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.patterns.application.enums.DeltaType;
import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.enums.Verdict;
import io.mersel.services.patterns.application.models.RelationshipAnalysis;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Pattern keşif/tanımlama motoru metrikleri.
 */
@Component
public class PatternMetrics {

    private final MeterRegistry registry;

    public PatternMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Çalıştırma sonucu ve süresi.
     */
    public void recordRun(RunKind kind, RunStatus status, long durationMs) {
        Counter.builder("patterns_runs_total")
                .tag("kind", kind.name())
                .tag("status", status.name())
                .description("Çalıştırma sayısı")
                .register(registry)
                .increment();

        Timer.builder("patterns_run_duration")
                .tag("kind", kind.name())
                .description("Çalıştırma süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Fragment çıkarım sayaçları.
     *
     * @param matched   Trie ile eşleşen subtree
     * @param failed    Oracle analizi başarısız
     * @param truncated Boyut sınırıyla kısaltılan
     */
    public void recordFragments(int matched, int failed, int truncated) {
        increment("patterns_fragments_total", "result", "matched", matched);
        increment("patterns_fragments_total", "result", "failed", failed);
        increment("patterns_fragments_total", "result", "truncated", truncated);
    }

    /**
     * Lenient kurtarma modu denemesi.
     *
     * @param recovered Belge kurtarma modunda parse edilebildi mi
     */
    public void recordParseRecovery(boolean recovered) {
        Counter.builder("patterns_parse_recovery_total")
                .tag("result", recovered ? "recovered" : "failed")
                .description("Lenient kurtarma modu denemesi")
                .register(registry)
                .increment();
    }

    /**
     * Oracle çağrı sonucu.
     *
     * @param operation "extract", "references" veya "describe"
     * @param outcome   "success" ya da hata türü (TIMEOUT, RATE_LIMITED ...)
     */
    public void recordOracleCall(String operation, String outcome, long durationMs) {
        Counter.builder("patterns_oracle_calls_total")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .description("Oracle çağrı sayısı")
                .register(registry)
                .increment();

        Timer.builder("patterns_oracle_call_duration")
                .tag("operation", operation)
                .description("Oracle çağrı süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordOracleRetry(String operation, String reason) {
        Counter.builder("patterns_oracle_retries_total")
                .tag("operation", operation)
                .tag("reason", reason)
                .description("Oracle yeniden deneme sayısı")
                .register(registry)
                .increment();
    }

    /**
     * İlişki analizinin raporlama sınıfları.
     */
    public void recordRelationships(RelationshipAnalysis.Statistics stats) {
        increment("patterns_relationships_total", "class", "expected_valid", stats.expectedValid());
        increment("patterns_relationships_total", "class", "expected_broken", stats.expectedBroken());
        increment("patterns_relationships_total", "class", "unexpected_valid", stats.unexpectedValid());
        increment("patterns_relationships_total", "class", "unexpected_broken", stats.unexpectedBroken());
        increment("patterns_relationship_oracle_failures_total", "stage", "pair", stats.oracleFailures());
    }

    public void recordPatternDelta(DeltaType type) {
        Counter.builder("patterns_catalog_upserts_total")
                .tag("type", type.name())
                .description("Katalog upsert sonucu")
                .register(registry)
                .increment();
    }

    /**
     * Eşzamanlı aynı imza yarışı: güncelleme olarak çözüldü.
     */
    public void recordUpsertConflict() {
        Counter.builder("patterns_catalog_upsert_conflicts_total")
                .description("İmza çakışması nedeniyle tekrarlanan upsert")
                .register(registry)
                .increment();
    }

    public void recordVerdict(Verdict verdict) {
        Counter.builder("patterns_identify_verdicts_total")
                .tag("verdict", verdict.name())
                .description("Identify verdict dağılımı")
                .register(registry)
                .increment();
    }

    /**
     * Derlenmiş trie önbelleği boyutu.
     */
    public void registerTrieCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("patterns_trie_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Önbellekteki derlenmiş hedef trie sayısı")
                .register(registry);
    }

    private void increment(String name, String tagKey, String tagValue, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder(name)
                .tag(tagKey, tagValue)
                .register(registry)
                .increment(amount);
    }
}
