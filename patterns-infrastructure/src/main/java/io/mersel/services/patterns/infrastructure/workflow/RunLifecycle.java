package io.mersel.services.patterns.infrastructure.workflow;

import io.mersel.services.patterns.application.enums.RunKind;
import io.mersel.services.patterns.application.enums.RunStatus;
import io.mersel.services.patterns.application.interfaces.IRunStore;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.application.models.RunConfig;
import io.mersel.services.patterns.application.models.RunRecord;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * RunRecord oluşturma ve sonlandırma. Her çalıştırma RUNNING olarak başlar ve
 * COMPLETED, CANCELLED veya FAILED ile kapanır.
 */
@Component
class RunLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RunLifecycle.class);

    private final IRunStore runStore;
    private final PatternMetrics metrics;

    RunLifecycle(IRunStore runStore, PatternMetrics metrics) {
        this.runStore = runStore;
        this.metrics = metrics;
    }

    RunRecord start(RunKind kind, DocumentSource document, RunConfig config) {
        var run = new RunRecord(UUID.randomUUID().toString(), config.workspaceId(), kind, RunStatus.RUNNING,
                document.name(), null, null, config.ownerCode(), null, List.of(), Map.of(), null,
                Instant.now(), null);
        runStore.saveRun(run);
        log.info("[{}] {} çalıştırması başladı: {} (workspace: {})", run.id(), kind, document.name(), config.workspaceId());
        return run;
    }

    RunRecord finish(RunRecord run, RunStatus status, DocumentDialect dialect, String ownerCode,
                     List<String> warnings, Map<String, Long> statistics) {
        var finished = new RunRecord(run.id(), run.workspaceId(), run.kind(), status, run.documentName(),
                dialect.version(), dialect.messageRoot(), ownerCode, dialect.versionSource(),
                warnings, statistics, null, run.startedAt(), Instant.now());
        runStore.updateRun(finished);
        record(finished);
        log.info("[{}] {} çalıştırması {}: {} v{}, {} uyarı", run.id(), run.kind(), status,
                dialect.messageRoot(), dialect.version(), warnings.size());
        return finished;
    }

    /**
     * Çalıştırmayı FAILED olarak kapatır. Kayıt güncellenemezse orijinal hata korunur,
     * güncelleme hatası yalnızca loglanır.
     */
    RunRecord fail(RunRecord run, Exception error) {
        var failed = new RunRecord(run.id(), run.workspaceId(), run.kind(), RunStatus.FAILED, run.documentName(),
                run.version(), run.messageRoot(), run.ownerCode(), run.versionSource(), run.warnings(),
                run.statistics(), error.getMessage(), run.startedAt(), Instant.now());
        try {
            runStore.updateRun(failed);
        } catch (DataAccessException e) {
            log.error("[{}] Başarısız çalıştırma kaydı güncellenemedi: {}", run.id(), e.getMessage());
        }
        record(failed);
        log.error("[{}] {} çalıştırması başarısız: {}", run.id(), run.kind(), error.getMessage());
        return failed;
    }

    private void record(RunRecord run) {
        long durationMs = Duration.between(run.startedAt(), run.finishedAt()).toMillis();
        metrics.recordRun(run.kind(), run.status(), durationMs);
    }
}
