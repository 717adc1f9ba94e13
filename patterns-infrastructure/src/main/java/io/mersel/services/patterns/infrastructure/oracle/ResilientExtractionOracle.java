package io.mersel.services.patterns.infrastructure.oracle;

import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.OracleException;
import io.mersel.services.patterns.application.models.DecisionRule;
import io.mersel.services.patterns.application.models.OracleFact;
import io.mersel.services.patterns.application.models.OracleRequest;
import io.mersel.services.patterns.application.models.ProposedReference;
import io.mersel.services.patterns.application.models.ReferenceQuery;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle çağrılarına zaman aşımı, yeniden deneme ve düzeltici tekrar ekleyen sarmalayıcı.
 * <ul>
 *   <li>Her çağrı {@code timeoutMs} ile sınırlıdır; aşımda {@code TIMEOUT}</li>
 *   <li>TIMEOUT / RATE_LIMITED / UNAVAILABLE → {@link BackoffPolicy} ile sınırlı yeniden deneme</li>
 *   <li>Fragment analizinde şemaya uymayan yanıt → bir kez düzeltici talimatla tekrar</li>
 * </ul>
 */
public class ResilientExtractionOracle implements IExtractionOracle {

    private static final Logger log = LoggerFactory.getLogger(ResilientExtractionOracle.class);

    static final String CORRECTION_PREFIX =
            "Your previous answer did not match the required JSON schema. Problem: ";

    private final IExtractionOracle delegate;
    private final BackoffPolicy backoff;
    private final long timeoutMs;
    private final Sleeper sleeper;
    private final PatternMetrics metrics;
    private final ExecutorService callExecutor;

    public ResilientExtractionOracle(IExtractionOracle delegate, BackoffPolicy backoff, long timeoutMs,
                                     Sleeper sleeper, PatternMetrics metrics) {
        this.delegate = delegate;
        this.backoff = backoff;
        this.timeoutMs = timeoutMs;
        this.sleeper = sleeper;
        this.metrics = metrics;
        var threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-call-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
        log.debug("Oracle çağrı havuzu kapatıldı");
    }

    @Override
    public OracleFact extract(OracleRequest request) throws OracleException {
        try {
            return withRetry("extract", () -> delegate.extract(request));
        } catch (OracleException e) {
            if (e.getKind() != OracleException.Kind.INVALID_RESPONSE) {
                throw e;
            }
            log.debug("Şemaya uymayan oracle yanıtı, düzeltici talimatla tekrar deneniyor: {}", e.getMessage());
            metrics.recordOracleRetry("extract", "correction");
            OracleRequest corrected = request.withCorrection(CORRECTION_PREFIX + e.getMessage());
            return withRetry("extract", () -> delegate.extract(corrected));
        }
    }

    @Override
    public List<ProposedReference> proposeReferences(ReferenceQuery query) throws OracleException {
        return withRetry("references", () -> delegate.proposeReferences(query));
    }

    @Override
    public Optional<String> describePattern(DecisionRule rule, List<String> examples) {
        try {
            return withRetry("describe", () -> delegate.describePattern(rule, examples));
        } catch (OracleException e) {
            log.debug("Pattern açıklaması üretilemedi ({}): {}", e.getKind(), e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T withRetry(String operation, Callable<T> call) throws OracleException {
        int retry = 0;
        while (true) {
            long start = System.currentTimeMillis();
            try {
                T result = callWithTimeout(call);
                metrics.recordOracleCall(operation, "success", System.currentTimeMillis() - start);
                return result;
            } catch (OracleException e) {
                metrics.recordOracleCall(operation, e.getKind().name(), System.currentTimeMillis() - start);
                if (!e.getKind().isTransient() || retry >= backoff.maxRetries()) {
                    throw e;
                }
                retry++;
                long delay = backoff.delayBeforeRetry(retry);
                log.debug("Oracle {} geçici hata ({}), {}. yeniden deneme {} ms sonra",
                        operation, e.getKind(), retry, delay);
                metrics.recordOracleRetry(operation, e.getKind().name());
                pause(delay);
            }
        }
    }

    private <T> T callWithTimeout(Callable<T> call) throws OracleException {
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleException(OracleException.Kind.TIMEOUT,
                    "Oracle çağrısı " + timeoutMs + " ms içinde tamamlanmadı", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OracleException oracleException) {
                throw oracleException;
            }
            throw new OracleException(OracleException.Kind.UNAVAILABLE,
                    "Oracle çağrısı başarısız: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "Oracle çağrısı kesildi", e);
        }
    }

    private void pause(long delayMs) throws OracleException {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "Geri çekilme beklemesi kesildi", e);
        }
    }
}
