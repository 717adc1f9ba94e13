package io.mersel.services.patterns.application.models;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * İşbirlikçi iptal sinyali. Extractor her subtree arasında kontrol eder.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
